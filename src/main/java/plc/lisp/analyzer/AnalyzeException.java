package plc.lisp.analyzer;

public final class AnalyzeException extends Exception {

    public AnalyzeException(String message) {
        super(message);
    }

}
