package plc.lisp.lexer;

public final class LexException extends Exception {

    public enum Kind {
        INVALID_STRING,
        INVALID_CHARACTER
    }

    private final Kind kind;

    public LexException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

}
