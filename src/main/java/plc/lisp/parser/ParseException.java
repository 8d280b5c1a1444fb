package plc.lisp.parser;

public final class ParseException extends Exception {

    public enum Kind {
        UNEXPECTED_INPUT("Unexpected input"),
        UNEXPECTED_EOF("Unexpected end of input"),
        INVALID_NUMBER("Invalid number"),
        INVALID_STRING("Invalid string"),
        INVALID_TYPE("Invalid type"),
        UNMATCHED_PAREN("Unmatched parenthesis"),
        GENERIC("Parse error");

        private final String description;

        Kind(String description) {
            this.description = description;
        }

    }

    private final Kind kind;

    public ParseException(Kind kind, String detail) {
        super(kind.description + ": " + detail);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

}
