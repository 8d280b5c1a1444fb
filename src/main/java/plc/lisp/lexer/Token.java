package plc.lisp.lexer;

public record Token(
    Type type,
    String literal
) {

    public enum Type {
        SYMBOL,
        INTEGER,
        DECIMAL,
        STRING,
        OPERATOR
    }

}
