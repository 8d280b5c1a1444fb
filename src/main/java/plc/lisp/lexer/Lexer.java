package plc.lisp.lexer;

import java.util.ArrayList;
import java.util.List;

/**
 * The lexer works through a combination of {@link #lex()}, which repeatedly
 * calls {@link #lexToken()} and skips over whitespace/comments, and
 * {@link #lexToken()}, which determines the type of the next token and
 * delegates to the corresponding lex method.
 *
 * <p>Symbols are any run of letters, digits and the operator characters in
 * {@link #SYMBOL}, which is how names like {@code +}, {@code <=} and
 * {@code +.} come out as ordinary symbols. The only punctuation tokens are
 * {@code ( ) [ ] : ,}.
 */
public final class Lexer {

    private static final String WHITESPACE = "[ \b\f\n\r\t]";
    private static final String SYMBOL = "[\\p{L}\\p{N}+\\-*/<>=!&|_?.]";

    private final CharStream chars;

    public Lexer(String input) {
        this.chars = new CharStream(input);
    }

    public List<Token> lex() throws LexException {
        List<Token> tokens = new ArrayList<>();
        while (!chars.end()) {
            if (chars.peek(WHITESPACE)) {
                chars.match(WHITESPACE);
                chars.emit();
            } else if (chars.peek(";")) {
                lexComment();
            } else {
                tokens.add(lexToken());
            }
        }
        return tokens;
    }

    private void lexComment() {
        // ';' runs to the end of the line
        chars.match(";");
        while (!chars.end() && !chars.peek("[\n\r]")) {
            chars.match("[^\n\r]");
        }
        chars.emit();
    }

    private Token lexToken() throws LexException {
        if (chars.peek("\"")) return lexString();
        else if (chars.peek("[0-9]") || chars.peek("-", "[0-9]"))
            return lexNumber();
        else if (chars.peek(SYMBOL)) return lexSymbol();
        else
            return lexOperator();
    }

    private Token lexSymbol() {
        while (chars.peek(SYMBOL)) chars.match(SYMBOL);
        return new Token(Token.Type.SYMBOL, chars.emit());
    }

    private Token lexNumber() {
        // -?\d+(\.\d+)?
        chars.match("-");
        while (chars.peek("[0-9]")) chars.match("[0-9]");

        if (chars.peek("[.]", "[0-9]")) {
            chars.match("[.]");
            while (chars.peek("[0-9]")) chars.match("[0-9]");
            return new Token(Token.Type.DECIMAL, chars.emit());
        }
        return new Token(Token.Type.INTEGER, chars.emit());
    }

    private Token lexString() throws LexException {
        chars.match("\"");
        while (!chars.end() && !chars.peek("\"")) {
            if (chars.peek("\\\\")) {
                chars.match("\\\\");
                if (!chars.match("[\"\\\\ntr]")) {
                    throw new LexException(LexException.Kind.INVALID_STRING, "Invalid escape sequence");
                }
            } else {
                chars.match("[^\"\\\\]");
            }
        }
        if (!chars.match("\"")) {
            throw new LexException(LexException.Kind.INVALID_STRING, "Unterminated string literal");
        }
        return new Token(Token.Type.STRING, chars.emit());
    }

    private Token lexOperator() throws LexException {
        if (!chars.match("[()\\[\\]:,]")) {
            throw new LexException(LexException.Kind.INVALID_CHARACTER,
                    "Invalid character '" + chars.current() + "'");
        }
        return new Token(Token.Type.OPERATOR, chars.emit());
    }

    private static final class CharStream {

        private final String input;
        private int index = 0, length = 0;

        public CharStream(String input) {
            this.input = input;
        }

        public boolean end() {
            return index >= input.length();
        }

        public char current() {
            return input.charAt(index);
        }

        public boolean peek(String... patterns) {
            if (index + patterns.length > input.length()) return false;
            for (int i = 0; i < patterns.length; i++) {
                String ch = String.valueOf(input.charAt(index + i));
                if (!ch.matches(patterns[i])) return false;
            }
            return true;
        }

        public boolean match(String... patterns) {
            if (peek(patterns)) {
                index += patterns.length;
                length += patterns.length;
                return true;
            }
            return false;
        }

        public String emit() {
            String token = input.substring(index - length, index);
            length = 0;
            return token;
        }

    }

}
