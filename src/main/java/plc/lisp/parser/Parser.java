package plc.lisp.parser;

import plc.lisp.analyzer.Type;
import plc.lisp.lexer.LexException;
import plc.lisp.lexer.Lexer;
import plc.lisp.lexer.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static com.google.common.base.Preconditions.checkState;
import static plc.lisp.analyzer.Environment.TYPES;

/**
 * This style of parser is called <em>recursive descent</em>. Each rule in the
 * grammar has a dedicated function, and references to other rules correspond
 * to calling that function.
 *
 * <p>After an opening parenthesis the parser looks at the leading symbol:
 * {@code if}, {@code let}, {@code defn}, {@code fn} and {@code lambda} are
 * special forms with their own rules, anything else is read as a generic
 * {@link Ast.Expr.List}.
 */
public final class Parser {

    private final TokenStream tokens;

    public Parser(List<Token> tokens) {
        this.tokens = new TokenStream(tokens);
    }

    /**
     * Parses exactly one expression; anything left over after it is an error.
     */
    public static Ast.Expr parse(String input) throws ParseException {
        Parser parser = new Parser(lex(input));
        Ast.Expr expr = parser.parseExpr();
        parser.checkEnd();
        return expr;
    }

    /**
     * Parses a whole program, i.e. zero or more top-level expressions.
     */
    public static Ast.Source parseSource(String input) throws ParseException {
        return new Parser(lex(input)).parseSource();
    }

    private static List<Token> lex(String input) throws ParseException {
        try {
            return new Lexer(input).lex();
        } catch (LexException e) {
            var kind = switch (e.getKind()) {
                case INVALID_STRING -> ParseException.Kind.INVALID_STRING;
                case INVALID_CHARACTER -> ParseException.Kind.UNEXPECTED_INPUT;
            };
            throw new ParseException(kind, e.getMessage());
        }
    }

    public Ast.Source parseSource() throws ParseException {
        List<Ast.Expr> expressions = new ArrayList<>();
        while (tokens.has(0)) {
            expressions.add(parseExpr());
        }
        return new Ast.Source(expressions);
    }

    public Ast.Expr parseExpr() throws ParseException {
        if (!tokens.has(0)) {
            throw new ParseException(ParseException.Kind.UNEXPECTED_EOF, "Expected expression");
        }
        if (tokens.peek("(")) {
            return parseListExpr();
        } else if (tokens.peek(")")) {
            throw new ParseException(ParseException.Kind.UNMATCHED_PAREN, "Unexpected ')'");
        } else if (tokens.peek(Token.Type.INTEGER) ||
                tokens.peek(Token.Type.DECIMAL) ||
                tokens.peek(Token.Type.STRING) ||
                tokens.peek("true") ||
                tokens.peek("false")) {
            return parseLiteralExpr();
        } else if (tokens.peek(Token.Type.SYMBOL)) {
            String name = tokens.get(0).literal();
            tokens.match(Token.Type.SYMBOL);
            return new Ast.Expr.Variable(name);
        }
        throw new ParseException(ParseException.Kind.GENERIC, "Unexpected token '" + tokens.get(0).literal() + "'");
    }

    private Ast.Expr.Literal parseLiteralExpr() throws ParseException {
        if (tokens.match("true")) {
            return new Ast.Expr.Literal(true);
        } else if (tokens.match("false")) {
            return new Ast.Expr.Literal(false);
        }
        Token token = tokens.get(0);
        tokens.match(token.type());
        return switch (token.type()) {
            case INTEGER -> new Ast.Expr.Literal(parseInteger(token.literal()));
            case DECIMAL -> new Ast.Expr.Literal(parseDecimal(token.literal()));
            case STRING -> {
                // Lexer returns raw tokens, so splice off the quotes here
                String noQuotes = token.literal().substring(1, token.literal().length() - 1);
                yield new Ast.Expr.Literal(unescape(noQuotes));
            }
            default -> throw new AssertionError(token);
        };
    }

    // Integers are as narrow as they can be: i32 first, then i64.
    private Object parseInteger(String literal) throws ParseException {
        try {
            return Integer.parseInt(literal);
        } catch (NumberFormatException e) {
            try {
                return Long.parseLong(literal);
            } catch (NumberFormatException ee) {
                throw new ParseException(ParseException.Kind.INVALID_NUMBER, literal + " is out of i64 range");
            }
        }
    }

    private Double parseDecimal(String literal) throws ParseException {
        double value = Double.parseDouble(literal);
        if (Double.isInfinite(value)) {
            throw new ParseException(ParseException.Kind.INVALID_NUMBER, literal + " is out of f64 range");
        }
        return value;
    }

    private Ast.Expr parseListExpr() throws ParseException {
        checkToken("(", "list");
        if (tokens.match(")")) {
            return new Ast.Expr.List(List.of());
        }
        if (tokens.peek("if")) {
            return parseIfExpr();
        } else if (tokens.peek("let")) {
            return parseLetExpr();
        } else if (tokens.peek("defn")) {
            return parseDefnExpr();
        } else if (tokens.peek("fn") || tokens.peek("lambda")) {
            return parseLambdaExpr();
        }
        List<Ast.Expr> elements = new ArrayList<>();
        while (!tokens.match(")")) {
            if (!tokens.has(0)) {
                throw new ParseException(ParseException.Kind.UNEXPECTED_EOF, "Expected ')'");
            }
            elements.add(parseExpr());
        }
        return new Ast.Expr.List(elements);
    }

    private Ast.Expr.If parseIfExpr() throws ParseException {
        checkToken("if", "if");
        Ast.Expr condition = parseOperand("if", "'if' expects exactly 3 arguments");
        Ast.Expr thenExpr = parseOperand("if", "'if' expects exactly 3 arguments");
        Ast.Expr elseExpr = parseOperand("if", "'if' expects exactly 3 arguments");
        checkClose("if", "'if' expects exactly 3 arguments");
        return new Ast.Expr.If(condition, thenExpr, elseExpr);
    }

    // (let name [:] [type] value [body])
    private Ast.Expr.Let parseLetExpr() throws ParseException {
        checkToken("let", "let");
        String name = getSymbol("let");
        Optional<Type> type = Optional.empty();
        // A colon with no type after it leaves the type to be inferred.
        tokens.match(":");
        if (peekType()) {
            type = Optional.of(parseType());
        }
        Ast.Expr value = parseOperand("let", "'let' requires a value");
        Optional<Ast.Expr> body = Optional.empty();
        if (tokens.has(0) && !tokens.peek(")")) {
            body = Optional.of(parseExpr());
        }
        checkClose("let", "'let' takes a name, a value and an optional body");
        return new Ast.Expr.Let(name, type, value, body);
    }

    // (defn name [param: type ...] -> type body)
    private Ast.Expr.Defn parseDefnExpr() throws ParseException {
        checkToken("defn", "defn");
        String name = getSymbol("defn");
        List<Ast.Expr.Parameter> parameters = parseParameters("defn");
        checkToken("->", "defn");
        Type returns = parseType();
        Ast.Expr body = parseOperand("defn", "'defn' requires a body");
        checkClose("defn", "'defn' takes exactly one body expression");
        return new Ast.Expr.Defn(name, parameters, returns, body);
    }

    // (fn [param: type ...] [-> type] body), lambda is an alias
    private Ast.Expr.Lambda parseLambdaExpr() throws ParseException {
        String form = tokens.get(0).literal();
        tokens.match(Token.Type.SYMBOL);
        List<Ast.Expr.Parameter> parameters = parseParameters(form);
        Optional<Type> returns = Optional.empty();
        if (tokens.match("->")) {
            returns = Optional.of(parseType());
        }
        Ast.Expr body = parseOperand(form, "'" + form + "' requires a body");
        checkClose(form, "'" + form + "' takes exactly one body expression");
        return new Ast.Expr.Lambda(parameters, returns, body);
    }

    //---------------------BEGIN HELPER FUNCTIONS-----------------------//

    private List<Ast.Expr.Parameter> parseParameters(String form) throws ParseException {
        checkToken("[", form);
        List<Ast.Expr.Parameter> parameters = new ArrayList<>();
        while (!tokens.match("]")) {
            String name = getSymbol(form);
            checkToken(":", form);
            parameters.add(new Ast.Expr.Parameter(name, parseType()));
        }
        return parameters;
    }

    private boolean peekType() {
        if (tokens.peek("fn", "(")) return true;
        return tokens.peek(Token.Type.SYMBOL) && TYPES.containsKey(tokens.get(0).literal());
    }

    // type := base | fn(type, ...) -> type
    private Type parseType() throws ParseException {
        if (!tokens.has(0)) {
            throw new ParseException(ParseException.Kind.UNEXPECTED_EOF, "Expected type");
        }
        if (tokens.match("fn")) {
            checkToken("(", "function type");
            List<Type> parameters = new ArrayList<>();
            if (!tokens.match(")")) {
                do {
                    parameters.add(parseType());
                } while (tokens.match(","));
                checkToken(")", "function type");
            }
            checkToken("->", "function type");
            return new Type.Function(parameters, parseType());
        }
        String name = tokens.get(0).literal();
        Type type = tokens.peek(Token.Type.SYMBOL) ? TYPES.get(name) : null;
        if (type == null) {
            throw new ParseException(ParseException.Kind.INVALID_TYPE, "Unknown type '" + name + "'");
        }
        tokens.match(Token.Type.SYMBOL);
        return type;
    }

    private Ast.Expr parseOperand(String form, String arity) throws ParseException {
        if (tokens.peek(")")) {
            throw new ParseException(ParseException.Kind.UNEXPECTED_INPUT, arity);
        }
        if (!tokens.has(0)) {
            throw new ParseException(ParseException.Kind.UNEXPECTED_EOF, "Unterminated '" + form + "'");
        }
        return parseExpr();
    }

    private void checkClose(String form, String arity) throws ParseException {
        if (tokens.match(")")) return;
        if (!tokens.has(0)) {
            throw new ParseException(ParseException.Kind.UNEXPECTED_EOF, "Expected ')' to close '" + form + "'");
        }
        throw new ParseException(ParseException.Kind.UNEXPECTED_INPUT, arity);
    }

    private void checkToken(String literal, String context) throws ParseException {
        if (tokens.match(literal)) return;
        if (!tokens.has(0)) {
            throw new ParseException(ParseException.Kind.UNEXPECTED_EOF, "Expected '" + literal + "' in " + context);
        }
        throw new ParseException(ParseException.Kind.UNEXPECTED_INPUT,
                "Expected '" + literal + "' in " + context + ", found '" + tokens.get(0).literal() + "'");
    }

    private String getSymbol(String context) throws ParseException {
        if (!tokens.has(0)) {
            throw new ParseException(ParseException.Kind.UNEXPECTED_EOF, "Expected name in " + context);
        }
        if (!tokens.peek(Token.Type.SYMBOL)) {
            throw new ParseException(ParseException.Kind.UNEXPECTED_INPUT,
                    "Expected name in " + context + ", found '" + tokens.get(0).literal() + "'");
        }
        String name = tokens.get(0).literal();
        tokens.match(Token.Type.SYMBOL);
        return name;
    }

    private void checkEnd() throws ParseException {
        if (!tokens.has(0)) return;
        if (tokens.peek(")")) {
            throw new ParseException(ParseException.Kind.UNMATCHED_PAREN, "Unexpected ')'");
        }
        throw new ParseException(ParseException.Kind.UNEXPECTED_INPUT, tokens.remaining());
    }

    private String unescape(String s) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < s.length(); ++i) {
            char c = s.charAt(i);
            if (c == '\\' && i + 1 < s.length()) {
                i++;
                char next = s.charAt(i);
                switch (next) {
                    case 'n': sb.append('\n'); break;
                    case 't': sb.append('\t'); break;
                    case 'r': sb.append('\r'); break;
                    default: sb.append(next);
                }
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    //--------------------END HELPER FUNCTIONS---------------------//

    private static final class TokenStream {

        private final List<Token> tokens;
        private int index = 0;

        private TokenStream(List<Token> tokens) {
            this.tokens = tokens;
        }

        /**
         * Returns true if there is a token at (index + offset).
         */
        public boolean has(int offset) {
            return index + offset < tokens.size();
        }

        /**
         * Returns the token at (index + offset).
         */
        public Token get(int offset) {
            checkState(has(offset));
            return tokens.get(index + offset);
        }

        /**
         * Returns true if the next tokens match their corresponding pattern.
         * Each pattern is either a {@link Token.Type}, matching tokens of that
         * type, or a {@link String}, matching tokens with that literal.
         */
        public boolean peek(Object... patterns) {
            if (!has(patterns.length - 1)) {
                return false;
            }
            for (int offset = 0; offset < patterns.length; offset++) {
                var token = tokens.get(index + offset);
                var pattern = patterns[offset];
                checkState(pattern instanceof Token.Type || pattern instanceof String, pattern);
                if (!token.type().equals(pattern) && !token.literal().equals(pattern)) {
                    return false;
                }
            }
            return true;
        }

        /**
         * Equivalent to peek, but also advances the token stream.
         */
        public boolean match(Object... patterns) {
            var peek = peek(patterns);
            if (peek) {
                index += patterns.length;
            }
            return peek;
        }

        /**
         * The unconsumed tokens, space separated.
         */
        public String remaining() {
            return tokens.subList(index, tokens.size()).stream()
                    .map(Token::literal)
                    .collect(Collectors.joining(" "));
        }

    }

}
