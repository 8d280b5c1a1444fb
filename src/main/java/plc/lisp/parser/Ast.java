package plc.lisp.parser;

import com.google.common.collect.ImmutableList;
import plc.lisp.analyzer.Type;

import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Syntax tree shared by the analyzer and the evaluator. Every node renders
 * back to canonical source text through {@code toString()}.
 *
 * <p>{@link Expr.List} is what the parser produces for a parenthesized form
 * that is not a special form; both passes turn it into an {@link Expr.Call}
 * through {@link Expr.List#toCall()} before doing anything else with it.
 */
public sealed interface Ast {

    interface Visitor<R, E extends Exception> {

        default R visit(Ast ast) throws E {
            if (ast instanceof Source source) return visit(source);
            else if (ast instanceof Expr.Literal literal) return visit(literal);
            else if (ast instanceof Expr.Variable variable) return visit(variable);
            else if (ast instanceof Expr.List list) return visit(list);
            else if (ast instanceof Expr.If iff) return visit(iff);
            else if (ast instanceof Expr.Let let) return visit(let);
            else if (ast instanceof Expr.Defn defn) return visit(defn);
            else if (ast instanceof Expr.Lambda lambda) return visit(lambda);
            else if (ast instanceof Expr.Call call) return visit(call);
            throw new AssertionError(ast.getClass());
        }

        R visit(Source ast) throws E;
        R visit(Expr.Literal ast) throws E;
        R visit(Expr.Variable ast) throws E;
        R visit(Expr.List ast) throws E;
        R visit(Expr.If ast) throws E;
        R visit(Expr.Let ast) throws E;
        R visit(Expr.Defn ast) throws E;
        R visit(Expr.Lambda ast) throws E;
        R visit(Expr.Call ast) throws E;

    }

    record Source(
        java.util.List<Expr> expressions
    ) implements Ast {

        public Source {
            expressions = ImmutableList.copyOf(expressions);
        }

        @Override
        public String toString() {
            return expressions.stream().map(Expr::toString).collect(Collectors.joining("\n"));
        }

    }

    sealed interface Expr extends Ast {

        /**
         * One of {@link Integer}, {@link Long}, {@link Double},
         * {@link Boolean} or {@link String}.
         */
        record Literal(
            Object value
        ) implements Expr {

            @Override
            public String toString() {
                if (value instanceof String string) {
                    return "\"" + escape(string) + "\"";
                } else if (value instanceof Double decimal) {
                    return Literal.formatDecimal(decimal);
                }
                return String.valueOf(value);
            }

            /**
             * Formats a double so that it reads back as a decimal literal,
             * i.e. always with a fractional part and never in exponent form.
             * Only finite values have a literal form; the float built-ins
             * never produce anything else.
             */
            public static String formatDecimal(double value) {
                if (Double.isNaN(value) || Double.isInfinite(value)) {
                    return Double.toString(value);
                } else if (Double.doubleToRawLongBits(value) == Double.doubleToRawLongBits(-0.0)) {
                    return "-0.0";
                }
                String plain = java.math.BigDecimal.valueOf(value).toPlainString();
                return plain.contains(".") ? plain : plain + ".0";
            }

            private static String escape(String string) {
                StringBuilder sb = new StringBuilder();
                for (char c : string.toCharArray()) {
                    switch (c) {
                        case '"' -> sb.append("\\\"");
                        case '\\' -> sb.append("\\\\");
                        case '\n' -> sb.append("\\n");
                        case '\t' -> sb.append("\\t");
                        case '\r' -> sb.append("\\r");
                        default -> sb.append(c);
                    }
                }
                return sb.toString();
            }

        }

        record Variable(
            String name
        ) implements Expr {

            @Override
            public String toString() {
                return name;
            }

        }

        record List(
            java.util.List<Expr> elements
        ) implements Expr {

            public List {
                elements = ImmutableList.copyOf(elements);
            }

            /**
             * The first element is the callee, the rest are the arguments.
             */
            public Call toCall() {
                if (elements.isEmpty()) {
                    throw new IllegalStateException("Empty list");
                }
                return new Call(elements.get(0), elements.subList(1, elements.size()));
            }

            @Override
            public String toString() {
                return elements.stream().map(Expr::toString).collect(Collectors.joining(" ", "(", ")"));
            }

        }

        record If(
            Expr condition,
            Expr thenExpr,
            Expr elseExpr
        ) implements Expr {

            @Override
            public String toString() {
                return "(if " + condition + " " + thenExpr + " " + elseExpr + ")";
            }

        }

        /**
         * A let with a body scopes the binding to the body; without one the
         * binding goes into the enclosing scope.
         */
        record Let(
            String name,
            Optional<Type> type,
            Expr value,
            Optional<Expr> body
        ) implements Expr {

            @Override
            public String toString() {
                return "(let " + name
                        + type.map(t -> ": " + t).orElse("")
                        + " " + value
                        + body.map(b -> " " + b).orElse("")
                        + ")";
            }

        }

        record Parameter(String name, Type type) {

            @Override
            public String toString() {
                return name + ": " + type;
            }

        }

        record Defn(
            String name,
            java.util.List<Parameter> parameters,
            Type returns,
            Expr body
        ) implements Expr {

            public Defn {
                parameters = ImmutableList.copyOf(parameters);
            }

            @Override
            public String toString() {
                return "(defn " + name + " " + renderParameters(parameters) + " -> " + returns + " " + body + ")";
            }

        }

        record Lambda(
            java.util.List<Parameter> parameters,
            Optional<Type> returns,
            Expr body
        ) implements Expr {

            public Lambda {
                parameters = ImmutableList.copyOf(parameters);
            }

            @Override
            public String toString() {
                return "(fn " + renderParameters(parameters)
                        + returns.map(r -> " -> " + r).orElse("")
                        + " " + body + ")";
            }

        }

        record Call(
            Expr callee,
            java.util.List<Expr> arguments
        ) implements Expr {

            public Call {
                arguments = ImmutableList.copyOf(arguments);
            }

            @Override
            public String toString() {
                StringBuilder sb = new StringBuilder("(").append(callee);
                for (Expr argument : arguments) {
                    sb.append(" ").append(argument);
                }
                return sb.append(")").toString();
            }

        }

        private static String renderParameters(java.util.List<Parameter> parameters) {
            return parameters.stream().map(Parameter::toString).collect(Collectors.joining(" ", "[", "]"));
        }

    }

}
