package plc.lisp.evaluator;

import plc.lisp.parser.Ast;

import java.util.List;
import java.util.Optional;

public sealed interface RuntimeValue {

    /**
     * The name {@code type-of} reports for this value.
     */
    String typeName();

    /**
     * Wraps an {@link Integer}, {@link Long}, {@link Double},
     * {@link Boolean} or {@link String}.
     */
    record Primitive(
        Object value
    ) implements RuntimeValue {

        @Override
        public String typeName() {
            if (value instanceof Integer) return "i32";
            else if (value instanceof Long) return "i64";
            else if (value instanceof Double) return "f64";
            else if (value instanceof Boolean) return "bool";
            else if (value instanceof String) return "String";
            throw new AssertionError(value == null ? "null" : value.getClass());
        }

        // Strings print without quotes.
        @Override
        public String toString() {
            if (value instanceof Double decimal) {
                return Ast.Expr.Literal.formatDecimal(decimal);
            }
            return String.valueOf(value);
        }

    }

    /**
     * A closure over a snapshot of its defining scope. A named function's
     * scope also binds its own name, so it can call itself.
     */
    record Function(
        Optional<String> name,
        List<String> parameters,
        Ast.Expr body,
        Scope scope
    ) implements RuntimeValue {

        public Function {
            parameters = List.copyOf(parameters);
        }

        @Override
        public String typeName() {
            return "function";
        }

        @Override
        public String toString() {
            return "#<function:" + parameters.size() + ">";
        }

    }

    record Builtin(
        String name,
        int arity,
        Definition definition
    ) implements RuntimeValue {

        @FunctionalInterface
        public interface Definition {
            RuntimeValue invoke(List<RuntimeValue> arguments) throws EvaluateException;
        }

        @Override
        public String typeName() {
            return "builtin";
        }

        @Override
        public String toString() {
            return "#<builtin:" + name + ":" + arity + ">";
        }

    }

}
