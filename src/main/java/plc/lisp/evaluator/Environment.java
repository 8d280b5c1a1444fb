package plc.lisp.evaluator;

import java.io.PrintStream;
import java.util.List;
import java.util.function.DoubleBinaryOperator;
import java.util.function.IntBinaryOperator;
import java.util.function.IntPredicate;
import java.util.function.LongBinaryOperator;

/**
 * The built-in functions installed in every root scope. The analyzer keeps
 * the matching types in its own {@code Environment}.
 */
public final class Environment {

    private Environment() {}

    public static Scope scope() {
        return scope(System.out);
    }

    /**
     * Creates a fresh root scope; {@code print} and {@code println} write to
     * {@code out}.
     */
    public static Scope scope(PrintStream out) {
        var scope = new Scope(null);

        define(scope, "+", 2, args -> integer("+", args, Math::addExact, Math::addExact));
        define(scope, "-", 2, args -> integer("-", args, Math::subtractExact, Math::subtractExact));
        define(scope, "*", 2, args -> integer("*", args, Math::multiplyExact, Math::multiplyExact));
        define(scope, "/", 2, args -> {
            Object divisor = primitive(args.get(1));
            if (Integer.valueOf(0).equals(divisor) || Long.valueOf(0).equals(divisor)) {
                throw new EvaluateException("Division by zero");
            }
            return integer("/", args, (a, b) -> a / b, (a, b) -> a / b);
        });

        define(scope, "+.", 2, args -> decimal("+.", args, Double::sum));
        define(scope, "-.", 2, args -> decimal("-.", args, (a, b) -> a - b));
        define(scope, "*.", 2, args -> decimal("*.", args, (a, b) -> a * b));
        define(scope, "/.", 2, args -> {
            if (primitive(args.get(1)) instanceof Double divisor && divisor == 0.0) {
                throw new EvaluateException("Division by zero");
            }
            return decimal("/.", args, (a, b) -> a / b);
        });

        define(scope, "=", 2, args -> compare("=", args, c -> c == 0));
        define(scope, "<", 2, args -> compare("<", args, c -> c < 0));
        define(scope, ">", 2, args -> compare(">", args, c -> c > 0));
        define(scope, "<=", 2, args -> compare("<=", args, c -> c <= 0));
        define(scope, ">=", 2, args -> compare(">=", args, c -> c >= 0));

        define(scope, "and", 2, args -> new RuntimeValue.Primitive(
                Evaluator.requireType(args.get(0), Boolean.class) && Evaluator.requireType(args.get(1), Boolean.class)));
        define(scope, "or", 2, args -> new RuntimeValue.Primitive(
                Evaluator.requireType(args.get(0), Boolean.class) || Evaluator.requireType(args.get(1), Boolean.class)));
        define(scope, "not", 1, args -> new RuntimeValue.Primitive(
                !Evaluator.requireType(args.get(0), Boolean.class)));

        define(scope, "print", 1, args -> {
            out.print(args.get(0));
            out.flush();
            return args.get(0);
        });
        define(scope, "println", 1, args -> {
            out.println(args.get(0));
            return args.get(0);
        });
        define(scope, "type-of", 1, args -> new RuntimeValue.Primitive(args.get(0).typeName()));

        return scope;
    }

    private static void define(Scope scope, String name, int arity, RuntimeValue.Builtin.Definition definition) {
        scope.define(name, new RuntimeValue.Builtin(name, arity, definition));
    }

    // Both operands must have the same width; the result keeps it.
    private static RuntimeValue integer(String name, List<RuntimeValue> args, IntBinaryOperator i32, LongBinaryOperator i64) throws EvaluateException {
        Object left = primitive(args.get(0));
        Object right = primitive(args.get(1));
        try {
            if (left instanceof Integer a && right instanceof Integer b) {
                return new RuntimeValue.Primitive(i32.applyAsInt(a, b));
            } else if (left instanceof Long a && right instanceof Long b) {
                return new RuntimeValue.Primitive(i64.applyAsLong(a, b));
            }
        } catch (ArithmeticException e) {
            throw new EvaluateException("Integer overflow in " + name);
        }
        throw new EvaluateException(name + " requires two integers of the same type");
    }

    private static RuntimeValue decimal(String name, List<RuntimeValue> args, DoubleBinaryOperator operator) throws EvaluateException {
        if (primitive(args.get(0)) instanceof Double a && primitive(args.get(1)) instanceof Double b) {
            double result = operator.applyAsDouble(a, b);
            if (!Double.isFinite(result)) {
                throw new EvaluateException("Float overflow in " + name);
            }
            return new RuntimeValue.Primitive(result);
        }
        throw new EvaluateException(name + " requires two floats");
    }

    private static RuntimeValue compare(String name, List<RuntimeValue> args, IntPredicate test) throws EvaluateException {
        Object left = primitive(args.get(0));
        Object right = primitive(args.get(1));
        if (left instanceof Integer a && right instanceof Integer b) {
            return new RuntimeValue.Primitive(test.test(Integer.compare(a, b)));
        } else if (left instanceof Long a && right instanceof Long b) {
            return new RuntimeValue.Primitive(test.test(Long.compare(a, b)));
        }
        throw new EvaluateException(name + " requires two integers of the same type");
    }

    private static Object primitive(RuntimeValue value) {
        return value instanceof RuntimeValue.Primitive primitive ? primitive.value() : null;
    }

}
