package plc.lisp.evaluator;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import plc.lisp.parser.Parser;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Stream;

final class EvaluatorTests {

    @ParameterizedTest
    @MethodSource
    void testArithmetic(String test, String input, Object expected) {
        test(List.of(input), expected);
    }

    private static Stream<Arguments> testArithmetic() {
        return Stream.of(
            Arguments.of("Add", "(+ 1 2)", 3),
            Arguments.of("Subtract", "(- 1 2)", -1),
            Arguments.of("Multiply", "(* 6 7)", 42),
            Arguments.of("Divide Truncates", "(/ 7 2)", 3),
            Arguments.of("Divide Negative", "(/ -7 2)", -3),
            Arguments.of("i64", "(- 2147483648 1)", 2147483647L),
            Arguments.of("i64 Multiply", "(* 2147483648 2147483648)", 4611686018427387904L),
            Arguments.of("Mixed Widths", "(+ 1 2147483648)", null),
            Arguments.of("Division By Zero", "(/ 5 0)", null),
            Arguments.of("i64 Division By Zero", "(/ 2147483648 0)", null),
            Arguments.of("i32 Overflow", "(+ 2147483647 1)", null),
            Arguments.of("i64 Overflow", "(* 9223372036854775807 2147483648)", null),
            Arguments.of("Integer And Float", "(+ 1 1.0)", null),
            Arguments.of("Float Add", "(+. 1.5 2.25)", 3.75),
            Arguments.of("Float Multiply", "(*. 1.5 2.0)", 3.0),
            Arguments.of("Float Divide", "(/. 1.0 4.0)", 0.25),
            Arguments.of("Float Division By Zero", "(/. 1.0 0.0)", null),
            Arguments.of("Float Operator On Integers", "(+. 1 2)", null)
        );
    }

    @ParameterizedTest
    @MethodSource
    void testLogic(String test, String input, Object expected) {
        test(List.of(input), expected);
    }

    private static Stream<Arguments> testLogic() {
        return Stream.of(
            Arguments.of("Equal", "(= 1 1)", true),
            Arguments.of("Less Than", "(< 1 2)", true),
            Arguments.of("Greater Than", "(> 1 2)", false),
            Arguments.of("Less Or Equal", "(<= 2 2)", true),
            Arguments.of("Greater Or Equal i64", "(>= 2147483648 2147483649)", false),
            Arguments.of("Compare Mixed Widths", "(< 1 2147483648)", null),
            Arguments.of("And", "(and true false)", false),
            Arguments.of("Or", "(or true false)", true),
            Arguments.of("Not", "(not true)", false),
            Arguments.of("Not Integer", "(not 1)", null),
            Arguments.of("If True", "(if true 1 2)", 1),
            Arguments.of("If False", "(if (= 1 2) 1 2)", 2),
            Arguments.of("If Skips Other Branch", "(if false (/ 1 0) 2)", 2),
            Arguments.of("If Integer Condition", "(if 1 2 3)", null)
        );
    }

    @ParameterizedTest
    @MethodSource
    void testTypeOf(String test, String input, Object expected) {
        test(List.of(input), expected);
    }

    private static Stream<Arguments> testTypeOf() {
        return Stream.of(
            Arguments.of("i32", "(type-of 1)", "i32"),
            Arguments.of("i64", "(type-of 2147483648)", "i64"),
            Arguments.of("f64", "(type-of 1.0)", "f64"),
            Arguments.of("bool", "(type-of true)", "bool"),
            Arguments.of("String", "(type-of \"s\")", "String"),
            Arguments.of("Function", "(type-of (fn [x: i32] x))", "function"),
            Arguments.of("Builtin", "(type-of +)", "builtin")
        );
    }

    @ParameterizedTest
    @MethodSource
    void testScope(String test, List<String> inputs, Object expected) {
        test(inputs, expected);
    }

    private static Stream<Arguments> testScope() {
        return Stream.of(
            Arguments.of("Undefined", List.of("x"), null),
            Arguments.of("Let", List.of("(let x 1)", "x"), 1),
            Arguments.of("Let Body", List.of("(let x 1 (+ x 1))"), 2),
            Arguments.of("Let Body Not Visible Afterwards", List.of("(let y 1 y)", "y"), null),
            Arguments.of("Let Body Shadow Restored", List.of("(let x 1)", "(let x 2 x)", "x"), 1),
            Arguments.of("Nested Shadow", List.of("(let x 1 (let x 2 x))"), 2),
            Arguments.of("Empty List", List.of("()"), null)
        );
    }

    @ParameterizedTest
    @MethodSource
    void testFunction(String test, List<String> inputs, Object expected) {
        test(inputs, expected);
    }

    private static Stream<Arguments> testFunction() {
        return Stream.of(
            Arguments.of("Lambda", List.of("((fn [x: i32 y: i32] (+ x y)) 1 2)"), 3),
            Arguments.of("Defn", List.of("(defn sq [n: i32] -> i32 (* n n))", "(sq 7)"), 49),
            Arguments.of("Factorial", List.of(
                "(defn fact [n: i32] -> i32 (if (<= n 1) 1 (* n (fact (- n 1)))))",
                "(fact 5)"
            ), 120),
            Arguments.of("Recursion Through Alias", List.of(
                "(defn fact [n: i32] -> i32 (if (<= n 1) 1 (* n (fact (- n 1)))))",
                "(let f fact)",
                "(f 6)"
            ), 720),
            Arguments.of("Recursion Through Parameter", List.of(
                "(defn countdown [n: i32] -> i32 (if (= n 0) 0 (countdown (- n 1))))",
                "((fn [f: fn(i32) -> i32] (f 50)) countdown)"
            ), 0),
            Arguments.of("Later Definition Not Captured", List.of(
                "(defn even? [n: i32] -> bool (if (= n 0) true (odd? (- n 1))))",
                "(defn odd? [n: i32] -> bool (if (= n 0) false (even? (- n 1))))",
                "(even? 10)"
            ), null),
            Arguments.of("Closure Captures Let", List.of("(let x 1 ((fn [y: i32] (+ x y)) 2))"), 3),
            Arguments.of("Closure Outlives Call", List.of(
                "(defn adder [n: i32] -> fn(i32) -> i32 (fn [x: i32] (+ x n)))",
                "(let add5 (adder 5))",
                "(add5 10)"
            ), 15),
            Arguments.of("Defn Captures Value", List.of(
                "(let n 1)",
                "(defn get [] -> i32 n)",
                "(let n 2)",
                "(get)"
            ), 1),
            Arguments.of("Lambda Captures Value", List.of(
                "(let y 1)",
                "(let g (fn [] y))",
                "(let y true)",
                "(g)"
            ), 1),
            Arguments.of("Redefinition Leaves Old Closure", List.of(
                "(defn f [] -> i32 1)",
                "(let old f)",
                "(defn f [] -> i32 2)",
                "(old)"
            ), 1),
            Arguments.of("Builtin As Argument", List.of("((fn [f: fn(i32, i32) -> i32] (f 2 3)) *)"), 6),
            Arguments.of("Too Many Arguments", List.of("((fn [x: i32] x) 1 2)"), null),
            Arguments.of("Builtin Too Few Arguments", List.of("(+ 1)"), null),
            Arguments.of("Duplicate Parameters", List.of("(fn [x: i32 x: i32] x)"), null),
            Arguments.of("Non-Function", List.of("(1 2)"), null),
            Arguments.of("Parameter Not Visible Afterwards", List.of("((fn [p: i32] p) 1)", "p"), null)
        );
    }

    @Test
    void testPrint() throws Exception {
        var out = new ByteArrayOutputStream();
        var scope = Environment.scope(new PrintStream(out, true, StandardCharsets.UTF_8));
        var value = new Evaluator(scope).visit(Parser.parse("(print \"hi\")"));
        Assertions.assertEquals(new RuntimeValue.Primitive("hi"), value);
        new Evaluator(scope).visit(Parser.parse("(println 4.0)"));
        Assertions.assertEquals("hi4.0" + System.lineSeparator(), out.toString(StandardCharsets.UTF_8));
    }

    @ParameterizedTest
    @MethodSource
    void testArityBeforeArguments(String test, String input) {
        var out = new ByteArrayOutputStream();
        var scope = Environment.scope(new PrintStream(out, true, StandardCharsets.UTF_8));
        Assertions.assertThrows(EvaluateException.class, () -> new Evaluator(scope).visit(Parser.parse(input)));
        Assertions.assertEquals("", out.toString(StandardCharsets.UTF_8));
    }

    private static Stream<Arguments> testArityBeforeArguments() {
        return Stream.of(
            Arguments.of("Function", "((fn [x: i32] x) (print \"a\") (print \"b\"))"),
            Arguments.of("Builtin", "(not (print true) (print false))")
        );
    }

    @Test
    void testFloatOverflow() {
        var multiply = (RuntimeValue.Builtin) Environment.scope().get("*.", false).orElseThrow();
        var exception = Assertions.assertThrows(EvaluateException.class, () -> multiply.definition().invoke(List.of(
                new RuntimeValue.Primitive(Double.MAX_VALUE),
                new RuntimeValue.Primitive(2.0)
        )));
        Assertions.assertEquals("Float overflow in *.", exception.getMessage());
    }

    @Test
    void testRender() throws Exception {
        var scope = Environment.scope();
        Assertions.assertEquals("#<builtin:+:2>", new Evaluator(scope).visit(Parser.parse("+")).toString());
        Assertions.assertEquals("#<function:2>",
                new Evaluator(scope).visit(Parser.parse("(fn [a: i32 b: i32] a)")).toString());
        Assertions.assertEquals("3.0", new Evaluator(scope).visit(Parser.parse("3.0")).toString());
        Assertions.assertEquals("a b", new Evaluator(scope).visit(Parser.parse("\"a b\"")).toString());
        Assertions.assertEquals("-0.0", new Evaluator(scope).visit(Parser.parse("(*. -1.0 0.0)")).toString());
    }

    /**
     * Evaluates each input in turn against one root scope; {@code expected}
     * is the primitive value of the last, or {@code null} if some input must
     * fail.
     */
    private static void test(List<String> inputs, Object expected) {
        var scope = Environment.scope(new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8));
        if (expected != null) {
            RuntimeValue value = null;
            for (String input : inputs) {
                value = Assertions.assertDoesNotThrow(() -> new Evaluator(scope).visit(Parser.parse(input)));
            }
            Assertions.assertEquals(new RuntimeValue.Primitive(expected), value);
        } else {
            Assertions.assertThrows(EvaluateException.class, () -> {
                for (String input : inputs) {
                    new Evaluator(scope).visit(Parser.parse(input));
                }
            });
        }
    }

}
