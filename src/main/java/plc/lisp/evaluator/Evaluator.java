package plc.lisp.evaluator;

import plc.lisp.parser.Ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

// Scope handling:
// Entering a new scope swaps `scope` and restores it in a finally, so an
// error halfway through a call never leaves the evaluator in the callee's scope.
// Functions capture a snapshot of the scope they were defined in.

public final class Evaluator implements Ast.Visitor<RuntimeValue, EvaluateException> {

    private Scope scope;

    public Evaluator(Scope scope) {
        this.scope = scope;
    }

    @Override
    public RuntimeValue visit(Ast.Source ast) throws EvaluateException {
        if (ast.expressions().isEmpty()) {
            throw new EvaluateException("Nothing to evaluate");
        }
        RuntimeValue value = null;
        for (Ast.Expr expression : ast.expressions()) {
            value = visit(expression);
        }
        return value;
    }

    @Override
    public RuntimeValue visit(Ast.Expr.Literal ast) throws EvaluateException {
        return new RuntimeValue.Primitive(ast.value());
    }

    @Override
    public RuntimeValue visit(Ast.Expr.Variable ast) throws EvaluateException {
        return scope.get(ast.name(), false)
                .orElseThrow(() -> new EvaluateException("Undefined variable: " + ast.name()));
    }

    @Override
    public RuntimeValue visit(Ast.Expr.List ast) throws EvaluateException {
        if (ast.elements().isEmpty()) {
            throw new EvaluateException("Empty list");
        }
        return visit(ast.toCall());
    }

    @Override
    public RuntimeValue visit(Ast.Expr.If ast) throws EvaluateException {
        // Re-checked here; the analyzer lets a placeholder-typed condition through.
        RuntimeValue condition = visit(ast.condition());
        if (!(condition instanceof RuntimeValue.Primitive primitive && primitive.value() instanceof Boolean b)) {
            throw new EvaluateException("If condition must be a boolean, got " + condition.typeName());
        }
        return b ? visit(ast.thenExpr()) : visit(ast.elseExpr());
    }

    @Override
    public RuntimeValue visit(Ast.Expr.Let ast) throws EvaluateException {
        RuntimeValue value = visit(ast.value());
        if (ast.body().isEmpty()) {
            scope.define(ast.name(), value);
            return value;
        }
        Scope previous = scope;
        scope = new Scope(previous);
        try {
            scope.define(ast.name(), value);
            return visit(ast.body().get());
        } finally {
            scope = previous;
        }
    }

    @Override
    public RuntimeValue visit(Ast.Expr.Defn ast) throws EvaluateException {
        List<String> parameters = parameterNames(ast.name(), ast.parameters());
        // The closure sees a snapshot of the current scope plus one frame
        // holding its own name, which is bound once the function exists.
        Scope frame = new Scope(scope.snapshot());
        RuntimeValue function = new RuntimeValue.Function(Optional.of(ast.name()), parameters, ast.body(), frame);
        frame.define(ast.name(), function);
        scope.define(ast.name(), function);
        return function;
    }

    @Override
    public RuntimeValue visit(Ast.Expr.Lambda ast) throws EvaluateException {
        List<String> parameters = parameterNames("lambda", ast.parameters());
        return new RuntimeValue.Function(Optional.empty(), parameters, ast.body(), scope.snapshot());
    }

    @Override
    public RuntimeValue visit(Ast.Expr.Call ast) throws EvaluateException {
        RuntimeValue callee = visit(ast.callee());
        if (callee instanceof RuntimeValue.Function function) {
            // Arity goes first so no argument is evaluated for a bad call.
            if (ast.arguments().size() != function.parameters().size()) {
                throw new EvaluateException("Wrong number of arguments" + function.name().map(n -> " for " + n).orElse("")
                        + ": expected " + function.parameters().size() + ", got " + ast.arguments().size());
            }
            List<RuntimeValue> arguments = visitArguments(ast.arguments());
            Scope functionScope = new Scope(function.scope());
            for (int i = 0; i < arguments.size(); i++) {
                functionScope.define(function.parameters().get(i), arguments.get(i));
            }
            Scope previous = scope;
            scope = functionScope;
            try {
                return visit(function.body());
            } finally {
                scope = previous;
            }
        } else if (callee instanceof RuntimeValue.Builtin builtin) {
            if (ast.arguments().size() != builtin.arity()) {
                throw new EvaluateException("Wrong number of arguments for " + builtin.name()
                        + ": expected " + builtin.arity() + ", got " + ast.arguments().size());
            }
            return builtin.definition().invoke(visitArguments(ast.arguments()));
        }
        throw new EvaluateException("Cannot call non-function value: " + callee);
    }

    /**
     * Helper function for extracting the Java value of a
     * {@link RuntimeValue.Primitive}, checking it is of the given type.
     */
    // Public for use in Environment.java
    public static <T> T requireType(RuntimeValue value, Class<T> type) throws EvaluateException {
        if (value instanceof RuntimeValue.Primitive primitive && type.isInstance(primitive.value())) {
            return type.cast(primitive.value());
        }
        throw new EvaluateException("Expected value to be of type " + type.getSimpleName()
                + ", received " + value.typeName() + ".");
    }

    /**************** HELPER FUNCTIONS **********************/

    private List<RuntimeValue> visitArguments(List<Ast.Expr> expressions) throws EvaluateException {
        List<RuntimeValue> arguments = new ArrayList<>();
        for (Ast.Expr expression : expressions) {
            arguments.add(visit(expression));
        }
        return arguments;
    }

    private static List<String> parameterNames(String name, List<Ast.Expr.Parameter> parameters) throws EvaluateException {
        List<String> names = parameters.stream().map(Ast.Expr.Parameter::name).collect(Collectors.toList());
        if (names.stream().distinct().count() != names.size()) {
            throw new EvaluateException("Duplicate parameter names in " + name);
        }
        return names;
    }

}
