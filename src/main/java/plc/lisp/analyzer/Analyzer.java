package plc.lisp.analyzer;

import plc.lisp.parser.Ast;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Structural type checker. There is no unification: literals have fixed
 * types, names have whatever type they were bound with, and the placeholder
 * {@link Type#INFERRED} is the only source of flexibility.
 */
public final class Analyzer implements Ast.Visitor<Type, AnalyzeException> {

    private Scope scope;

    public Analyzer(Scope scope) {
        this.scope = scope;
    }

    /**
     * Checks each expression in order; the program has the type of its last
     * expression.
     */
    @Override
    public Type visit(Ast.Source ast) throws AnalyzeException {
        if (ast.expressions().isEmpty()) {
            throw new AnalyzeException("Nothing to check");
        }
        Type type = null;
        for (Ast.Expr expression : ast.expressions()) {
            type = visit(expression);
        }
        return type;
    }

    @Override
    public Type visit(Ast.Expr.Literal ast) throws AnalyzeException {
        Object value = ast.value();
        if (value instanceof Integer) return Type.I32;
        else if (value instanceof Long) return Type.I64;
        else if (value instanceof Double) return Type.F64;
        else if (value instanceof Boolean) return Type.BOOL;
        else if (value instanceof String) return Type.STRING;
        //If the AST value isn't one of the above types, the Parser is
        //returning an incorrect AST - this is an implementation issue,
        //hence throw AssertionError rather than AnalyzeException.
        throw new AssertionError(value == null ? "null" : value.getClass());
    }

    @Override
    public Type visit(Ast.Expr.Variable ast) throws AnalyzeException {
        return scope.get(ast.name(), false)
                .orElseThrow(() -> new AnalyzeException("Undefined variable: " + ast.name()));
    }

    @Override
    public Type visit(Ast.Expr.List ast) throws AnalyzeException {
        if (ast.elements().isEmpty()) {
            throw new AnalyzeException("Empty list");
        }
        return visit(ast.toCall());
    }

    @Override
    public Type visit(Ast.Expr.If ast) throws AnalyzeException {
        Type condition = visit(ast.condition());
        if (!isCompatible(condition, Type.BOOL)) {
            throw new AnalyzeException("If condition must be bool, got " + condition);
        }
        Type thenType = visit(ast.thenExpr());
        Type elseType = visit(ast.elseExpr());
        if (!isCompatible(thenType, elseType)) {
            throw new AnalyzeException("If branches must have same type: " + thenType + " vs " + elseType);
        }
        return thenType.equals(Type.INFERRED) ? elseType : thenType;
    }

    @Override
    public Type visit(Ast.Expr.Let ast) throws AnalyzeException {
        Type value = visit(ast.value());
        Type type = value;
        Optional<Type> declared = ast.type().filter(t -> !t.equals(Type.INFERRED));
        if (declared.isPresent()) {
            if (!isCompatible(value, declared.get())) {
                throw new AnalyzeException("Type mismatch: expected " + declared.get() + ", got " + value);
            }
            type = declared.get();
        }
        if (ast.body().isEmpty()) {
            scope.define(ast.name(), type);
            return type;
        }
        Scope previous = scope;
        scope = new Scope(previous);
        try {
            scope.define(ast.name(), type);
            return visit(ast.body().get());
        } finally {
            scope = previous;
        }
    }

    @Override
    public Type visit(Ast.Expr.Defn ast) throws AnalyzeException {
        checkParameters(ast.name(), ast.parameters());
        List<Type> parameters = parameterTypes(ast.parameters());

        // NOTE: declared before the body is checked so recursive calls resolve
        Type.Function type = new Type.Function(parameters, ast.returns());
        scope.define(ast.name(), type);

        Type body = visitBody(ast.parameters(), ast.body());
        if (ast.returns().equals(Type.INFERRED)) {
            type = new Type.Function(parameters, body);
            scope.define(ast.name(), type);
        } else if (!isCompatible(body, ast.returns())) {
            throw new AnalyzeException("Return type mismatch in " + ast.name()
                    + ": expected " + ast.returns() + ", got " + body);
        }
        return type;
    }

    @Override
    public Type visit(Ast.Expr.Lambda ast) throws AnalyzeException {
        checkParameters("lambda", ast.parameters());
        List<Type> parameters = parameterTypes(ast.parameters());
        Type body = visitBody(ast.parameters(), ast.body());
        Optional<Type> declared = ast.returns().filter(t -> !t.equals(Type.INFERRED));
        if (declared.isPresent()) {
            if (!isCompatible(body, declared.get())) {
                throw new AnalyzeException("Lambda return type mismatch: expected "
                        + declared.get() + ", got " + body);
            }
            return new Type.Function(parameters, declared.get());
        }
        return new Type.Function(parameters, body);
    }

    @Override
    public Type visit(Ast.Expr.Call ast) throws AnalyzeException {
        Type callee = visit(ast.callee());
        if (callee.equals(Type.INFERRED)) {
            // Nothing is known about the callee; still check the arguments.
            for (Ast.Expr argument : ast.arguments()) {
                visit(argument);
            }
            return Type.INFERRED;
        }
        if (!(callee instanceof Type.Function function)) {
            throw new AnalyzeException("Cannot call non-function type: " + callee);
        }
        List<Type> parameters = function.parameters();
        if (ast.arguments().size() != parameters.size()) {
            throw new AnalyzeException("Wrong number of arguments to " + ast.callee()
                    + ": expected " + parameters.size() + ", got " + ast.arguments().size());
        }
        Type result = function.returns();
        for (int i = 0; i < parameters.size(); i++) {
            Type argument = visit(ast.arguments().get(i));
            Type parameter = parameters.get(i);
            if (!isCompatible(argument, parameter)) {
                throw new AnalyzeException("Type mismatch in argument " + (i + 1) + " to " + ast.callee()
                        + ": expected " + parameter + ", got " + argument);
            }
            // A placeholder result takes the type of the placeholder argument,
            // which is what lets print return whatever it was given.
            if (function.returns().equals(Type.INFERRED) && parameter.equals(Type.INFERRED)) {
                result = argument;
            }
        }
        return result;
    }

    // ------------- BEGIN HELPER -------------

    private Type visitBody(List<Ast.Expr.Parameter> parameters, Ast.Expr body) throws AnalyzeException {
        Scope previous = scope;
        scope = new Scope(previous);
        try {
            for (Ast.Expr.Parameter parameter : parameters) {
                scope.define(parameter.name(), parameter.type());
            }
            return visit(body);
        } finally {
            scope = previous;
        }
    }

    private static List<Type> parameterTypes(List<Ast.Expr.Parameter> parameters) {
        return parameters.stream().map(Ast.Expr.Parameter::type).collect(Collectors.toList());
    }

    private static void checkParameters(String name, List<Ast.Expr.Parameter> parameters) throws AnalyzeException {
        if (parameters.stream().map(Ast.Expr.Parameter::name).distinct().count() != parameters.size()) {
            throw new AnalyzeException("Duplicate parameter names in " + name);
        }
    }

    /**
     * Structural equality, except that the placeholder on either side matches
     * anything, including inside function types.
     */
    public static boolean isCompatible(Type type, Type other) {
        if (type.equals(other) || type.equals(Type.INFERRED) || other.equals(Type.INFERRED)) {
            return true;
        }
        if (type instanceof Type.Function function && other instanceof Type.Function otherFunction) {
            if (function.parameters().size() != otherFunction.parameters().size()) {
                return false;
            }
            for (int i = 0; i < function.parameters().size(); i++) {
                if (!isCompatible(function.parameters().get(i), otherFunction.parameters().get(i))) {
                    return false;
                }
            }
            return isCompatible(function.returns(), otherFunction.returns());
        }
        return false;
    }

    // ------------- END HELPER -----------

}
