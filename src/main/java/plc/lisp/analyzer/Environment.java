package plc.lisp.analyzer;

import com.google.common.collect.ImmutableMap;

import java.util.List;
import java.util.Map;

/**
 * Type names accepted in annotations and the types of the built-in
 * functions. Must be kept in line with the evaluator's table.
 */
public final class Environment {

    public static final Map<String, Type> TYPES = ImmutableMap.of(
        "i32", Type.I32,
        "i64", Type.I64,
        "f64", Type.F64,
        "bool", Type.BOOL,
        "String", Type.STRING,
        "_", Type.INFERRED
    );

    private Environment() {}

    /**
     * Creates a fresh root scope holding every built-in.
     */
    public static Scope scope() {
        var scope = new Scope(null);
        // Integer operators work on either width, so the checker defers to
        // the argument types.
        for (String name : List.of("+", "-", "*", "/")) {
            scope.define(name, function(List.of(Type.INFERRED, Type.INFERRED), Type.INFERRED));
        }
        for (String name : List.of("+.", "-.", "*.", "/.")) {
            scope.define(name, function(List.of(Type.F64, Type.F64), Type.F64));
        }
        for (String name : List.of("=", "<", ">", "<=", ">=")) {
            scope.define(name, function(List.of(Type.INFERRED, Type.INFERRED), Type.BOOL));
        }
        scope.define("and", function(List.of(Type.BOOL, Type.BOOL), Type.BOOL));
        scope.define("or", function(List.of(Type.BOOL, Type.BOOL), Type.BOOL));
        scope.define("not", function(List.of(Type.BOOL), Type.BOOL));
        scope.define("print", function(List.of(Type.INFERRED), Type.INFERRED));
        scope.define("println", function(List.of(Type.INFERRED), Type.INFERRED));
        scope.define("type-of", function(List.of(Type.INFERRED), Type.STRING));
        return scope;
    }

    private static Type.Function function(List<Type> parameters, Type returns) {
        return new Type.Function(parameters, returns);
    }

}
