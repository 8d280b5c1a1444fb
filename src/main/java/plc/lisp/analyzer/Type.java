package plc.lisp.analyzer;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Static types. Equality is structural (records), so two function types with
 * the same parameter and return types are the same type.
 *
 * <p>{@link #INFERRED} is the placeholder written {@code _} in source: it
 * accepts any type where it is expected and defers when it is produced. See
 * {@link Analyzer#isCompatible(Type, Type)}.
 */
public sealed interface Type {

    Primitive I32 = new Primitive("i32");
    Primitive I64 = new Primitive("i64");
    Primitive F64 = new Primitive("f64");
    Primitive BOOL = new Primitive("bool");
    Primitive STRING = new Primitive("String");

    Primitive INFERRED = new Primitive("_");

    record Primitive(
        String name
    ) implements Type {

        @Override
        public String toString() {
            return name;
        }

    }

    record Function(
        List<Type> parameters,
        Type returns
    ) implements Type {

        public Function {
            parameters = List.copyOf(parameters);
        }

        @Override
        public String toString() {
            return parameters.stream()
                    .map(Type::toString)
                    .collect(Collectors.joining(", ", "fn(", ") -> " + returns));
        }

    }

}
