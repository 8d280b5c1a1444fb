package plc.lisp.evaluator;

import com.google.common.collect.ImmutableMap;

import java.util.Optional;

/**
 * A value environment. Local bindings are an immutable map that
 * {@link #define} replaces, so a {@link #snapshot()} can share it and never
 * sees later definitions.
 */
public final class Scope {

    private final Scope parent;
    private ImmutableMap<String, RuntimeValue> values;

    public Scope(Scope parent) {
        this(parent, ImmutableMap.of());
    }

    private Scope(Scope parent, ImmutableMap<String, RuntimeValue> values) {
        this.parent = parent;
        this.values = values;
    }

    public Optional<Scope> parent() {
        return Optional.ofNullable(parent);
    }

    public void define(String name, RuntimeValue value) {
        values = ImmutableMap.<String, RuntimeValue>builderWithExpectedSize(values.size() + 1)
                .putAll(values)
                .put(name, value)
                .buildKeepingLast();
    }

    public Optional<RuntimeValue> get(String name, boolean current) {
        if (values.containsKey(name)) {
            return Optional.of(values.get(name));
        } else if (parent != null && !current) {
            return parent.get(name, false);
        }
        return Optional.empty();
    }

    /**
     * A copy of this chain as it is now. Closures capture one, so rebinding
     * a name here afterwards does not change what they see.
     */
    public Scope snapshot() {
        return new Scope(parent == null ? null : parent.snapshot(), values);
    }

    /**
     * The local bindings at this moment, for a later {@link #restore}.
     */
    public ImmutableMap<String, RuntimeValue> bindings() {
        return values;
    }

    public void restore(ImmutableMap<String, RuntimeValue> bindings) {
        values = bindings;
    }

}
