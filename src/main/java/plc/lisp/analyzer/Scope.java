package plc.lisp.analyzer;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkState;

/**
 * A type environment: local bindings on top of an optional parent. Child
 * scopes share their parent rather than copying it, and defining a name only
 * ever touches the local map.
 */
public final class Scope {

    private final Scope parent;
    private final Map<String, Type> types = new HashMap<>();

    public Scope(Scope parent) {
        this.parent = parent;
    }

    public Optional<Scope> parent() {
        return Optional.ofNullable(parent);
    }

    /**
     * Binds (or rebinds) a name in this scope.
     */
    public void define(String name, Type type) {
        types.put(name, type);
    }

    /**
     * Looks a name up locally, then through the parents unless
     * {@code current} is set.
     */
    public Optional<Type> get(String name, boolean current) {
        if (types.containsKey(name)) {
            return Optional.of(types.get(name));
        } else if (parent != null && !current) {
            return parent.get(name, false);
        }
        return Optional.empty();
    }

    /**
     * Moves every local binding into the parent scope. Used to keep the
     * bindings of an expression out of the root until it has checked.
     */
    public void commit() {
        checkState(parent != null, "The root scope has no parent to commit to");
        types.forEach(parent::define);
        types.clear();
    }

}
