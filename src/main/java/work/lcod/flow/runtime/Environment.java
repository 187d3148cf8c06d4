package work.lcod.flow.runtime;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Variable scope with an optional parent. Each execution builds its own chain.
 */
public final class Environment {
    private final Map<String, FlowValue> variables = new HashMap<>();
    private final Environment parent;

    private Environment(Environment parent) {
        this.parent = parent;
    }

    public static Environment root() {
        return new Environment(null);
    }

    public Environment child() {
        return new Environment(this);
    }

    public Optional<FlowValue> get(String name) {
        for (Environment scope = this; scope != null; scope = scope.parent) {
            FlowValue value = scope.variables.get(name);
            if (value != null) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    /** Creates or replaces {@code name} in this scope only. */
    public void define(String name, FlowValue value) {
        variables.put(name, value);
    }

    /**
     * Updates {@code name} in the nearest scope that already holds it, or creates it here when no
     * scope does.
     */
    public void set(String name, FlowValue value) {
        for (Environment scope = this; scope != null; scope = scope.parent) {
            if (scope.variables.containsKey(name)) {
                scope.variables.put(name, value);
                return;
            }
        }
        variables.put(name, value);
    }

    public boolean isDefinedLocally(String name) {
        return variables.containsKey(name);
    }
}
