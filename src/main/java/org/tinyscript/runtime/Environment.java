package org.tinyscript.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The flat variable table of one program run. There are no nested scopes: every assignment,
 * including the binding of a loop iterator, writes into this single table.
 * <p>
 * The caller creates the environment, passes it into the interpreter and decides when to discard it.
 * It is not thread-safe.
 */
public class Environment {

    private final Map<String, Object> variables = new LinkedHashMap<>();

    /**
     * Looks up a variable.
     * @param name The variable name.
     * @return The bound value, or empty if the name is unbound.
     */
    public Optional<Object> lookup(String name) {
        return Optional.ofNullable(variables.get(name));
    }

    /**
     * @param name The variable name.
     * @return {@code true} if the name is bound.
     */
    public boolean isDefined(String name) {
        return variables.containsKey(name);
    }

    /**
     * Binds a name, replacing any earlier binding.
     * @param name The variable name.
     * @param value The value, never {@code null}.
     */
    public void assign(String name, Object value) {
        variables.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
    }

    /**
     * @return An unmodifiable copy of all bindings in first-assignment order.
     */
    public Map<String, Object> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(variables));
    }

    /**
     * Removes all bindings.
     */
    public void clear() {
        variables.clear();
    }

    /**
     * @return The number of bound names.
     */
    public int size() {
        return variables.size();
    }
}
