package org.tinyscript.runtime.builtins;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A registry for built-in functions. This class holds a map of function names
 * to their implementations. Names are case-sensitive.
 */
public class BuiltinRegistry {
    private final Map<String, IBuiltinFunction> functions = new HashMap<>();

    /**
     * Registers a built-in under its own name, replacing an earlier registration of that name.
     * @param function The built-in function.
     */
    public void register(IBuiltinFunction function) {
        functions.put(function.name(), function);
    }

    /**
     * Gets the built-in registered under a name.
     * @param name The function name.
     * @return An {@link Optional} containing the function if it exists, otherwise empty.
     */
    public Optional<IBuiltinFunction> get(String name) {
        return Optional.ofNullable(functions.get(name));
    }

    /**
     * @return The registered names.
     */
    public Set<String> names() {
        return Collections.unmodifiableSet(functions.keySet());
    }

    /**
     * Initializes the registry with all the standard built-ins.
     * @return A new instance of {@link BuiltinRegistry} with all built-ins registered.
     */
    public static BuiltinRegistry initialize() {
        BuiltinRegistry registry = new BuiltinRegistry();
        registry.register(new StrBuiltin());
        return registry;
    }
}
