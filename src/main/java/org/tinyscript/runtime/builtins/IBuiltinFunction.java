package org.tinyscript.runtime.builtins;

import java.util.List;

/**
 * A function provided by the runtime that scripts can call by name.
 */
public interface IBuiltinFunction {

    /**
     * @return The name under which scripts call this function.
     */
    String name();

    /**
     * Invokes the function. Implementations validate their own arity and argument types.
     *
     * @param arguments The already evaluated positional arguments, in source order.
     * @return The result value, never {@code null}.
     * @throws org.tinyscript.runtime.api.ScriptRuntimeException if the arguments are not acceptable.
     */
    Object invoke(List<Object> arguments);
}
