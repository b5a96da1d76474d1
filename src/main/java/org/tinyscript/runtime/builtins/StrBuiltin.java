package org.tinyscript.runtime.builtins;

import org.tinyscript.runtime.Values;
import org.tinyscript.runtime.api.RuntimeErrorKind;
import org.tinyscript.runtime.api.ScriptRuntimeException;

import java.util.List;

/**
 * {@code str(value)}: converts exactly one value to its textual form.
 */
public class StrBuiltin implements IBuiltinFunction {

    @Override
    public String name() {
        return "str";
    }

    @Override
    public Object invoke(List<Object> arguments) {
        if (arguments.isEmpty()) {
            throw new ScriptRuntimeException(RuntimeErrorKind.TYPE_ERROR, "str() takes exactly one argument (0 given)");
        }
        if (arguments.size() > 1) {
            throw new ScriptRuntimeException(RuntimeErrorKind.TYPE_ERROR,
                    "str() takes at most 1 argument (" + arguments.size() + " given)");
        }
        return Values.str(arguments.get(0));
    }
}
