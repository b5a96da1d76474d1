package org.tinyscript.runtime;

import org.tinyscript.runtime.api.ScriptRuntimeException;

import java.util.Map;
import java.util.Optional;

/**
 * The outcome of one program run.
 * <p>
 * Output and bindings are present even when the run failed: they hold everything that happened
 * before the failing statement.
 *
 * @param output The text printed by the program.
 * @param variables The bindings of the environment when the run ended.
 * @param lastValue The value of the last top-level statement if it was an expression or an
 *                  assignment, otherwise {@code null}.
 * @param error The error that stopped the run, or {@code null} if it completed.
 */
public record ExecutionResult(
        String output,
        Map<String, Object> variables,
        Object lastValue,
        ScriptRuntimeException error
) {

    /**
     * @return {@code true} if the program ran to completion.
     */
    public boolean isSuccess() {
        return error == null;
    }

    /**
     * @return The error that stopped the run, if any.
     */
    public Optional<ScriptRuntimeException> getError() {
        return Optional.ofNullable(error);
    }

    /**
     * @return The value of the last top-level statement, if it had one.
     */
    public Optional<Object> getLastValue() {
        return Optional.ofNullable(lastValue);
    }
}
