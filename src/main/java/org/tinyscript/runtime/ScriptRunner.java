package org.tinyscript.runtime;

import org.tinyscript.compiler.frontend.parser.ast.BlockNode;
import org.tinyscript.runtime.api.ScriptRuntimeException;
import org.tinyscript.runtime.builtins.BuiltinRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs parsed programs and turns runtime errors into an {@link ExecutionResult}.
 * A runner can be shared; every run gets its own {@link Interpreter}.
 */
public class ScriptRunner {

    private static final Logger LOG = LoggerFactory.getLogger(ScriptRunner.class);

    private final BuiltinRegistry builtins;

    public ScriptRunner() {
        this(BuiltinRegistry.initialize());
    }

    /**
     * @param builtins The functions programs may call.
     */
    public ScriptRunner(BuiltinRegistry builtins) {
        this.builtins = builtins;
    }

    /**
     * Runs a program in a fresh, empty environment.
     * @param program The parsed program.
     * @return The outcome of the run.
     */
    public ExecutionResult run(BlockNode program) {
        return run(program, new Environment());
    }

    /**
     * Runs a program against a caller-owned environment. Bindings made by the program,
     * including those made before a failure, stay in the environment.
     * @param program The parsed program.
     * @param environment The variable table to use.
     * @return The outcome of the run.
     */
    public ExecutionResult run(BlockNode program, Environment environment) {
        Interpreter interpreter = new Interpreter(environment, builtins);
        long startNanos = System.nanoTime();
        LOG.debug("Running program with {} top-level statement(s)", program.statements().size());
        try {
            Object lastValue = null;
            for (var statement : program.statements()) {
                lastValue = interpreter.evaluate(statement);
            }
            LOG.debug("Program finished in {} µs, {} variable(s) bound",
                    (System.nanoTime() - startNanos) / 1_000, environment.size());
            return new ExecutionResult(interpreter.getOutput(), environment.snapshot(), lastValue, null);
        } catch (ScriptRuntimeException e) {
            LOG.debug("Program stopped by {}", e.toString());
            return new ExecutionResult(interpreter.getOutput(), environment.snapshot(), null, e);
        }
    }
}
