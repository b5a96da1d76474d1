package org.tinyscript.cli.shell;

import org.tinyscript.cli.ExecutionWatchdog;
import org.tinyscript.compiler.api.CompilationException;
import org.tinyscript.compiler.api.ICompiler;
import org.tinyscript.compiler.frontend.parser.ast.BlockNode;
import org.tinyscript.compiler.util.AstPrinter;
import org.tinyscript.runtime.Environment;
import org.tinyscript.runtime.ExecutionResult;
import org.tinyscript.runtime.ScriptRunner;
import org.tinyscript.runtime.Values;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * State and line handling of one interactive shell session, independent of the terminal.
 * Every program line runs against the same environment, so variables survive between lines.
 */
public class ShellSession {

    private static final Logger LOG = LoggerFactory.getLogger(ShellSession.class);

    /** File name reported in diagnostics for shell input. */
    public static final String SOURCE_NAME = "<shell>";

    /** Meta commands understood by {@link #handle(String)}, used for tab completion. */
    public static final List<String> META_COMMANDS =
            List.of(":help", ":vars", ":reset", ":ast", ":examples", ":quit", ":exit");

    private static final String HELP = """
            Enter a TinyScript program on one line; separate statements with ';'.
            Variables are kept for the rest of the session.
              :help           show this help
              :vars           list the current variables
              :reset          forget all variables
              :ast on|off     print the syntax tree of each line
              :examples       show the shape of every statement kind
              :quit, :exit    leave the shell (Ctrl+D works too)""";

    private static final String EXAMPLES = """
            Arithmetic expression  3 + 5 * (10 - 4) / 2
            List declaration       numbers = [1, 2.5, "three", True]
            For loop               for i in range(1, 5): print(i)
            While loop             while x > 0: x = x - 1
            If statement           if x >= 10: print("big") else: print("small")
            Simple declaration     x = 42
            Conversion             print("x is " + str(x))""";

    private final ICompiler compiler;
    private final ScriptRunner runner;
    private final ExecutionWatchdog watchdog;
    private final PrintWriter out;
    private final boolean showResult;

    private Environment environment = new Environment();
    private boolean showAst;
    private boolean running = true;

    /**
     * @param compiler The compiler used for every line.
     * @param runner The runner used for every line.
     * @param watchdog The time limit applied to every line.
     * @param out Where results, program output and errors are written.
     * @param showAst Whether to print the syntax tree initially.
     * @param showResult Whether to echo the value and type of single expressions and assignments.
     */
    public ShellSession(ICompiler compiler, ScriptRunner runner, ExecutionWatchdog watchdog,
                        PrintWriter out, boolean showAst, boolean showResult) {
        this.compiler = compiler;
        this.runner = runner;
        this.watchdog = watchdog;
        this.out = out;
        this.showAst = showAst;
        this.showResult = showResult;
    }

    /**
     * @return {@code false} once the user asked to leave.
     */
    public boolean isRunning() {
        return running;
    }

    public Environment getEnvironment() {
        return environment;
    }

    /**
     * Handles one input line: a meta command or a program.
     * @param line The raw input line.
     */
    public void handle(String line) {
        final String input = line.trim();
        if (input.isEmpty()) {
            return;
        }
        if (input.startsWith(":")) {
            handleMetaCommand(input);
        } else {
            evaluate(input);
        }
        out.flush();
    }

    private void handleMetaCommand(String input) {
        final String[] parts = input.split("\\s+");
        switch (parts[0]) {
            case ":help" -> out.println(HELP);
            case ":examples" -> out.println(EXAMPLES);
            case ":vars" -> printVariables();
            case ":reset" -> {
                environment.clear();
                out.println("Environment cleared.");
            }
            case ":ast" -> toggleAst(parts);
            case ":quit", ":exit" -> running = false;
            default -> out.println("Unknown command '" + parts[0] + "'. Type :help for a list of commands.");
        }
    }

    private void toggleAst(String[] parts) {
        if (parts.length == 2 && parts[1].equalsIgnoreCase("on")) {
            showAst = true;
        } else if (parts.length == 2 && parts[1].equalsIgnoreCase("off")) {
            showAst = false;
        } else if (parts.length != 1) {
            out.println("Usage: :ast on|off");
            return;
        }
        out.println("AST display is " + (showAst ? "on" : "off") + ".");
    }

    private void printVariables() {
        final Map<String, Object> variables = environment.snapshot();
        if (variables.isEmpty()) {
            out.println("No variables defined.");
            return;
        }
        variables.forEach((name, value) ->
                out.println(name + " = " + Values.repr(value) + " (" + Values.typeName(value) + ")"));
    }

    private void evaluate(String input) {
        final BlockNode program;
        try {
            program = compiler.parse(input, SOURCE_NAME);
        } catch (CompilationException e) {
            out.println(e.getDiagnostic().describe());
            return;
        }

        if (showAst) {
            out.print(AstPrinter.render(program));
        }

        final Environment target = environment;
        final ExecutionResult result;
        try {
            result = watchdog.run(() -> runner.run(program, target));
        } catch (TimeoutException e) {
            // The abandoned evaluation may still write to the old environment.
            environment = new Environment();
            out.println("Error: evaluation did not finish within " + watchdog.getTimeout().toMillis()
                    + " ms; variables have been reset.");
            out.println("Note: the abandoned evaluation cannot be stopped and keeps using CPU until the shell exits.");
            return;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running = false;
            return;
        }

        out.print(result.output());
        if (!result.isSuccess()) {
            out.println(result.error().toString());
            return;
        }
        if (showResult && program.statements().size() == 1) {
            result.getLastValue().ifPresent(value -> {
                out.println("Output: " + Values.str(value));
                out.println("Type: " + Values.typeName(value));
            });
        }
        LOG.debug("Evaluated shell line, {} variable(s) bound", result.variables().size());
    }
}
