package org.tinyscript.cli.commands;

import com.typesafe.config.Config;
import org.tinyscript.cli.CommandLineInterface;
import org.tinyscript.cli.ExecutionWatchdog;
import org.tinyscript.cli.ExitCodes;
import org.tinyscript.cli.SourceOptions;
import org.tinyscript.compiler.Compiler;
import org.tinyscript.compiler.api.CompilationException;
import org.tinyscript.compiler.frontend.parser.ast.BlockNode;
import org.tinyscript.compiler.util.AstPrinter;
import org.tinyscript.runtime.ExecutionResult;
import org.tinyscript.runtime.ScriptRunner;
import org.tinyscript.runtime.Values;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.io.PrintWriter;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeoutException;

@Command(name = "run", mixinStandardHelpOptions = true,
        exitCodeOnInvalidInput = ExitCodes.USAGE_ERROR,
        description = "Parses and runs a TinyScript program.")
public class RunCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(RunCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Mixin
    private SourceOptions source;

    @Option(names = "--ast", description = "Print the syntax tree before running.")
    private boolean showAst;

    @Option(names = "--vars", description = "Print the final variable bindings after the program output.")
    private boolean showVariables;

    @Option(names = "--timeout", paramLabel = "SECONDS",
            description = "Wall-clock limit in seconds, 0 disables it (default: tinyscript.run.timeout).")
    private Long timeoutSeconds;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        final Config config = parent.getConfig();
        final PrintWriter out = spec.commandLine().getOut();
        final PrintWriter err = spec.commandLine().getErr();

        final String code;
        try {
            code = source.read();
        } catch (IOException e) {
            err.println("Error: cannot read " + source.name() + ": " + e.getMessage());
            return ExitCodes.USAGE_ERROR;
        }

        final Compiler compiler = new Compiler();
        compiler.setVerbosity(config.getInt("tinyscript.compiler.verbosity"));
        final BlockNode program;
        try {
            program = compiler.parse(code, source.name());
        } catch (CompilationException e) {
            err.println(e.getDiagnostic().describe());
            return ExitCodes.COMPILATION_ERROR;
        }

        if (showAst) {
            out.print(AstPrinter.render(program));
        }

        final Duration timeout = timeoutSeconds != null
                ? Duration.ofSeconds(timeoutSeconds)
                : config.getDuration("tinyscript.run.timeout");
        final ExecutionResult result;
        try {
            result = new ExecutionWatchdog(timeout).run(() -> new ScriptRunner().run(program));
        } catch (TimeoutException e) {
            err.println("Error: " + source.name() + " did not finish within " + timeout.toMillis() + " ms");
            return ExitCodes.TIMEOUT;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            err.println("Error: interrupted");
            return ExitCodes.TIMEOUT;
        }

        out.print(result.output());
        if (showVariables) {
            for (Map.Entry<String, Object> binding : result.variables().entrySet()) {
                out.println(binding.getKey() + " = " + Values.repr(binding.getValue()));
            }
        }
        out.flush();

        if (!result.isSuccess()) {
            err.println(result.error().toString());
            LOG.debug("Run of {} failed", source.name(), result.error());
            return ExitCodes.RUNTIME_ERROR;
        }
        return ExitCodes.OK;
    }
}
