package org.tinyscript.cli.commands;

import org.tinyscript.cli.CommandLineInterface;
import org.tinyscript.cli.ExitCodes;
import org.tinyscript.cli.SourceOptions;
import org.tinyscript.compiler.Compiler;
import org.tinyscript.compiler.api.CompilationException;
import org.tinyscript.compiler.util.AstPrinter;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.util.concurrent.Callable;

@Command(name = "ast", mixinStandardHelpOptions = true,
        exitCodeOnInvalidInput = ExitCodes.USAGE_ERROR,
        description = "Parses a TinyScript program and prints its syntax tree.")
public class AstCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @Mixin
    private SourceOptions source;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        final Compiler compiler = new Compiler();
        compiler.setVerbosity(parent.getConfig().getInt("tinyscript.compiler.verbosity"));
        try {
            spec.commandLine().getOut().print(AstPrinter.render(compiler.parse(source.read(), source.name())));
            return ExitCodes.OK;
        } catch (CompilationException e) {
            spec.commandLine().getErr().println(e.getDiagnostic().describe());
            return ExitCodes.COMPILATION_ERROR;
        } catch (IOException e) {
            spec.commandLine().getErr().println("Error: cannot read " + source.name() + ": " + e.getMessage());
            return ExitCodes.USAGE_ERROR;
        }
    }
}
