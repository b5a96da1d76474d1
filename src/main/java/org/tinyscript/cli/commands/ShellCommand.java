package org.tinyscript.cli.commands;

import com.typesafe.config.Config;
import org.jline.reader.Candidate;
import org.jline.reader.Completer;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.ParsedLine;
import org.jline.reader.UserInterruptException;
import org.jline.reader.impl.history.DefaultHistory;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.tinyscript.cli.CommandLineInterface;
import org.tinyscript.cli.ExecutionWatchdog;
import org.tinyscript.cli.ExitCodes;
import org.tinyscript.cli.shell.ShellSession;
import org.tinyscript.compiler.Compiler;
import org.tinyscript.runtime.ScriptRunner;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "shell", mixinStandardHelpOptions = true,
        exitCodeOnInvalidInput = ExitCodes.USAGE_ERROR,
        description = "Starts an interactive TinyScript shell.")
public class ShellCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() throws IOException {
        final Config config = parent.getConfig();
        final Config shellConfig = config.getConfig("tinyscript.shell");
        final String prompt = shellConfig.getString("prompt");

        final Compiler compiler = new Compiler();
        compiler.setVerbosity(config.getInt("tinyscript.compiler.verbosity"));

        try (Terminal terminal = TerminalBuilder.builder().system(true).build()) {
            final PrintWriter out = terminal.writer();
            final ShellSession session = new ShellSession(
                    compiler,
                    new ScriptRunner(),
                    new ExecutionWatchdog(config.getDuration("tinyscript.run.timeout")),
                    out,
                    shellConfig.getBoolean("show-ast"),
                    shellConfig.getBoolean("show-result"));

            final LineReader lineReader = LineReaderBuilder.builder()
                    .terminal(terminal)
                    .history(new DefaultHistory())
                    .completer(new MetaCommandCompleter())
                    .build();

            out.println("TinyScript shell. Type :help for help, :quit to exit.");
            while (session.isRunning()) {
                try {
                    session.handle(lineReader.readLine(prompt));
                } catch (UserInterruptException e) {
                    // Ctrl-C, exit
                    break;
                } catch (EndOfFileException e) {
                    // Ctrl-D, exit
                    break;
                }
            }
            out.flush();
        }
        return ExitCodes.OK;
    }

    private static class MetaCommandCompleter implements Completer {
        @Override
        public void complete(LineReader reader, ParsedLine line, List<Candidate> candidates) {
            if (line.wordIndex() == 0) {
                for (String command : ShellSession.META_COMMANDS) {
                    if (command.startsWith(line.word())) {
                        candidates.add(new Candidate(command));
                    }
                }
            }
        }
    }
}
