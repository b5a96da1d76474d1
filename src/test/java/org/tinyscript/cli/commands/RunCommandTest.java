package org.tinyscript.cli.commands;

import org.tinyscript.cli.CommandLineInterface;
import org.tinyscript.cli.ExitCodes;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the {@code run} sub-command through picocli and checks its output streams and exit codes.
 */
@Tag("unit")
public class RunCommandTest {

    private StringWriter out;
    private StringWriter err;
    private CommandLine commandLine;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
        commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
    }

    @Test
    void runsInlineProgram() {
        // Act
        int exitCode = commandLine.execute("run", "-e", "x = 10; if x > 5: print(\"big\") else: print(\"small\")");

        // Assert
        assertThat(exitCode).isEqualTo(ExitCodes.OK);
        assertThat(out.toString()).isEqualTo("big\n");
        assertThat(err.toString()).isEmpty();
    }

    @Test
    void runsProgramFromFile(@TempDir Path tempDir) throws Exception {
        // Arrange
        Path script = tempDir.resolve("count.ts");
        Files.writeString(script, "# count to three\nfor i in range(1, 4):\n    print(i)\n");

        // Act
        int exitCode = commandLine.execute("run", script.toString());

        // Assert
        assertThat(exitCode).isEqualTo(ExitCodes.OK);
        assertThat(out.toString()).isEqualTo("1\n2\n3\n");
    }

    @Test
    void syntaxErrorExitsWithCompilationCode() {
        // Act
        int exitCode = commandLine.execute("run", "-e", "if x > 5 print(1)");

        // Assert
        assertThat(exitCode).isEqualTo(ExitCodes.COMPILATION_ERROR);
        assertThat(out.toString()).isEmpty();
        assertThat(err.toString().trim())
                .isEqualTo("SyntaxError: Syntax error at line 1, token='print' (type='PRINT')");
    }

    @Test
    void lexErrorIsReportedWithItsKind() {
        // Act
        int exitCode = commandLine.execute("run", "-e", "x = 1 @ 2");

        // Assert
        assertThat(exitCode).isEqualTo(ExitCodes.COMPILATION_ERROR);
        assertThat(err.toString().trim()).isEqualTo("LexError: Illegal character '@' at line 1");
    }

    @Test
    void runtimeErrorKeepsEarlierOutput() {
        // Act
        int exitCode = commandLine.execute("run", "-e", "print(\"before\"); print(1 / 0)");

        // Assert
        assertThat(exitCode).isEqualTo(ExitCodes.RUNTIME_ERROR);
        assertThat(out.toString()).isEqualTo("before\n");
        assertThat(err.toString().trim()).isEqualTo("ZeroDivisionError: division by zero (line 1)");
    }

    @Test
    void printsAstAndVariablesOnRequest() {
        // Act
        int exitCode = commandLine.execute("run", "--ast", "--vars", "-e", "x = 1; s = \"a\"");

        // Assert
        assertThat(exitCode).isEqualTo(ExitCodes.OK);
        assertThat(out.toString().lines()).containsExactly(
                "Block:",
                "  Assignment:",
                "    Variable(x)",
                "    Number(1)",
                "  Assignment:",
                "    Variable(s)",
                "    String(a)",
                "x = 1",
                "s = 'a'");
    }

    @Test
    void missingProgramIsUsageError() {
        // Act
        int exitCode = commandLine.execute("run");

        // Assert
        assertThat(exitCode).isEqualTo(ExitCodes.USAGE_ERROR);
        assertThat(err.toString()).contains("Missing program");
    }

    @Test
    void fileAndInlineProgramAreExclusive(@TempDir Path tempDir) throws Exception {
        // Arrange
        Path script = tempDir.resolve("a.ts");
        Files.writeString(script, "print(1)");

        // Act
        int exitCode = commandLine.execute("run", "-e", "print(2)", script.toString());

        // Assert
        assertThat(exitCode).isEqualTo(ExitCodes.USAGE_ERROR);
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void unreadableFileIsUsageError(@TempDir Path tempDir) {
        // Act
        int exitCode = commandLine.execute("run", tempDir.resolve("missing.ts").toString());

        // Assert
        assertThat(exitCode).isEqualTo(ExitCodes.USAGE_ERROR);
        assertThat(err.toString()).contains("cannot read");
    }

    @Test
    void missingConfigFileIsUsageError(@TempDir Path tempDir) {
        // Act
        int exitCode = commandLine.execute("--config", tempDir.resolve("nope.conf").toString(), "run", "-e", "print(1)");

        // Assert
        assertThat(exitCode).isEqualTo(ExitCodes.USAGE_ERROR);
        assertThat(err.toString()).contains("was not found");
    }

    @Test
    void configFileOverridesDefaults(@TempDir Path tempDir) throws Exception {
        // Arrange
        Path conf = tempDir.resolve("custom.conf");
        Files.writeString(conf, "tinyscript.run.timeout = 0s\n");

        // Act
        int exitCode = commandLine.execute("--config", conf.toString(), "run", "-e", "print(str(2 * 21))");

        // Assert
        assertThat(exitCode).isEqualTo(ExitCodes.OK);
        assertThat(out.toString()).isEqualTo("42\n");
    }
}
