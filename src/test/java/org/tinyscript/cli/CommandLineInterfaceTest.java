package org.tinyscript.cli;

import com.typesafe.config.ConfigException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests configuration loading and the logging setup done by the root command.
 */
@Tag("unit")
public class CommandLineInterfaceTest {

    @AfterEach
    void tearDown() {
        System.clearProperty(CommandLineInterface.FORMAT_PROPERTY);
    }

    @Test
    void appenderForMapsBothFormatsInAnyCase() {
        assertThat(CommandLineInterface.appenderFor("json")).isEqualTo("STDOUT");
        assertThat(CommandLineInterface.appenderFor("PLAIN")).isEqualTo("STDOUT_PLAIN");
    }

    @Test
    void appenderForRejectsUnknownFormat() {
        assertThatThrownBy(() -> CommandLineInterface.appenderFor("xml"))
                .isInstanceOf(ConfigException.BadValue.class)
                .hasMessageContaining("expected PLAIN or JSON but was 'xml'");
    }

    @Test
    void invalidLogLevelInConfigFileIsAUsageError(@TempDir Path tempDir) throws Exception {
        // Arrange
        Path conf = tempDir.resolve("bad.conf");
        Files.writeString(conf, "logging { default-level = LOUD }\n");
        StringWriter out = new StringWriter();
        StringWriter err = new StringWriter();
        CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));

        // Act
        int exitCode = commandLine.execute("--config", conf.toString(), "run", "-e", "print(1)");

        // Assert
        assertThat(exitCode).isEqualTo(ExitCodes.USAGE_ERROR);
        assertThat(out.toString()).isEmpty();
        assertThat(err.toString()).contains("'LOUD' is not a log level");
    }

    @Test
    void configFileSelectsTheJsonAppender(@TempDir Path tempDir) throws Exception {
        // Arrange
        Path conf = tempDir.resolve("json.conf");
        Files.writeString(conf, "logging { format = JSON }\n");
        CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setOut(new PrintWriter(new StringWriter(), true));

        // Act
        int exitCode = commandLine.execute("--config", conf.toString(), "run", "-e", "print(1)");

        // Assert
        assertThat(exitCode).isEqualTo(ExitCodes.OK);
        assertThat(System.getProperty(CommandLineInterface.FORMAT_PROPERTY)).isEqualTo("STDOUT");
    }
}
