package org.tinyscript.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests how the {@code logging} block is turned into Logback levels.
 */
@Tag("unit")
class LoggingConfiguratorTest {

    private static final String RUNTIME_LOGGER = "org.tinyscript.runtime";
    private static final String SHELL_LOGGER = "org.tinyscript.cli.shell";

    private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
    private Level originalRootLevel;

    @BeforeEach
    void setUp() {
        originalRootLevel = context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel();
    }

    @AfterEach
    void tearDown() {
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(originalRootLevel);
        context.getLogger(RUNTIME_LOGGER).setLevel(null);
        context.getLogger(SHELL_LOGGER).setLevel(null);
    }

    @Test
    void apply_withDefaultLevelAndQuotedLoggerName_shouldSetBoth() {
        // Given
        final Config logging = ConfigFactory.parseString("""
            default-level = "ERROR"
            levels {
              "org.tinyscript.runtime" = "DEBUG"
            }
            """);

        // When
        final Map<String, Level> applied = LoggingConfigurator.apply(logging);

        // Then
        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.ERROR);
        assertThat(context.getLogger(RUNTIME_LOGGER).getLevel()).isEqualTo(Level.DEBUG);
        assertThat(applied).containsOnlyKeys(Logger.ROOT_LOGGER_NAME, RUNTIME_LOGGER);
    }

    @Test
    void apply_withUnquotedDottedPath_shouldNameTheSameLogger() {
        // Given
        final Config logging = ConfigFactory.parseString("""
            levels {
              org.tinyscript.cli.shell = info
            }
            """);

        // When
        LoggingConfigurator.apply(logging);

        // Then
        assertThat(context.getLogger(SHELL_LOGGER).getLevel()).isEqualTo(Level.INFO);
    }

    @Test
    void apply_withUnknownLevel_shouldRejectTheBlockWithoutChangingAnything() {
        // Given
        final Config logging = ConfigFactory.parseString("""
            default-level = "ERROR"
            levels {
              "org.tinyscript.runtime" = "LOUD"
            }
            """);

        // When / Then
        assertThatThrownBy(() -> LoggingConfigurator.apply(logging))
                .isInstanceOf(ConfigException.BadValue.class)
                .hasMessageContaining("'LOUD' is not a log level");
        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(originalRootLevel);
        assertThat(context.getLogger(RUNTIME_LOGGER).getLevel()).isNull();
    }

    @Test
    void apply_withEmptyBlock_shouldChangeNothing() {
        // When
        final Map<String, Level> applied = LoggingConfigurator.apply(ConfigFactory.parseString("levels {}"));

        // Then
        assertThat(applied).isEmpty();
        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(originalRootLevel);
    }
}
