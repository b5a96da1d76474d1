package org.tinyscript.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigUtil;
import com.typesafe.config.ConfigValue;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Applies the level settings of the {@code logging} block to Logback.
 *
 * <pre>
 * logging {
 *   default-level = "WARN"            # root logger
 *   levels {
 *     "org.tinyscript.runtime" = "DEBUG"
 *     org.tinyscript.cli.shell = INFO  # unquoted paths name the same logger
 *   }
 * }
 * </pre>
 *
 * The console format ({@code logging.format}) is not handled here; it selects the appender
 * while logback.xml is loaded, which happens before levels are applied.
 */
public final class LoggingConfigurator {

    private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(LoggingConfigurator.class);

    private LoggingConfigurator() {}

    /**
     * Sets the root level and the per-logger levels. Nothing is changed unless every level
     * name is valid.
     * @param logging The {@code logging} block of the configuration.
     * @return The applied levels by logger name; the root logger appears as {@code ROOT}.
     * @throws ConfigException.BadValue if a level is not a Logback level name.
     */
    public static Map<String, Level> apply(final Config logging) {
        final Map<String, Level> levels = new LinkedHashMap<>();
        if (logging.hasPath("default-level")) {
            levels.put(Logger.ROOT_LOGGER_NAME, levelAt(logging, "default-level"));
        }
        if (logging.hasPath("levels")) {
            final Config perLogger = logging.getConfig("levels");
            for (final Map.Entry<String, ConfigValue> entry : perLogger.entrySet()) {
                final String loggerName = String.join(".", ConfigUtil.splitPath(entry.getKey()));
                levels.put(loggerName, levelAt(perLogger, entry.getKey()));
            }
        }

        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        levels.forEach((name, level) -> context.getLogger(name).setLevel(level));
        LOGGER.debug("Applied log levels {}", levels);
        return levels;
    }

    private static Level levelAt(final Config config, final String path) {
        final String name = config.getString(path);
        final Level level = Level.toLevel(name, null);
        if (level == null) {
            throw new ConfigException.BadValue(config.getValue(path).origin(), path,
                    "'" + name + "' is not a log level (expected TRACE, DEBUG, INFO, WARN, ERROR or OFF)");
        }
        return level;
    }
}
