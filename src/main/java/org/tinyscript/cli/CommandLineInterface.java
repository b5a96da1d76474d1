package org.tinyscript.cli;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.tinyscript.cli.commands.AstCommand;
import org.tinyscript.cli.commands.RunCommand;
import org.tinyscript.cli.commands.ShellCommand;
import org.tinyscript.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.File;
import java.net.URL;
import java.util.concurrent.Callable;

@Command(
    name = "tinyscript",
    mixinStandardHelpOptions = true,
    version = "TinyScript 1.0",
    description = "TinyScript - a small interpreted scripting language",
    exitCodeOnInvalidInput = ExitCodes.USAGE_ERROR,
    subcommands = {
        RunCommand.class,
        AstCommand.class,
        ShellCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(CommandLineInterface.class);
    private static final String CONFIG_FILE_NAME = "tinyscript.conf";
    /** System property read by logback.xml to choose the console appender. */
    static final String FORMAT_PROPERTY = "tinyscript.logging.format";

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: tinyscript.conf)"
    )
    private File configFile;

    @Spec
    private CommandSpec spec;

    private Config config;
    private boolean initialized = false;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        spec.commandLine().usage(spec.commandLine().getOut());
        return ExitCodes.OK;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("tinyscript");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private void initialize() {
        if (initialized) {
            return;
        }

        try {
            this.config = loadConfig();
            // The appender is picked while logback.xml loads, so the format goes in first and levels after.
            if (config.hasPath("logging.format")) {
                System.setProperty(FORMAT_PROPERTY, appenderFor(config.getString("logging.format")));
                reconfigureLogback();
            }
            if (config.hasPath("logging")) {
                LoggingConfigurator.apply(config.getConfig("logging"));
            }
        } catch (ConfigException e) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "Failed to load or parse configuration: " + e.getMessage(), e, null, null);
        }
        initialized = true;
    }

    private Config loadConfig() {
        // Config load order: System Props > Env Vars > File > Classpath defaults
        final Config base = ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment());

        // 1) Highest precedence: explicit CLI option --config
        if (this.configFile != null) {
            if (!this.configFile.exists()) {
                throw new CommandLine.ParameterException(spec.commandLine(),
                        "Configuration file specified via --config was not found: " + this.configFile.getAbsolutePath());
            }
            LOGGER.info("Using configuration file specified via --config: {}", this.configFile.getAbsolutePath());
            return base.withFallback(ConfigFactory.parseFile(this.configFile))
                    .withFallback(ConfigFactory.load())
                    .resolve();
        }
        // 2) Then: tinyscript.conf in the current working directory
        final File cwdConfigFile = new File(CONFIG_FILE_NAME);
        if (cwdConfigFile.exists()) {
            LOGGER.info("Using configuration file found in current directory: {}", cwdConfigFile.getAbsolutePath());
            return base.withFallback(ConfigFactory.parseFile(cwdConfigFile))
                    .withFallback(ConfigFactory.load())
                    .resolve();
        }
        // 3) Finally: classpath defaults only (this also honours -Dconfig.file)
        LOGGER.debug("No '{}' found in current directory. Using default configuration from classpath.", CONFIG_FILE_NAME);
        return base.withFallback(ConfigFactory.load()).resolve();
    }

    /**
     * Maps {@code logging.format} to the console appender declared in logback.xml.
     * @param format {@code PLAIN} or {@code JSON}, in any case.
     * @return The appender name.
     * @throws ConfigException.BadValue for any other format.
     */
    static String appenderFor(final String format) {
        if ("JSON".equalsIgnoreCase(format)) {
            return "STDOUT";
        }
        if ("PLAIN".equalsIgnoreCase(format)) {
            return "STDOUT_PLAIN";
        }
        throw new ConfigException.BadValue("logging.format", "expected PLAIN or JSON but was '" + format + "'");
    }

    private void reconfigureLogback() {
        try {
            final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
            final JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);
            context.reset();
            final URL configUrl = CommandLineInterface.class.getClassLoader().getResource("logback.xml");
            if (configUrl != null) {
                configurator.doConfigure(configUrl);
            }
        } catch (JoranException e) {
            spec.commandLine().getErr().println("Failed to reconfigure Logback: " + e.getMessage());
        }
    }

    /**
     * Returns the merged configuration, loading it and applying the logging settings on first use.
     * @return The resolved configuration.
     */
    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }
}
