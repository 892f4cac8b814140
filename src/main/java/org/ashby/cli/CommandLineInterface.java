package org.ashby.cli;

import java.io.File;
import java.net.URL;
import java.util.concurrent.Callable;

import org.ashby.cli.commands.BatchCommand;
import org.ashby.cli.commands.PlotCommand;
import org.ashby.cli.config.ConfigLoader;
import org.ashby.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ScopeType;

@Command(
    name = "ashby",
    mixinStandardHelpOptions = true,
    version = "Ashby 1.0",
    description = "Ashby - turns declarative plot definitions and database queries into Plotly figure documents",
    subcommands = {
        PlotCommand.class,
        BatchCommand.class,
        CommandLine.HelpCommand.class
    },
    footer = {
        "",
        "Configuration is read from config/ashby.conf unless --config names another file.",
        "Every setting can be overridden with a system property, e.g. -Dashby.batch.concurrency=2"
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final String ROOT_PATH = "ashby";

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/ashby.conf)",
        scope = ScopeType.INHERIT
    )
    private File configFile;

    @Option(
        names = {"-v", "--verbose"},
        description = "Log progress at INFO level (default)",
        scope = ScopeType.INHERIT
    )
    private boolean verbose;

    @Option(
        names = {"--very-verbose"},
        description = "Log at DEBUG level, including every dataset query",
        scope = ScopeType.INHERIT
    )
    private boolean veryVerbose;

    @Option(
        names = {"-q", "--quiet"},
        description = "Only log warnings and errors",
        scope = ScopeType.INHERIT
    )
    private boolean quiet;

    private Config config;
    private boolean initialized = false;

    @Override
    public Integer call() {
        // Without a subcommand, show usage.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = createCommandLine();
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Creates a fully configured CommandLine instance.
     * <p>
     * Use this method in tests to get the same configuration as the CLI entry point.
     *
     * @return A configured CommandLine instance.
     */
    public static CommandLine createCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("ashby");
        return commandLine;
    }

    private void initialize() {
        if (initialized) {
            return;
        }

        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);

        final Config resolved;
        try {
            resolved = ConfigLoader.resolve(this.configFile, (level, message) -> {
                switch (level) {
                    case INFO -> logger.debug(message);
                    case WARN -> logger.warn(message);
                }
            });
        } catch (ConfigException e) {
            throw new IllegalStateException("Failed to load or parse configuration: " + e.getMessage(), e);
        }
        this.config = resolved.getConfig(ROOT_PATH);

        final Config logging = config.getConfig("logging");
        if (logging.hasPath("format")) {
            System.setProperty(LoggingConfigurator.FORMAT_PROPERTY,
                LoggingConfigurator.appenderFor(logging.getString("format")));
            reconfigureLogback(logger);
        }
        LoggingConfigurator.configure(logging, verbosityLevel());

        initialized = true;
    }

    Level verbosityLevel() {
        if (quiet) {
            return Level.WARN;
        }
        if (veryVerbose) {
            return Level.DEBUG;
        }
        return Level.INFO;
    }

    private void reconfigureLogback(final Logger logger) {
        final URL configUrl = CommandLineInterface.class.getClassLoader().getResource("logback.xml");
        if (configUrl == null) {
            return;
        }
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        final JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        context.reset();
        try {
            configurator.doConfigure(configUrl);
        } catch (JoranException e) {
            logger.warn("Failed to reconfigure Logback: {}", e.getMessage());
        }
    }

    /**
     * Returns the {@code ashby} block of the resolved configuration, loading it and applying the
     * logging settings on first access.
     *
     * @return the application configuration
     * @throws IllegalArgumentException if an explicitly named configuration file does not exist
     * @throws IllegalStateException    if the configuration cannot be parsed
     */
    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }
}
