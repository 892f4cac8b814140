package org.ashby.cli.config;

import java.util.Map;

import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;

/**
 * Applies log levels at runtime.
 * <p>
 * The verbosity chosen on the command line sets the level of the {@code org.ashby} loggers;
 * levels configured under {@code ashby.logging.levels} are applied afterwards and win.
 * <pre>
 * ashby.logging {
 *   format = "PLAIN"
 *   levels {
 *     "org.ashby.plot.data" = "DEBUG"
 *     "com.zaxxer.hikari" = "WARN"
 *   }
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(LoggingConfigurator.class);

    public static final String APPLICATION_LOGGER = "org.ashby";
    public static final String FORMAT_PROPERTY = "ashby.logging.format";

    private LoggingConfigurator() {
    }

    /**
     * Maps the logging format setting to the name of the logback appender that renders it.
     *
     * @param format {@code PLAIN} for colored console lines, anything else for key=value lines
     * @return appender name referenced from {@code logback.xml}
     */
    public static String appenderFor(final String format) {
        return "PLAIN".equalsIgnoreCase(format) ? "STDOUT_PLAIN" : "STDOUT";
    }

    /**
     * Sets the application level and then every configured logger level.
     *
     * @param loggingConfig  the {@code ashby.logging} block, may lack {@code levels}
     * @param verbosityLevel level chosen by the command line flags
     */
    public static void configure(final Config loggingConfig, final Level verbosityLevel) {
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        context.getLogger(APPLICATION_LOGGER).setLevel(verbosityLevel);

        if (!loggingConfig.hasPath("levels")) {
            return;
        }
        int configured = 0;
        for (final Map.Entry<String, ConfigValue> entry : loggingConfig.getObject("levels").entrySet()) {
            final String loggerName = entry.getKey();
            final String levelName = String.valueOf(entry.getValue().unwrapped());
            final Level level = Level.toLevel(levelName, null);
            if (level == null) {
                LOGGER.warn("Ignoring unknown log level '{}' for logger '{}'", levelName, loggerName);
                continue;
            }
            final Logger logger = context.getLogger(loggerName);
            logger.setLevel(level);
            configured++;
        }
        LOGGER.debug("Configured {} specific logger levels", configured);
    }
}
