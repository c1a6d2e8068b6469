package org.minicc.node.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.LoggerFactory;

import java.net.URL;
import java.util.Map;

/**
 * Applies the {@code logging} block of the configuration to Logback at runtime.
 *
 * <pre>
 * logging {
 *   format = "PLAIN"         # PLAIN or JSON
 *   default-level = "INFO"   # root logger level
 *   levels {
 *     "org.minicc.compiler" = "DEBUG"
 *   }
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    /** System property read by {@code logback.xml} to pick the console appender. */
    public static final String FORMAT_PROPERTY = "minicc.logging.format";

    private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(LoggingConfigurator.class);
    private static final String LOGGING_CONFIG_PATH = "logging";
    private static final String FORMAT_KEY = "format";
    private static final String DEFAULT_LEVEL_KEY = "default-level";
    private static final String LEVELS_KEY = "levels";

    private static boolean loggingConfigured = false;

    private LoggingConfigurator() {
    }

    /**
     * Configures Logback from the given configuration. Only the first call has an effect
     * until {@link #reset()} is called.
     *
     * @param config The application configuration.
     */
    public static synchronized void configure(final Config config) {
        if (loggingConfigured) {
            LOGGER.debug("Logging already configured, skipping.");
            return;
        }
        loggingConfigured = true;

        if (!config.hasPath(LOGGING_CONFIG_PATH)) {
            LOGGER.debug("No logging configuration found, using Logback defaults.");
            return;
        }

        final Config loggingConfig = config.getConfig(LOGGING_CONFIG_PATH);
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        configureFormat(loggingConfig, context);
        configureDefaultLevel(loggingConfig, context);
        configureSpecificLevels(loggingConfig, context);
    }

    /**
     * Allows {@link #configure(Config)} to run again. Intended for tests.
     */
    public static synchronized void reset() {
        loggingConfigured = false;
    }

    /**
     * Maps a configured format name to the appender name used in {@code logback.xml}.
     *
     * @param format {@code PLAIN} or {@code JSON}, case-insensitive.
     * @return {@code STDOUT_PLAIN} for PLAIN, {@code STDOUT} for anything else.
     */
    static String appenderFor(final String format) {
        return "PLAIN".equalsIgnoreCase(format) ? "STDOUT_PLAIN" : "STDOUT";
    }

    private static void configureFormat(final Config loggingConfig, final LoggerContext context) {
        if (!loggingConfig.hasPath(FORMAT_KEY)) {
            return;
        }
        final String appender = appenderFor(loggingConfig.getString(FORMAT_KEY));
        if (appender.equals(System.getProperty(FORMAT_PROPERTY))) {
            return;
        }
        System.setProperty(FORMAT_PROPERTY, appender);
        reloadLogback(context);
        LOGGER.debug("Switched console logging to appender {}", appender);
    }

    private static void reloadLogback(final LoggerContext context) {
        final URL configUrl = LoggingConfigurator.class.getClassLoader().getResource("logback.xml");
        if (configUrl == null) {
            return;
        }
        final JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        context.reset();
        try {
            configurator.doConfigure(configUrl);
        } catch (final JoranException e) {
            LOGGER.error("Failed to reload Logback configuration from {}", configUrl, e);
        }
    }

    private static void configureDefaultLevel(final Config loggingConfig, final LoggerContext context) {
        if (loggingConfig.hasPath(DEFAULT_LEVEL_KEY)) {
            final Level level = Level.toLevel(loggingConfig.getString(DEFAULT_LEVEL_KEY), Level.INFO);
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(level);
            LOGGER.debug("Configured default log level: {}", level);
        }
    }

    private static void configureSpecificLevels(final Config loggingConfig, final LoggerContext context) {
        if (!loggingConfig.hasPath(LEVELS_KEY)) {
            return;
        }
        for (final Map.Entry<String, ConfigValue> entry : loggingConfig.getConfig(LEVELS_KEY).root().entrySet()) {
            final Level level = Level.toLevel(entry.getValue().unwrapped().toString(), Level.INFO);
            context.getLogger(entry.getKey()).setLevel(level);
            LOGGER.debug("Configured logger '{}' to level: {}", entry.getKey(), level);
        }
    }
}
