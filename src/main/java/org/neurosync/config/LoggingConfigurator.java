package org.neurosync.config;

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
 * Applies the {@code logging} section of the configuration to Logback at runtime.
 *
 * <pre>
 * logging {
 *   format = "PLAIN"          # PLAIN or JSON
 *   default-level = "INFO"
 *   levels {
 *     "org.neurosync.http" = "DEBUG"
 *   }
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(LoggingConfigurator.class);

    public static final String FORMAT_PROPERTY = "neurosync.logging.format";

    private static final String LOGGING_CONFIG_PATH = "logging";
    private static final String FORMAT_KEY = "format";
    private static final String DEFAULT_LEVEL_KEY = "default-level";
    private static final String LEVELS_KEY = "levels";

    private static boolean loggingConfigured = false;

    private LoggingConfigurator() {
        // Private constructor to prevent instantiation
    }

    /**
     * Applies the logging configuration once; later calls have no effect until {@link #reset()}.
     *
     * @param config the application configuration
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
        LOGGER.debug("Logging configuration applied.");
    }

    /**
     * Selects the appender through the {@value #FORMAT_PROPERTY} property and reloads
     * {@code logback.xml} when the selection changed.
     */
    private static void configureFormat(final Config loggingConfig, final LoggerContext context) {
        if (!loggingConfig.hasPath(FORMAT_KEY)) {
            return;
        }
        final String appender = "JSON".equalsIgnoreCase(loggingConfig.getString(FORMAT_KEY)) ? "STDOUT_JSON" : "STDOUT";
        final String current = context.getProperty(FORMAT_PROPERTY) != null
            ? context.getProperty(FORMAT_PROPERTY)
            : System.getProperty(FORMAT_PROPERTY, "STDOUT");
        if (appender.equals(current)) {
            return;
        }
        System.setProperty(FORMAT_PROPERTY, appender);
        final URL configUrl = LoggingConfigurator.class.getClassLoader().getResource("logback.xml");
        if (configUrl == null) {
            return;
        }
        try {
            final JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);
            context.reset();
            context.putProperty(FORMAT_PROPERTY, appender);
            configurator.doConfigure(configUrl);
        } catch (final JoranException e) {
            LOGGER.error("Failed to reload Logback configuration, keeping the current setup.", e);
        }
        LOGGER.debug("Configured logging format: {}", appender);
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
        // Quoted keys like "org.neurosync.http" are single path elements, so iterate the root.
        for (final Map.Entry<String, ConfigValue> entry : loggingConfig.getConfig(LEVELS_KEY).root().entrySet()) {
            final String levelName = entry.getValue().unwrapped().toString();
            final Level level = Level.toLevel(levelName, null);
            if (level == null) {
                LOGGER.warn("Ignoring unknown log level '{}' for logger '{}'", levelName, entry.getKey());
                continue;
            }
            context.getLogger(entry.getKey()).setLevel(level);
            LOGGER.debug("Configured logger '{}' to level: {}", entry.getKey(), level);
        }
    }

    /**
     * Allows {@link #configure(Config)} to run again. For tests.
     */
    public static synchronized void reset() {
        loggingConfigured = false;
    }
}
