package org.neurosync.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.neurosync.junit.extensions.logging.ExpectLog;
import org.neurosync.junit.extensions.logging.LogLevel;
import org.neurosync.junit.extensions.logging.LogWatchExtension;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class LoggingConfiguratorTest {

    private static final String TEST_LOGGER = "org.neurosync.config.test";

    private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

    @BeforeEach
    void setUp() {
        LoggingConfigurator.reset();
    }

    @AfterEach
    void tearDown() {
        LoggingConfigurator.reset();
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(Level.INFO);
        context.getLogger(TEST_LOGGER).setLevel(null);
    }

    @Test
    void configure_appliesLevels() {
        // Given
        Config config = ConfigFactory.parseString("""
            logging {
              format = "PLAIN"
              default-level = "WARN"
              levels {
                "org.neurosync.config.test" = "DEBUG"
              }
            }
            """);

        // When
        LoggingConfigurator.configure(config);

        // Then
        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.WARN);
        assertThat(context.getLogger(TEST_LOGGER).getLevel()).isEqualTo(Level.DEBUG);
    }

    @Test
    void configure_runsOnlyOnceUntilReset() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.default-level = ERROR"));
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.default-level = DEBUG"));

        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.ERROR);

        LoggingConfigurator.reset();
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.default-level = INFO"));

        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.INFO);
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*LoggingConfigurator",
        messagePattern = "Ignoring unknown log level 'LOUD' for logger 'org.neurosync.config.test'")
    void configure_ignoresUnknownLevel() {
        LoggingConfigurator.configure(ConfigFactory.parseString(
            "logging.levels { \"org.neurosync.config.test\" = LOUD }"));

        assertThat(context.getLogger(TEST_LOGGER).getLevel()).isNull();
    }

    @Test
    void configure_withoutLoggingSectionKeepsDefaults() {
        LoggingConfigurator.configure(ConfigFactory.empty());

        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.INFO);
    }
}
