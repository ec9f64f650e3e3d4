package org.gathermine.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.ConfigFactory;
import org.gathermine.junit.extensions.logging.ExpectLog;
import org.gathermine.junit.extensions.logging.LogLevel;
import org.gathermine.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for applying the logging block to Logback.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class LoggingConfiguratorTest {

    private static final String TEST_LOGGER = "org.gathermine.test.configured";

    private Level rootLevel;

    @BeforeEach
    void setUp() {
        LoggingConfigurator.reset();
        rootLevel = context().getLogger(Logger.ROOT_LOGGER_NAME).getLevel();
    }

    @AfterEach
    void tearDown() {
        LoggingConfigurator.reset();
        context().getLogger(Logger.ROOT_LOGGER_NAME).setLevel(rootLevel);
        context().getLogger(TEST_LOGGER).setLevel(null);
        System.clearProperty(LoggingConfigurator.FORMAT_PROPERTY);
    }

    @Test
    void configure_withPlainFormat_setsPlainAppenderProperty() {
        LoggingConfigurator.configure(ConfigFactory.parseString("""
            logging {
              format = "PLAIN"
            }
            """));

        assertEquals("STDOUT_PLAIN", context().getProperty(LoggingConfigurator.FORMAT_PROPERTY));
        assertEquals("STDOUT_PLAIN", System.getProperty(LoggingConfigurator.FORMAT_PROPERTY));
    }

    @Test
    void configure_withJsonFormat_setsJsonAppenderProperty() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging { format = \"json\" }"));

        assertEquals("STDOUT", context().getProperty(LoggingConfigurator.FORMAT_PROPERTY));
    }

    @Test
    void configure_appliesDefaultAndSpecificLevels() {
        LoggingConfigurator.configure(ConfigFactory.parseString("""
            logging {
              default-level = "INFO"
              levels {
                "org.gathermine.test.configured" = "ERROR"
              }
            }
            """));

        assertEquals(Level.INFO, context().getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
        assertEquals(Level.ERROR, context().getLogger(TEST_LOGGER).getLevel());
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Ignoring unknown level 'LOUD' for logger 'org.gathermine.test.configured'")
    void configure_withUnknownLevel_warnsAndSkips() {
        LoggingConfigurator.configure(ConfigFactory.parseString(
                "logging { levels { \"org.gathermine.test.configured\" = \"LOUD\" } }"));

        assertNull(context().getLogger(TEST_LOGGER).getLevel());
    }

    @Test
    void configure_secondCallIsIgnoredUntilReset() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging { levels { \"org.gathermine.test.configured\" = \"ERROR\" } }"));
        LoggingConfigurator.configure(ConfigFactory.parseString("logging { levels { \"org.gathermine.test.configured\" = \"DEBUG\" } }"));
        assertEquals(Level.ERROR, context().getLogger(TEST_LOGGER).getLevel());

        LoggingConfigurator.reset();
        LoggingConfigurator.configure(ConfigFactory.parseString("logging { levels { \"org.gathermine.test.configured\" = \"DEBUG\" } }"));
        assertEquals(Level.DEBUG, context().getLogger(TEST_LOGGER).getLevel());
    }

    @Test
    void appenderFor_mapsFormats() {
        assertEquals("STDOUT_PLAIN", LoggingConfigurator.appenderFor("plain"));
        assertEquals("STDOUT", LoggingConfigurator.appenderFor("JSON"));
    }

    private static LoggerContext context() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }
}
