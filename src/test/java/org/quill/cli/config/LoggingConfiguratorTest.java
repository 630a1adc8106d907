package org.quill.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the LoggingConfigurator class.
 * Only the PLAIN format is exercised, so logback.xml is never reloaded here.
 */
@Tag("unit")
class LoggingConfiguratorTest {

    private LoggerContext context;
    private Level originalRootLevel;

    @BeforeEach
    void setUp() {
        LoggingConfigurator.reset();
        context = (LoggerContext) LoggerFactory.getILoggerFactory();
        originalRootLevel = context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel();
    }

    @AfterEach
    void tearDown() {
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(originalRootLevel);
        context.getLogger("org.quill.session").setLevel(null);
        context.getLogger("org.quill.interpreter").setLevel(null);
        LoggingConfigurator.reset();
    }

    @Test
    void configure_shouldApplyDefaultAndSpecificLevels() {
        // Given
        final Config config = ConfigFactory.parseString("""
            logging {
              format = "PLAIN"
              default-level = "ERROR"
              levels {
                "org.quill.session" = "DEBUG"
              }
            }
            """);

        // When
        LoggingConfigurator.configure(config);

        // Then
        assertEquals(Level.ERROR, context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
        assertEquals(Level.DEBUG, context.getLogger("org.quill.session").getLevel());
    }

    @Test
    void configure_shouldBeIdempotent() {
        // Given
        final Config first = ConfigFactory.parseString("logging { default-level = \"INFO\" }");
        final Config second = ConfigFactory.parseString("logging { default-level = \"ERROR\" }");

        // When
        LoggingConfigurator.configure(first);
        LoggingConfigurator.configure(second);

        // Then
        assertEquals(Level.INFO, context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
    }

    @Test
    void configure_shouldSkipUnknownLevels() {
        // Given
        final Config config = ConfigFactory.parseString("""
            logging {
              levels {
                "org.quill.session" = "LOUD"
                "org.quill.interpreter" = "TRACE"
              }
            }
            """);

        // When
        LoggingConfigurator.configure(config);

        // Then
        assertNull(context.getLogger("org.quill.session").getLevel());
        assertEquals(Level.TRACE, context.getLogger("org.quill.interpreter").getLevel());
    }

    @Test
    void configure_withoutLoggingBlock_shouldKeepCurrentLevels() {
        // When
        LoggingConfigurator.configure(ConfigFactory.empty());

        // Then
        assertEquals(originalRootLevel, context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
    }
}
