package org.tensorlatex.cli.config;

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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

/**
 * Tests for the LoggingConfigurator class.
 */
@Tag("unit")
class LoggingConfiguratorTest {

    private static final String PROBE_LOGGER = "org.tensorlatex.probe";

    private LoggerContext context;
    private Level rootLevel;

    @BeforeEach
    void setUp() {
        LoggingConfigurator.reset();
        context = (LoggerContext) LoggerFactory.getILoggerFactory();
        rootLevel = context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel();
    }

    @AfterEach
    void tearDown() {
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(rootLevel);
        context.getLogger(PROBE_LOGGER).setLevel(null);
        LoggingConfigurator.reset();
    }

    @Test
    void configure_withLevels_shouldApplyDefaultAndSpecificLevels() {
        // Given
        final Config config = ConfigFactory.parseString("""
            logging {
              default-level = "ERROR"
              levels {
                "org.tensorlatex.probe" = "DEBUG"
              }
            }
            """);

        // When
        LoggingConfigurator.configure(config);

        // Then
        assertEquals(Level.ERROR, context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
        assertEquals(Level.DEBUG, context.getLogger(PROBE_LOGGER).getLevel());
    }

    @Test
    void configure_calledTwice_shouldOnlyApplyFirstConfiguration() {
        // Given
        final Config first = ConfigFactory.parseString("logging.levels { \"org.tensorlatex.probe\" = \"INFO\" }");
        final Config second = ConfigFactory.parseString("logging.levels { \"org.tensorlatex.probe\" = \"TRACE\" }");

        // When
        LoggingConfigurator.configure(first);
        LoggingConfigurator.configure(second);

        // Then
        assertEquals(Level.INFO, context.getLogger(PROBE_LOGGER).getLevel());
    }

    @Test
    void configure_withoutLoggingBlock_shouldLeaveLevelsUntouched() {
        // When
        LoggingConfigurator.configure(ConfigFactory.empty());

        // Then
        assertEquals(rootLevel, context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
        assertNull(context.getLogger(PROBE_LOGGER).getLevel());
    }
}
