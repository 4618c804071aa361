package me.golemcore.relay.infrastructure.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LoggingFlagsConfigurerTest {

    private LoggerContext loggerContext;
    private Level applicationLevel;
    private Level chatLevel;

    @BeforeEach
    void setUp() {
        loggerContext = (LoggerContext) LoggerFactory.getILoggerFactory();
        applicationLevel = loggerContext.getLogger(LoggingFlagsConfigurer.APPLICATION_LOGGER).getLevel();
        chatLevel = loggerContext.getLogger(LoggingFlagsConfigurer.CHAT_LOGGER).getLevel();
    }

    @AfterEach
    void tearDown() {
        loggerContext.getLogger(LoggingFlagsConfigurer.APPLICATION_LOGGER).setLevel(applicationLevel);
        loggerContext.getLogger(LoggingFlagsConfigurer.CHAT_LOGGER).setLevel(chatLevel);
    }

    @Test
    void shouldPickMostVerboseEnabledLevel() {
        BotProperties.LoggingProperties logging = new BotProperties.LoggingProperties();
        assertEquals(Level.INFO, LoggingFlagsConfigurer.resolveApplicationLevel(logging));

        logging.setDebug(true);
        assertEquals(Level.DEBUG, LoggingFlagsConfigurer.resolveApplicationLevel(logging));

        logging.setDebug(false);
        logging.setInfo(false);
        assertEquals(Level.WARN, LoggingFlagsConfigurer.resolveApplicationLevel(logging));

        logging.setWarning(false);
        assertEquals(Level.ERROR, LoggingFlagsConfigurer.resolveApplicationLevel(logging));

        logging.setError(false);
        assertEquals(Level.OFF, LoggingFlagsConfigurer.resolveApplicationLevel(logging));
    }

    @Test
    void shouldSilenceChatLoggerWhenDisabled() {
        BotProperties properties = new BotProperties();
        properties.getLogging().setChat(false);
        properties.getLogging().setInfo(false);

        new LoggingFlagsConfigurer(properties).applyFlags();

        assertEquals(Level.OFF, loggerContext.getLogger(LoggingFlagsConfigurer.CHAT_LOGGER).getLevel());
        assertEquals(Level.WARN, loggerContext.getLogger(LoggingFlagsConfigurer.APPLICATION_LOGGER).getLevel());
    }

    @Test
    void shouldAttachAndDetachFileAppender(@TempDir Path tempDir) throws Exception {
        Path file = tempDir.resolve("relay.log");
        BotProperties properties = new BotProperties();
        properties.getLogging().setFile(file.toString());
        LoggingFlagsConfigurer configurer = new LoggingFlagsConfigurer(properties);

        configurer.applyFlags();
        Logger root = loggerContext.getLogger(Logger.ROOT_LOGGER_NAME);
        assertNotNull(root.getAppender("RELAY_FILE"));
        LoggerFactory.getLogger(LoggingFlagsConfigurer.CHAT_LOGGER).info("[private:1] Alice: hi");

        configurer.detachFileAppender();
        assertNull(root.getAppender("RELAY_FILE"));
        assertTrue(Files.readString(file).contains("Alice: hi"));
    }
}
