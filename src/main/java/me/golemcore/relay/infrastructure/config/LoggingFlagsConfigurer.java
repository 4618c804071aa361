package me.golemcore.relay.infrastructure.config;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.FileAppender;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Applies the {@code bot.logging.*} switches to the Logback context at startup.
 *
 * <p>
 * Level flags set the threshold of the application loggers, the chat flag
 * silences the {@value #CHAT_LOGGER} logger, and a configured file adds a file
 * appender to the root logger.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LoggingFlagsConfigurer {

    public static final String CHAT_LOGGER = "chat";
    static final String APPLICATION_LOGGER = "me.golemcore.relay";
    private static final String FILE_APPENDER_NAME = "RELAY_FILE";
    private static final String FILE_PATTERN = "%d{yyyy-MM-dd HH:mm:ss.SSS} %-5level [%thread] %logger{36} - %msg%n";

    private final BotProperties properties;

    private FileAppender<ILoggingEvent> fileAppender;

    @PostConstruct
    void applyFlags() {
        BotProperties.LoggingProperties logging = properties.getLogging();
        LoggerContext loggerContext = (LoggerContext) LoggerFactory.getILoggerFactory();

        Level applicationLevel = resolveApplicationLevel(logging);
        loggerContext.getLogger(APPLICATION_LOGGER).setLevel(applicationLevel);
        loggerContext.getLogger(CHAT_LOGGER).setLevel(logging.isChat() ? Level.INFO : Level.OFF);

        String file = logging.getFile();
        if (file != null && !file.isBlank()) {
            attachFileAppender(loggerContext, file.trim());
        }
        log.debug("[Logging] application level={}, chat={}", applicationLevel, logging.isChat());
    }

    @PreDestroy
    void detachFileAppender() {
        if (fileAppender == null) {
            return;
        }
        LoggerContext loggerContext = (LoggerContext) LoggerFactory.getILoggerFactory();
        Logger rootLogger = loggerContext.getLogger(Logger.ROOT_LOGGER_NAME);
        rootLogger.detachAppender(FILE_APPENDER_NAME);
        fileAppender.stop();
        fileAppender = null;
    }

    static Level resolveApplicationLevel(BotProperties.LoggingProperties logging) {
        if (logging.isDebug()) {
            return Level.DEBUG;
        }
        if (logging.isInfo()) {
            return Level.INFO;
        }
        if (logging.isWarning()) {
            return Level.WARN;
        }
        if (logging.isError()) {
            return Level.ERROR;
        }
        return Level.OFF;
    }

    private void attachFileAppender(LoggerContext loggerContext, String file) {
        Logger rootLogger = loggerContext.getLogger(Logger.ROOT_LOGGER_NAME);
        if (rootLogger.getAppender(FILE_APPENDER_NAME) != null) {
            return;
        }

        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(loggerContext);
        encoder.setPattern(FILE_PATTERN);
        encoder.start();

        FileAppender<ILoggingEvent> appender = new FileAppender<>();
        appender.setContext(loggerContext);
        appender.setName(FILE_APPENDER_NAME);
        appender.setFile(file);
        appender.setAppend(true);
        appender.setEncoder(encoder);
        appender.start();
        rootLogger.addAppender(appender);
        fileAppender = appender;
        log.info("[Logging] writing log file: {}", file);
    }
}
