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

import lombok.Data;
import me.golemcore.relay.domain.model.Tier;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties for the relay, bound from
 * application.yml.
 *
 * <p>
 * All configuration is organized under the {@code bot.*} prefix. This class
 * contains nested property classes for the different subsystems:
 * <ul>
 * <li>{@link GatewayProperties} - OneBot bridge addresses and auth</li>
 * <li>{@link PermissionProperties} - initial permission policy</li>
 * <li>{@link ConversationProperties} - context window limits</li>
 * <li>{@link CompletionProperties} - LLM provider settings</li>
 * <li>{@link DispatchProperties} - concurrency and retry limits</li>
 * <li>{@link TriggerProperties} - group reply scoring</li>
 * </ul>
 *
 * <p>
 * Uses Spring Boot's {@link ConfigurationProperties} for type-safe property
 * binding.
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "bot")
@Data
public class BotProperties {

    /**
     * Base tick of the agent: event poll interval and initial reconnect delay.
     */
    private Duration heartbeat = Duration.ofMillis(500);
    private GatewayProperties gateway = new GatewayProperties();
    private PermissionProperties permission = new PermissionProperties();
    private ConversationProperties conversation = new ConversationProperties();
    private CompletionProperties completion = new CompletionProperties();
    private DispatchProperties dispatch = new DispatchProperties();
    private TriggerProperties trigger = new TriggerProperties();
    private CommandsProperties commands = new CommandsProperties();
    private StorageProperties storage = new StorageProperties();
    private HttpProperties http = new HttpProperties();
    private LoggingProperties logging = new LoggingProperties();

    // ==================== GATEWAY ====================

    @Data
    public static class GatewayProperties {
        private String websocketUrl = "ws://127.0.0.1:3001";
        private String httpUrl = "http://127.0.0.1:3000";
        private String token = "";
        private Duration sendTimeout = Duration.ofSeconds(15);
        private Duration reconnectMaxDelay = Duration.ofSeconds(30);
    }

    // ==================== PERMISSION ====================

    @Data
    public static class PermissionProperties {
        private Tier defaultTier = Tier.DEFAULT;
        private Tier privateTier = Tier.DEFAULT;
        private List<String> admins = new ArrayList<>();
        /**
         * Keys are canonical scopes such as {@code group:123456}.
         */
        private Map<String, Tier> overrides = new LinkedHashMap<>();
    }

    // ==================== CONVERSATION ====================

    @Data
    public static class ConversationProperties {
        private int windowSize = 20;
        /**
         * Turns older than this are left out of prompts. Zero disables the cutoff.
         */
        private Duration maxTurnAge = Duration.ofSeconds(1300);

        /**
         * Windows kept in memory; least recently used ones are unloaded after
         * they are written.
         */
        private int maxLoadedScopes = 256;
    }

    // ==================== COMPLETION ====================

    @Data
    public static class CompletionProperties {
        private String provider = "langchain4j";
        private String baseUrl = "https://api.deepseek.com/v1";
        private String apiKey = "";
        private String model = "deepseek-chat";
        private double temperature = 0.7;
        private Integer maxTokens;
        private Duration timeout = Duration.ofSeconds(60);
        /**
         * Inline system prompt; takes precedence over {@link #systemPromptLocation}.
         */
        private String systemPrompt = "";
        private String systemPromptLocation = "classpath:prompts/system-prompt.md";
    }

    // ==================== DISPATCH ====================

    @Data
    public static class DispatchProperties {
        private int maxConcurrentScopes = 8;
        private int maxAttempts = 4;
        private Duration initialBackoff = Duration.ofSeconds(1);
        private Duration maxBackoff = Duration.ofSeconds(30);
        private Duration maxRateLimitWait = Duration.ofSeconds(60);
        private Duration shutdownTimeout = Duration.ofSeconds(10);
        private int dedupCacheSize = 256;

        /**
         * Scopes whose recent sequence numbers are remembered for replay
         * suppression and gap logging.
         */
        private int maxTrackedScopes = 1024;
    }

    // ==================== TRIGGER ====================

    @Data
    public static class TriggerProperties {
        private int threshold = 50;
        private int mentionScore = 100;
        private int boostScore = 30;
        /**
         * User messages after a bot reply that still receive the boost.
         */
        private int boostMessages = 2;
        /**
         * Case-insensitive keyword to score contribution. The shipped table
         * lives in application.yml.
         */
        private Map<String, Integer> keywords = new LinkedHashMap<>();
    }

    // ==================== COMMANDS ====================

    @Data
    public static class CommandsProperties {
        private boolean enabled = true;
        private String prefix = "#";
    }

    // ==================== STORAGE ====================

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/relay";
    }

    // ==================== HTTP ====================

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    // ==================== LOGGING ====================

    @Data
    public static class LoggingProperties {
        private boolean info = true;
        private boolean warning = true;
        private boolean error = true;
        private boolean chat = true;
        private boolean debug = false;
        /**
         * Optional log file; console only when blank.
         */
        private String file;
    }
}
