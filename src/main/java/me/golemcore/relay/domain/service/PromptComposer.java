package me.golemcore.relay.domain.service;

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

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.domain.model.CompletionRequest;
import me.golemcore.relay.domain.model.ConversationContext;
import me.golemcore.relay.domain.model.Scope;
import me.golemcore.relay.domain.model.Turn;
import me.golemcore.relay.infrastructure.config.BotProperties;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Turns a context snapshot into a completion request.
 *
 * <p>
 * Turns older than {@code bot.conversation.max-turn-age} are left out (the
 * newest turn is always kept), and group user turns are prefixed with the
 * speaker as {@code [name|id]}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PromptComposer {

    static final String FALLBACK_SYSTEM_PROMPT = "You are a friendly member of a chat. Reply briefly and naturally.";

    private final BotProperties properties;
    private final ResourceLoader resourceLoader;
    private final Clock clock;

    private String systemPrompt = FALLBACK_SYSTEM_PROMPT;

    @PostConstruct
    public void init() {
        systemPrompt = resolveSystemPrompt();
    }

    public CompletionRequest compose(ConversationContext context) {
        CompletionRequest.CompletionRequestBuilder builder = CompletionRequest.builder()
                .scope(context.getScope())
                .systemPrompt(systemPrompt);

        List<Turn> turns = context.getTurns();
        Instant cutoff = resolveCutoff();
        for (int i = 0; i < turns.size(); i++) {
            Turn turn = turns.get(i);
            boolean newest = i == turns.size() - 1;
            if (!newest && isStale(turn, cutoff)) {
                continue;
            }
            builder.turn(render(context.getScope(), turn));
        }
        return builder.build();
    }

    public String getSystemPrompt() {
        return systemPrompt;
    }

    Turn render(Scope scope, Turn turn) {
        if (!scope.isGroup() || !turn.isUser()) {
            return turn;
        }
        String name = turn.getSenderName() != null && !turn.getSenderName().isBlank()
                ? turn.getSenderName()
                : turn.getSenderId();
        return turn.toBuilder()
                .text("[" + name + "|" + turn.getSenderId() + "] " + turn.getText())
                .build();
    }

    private Instant resolveCutoff() {
        Duration maxAge = properties.getConversation().getMaxTurnAge();
        if (maxAge == null || maxAge.isZero() || maxAge.isNegative()) {
            return null;
        }
        return Instant.now(clock).minus(maxAge);
    }

    private boolean isStale(Turn turn, Instant cutoff) {
        return cutoff != null && turn.getTimestamp() != null && turn.getTimestamp().isBefore(cutoff);
    }

    private String resolveSystemPrompt() {
        BotProperties.CompletionProperties completion = properties.getCompletion();
        if (completion.getSystemPrompt() != null && !completion.getSystemPrompt().isBlank()) {
            return completion.getSystemPrompt().trim();
        }
        String location = completion.getSystemPromptLocation();
        if (location == null || location.isBlank()) {
            return FALLBACK_SYSTEM_PROMPT;
        }
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.warn("[Completion] system prompt not found at {}, using built-in prompt", location);
            return FALLBACK_SYSTEM_PROMPT;
        }
        try (InputStream in = resource.getInputStream()) {
            String text = new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
            return text.isEmpty() ? FALLBACK_SYSTEM_PROMPT : text;
        } catch (IOException e) {
            log.warn("[Completion] failed to read system prompt from {}: {}", location, e.getMessage());
            return FALLBACK_SYSTEM_PROMPT;
        }
    }
}
