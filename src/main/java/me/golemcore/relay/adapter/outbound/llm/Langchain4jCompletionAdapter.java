package me.golemcore.relay.adapter.outbound.llm;

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

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.domain.model.CompletionFailureKind;
import me.golemcore.relay.domain.model.CompletionRequest;
import me.golemcore.relay.domain.model.CompletionResult;
import me.golemcore.relay.domain.model.Turn;
import me.golemcore.relay.infrastructure.config.BotProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Completion adapter for OpenAI-compatible chat endpoints via langchain4j.
 *
 * <p>
 * The model is built lazily from {@code bot.completion.*} with retries
 * disabled; every failure is classified by {@link CompletionErrorClassifier}
 * and returned as a result value. Calls are bounded by
 * {@code bot.completion.timeout}.
 *
 * <p>
 * Provider ID: {@code "langchain4j"}
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jCompletionAdapter implements CompletionProviderAdapter {

    static final String PROVIDER_ID = "langchain4j";

    private final BotProperties properties;

    private volatile ChatModel chatModel;

    @Override
    public String getProviderId() {
        return PROVIDER_ID;
    }

    @Override
    public boolean isAvailable() {
        String apiKey = properties.getCompletion().getApiKey();
        return chatModel != null || (apiKey != null && !apiKey.isBlank());
    }

    @Override
    public CompletableFuture<CompletionResult> complete(CompletionRequest request) {
        Duration timeout = properties.getCompletion().getTimeout();
        CompletableFuture<CompletionResult> call = CompletableFuture.supplyAsync(() -> invoke(request));
        if (timeout != null && !timeout.isZero() && !timeout.isNegative()) {
            call = call.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }
        return call.exceptionally(error -> {
            CompletionResult result = CompletionErrorClassifier.classify(error);
            log.warn("[Completion] request for {} failed: kind={}, retryAfter={}, error={}",
                    request.getScope(), result.getFailureKind(), result.getRetryAfter(), result.getError());
            return result;
        });
    }

    private CompletionResult invoke(CompletionRequest request) {
        ChatModel model = ensureModel();
        List<ChatMessage> messages = toMessages(request);
        log.debug("[Completion] calling model for {} with {} message(s)", request.getScope(), messages.size());
        ChatResponse response = model.chat(messages);
        String text = response != null && response.aiMessage() != null ? response.aiMessage().text() : null;
        if (text == null || text.isBlank()) {
            return CompletionResult.failure(CompletionFailureKind.TRANSIENT, "empty completion");
        }
        return CompletionResult.success(text.trim());
    }

    List<ChatMessage> toMessages(CompletionRequest request) {
        List<ChatMessage> messages = new ArrayList<>();
        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(SystemMessage.from(request.getSystemPrompt()));
        }
        for (Turn turn : request.getTurns()) {
            if (turn.getText() == null || turn.getText().isBlank()) {
                continue;
            }
            if (turn.isAssistant()) {
                messages.add(AiMessage.from(turn.getText()));
            } else {
                messages.add(UserMessage.from(turn.getText()));
            }
        }
        return messages;
    }

    private ChatModel ensureModel() {
        ChatModel model = chatModel;
        if (model == null) {
            synchronized (this) {
                if (chatModel == null) {
                    chatModel = createModel();
                }
                model = chatModel;
            }
        }
        return model;
    }

    private ChatModel createModel() {
        BotProperties.CompletionProperties completion = properties.getCompletion();
        var builder = OpenAiChatModel.builder()
                .apiKey(completion.getApiKey())
                .modelName(completion.getModel())
                .temperature(completion.getTemperature())
                .maxRetries(0); // Retry handled by the dispatcher

        if (completion.getTimeout() != null) {
            builder.timeout(completion.getTimeout());
        }
        if (completion.getBaseUrl() != null && !completion.getBaseUrl().isBlank()) {
            builder.baseUrl(completion.getBaseUrl());
        }
        if (completion.getMaxTokens() != null) {
            builder.maxTokens(completion.getMaxTokens());
        }
        log.info("[Completion] initialized model {} at {}", completion.getModel(), completion.getBaseUrl());
        return builder.build();
    }

    // Visible for testing
    void setChatModel(ChatModel chatModel) {
        this.chatModel = chatModel;
    }
}
