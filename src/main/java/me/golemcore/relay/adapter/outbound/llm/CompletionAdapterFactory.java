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

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.domain.model.CompletionRequest;
import me.golemcore.relay.domain.model.CompletionResult;
import me.golemcore.relay.infrastructure.config.BotProperties;
import me.golemcore.relay.port.outbound.CompletionPort;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Selects the active completion provider from {@code bot.completion.provider}.
 *
 * <p>
 * Falls back to the {@code none} adapter when the configured provider is
 * unknown or unavailable (no API key).
 */
@Component
@Primary
@RequiredArgsConstructor
@Slf4j
public class CompletionAdapterFactory implements CompletionPort {

    private static final String PROVIDER_NONE = NoOpCompletionAdapter.PROVIDER_ID;

    private final BotProperties properties;
    private final List<CompletionProviderAdapter> adapters;

    private final Map<String, CompletionProviderAdapter> adaptersByProvider = new ConcurrentHashMap<>();
    private CompletionProviderAdapter activeAdapter;

    @PostConstruct
    public void init() {
        for (CompletionProviderAdapter adapter : adapters) {
            adaptersByProvider.put(adapter.getProviderId(), adapter);
            log.debug("Registered completion adapter: {}", adapter.getProviderId());
        }

        String provider = properties.getCompletion().getProvider();
        CompletionProviderAdapter configured = adaptersByProvider.get(provider);
        if (configured != null && configured.isAvailable()) {
            activeAdapter = configured;
            log.info("[Completion] active provider: {}", provider);
            return;
        }

        activeAdapter = adaptersByProvider.get(PROVIDER_NONE);
        if (activeAdapter == null && !adapters.isEmpty()) {
            activeAdapter = adapters.get(0);
        }
        log.warn("[Completion] provider '{}' {}, using: {}", provider,
                configured == null ? "not found" : "not configured (missing api key)",
                activeAdapter != null ? activeAdapter.getProviderId() : PROVIDER_NONE);
    }

    public CompletionPort getActiveAdapter() {
        return activeAdapter;
    }

    @Override
    public String getProviderId() {
        return activeAdapter != null ? activeAdapter.getProviderId() : PROVIDER_NONE;
    }

    @Override
    public CompletableFuture<CompletionResult> complete(CompletionRequest request) {
        return activeAdapter.complete(request);
    }

    @Override
    public boolean isAvailable() {
        return activeAdapter != null && activeAdapter.isAvailable();
    }
}
