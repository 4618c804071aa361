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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.domain.model.CompletionFailureKind;
import me.golemcore.relay.domain.model.CompletionRequest;
import me.golemcore.relay.domain.model.CompletionResult;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Fallback used when no completion provider is configured. Every request
 * fails fatally, so the dispatcher never retries it.
 *
 * <p>
 * Provider ID: {@code "none"}
 */
@Component
@Slf4j
public class NoOpCompletionAdapter implements CompletionProviderAdapter {

    static final String PROVIDER_ID = "none";
    static final String NOT_CONFIGURED = "completion provider not configured";

    @Override
    public String getProviderId() {
        return PROVIDER_ID;
    }

    @Override
    public CompletableFuture<CompletionResult> complete(CompletionRequest request) {
        log.warn("[Completion] no provider configured, dropping request for {}", request.getScope());
        return CompletableFuture.completedFuture(
                CompletionResult.failure(CompletionFailureKind.FATAL, NOT_CONFIGURED));
    }

    @Override
    public boolean isAvailable() {
        return true;
    }
}
