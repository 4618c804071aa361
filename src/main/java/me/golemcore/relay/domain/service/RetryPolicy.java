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

import lombok.RequiredArgsConstructor;
import me.golemcore.relay.domain.model.CompletionFailureKind;
import me.golemcore.relay.domain.model.CompletionResult;
import me.golemcore.relay.domain.model.DeliveryResult;
import me.golemcore.relay.infrastructure.config.BotProperties;
import me.golemcore.relay.ratelimit.ExponentialBackoff;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Retry decisions for the dispatch loop.
 *
 * <p>
 * Attempts are counted from one. Transient failures and timeouts back off
 * exponentially from {@code initial-backoff} up to {@code max-backoff}; rate
 * limits wait for the provider's hint, capped at {@code max-rate-limit-wait};
 * fatal completion errors and refused sends are never retried. Nothing is
 * retried once {@code max-attempts} attempts have been made.
 */
@Component
@RequiredArgsConstructor
public class RetryPolicy {

    private final BotProperties properties;

    /**
     * @return the delay before the next completion attempt, or empty to give up
     */
    public Optional<Duration> completionRetryDelay(int attemptsMade, CompletionResult result) {
        if (result.isSuccess() || result.getFailureKind() == null || !result.getFailureKind().isRetryable()) {
            return Optional.empty();
        }
        if (attemptsMade >= maxAttempts()) {
            return Optional.empty();
        }
        if (result.getFailureKind() == CompletionFailureKind.RATE_LIMITED && hasHint(result.getRetryAfter())) {
            Duration cap = properties.getDispatch().getMaxRateLimitWait();
            Duration hint = result.getRetryAfter();
            return Optional.of(cap != null && hint.compareTo(cap) > 0 ? cap : hint);
        }
        return Optional.of(backoff(attemptsMade));
    }

    /**
     * @return the delay before the next send attempt, or empty to give up
     */
    public Optional<Duration> deliveryRetryDelay(int attemptsMade, DeliveryResult result) {
        if (result.isDelivered() || result.getFailureKind() == null || !result.getFailureKind().isRetryable()) {
            return Optional.empty();
        }
        if (attemptsMade >= maxAttempts()) {
            return Optional.empty();
        }
        return Optional.of(backoff(attemptsMade));
    }

    Duration backoff(int attemptsMade) {
        BotProperties.DispatchProperties dispatch = properties.getDispatch();
        return new ExponentialBackoff(dispatch.getInitialBackoff(), dispatch.getMaxBackoff())
                .delayFor(Math.max(0, attemptsMade - 1));
    }

    private int maxAttempts() {
        return Math.max(1, properties.getDispatch().getMaxAttempts());
    }

    private static boolean hasHint(Duration retryAfter) {
        return retryAfter != null && !retryAfter.isNegative() && !retryAfter.isZero();
    }
}
