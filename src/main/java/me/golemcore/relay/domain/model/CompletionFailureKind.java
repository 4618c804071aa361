package me.golemcore.relay.domain.model;

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

/**
 * Classified reason a completion request did not produce text.
 */
public enum CompletionFailureKind {

    /**
     * Provider throttled the request; may carry a retry-after hint.
     */
    RATE_LIMITED,

    /**
     * Temporary provider or network failure (5xx, connection reset, blank
     * answer).
     */
    TRANSIENT,

    /**
     * Request can never succeed as issued (auth failure, invalid request,
     * provider not configured).
     */
    FATAL,

    /**
     * Per-call deadline elapsed.
     */
    TIMEOUT;

    public boolean isRetryable() {
        return this != FATAL;
    }
}
