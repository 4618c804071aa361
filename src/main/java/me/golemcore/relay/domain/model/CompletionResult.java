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

import lombok.Builder;
import lombok.Data;

import java.time.Duration;

/**
 * Outcome of a completion call: generated text or a classified failure.
 */
@Data
@Builder
public class CompletionResult {

    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isSuccess()
    private boolean success;
    private String text;
    private CompletionFailureKind failureKind;
    private Duration retryAfter;
    private String error;

    public static CompletionResult success(String text) {
        return CompletionResult.builder()
                .success(true)
                .text(text)
                .build();
    }

    public static CompletionResult failure(CompletionFailureKind kind, String error) {
        return CompletionResult.builder()
                .success(false)
                .failureKind(kind)
                .error(error)
                .build();
    }

    public static CompletionResult rateLimited(Duration retryAfter, String error) {
        return CompletionResult.builder()
                .success(false)
                .failureKind(CompletionFailureKind.RATE_LIMITED)
                .retryAfter(retryAfter)
                .error(error)
                .build();
    }
}
