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

import me.golemcore.relay.domain.model.CompletionFailureKind;
import me.golemcore.relay.domain.model.CompletionResult;

import java.io.IOException;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps provider exceptions onto {@link CompletionFailureKind}s.
 *
 * <p>
 * langchain4j exceptions are recognised by class name and, for generic HTTP
 * errors, by status code: 429 is a rate limit, 401/403 is fatal, 408/504 is a
 * timeout, other 5xx are transient and other 4xx fatal. Rate limit hints are
 * read from {@code Retry-After}, {@code retry_after}, {@code reset_seconds} or
 * "try again in" fragments of the error text.
 */
public final class CompletionErrorClassifier {

    private static final String LANGCHAIN4J_EXCEPTIONS_PREFIX = "dev.langchain4j.exception.";
    private static final String CLASS_RATE_LIMIT_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "RateLimitException";
    private static final String CLASS_TIMEOUT_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "TimeoutException";
    private static final String CLASS_AUTHENTICATION_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "AuthenticationException";
    private static final String CLASS_INVALID_REQUEST_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "InvalidRequestException";
    private static final String CLASS_MODEL_NOT_FOUND_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "ModelNotFoundException";
    private static final String CLASS_CONTENT_FILTERED_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "ContentFilteredException";
    private static final String CLASS_INTERNAL_SERVER_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "InternalServerException";
    private static final String CLASS_UNRESOLVED_MODEL_SERVER_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "UnresolvedModelServerException";
    private static final String CLASS_RETRIABLE_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "RetriableException";
    private static final String CLASS_NON_RETRIABLE_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "NonRetriableException";
    private static final String CLASS_HTTP_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "HttpException";

    private static final int MAX_ERROR_LENGTH = 300;

    private static final Pattern RETRY_AFTER_PATTERN = Pattern.compile(
            "retry[-_ ]after\"?\\s*[:=]\\s*\"?(\\d+(?:\\.\\d+)?)\\s*(ms|s)?", Pattern.CASE_INSENSITIVE);
    private static final Pattern RESET_SECONDS_PATTERN = Pattern.compile("\"reset_seconds\"\\s*:\\s*(\\d+)");
    private static final Pattern TRY_AGAIN_PATTERN = Pattern.compile(
            "try again in\\s+(\\d+(?:\\.\\d+)?)\\s*(ms|s)", Pattern.CASE_INSENSITIVE);

    private CompletionErrorClassifier() {
    }

    /**
     * Classify a completion failure by walking the cause chain.
     */
    public static CompletionResult classify(Throwable throwable) {
        String error = describe(throwable);
        CompletionFailureKind kind = classifyKind(throwable);
        if (kind == CompletionFailureKind.RATE_LIMITED) {
            return CompletionResult.rateLimited(extractRetryAfter(throwable), error);
        }
        return CompletionResult.failure(kind, error);
    }

    static CompletionFailureKind classifyKind(Throwable throwable) {
        Set<Throwable> visited = new HashSet<>();
        Throwable current = throwable;
        while (current != null && visited.add(current)) {
            CompletionFailureKind byType = classifyKnownThrowable(current);
            if (byType != null) {
                return byType;
            }
            current = current.getCause();
        }
        return CompletionFailureKind.TRANSIENT;
    }

    /**
     * Extract a provider-supplied wait hint from the error text, if any.
     */
    static Duration extractRetryAfter(Throwable throwable) {
        Set<Throwable> visited = new HashSet<>();
        Throwable current = throwable;
        while (current != null && visited.add(current)) {
            Duration hint = parseRetryAfter(current.getMessage());
            if (hint != null) {
                return hint;
            }
            current = current.getCause();
        }
        return null;
    }

    static Duration parseRetryAfter(String message) {
        if (message == null || message.isBlank()) {
            return null;
        }
        Matcher resetSeconds = RESET_SECONDS_PATTERN.matcher(message);
        if (resetSeconds.find()) {
            return Duration.ofSeconds(Long.parseLong(resetSeconds.group(1)));
        }
        Matcher retryAfter = RETRY_AFTER_PATTERN.matcher(message);
        if (retryAfter.find()) {
            return toDuration(retryAfter.group(1), retryAfter.group(2));
        }
        Matcher tryAgain = TRY_AGAIN_PATTERN.matcher(message);
        if (tryAgain.find()) {
            return toDuration(tryAgain.group(1), tryAgain.group(2));
        }
        return null;
    }

    private static Duration toDuration(String amount, String unit) {
        try {
            double value = Double.parseDouble(amount);
            long millis = "ms".equalsIgnoreCase(unit) ? Math.round(value) : Math.round(value * 1000);
            return Duration.ofMillis(millis);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static CompletionFailureKind classifyKnownThrowable(Throwable throwable) {
        if (throwable instanceof CancellationException || throwable instanceof InterruptedException) {
            return CompletionFailureKind.TRANSIENT;
        }
        if (throwable instanceof SocketTimeoutException
                || throwable instanceof HttpTimeoutException
                || throwable instanceof TimeoutException) {
            return CompletionFailureKind.TIMEOUT;
        }

        String className = throwable.getClass().getName();
        if (!className.startsWith(LANGCHAIN4J_EXCEPTIONS_PREFIX)) {
            if (throwable instanceof IOException) {
                return CompletionFailureKind.TRANSIENT;
            }
            return null;
        }

        switch (className) {
            case CLASS_RATE_LIMIT_EXCEPTION:
                return CompletionFailureKind.RATE_LIMITED;
            case CLASS_TIMEOUT_EXCEPTION:
                return CompletionFailureKind.TIMEOUT;
            case CLASS_AUTHENTICATION_EXCEPTION:
            case CLASS_INVALID_REQUEST_EXCEPTION:
            case CLASS_MODEL_NOT_FOUND_EXCEPTION:
            case CLASS_CONTENT_FILTERED_EXCEPTION:
            case CLASS_UNRESOLVED_MODEL_SERVER_EXCEPTION:
            case CLASS_NON_RETRIABLE_EXCEPTION:
                return CompletionFailureKind.FATAL;
            case CLASS_INTERNAL_SERVER_EXCEPTION:
            case CLASS_RETRIABLE_EXCEPTION:
                return CompletionFailureKind.TRANSIENT;
            case CLASS_HTTP_EXCEPTION:
                return classifyHttpStatus(readHttpStatusCode(throwable));
            default:
                return null;
        }
    }

    static CompletionFailureKind classifyHttpStatus(Integer statusCode) {
        if (statusCode == null) {
            return CompletionFailureKind.TRANSIENT;
        }
        if (statusCode == 429) {
            return CompletionFailureKind.RATE_LIMITED;
        }
        if (statusCode == 401 || statusCode == 403) {
            return CompletionFailureKind.FATAL;
        }
        if (statusCode == 408 || statusCode == 504) {
            return CompletionFailureKind.TIMEOUT;
        }
        if (statusCode >= 500) {
            return CompletionFailureKind.TRANSIENT;
        }
        if (statusCode >= 400) {
            return CompletionFailureKind.FATAL;
        }
        return CompletionFailureKind.TRANSIENT;
    }

    private static Integer readHttpStatusCode(Throwable throwable) {
        try {
            Method method = throwable.getClass().getMethod("statusCode");
            Object result = method.invoke(throwable);
            if (result instanceof Integer) {
                return (Integer) result;
            }
        } catch (NoSuchMethodException | IllegalAccessException | InvocationTargetException ignored) {
            return null;
        }
        return null;
    }

    private static String describe(Throwable throwable) {
        if (throwable == null) {
            return "unknown completion failure";
        }
        Throwable root = throwable;
        while (root.getCause() != null && root.getCause() != root
                && (root.getMessage() == null || root instanceof CompletionException)) {
            root = root.getCause();
        }
        String message = root.getMessage();
        String type = root.getClass().getSimpleName();
        if (message == null || message.isBlank()) {
            return type;
        }
        String trimmed = message.length() > MAX_ERROR_LENGTH
                ? message.substring(0, MAX_ERROR_LENGTH) + "..."
                : message;
        return type + ": " + trimmed.replace('\n', ' ');
    }
}
