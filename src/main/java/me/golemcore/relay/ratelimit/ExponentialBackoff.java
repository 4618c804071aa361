package me.golemcore.relay.ratelimit;

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

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff schedule with an upper bound and optional jitter.
 *
 * <p>
 * The delay for attempt {@code n} (zero-based) is {@code initial * 2^n},
 * capped at {@code max}, then scaled by a random factor in
 * {@code [1 - jitter, 1 + jitter]}. The jittered delay may exceed {@code max}
 * by at most the jitter fraction.
 *
 * @since 1.0
 */
public final class ExponentialBackoff {

    private static final int MAX_SHIFT = 30;

    private final Duration initial;
    private final Duration max;
    private final double jitter;
    private final DoubleSupplier random;

    public ExponentialBackoff(Duration initial, Duration max) {
        this(initial, max, 0.0, () -> 0.5);
    }

    public ExponentialBackoff(Duration initial, Duration max, double jitter) {
        this(initial, max, jitter, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param random
     *            source of values in {@code [0, 1)}, injectable for tests
     */
    public ExponentialBackoff(Duration initial, Duration max, double jitter, DoubleSupplier random) {
        this.initial = Objects.requireNonNull(initial, "initial");
        this.max = Objects.requireNonNull(max, "max");
        if (jitter < 0 || jitter >= 1) {
            throw new IllegalArgumentException("jitter must be in [0, 1): " + jitter);
        }
        this.jitter = jitter;
        this.random = random;
    }

    public Duration delayFor(int attempt) {
        long initialMillis = Math.max(0, initial.toMillis());
        long maxMillis = Math.max(initialMillis, max.toMillis());
        int shift = Math.min(Math.max(0, attempt), MAX_SHIFT);
        long base = initialMillis << shift;
        if (base < 0 || base > maxMillis || (initialMillis > 0 && base >> shift != initialMillis)) {
            base = maxMillis;
        }
        if (jitter == 0) {
            return Duration.ofMillis(base);
        }
        double factor = 1 - jitter + 2 * jitter * random.getAsDouble();
        return Duration.ofMillis(Math.round(base * factor));
    }
}
