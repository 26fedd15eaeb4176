/*
 * Copyright 2025 Firefly Software Solutions Inc
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
 */

package com.firefly.consistency.outbox;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff: {@code base * multiplier^(retryCount - 1)}, spread by a symmetric
 * jitter of {@code jitterFactor}, never longer than {@code max} and never shorter than
 * 100 ms.
 */
public final class ExponentialBackoff implements BackoffPolicy {

    static final Duration MIN_DELAY = Duration.ofMillis(100);

    private final Duration base;
    private final double multiplier;
    private final Duration max;
    private final double jitterFactor;

    public ExponentialBackoff(Duration base, double multiplier, Duration max, double jitterFactor) {
        this.base = Objects.requireNonNull(base, "base");
        this.max = Objects.requireNonNull(max, "max");
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be within [0, 1]");
        }
        this.multiplier = multiplier;
        this.jitterFactor = jitterFactor;
    }

    public static ExponentialBackoff withoutJitter(Duration base, double multiplier, Duration max) {
        return new ExponentialBackoff(base, multiplier, max, 0.0);
    }

    @Override
    public Duration delayFor(int retryCount) {
        int exponent = Math.max(0, retryCount - 1);
        double raw = base.toMillis() * Math.pow(multiplier, exponent);
        double capped = Math.min(raw, (double) max.toMillis());
        if (jitterFactor > 0.0) {
            double spread = capped * jitterFactor;
            if (spread > 0.0) {
                capped += ThreadLocalRandom.current().nextDouble(-spread, spread);
            }
        }
        capped = Math.min(capped, (double) max.toMillis());
        long millis = Math.max(MIN_DELAY.toMillis(), Math.round(capped));
        return Duration.ofMillis(millis);
    }

    public Duration base() { return base; }
    public double multiplier() { return multiplier; }
    public Duration max() { return max; }
    public double jitterFactor() { return jitterFactor; }
}
