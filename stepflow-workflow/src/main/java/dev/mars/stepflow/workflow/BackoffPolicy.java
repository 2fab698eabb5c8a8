/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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


package dev.mars.stepflow.workflow;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff: the wait after failed attempt {@code i} (zero-based) is
 * {@code min(base * 2^i, max)}. With jitter enabled the wait is drawn uniformly from
 * {@code [delay / 2, delay]}, so it never exceeds the cap.
 */
public final class BackoffPolicy {

    private final Duration baseDelay;
    private final Duration maxDelay;
    private final boolean jitter;

    public BackoffPolicy(Duration baseDelay, Duration maxDelay, boolean jitter) {
        this.baseDelay = Objects.requireNonNull(baseDelay, "Base delay cannot be null");
        this.maxDelay = Objects.requireNonNull(maxDelay, "Max delay cannot be null");
        if (baseDelay.isNegative()) {
            throw new IllegalArgumentException("Base delay cannot be negative: " + baseDelay);
        }
        if (maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("Max delay " + maxDelay + " is shorter than base delay " + baseDelay);
        }
        this.jitter = jitter;
    }

    public static BackoffPolicy forStep(WorkflowStep step, boolean jitter) {
        return new BackoffPolicy(step.getRetryBaseDelay(), step.getRetryMaxDelay(), jitter);
    }

    /**
     * Delay to wait after the given failed attempt before starting the next one.
     *
     * @param attempt zero-based number of the attempt that just failed
     */
    public Duration delayFor(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("Attempt cannot be negative: " + attempt);
        }

        Duration delay = maxDelay;
        if (attempt < Long.SIZE - 1) {
            try {
                Duration scaled = baseDelay.multipliedBy(1L << attempt);
                if (scaled.compareTo(maxDelay) < 0) {
                    delay = scaled;
                }
            } catch (ArithmeticException e) {
                // base * 2^attempt does not fit in a Duration
                delay = maxDelay;
            }
        }

        if (!jitter || delay.isZero()) {
            return delay;
        }
        long nanos = toNanosSaturated(delay);
        long half = nanos / 2;
        return Duration.ofNanos(half + ThreadLocalRandom.current().nextLong(nanos - half + 1));
    }

    public Duration getBaseDelay() {
        return baseDelay;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    public boolean isJitterEnabled() {
        return jitter;
    }

    private static long toNanosSaturated(Duration duration) {
        try {
            return duration.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE - 1;
        }
    }

    @Override
    public String toString() {
        return "BackoffPolicy{" +
               "baseDelay=" + baseDelay +
               ", maxDelay=" + maxDelay +
               ", jitter=" + jitter +
               '}';
    }
}
