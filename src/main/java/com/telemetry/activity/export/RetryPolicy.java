package com.telemetry.activity.export;

import java.time.Duration;

/**
 * Bounded exponential backoff for failed exports.
 *
 * @param maxAttempts    total attempts per batch, including the first
 * @param initialBackoff wait after the first failed attempt
 * @param maxBackoff     upper bound for any single wait
 * @param multiplier     growth factor between consecutive waits
 */
public record RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff, double multiplier) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (initialBackoff == null || initialBackoff.isNegative()) {
            throw new IllegalArgumentException("initialBackoff must be >= 0");
        }
        if (maxBackoff == null || maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("maxBackoff must be >= initialBackoff");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0");
        }
    }

    /**
     * Default policy: 5 attempts, 1s initial backoff growing by 1.5x up to 5s.
     */
    public static RetryPolicy defaults() {
        return new RetryPolicy(5, Duration.ofSeconds(1), Duration.ofSeconds(5), 1.5);
    }

    /**
     * A policy that never retries.
     */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO, Duration.ZERO, 1.0);
    }

    /**
     * Wait before the next attempt, after {@code failedAttempts} attempts have failed.
     * Formula: initialBackoff * multiplier^(failedAttempts - 1), capped at maxBackoff.
     */
    public Duration backoffAfter(int failedAttempts) {
        if (failedAttempts < 1) {
            return Duration.ZERO;
        }
        double millis = initialBackoff.toMillis() * Math.pow(multiplier, failedAttempts - 1);
        long capped = (long) Math.min(millis, maxBackoff.toMillis());
        return Duration.ofMillis(capped);
    }
}
