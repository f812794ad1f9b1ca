package com.idp.assessment.model;

import java.time.Duration;

/**
 * Exponential backoff for throttled invocations.
 *
 * @param maxAttempts    total attempts including the first one
 * @param initialBackoff wait before the second attempt
 * @param maxBackoff     upper bound for a single wait
 */
public record RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff) {

    public static final RetryPolicy DEFAULT = new RetryPolicy(4, Duration.ofSeconds(1), Duration.ofSeconds(30));

    public RetryPolicy {
        maxAttempts = Math.max(1, maxAttempts);
        initialBackoff = initialBackoff != null ? initialBackoff : Duration.ofSeconds(1);
        maxBackoff = maxBackoff != null ? maxBackoff : Duration.ofSeconds(30);
    }

    /** Wait after the given failed attempt (1-based): initial, 2x, 4x... capped at {@code maxBackoff}. */
    public Duration backoffAfter(int attempt) {
        long factor = 1L << Math.min(Math.max(attempt - 1, 0), 30);
        long millis = initialBackoff.toMillis() * factor;
        if (millis < 0 || millis > maxBackoff.toMillis()) {
            return maxBackoff;
        }
        return Duration.ofMillis(millis);
    }
}
