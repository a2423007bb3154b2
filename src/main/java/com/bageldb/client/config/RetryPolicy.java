package com.bageldb.client.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for retrying a page fetch after a transport failure.
 *
 * <p>Backoff is fixed: every retry waits the same {@code backoff}. Only
 * connection-level failures are retried; HTTP error statuses and undecodable
 * bodies are not.
 *
 * @param maxAttempts total attempts per page, including the first one
 * @param backoff pause between two attempts
 */
public record RetryPolicy(
        int maxAttempts,
        Duration backoff
) {
    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, was " + maxAttempts);
        }
        Objects.requireNonNull(backoff, "backoff must not be null");
        if (backoff.isNegative()) {
            throw new IllegalArgumentException("backoff must not be negative");
        }
    }

    /**
     * Ten attempts, one second apart.
     */
    public static RetryPolicy defaults() {
        return new RetryPolicy(10, Duration.ofSeconds(1));
    }

    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO);
    }
}
