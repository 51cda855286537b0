package com.redhat.cdsync.engine.reconcile;

import java.time.Duration;

/**
 * Bounded exponential backoff for retrying a single object write.
 *
 * @param maxAttempts total attempts including the first one
 */
public record RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff) {

    public static final RetryPolicy DEFAULT = new RetryPolicy(5, Duration.ofMillis(200), Duration.ofSeconds(10));

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
    }

    /**
     * @param attempt the attempt that just failed, starting at 1
     */
    public Duration delay(int attempt) {
        Duration delay = initialBackoff;
        for (int i = 1; i < attempt; ++i) {
            delay = delay.multipliedBy(2);
            if (delay.compareTo(maxBackoff) >= 0) {
                return maxBackoff;
            }
        }
        return delay;
    }
}
