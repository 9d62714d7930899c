package com.vidfeed.scheduler;

import java.time.Duration;

/**
 * Exponential retry schedule for videos whose warm-up failed.
 * The n-th consecutive failure waits {@code base * factor^(n-1)}, capped at {@code maxDelay};
 * after {@code maxRetries} retries no further automatic attempt is made.
 */
public class BackoffPolicy {

    private final Duration base;
    private final double factor;
    private final Duration maxDelay;
    private final int maxRetries;

    public BackoffPolicy(Duration base, double factor, Duration maxDelay, int maxRetries) {
        this.base = base;
        this.factor = factor;
        this.maxDelay = maxDelay;
        this.maxRetries = maxRetries;
    }

    /**
     * Delay before the retry that follows the given number of consecutive failures.
     */
    public Duration delayAfter(int failureCount) {
        if (failureCount <= 0) {
            return Duration.ZERO;
        }
        double millis = base.toMillis() * Math.pow(factor, failureCount - 1);
        if (millis >= maxDelay.toMillis()) {
            return maxDelay;
        }
        return Duration.ofMillis((long) millis);
    }

    public boolean canRetry(int failureCount) {
        return failureCount <= maxRetries;
    }

    public int getMaxRetries() {
        return maxRetries;
    }
}
