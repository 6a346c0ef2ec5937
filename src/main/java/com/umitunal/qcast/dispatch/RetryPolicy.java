package com.umitunal.qcast.dispatch;

import com.umitunal.qcast.config.BroadcastConfig;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Retry budget and exponential backoff for transient send failures.
 */
public class RetryPolicy {
    private static final int MAX_SHIFT = 20;

    private final int maxRetries;
    private final Duration baseBackoff;
    private final boolean jitter;

    public RetryPolicy(int maxRetries, Duration baseBackoff, boolean jitter) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        this.maxRetries = maxRetries;
        this.baseBackoff = baseBackoff;
        this.jitter = jitter;
    }

    public static RetryPolicy from(BroadcastConfig config) {
        return new RetryPolicy(config.getMaxRetries(), config.getBaseBackoff(), config.isBackoffJitter());
    }

    /**
     * Checks if another retry is allowed after {@code retriesSoFar} retries.
     */
    public boolean canRetry(int retriesSoFar) {
        return retriesSoFar < maxRetries;
    }

    /**
     * Delay before retry number {@code retryIndex} (0-based): {@code base * 2^retryIndex}.
     * With jitter the delay is drawn from the upper half of that value.
     */
    public Duration backoffFor(int retryIndex) {
        long baseNanos = baseBackoff.toNanos();
        long nanos = baseNanos << Math.min(retryIndex, MAX_SHIFT);
        if (nanos < baseNanos) {
            nanos = Long.MAX_VALUE;
        }
        if (jitter && nanos > 1) {
            long half = nanos / 2;
            nanos = half + ThreadLocalRandom.current().nextLong(half + 1);
        }
        return Duration.ofNanos(nanos);
    }

    public int getMaxRetries() { return maxRetries; }
    public Duration getBaseBackoff() { return baseBackoff; }
    public boolean isJitter() { return jitter; }
}
