package com.umitunal.qcast.dispatch;

import com.google.common.util.concurrent.RateLimiter;
import com.umitunal.qcast.config.BroadcastConfig;

import java.time.Duration;

/**
 * Global ceiling on outbound sends, shared by every delivery worker.
 *
 * Backed by Guava's warming-up {@link RateLimiter}. Permits accrue
 * continuously at the configured rate while the limiter is idle, capped at one
 * second's worth, and a caller that arrives before its permit is due reserves
 * it and sleeps outside the limiter's lock. Stored permits are never handed
 * out faster than the steady rate, so consecutive grants are at least
 * {@code 1/rate} seconds apart even right after a long idle period.
 */
public class SendRateLimiter {
    private static final Duration WARMUP_PERIOD = Duration.ofSeconds(1);

    private final RateLimiter rateLimiter;

    public SendRateLimiter(int permitsPerSecond) {
        if (permitsPerSecond <= 0) {
            throw new IllegalArgumentException("permitsPerSecond must be > 0");
        }
        this.rateLimiter = RateLimiter.create(permitsPerSecond, WARMUP_PERIOD);
    }

    public static SendRateLimiter forConfig(BroadcastConfig config) {
        return new SendRateLimiter(config.getSendRatePerSecond());
    }

    /**
     * Block until a send is permitted.
     *
     * @return time spent waiting
     */
    public Duration acquire() {
        double waitedSeconds = rateLimiter.acquire();
        return Duration.ofNanos((long) (waitedSeconds * 1_000_000_000d));
    }

    public double getPermitsPerSecond() {
        return rateLimiter.getRate();
    }
}
