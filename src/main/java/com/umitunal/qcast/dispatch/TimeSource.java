package com.umitunal.qcast.dispatch;

import java.util.concurrent.TimeUnit;

/**
 * Sleep used for retry backoff and provider-imposed waits.
 */
public interface TimeSource {

    TimeSource SYSTEM = nanos -> {
        if (nanos > 0) {
            TimeUnit.NANOSECONDS.sleep(nanos);
        }
    };

    void sleepNanos(long nanos) throws InterruptedException;
}
