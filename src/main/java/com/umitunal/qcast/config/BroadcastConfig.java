package com.umitunal.qcast.config;

import java.time.Duration;
import java.util.Properties;

/**
 * Tunables of the scheduler and the delivery pipeline. Read once at startup.
 */
public class BroadcastConfig {
    private final Duration tickInterval;
    private final Duration errorBackoff;
    private final int executionThreads;
    private final Duration shutdownGracePeriod;
    private final int sendRatePerSecond;
    private final int workerCount;
    private final int queueCapacity;
    private final int maxRetries;
    private final Duration baseBackoff;
    private final boolean backoffJitter;

    private BroadcastConfig(Builder builder) {
        this.tickInterval = builder.tickInterval;
        this.errorBackoff = builder.errorBackoff;
        this.executionThreads = builder.executionThreads;
        this.shutdownGracePeriod = builder.shutdownGracePeriod;
        this.sendRatePerSecond = builder.sendRatePerSecond;
        this.workerCount = builder.workerCount;
        this.queueCapacity = builder.queueCapacity;
        this.maxRetries = builder.maxRetries;
        this.baseBackoff = builder.baseBackoff;
        this.backoffJitter = builder.backoffJitter;
    }

    public Duration getTickInterval() { return tickInterval; }
    public Duration getErrorBackoff() { return errorBackoff; }
    public int getExecutionThreads() { return executionThreads; }
    public Duration getShutdownGracePeriod() { return shutdownGracePeriod; }
    public int getSendRatePerSecond() { return sendRatePerSecond; }
    public int getWorkerCount() { return workerCount; }
    public int getQueueCapacity() { return queueCapacity; }
    public int getMaxRetries() { return maxRetries; }
    public Duration getBaseBackoff() { return baseBackoff; }
    public boolean isBackoffJitter() { return backoffJitter; }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static BroadcastConfig defaults() {
        return new Builder().build();
    }

    /**
     * Read {@code qcast.scheduler.*} and {@code qcast.dispatch.*} keys,
     * falling back to builder defaults.
     */
    public static BroadcastConfig fromProperties(Properties properties) {
        PropertyReader reader = new PropertyReader(properties);
        Builder d = new Builder();
        return new Builder()
                .withTickInterval(reader.getMillis("qcast.scheduler.tick-interval-ms", d.tickInterval))
                .withErrorBackoff(reader.getMillis("qcast.scheduler.error-backoff-ms", d.errorBackoff))
                .withExecutionThreads(reader.getInt("qcast.scheduler.execution-threads", d.executionThreads))
                .withShutdownGracePeriod(reader.getMillis("qcast.scheduler.shutdown-grace-ms", d.shutdownGracePeriod))
                .withSendRate(reader.getInt("qcast.dispatch.rate-per-second", d.sendRatePerSecond))
                .withWorkerCount(reader.getInt("qcast.dispatch.workers", d.workerCount))
                .withQueueCapacity(reader.getInt("qcast.dispatch.queue-capacity", d.queueCapacity))
                .withMaxRetries(reader.getInt("qcast.dispatch.max-retries", d.maxRetries))
                .withBaseBackoff(reader.getMillis("qcast.dispatch.base-backoff-ms", d.baseBackoff))
                .withBackoffJitter(reader.getBoolean("qcast.dispatch.backoff-jitter", d.backoffJitter))
                .build();
    }

    @Override
    public String toString() {
        return String.format(
            "BroadcastConfig{tick=%s, rate=%d/s, workers=%d, queue=%d, retries=%d, backoff=%s, jitter=%s}",
            tickInterval, sendRatePerSecond, workerCount, queueCapacity,
            maxRetries, baseBackoff, backoffJitter
        );
    }

    public static class Builder {
        private Duration tickInterval = Duration.ofSeconds(15);
        private Duration errorBackoff = Duration.ofSeconds(5);
        private int executionThreads = 4;
        private Duration shutdownGracePeriod = Duration.ofSeconds(30);
        private int sendRatePerSecond = 25;
        private int workerCount = 20;
        private int queueCapacity = 50_000;
        private int maxRetries = 3;
        private Duration baseBackoff = Duration.ofSeconds(1);
        private boolean backoffJitter = false;

        private Builder() {
        }

        /**
         * How often the job store is polled for due jobs.
         * Default: 15 seconds
         */
        public Builder withTickInterval(Duration interval) {
            this.tickInterval = interval;
            return this;
        }

        /**
         * Pause after a failed tick before polling again.
         * Default: 5 seconds
         */
        public Builder withErrorBackoff(Duration backoff) {
            this.errorBackoff = backoff;
            return this;
        }

        /**
         * Threads running job executions (recipient resolution and enqueueing).
         * Default: 4
         */
        public Builder withExecutionThreads(int threads) {
            this.executionThreads = threads;
            return this;
        }

        /**
         * How long shutdown waits for in-flight job executions.
         * Default: 30 seconds
         */
        public Builder withShutdownGracePeriod(Duration grace) {
            this.shutdownGracePeriod = grace;
            return this;
        }

        /**
         * Global send ceiling in messages per second.
         * Default: 25
         */
        public Builder withSendRate(int permitsPerSecond) {
            this.sendRatePerSecond = permitsPerSecond;
            return this;
        }

        /**
         * Number of delivery workers.
         * Default: 20
         */
        public Builder withWorkerCount(int count) {
            this.workerCount = count;
            return this;
        }

        /**
         * Bound of the delivery queue; enqueue blocks when it is full.
         * Default: 50,000
         */
        public Builder withQueueCapacity(int capacity) {
            this.queueCapacity = capacity;
            return this;
        }

        /**
         * Retries after a transient send failure.
         * Default: 3
         */
        public Builder withMaxRetries(int retries) {
            this.maxRetries = retries;
            return this;
        }

        /**
         * First retry delay; doubled on every further retry.
         * Default: 1 second
         */
        public Builder withBaseBackoff(Duration backoff) {
            this.baseBackoff = backoff;
            return this;
        }

        /**
         * Randomize retry delays. Default: false
         */
        public Builder withBackoffJitter(boolean enable) {
            this.backoffJitter = enable;
            return this;
        }

        public BroadcastConfig build() {
            requirePositive(tickInterval, "tickInterval");
            requirePositive(errorBackoff, "errorBackoff");
            if (shutdownGracePeriod == null || shutdownGracePeriod.isNegative()) {
                throw new IllegalArgumentException("shutdownGracePeriod must not be negative");
            }
            if (baseBackoff == null || baseBackoff.isNegative()) {
                throw new IllegalArgumentException("baseBackoff must not be negative");
            }
            if (executionThreads < 1) {
                throw new IllegalArgumentException("executionThreads must be >= 1");
            }
            if (sendRatePerSecond < 1) {
                throw new IllegalArgumentException("sendRatePerSecond must be >= 1");
            }
            if (workerCount < 1) {
                throw new IllegalArgumentException("workerCount must be >= 1");
            }
            if (queueCapacity < 1) {
                throw new IllegalArgumentException("queueCapacity must be >= 1");
            }
            if (maxRetries < 0) {
                throw new IllegalArgumentException("maxRetries must not be negative");
            }
            return new BroadcastConfig(this);
        }

        private static void requirePositive(Duration value, String name) {
            if (value == null || value.isZero() || value.isNegative()) {
                throw new IllegalArgumentException(name + " must be positive");
            }
        }
    }
}
