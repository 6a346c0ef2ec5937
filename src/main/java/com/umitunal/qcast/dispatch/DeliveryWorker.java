package com.umitunal.qcast.dispatch;

import com.umitunal.qcast.core.DeliveryTask;
import com.umitunal.qcast.core.MessageTransport;
import com.umitunal.qcast.core.SendResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A worker that continuously drains the delivery queue and sends each task
 * under the global rate limit.
 */
public class DeliveryWorker implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(DeliveryWorker.class);

    private final String workerId;
    private final BlockingQueue<DeliveryTask> queue;
    private final MessageTransport transport;
    private final SendRateLimiter rateLimiter;
    private final RetryPolicy retryPolicy;
    private final TimeSource timeSource;
    private final long pollIntervalMillis;
    private final AtomicBoolean running;
    private final AtomicLong sentCount;
    private final AtomicLong permanentFailureCount;
    private final AtomicLong droppedCount;

    private Thread workerThread;

    private DeliveryWorker(Builder builder) {
        this.workerId = builder.workerId;
        this.queue = builder.queue;
        this.transport = builder.transport;
        this.rateLimiter = builder.rateLimiter;
        this.retryPolicy = builder.retryPolicy;
        this.timeSource = builder.timeSource;
        this.pollIntervalMillis = builder.pollIntervalMillis;
        this.running = new AtomicBoolean(false);
        this.sentCount = new AtomicLong(0);
        this.permanentFailureCount = new AtomicLong(0);
        this.droppedCount = new AtomicLong(0);
    }

    /**
     * Start the worker in the background.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            workerThread = new Thread(this::run, "DeliveryWorker-" + workerId);
            workerThread.setDaemon(false);
            workerThread.start();
        }
    }

    /**
     * Stop the worker. A send in progress is interrupted.
     */
    public void stop() {
        running.set(false);
        if (workerThread != null) {
            workerThread.interrupt();
            try {
                workerThread.join(5000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Deliver a single task: rate-limit, send, and apply the retry policy.
     *
     * Provider throttling is waited out and retried without touching the retry
     * budget. Transient failures are retried with exponential backoff until the
     * budget is spent, then the task is dropped.
     */
    public Outcome deliverOne(DeliveryTask task) throws InterruptedException {
        int retries = 0;

        while (true) {
            rateLimiter.acquire();
            SendResult result = attempt(task);

            switch (result.getStatus()) {
                case DELIVERED -> {
                    sentCount.incrementAndGet();
                    log.debug("Worker {} delivered job {} to {}", workerId, task.getJobId(), task.getRecipientId());
                    return Outcome.DELIVERED;
                }
                case PERMANENT_FAILURE -> {
                    permanentFailureCount.incrementAndGet();
                    log.info("Recipient {} unreachable for job {}: {}",
                            task.getRecipientId(), task.getJobId(), result.getMessage());
                    return Outcome.PERMANENT_FAILURE;
                }
                case RATE_LIMITED -> {
                    Duration wait = result.getRetryAfter();
                    log.debug("Worker {} throttled by provider, waiting {}", workerId, wait);
                    timeSource.sleepNanos(wait.toNanos());
                }
                case TRANSIENT_ERROR -> {
                    if (!retryPolicy.canRetry(retries)) {
                        droppedCount.incrementAndGet();
                        log.warn("Dropping delivery of job {} to {} after {} retries: {}",
                                task.getJobId(), task.getRecipientId(), retries, result.getMessage());
                        return Outcome.DROPPED;
                    }
                    Duration backoff = retryPolicy.backoffFor(retries);
                    retries++;
                    log.debug("Send to {} failed ({}), retry {}/{} in {}", task.getRecipientId(),
                            result.getMessage(), retries, retryPolicy.getMaxRetries(), backoff);
                    timeSource.sleepNanos(backoff.toNanos());
                }
            }
        }
    }

    private SendResult attempt(DeliveryTask task) {
        try {
            SendResult result = transport.send(task.getRecipientId(), task.getMessageText());
            return result != null ? result : SendResult.transientError("Transport returned no result");
        } catch (RuntimeException e) {
            return SendResult.transientError(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private void run() {
        while (running.get()) {
            try {
                DeliveryTask task = queue.poll(pollIntervalMillis, TimeUnit.MILLISECONDS);
                if (task == null) {
                    continue;
                }
                try {
                    deliverOne(task);
                } catch (RuntimeException e) {
                    droppedCount.incrementAndGet();
                    log.error("Worker {} failed delivering {}", workerId, task, e);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }

    public String getWorkerId() { return workerId; }
    public long getSentCount() { return sentCount.get(); }
    public long getPermanentFailureCount() { return permanentFailureCount.get(); }
    public long getDroppedCount() { return droppedCount.get(); }
    public boolean isRunning() { return running.get(); }

    /**
     * Tasks this worker has finished, whatever the outcome.
     */
    public long getCompletedCount() {
        return sentCount.get() + permanentFailureCount.get() + droppedCount.get();
    }

    @Override
    public void close() {
        stop();
    }

    public static Builder builder(String workerId, BlockingQueue<DeliveryTask> queue, MessageTransport transport) {
        return new Builder(workerId, queue, transport);
    }

    /**
     * Final state of one delivery task.
     */
    public enum Outcome {
        DELIVERED,
        PERMANENT_FAILURE,
        DROPPED
    }

    public static class Builder {
        private final String workerId;
        private final BlockingQueue<DeliveryTask> queue;
        private final MessageTransport transport;
        private SendRateLimiter rateLimiter;
        private RetryPolicy retryPolicy = new RetryPolicy(3, Duration.ofSeconds(1), false);
        private TimeSource timeSource = TimeSource.SYSTEM;
        private long pollIntervalMillis = 500;

        private Builder(String workerId, BlockingQueue<DeliveryTask> queue, MessageTransport transport) {
            this.workerId = workerId;
            this.queue = queue;
            this.transport = transport;
        }

        public Builder withRateLimiter(SendRateLimiter rateLimiter) {
            this.rateLimiter = rateLimiter;
            return this;
        }

        public Builder withRetryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder withTimeSource(TimeSource timeSource) {
            this.timeSource = timeSource;
            return this;
        }

        public Builder withPollInterval(long millis) {
            this.pollIntervalMillis = millis;
            return this;
        }

        public DeliveryWorker build() {
            if (rateLimiter == null) {
                rateLimiter = new SendRateLimiter(25);
            }
            return new DeliveryWorker(this);
        }
    }
}
