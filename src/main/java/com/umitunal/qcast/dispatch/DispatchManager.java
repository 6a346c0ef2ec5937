package com.umitunal.qcast.dispatch;

import com.umitunal.qcast.config.BroadcastConfig;
import com.umitunal.qcast.core.DeliveryTask;
import com.umitunal.qcast.core.DispatchMetrics;
import com.umitunal.qcast.core.MessageTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.ToLongFunction;

/**
 * Owns the delivery queue and the worker pool.
 *
 * One instance per process, shared by every job execution. Enqueueing blocks
 * while the queue is full so that bursts never drop recipients. Tasks are
 * delivered in roughly FIFO order per worker; there is no ordering across
 * workers.
 */
public class DispatchManager implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(DispatchManager.class);

    private final BlockingQueue<DeliveryTask> queue;
    private final MessageTransport transport;
    private final SendRateLimiter rateLimiter;
    private final RetryPolicy retryPolicy;
    private final TimeSource timeSource;
    private final int workerCount;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicLong totalEnqueued = new AtomicLong(0);
    private final List<DeliveryWorker> workers = new ArrayList<>();

    public DispatchManager(BroadcastConfig config, MessageTransport transport) {
        this(config, transport, TimeSource.SYSTEM);
    }

    public DispatchManager(BroadcastConfig config, MessageTransport transport, TimeSource timeSource) {
        this(config, transport, timeSource, SendRateLimiter.forConfig(config));
    }

    public DispatchManager(BroadcastConfig config, MessageTransport transport, TimeSource timeSource,
                           SendRateLimiter rateLimiter) {
        this.queue = new ArrayBlockingQueue<>(config.getQueueCapacity());
        this.transport = transport;
        this.rateLimiter = rateLimiter;
        this.retryPolicy = RetryPolicy.from(config);
        this.timeSource = timeSource;
        this.workerCount = config.getWorkerCount();
    }

    /**
     * Start the worker pool. Calling it again has no effect.
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        synchronized (workers) {
            for (int i = 1; i <= workerCount; i++) {
                DeliveryWorker worker = DeliveryWorker.builder("w" + i, queue, transport)
                        .withRateLimiter(rateLimiter)
                        .withRetryPolicy(retryPolicy)
                        .withTimeSource(timeSource)
                        .build();
                worker.start();
                workers.add(worker);
            }
        }
        log.info("Dispatch started with {} workers at {} msg/s", workerCount, rateLimiter.getPermitsPerSecond());
    }

    /**
     * Queue one message for one recipient, waiting for space if the queue is full.
     *
     * @throws InterruptedException if interrupted while waiting for space
     */
    public void enqueueJob(String recipientId, String text, String jobId) throws InterruptedException {
        queue.put(new DeliveryTask(recipientId, text, jobId));
        totalEnqueued.incrementAndGet();
    }

    /**
     * Checks if every enqueued task has been delivered, rejected or dropped.
     */
    public boolean isIdle() {
        return queue.isEmpty() && completedCount() >= totalEnqueued.get();
    }

    /**
     * Stop all workers.
     *
     * @return number of tasks still queued and therefore not delivered
     */
    public int stop() {
        List<DeliveryWorker> snapshot;
        synchronized (workers) {
            snapshot = new ArrayList<>(workers);
        }
        snapshot.forEach(DeliveryWorker::stop);
        int remaining = queue.size();
        if (remaining > 0) {
            log.warn("Dispatch stopped with {} undelivered tasks", remaining);
        }
        log.info("Dispatch stopped: {}", getMetrics());
        return remaining;
    }

    public long getTotalEnqueued() {
        return totalEnqueued.get();
    }

    public long getTotalSent() {
        return sum(DeliveryWorker::getSentCount);
    }

    public DispatchMetrics getMetrics() {
        return new DispatchMetrics(
                totalEnqueued.get(),
                getTotalSent(),
                sum(DeliveryWorker::getPermanentFailureCount),
                sum(DeliveryWorker::getDroppedCount),
                queue.size());
    }

    public boolean isStarted() {
        return started.get();
    }

    public int getWorkerCount() {
        synchronized (workers) {
            return workers.size();
        }
    }

    @Override
    public void close() {
        stop();
    }

    private long completedCount() {
        return sum(DeliveryWorker::getCompletedCount);
    }

    private long sum(ToLongFunction<DeliveryWorker> counter) {
        synchronized (workers) {
            return workers.stream().mapToLong(counter).sum();
        }
    }
}
