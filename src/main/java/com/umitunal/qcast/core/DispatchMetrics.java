package com.umitunal.qcast.core;

/**
 * Point-in-time counters of the delivery pipeline.
 */
public class DispatchMetrics {
    private final long totalEnqueued;
    private final long totalSent;
    private final long permanentFailures;
    private final long dropped;
    private final int queueDepth;

    public DispatchMetrics(long totalEnqueued, long totalSent, long permanentFailures,
                           long dropped, int queueDepth) {
        this.totalEnqueued = totalEnqueued;
        this.totalSent = totalSent;
        this.permanentFailures = permanentFailures;
        this.dropped = dropped;
        this.queueDepth = queueDepth;
    }

    public long getTotalEnqueued() { return totalEnqueued; }
    public long getTotalSent() { return totalSent; }
    public long getPermanentFailures() { return permanentFailures; }
    public long getDropped() { return dropped; }
    public int getQueueDepth() { return queueDepth; }

    @Override
    public String toString() {
        return String.format(
            "DispatchMetrics{enqueued=%d, sent=%d, permanentFailures=%d, dropped=%d, queued=%d}",
            totalEnqueued, totalSent, permanentFailures, dropped, queueDepth
        );
    }
}
