package com.umitunal.qcast.core;

import java.time.Instant;

/**
 * Schedule change written back by the scheduler after a job execution.
 * Either advances the next run or deactivates the job; never both.
 */
public final class ScheduleUpdate {
    private final Instant nextRunAt;
    private final boolean deactivate;

    private ScheduleUpdate(Instant nextRunAt, boolean deactivate) {
        this.nextRunAt = nextRunAt;
        this.deactivate = deactivate;
    }

    public static ScheduleUpdate advanceTo(Instant nextRunAt) {
        if (nextRunAt == null) {
            throw new IllegalArgumentException("nextRunAt must not be null");
        }
        return new ScheduleUpdate(nextRunAt, false);
    }

    public static ScheduleUpdate deactivate() {
        return new ScheduleUpdate(null, true);
    }

    /**
     * Advance to {@code next}, or deactivate when there is no further occurrence.
     */
    public static ScheduleUpdate of(Instant next) {
        return next != null ? advanceTo(next) : deactivate();
    }

    public Instant getNextRunAt() { return nextRunAt; }
    public boolean isDeactivate() { return deactivate; }

    /**
     * Apply this update to a job, leaving every other field untouched.
     * Advancing never re-activates a job that was deactivated meanwhile.
     */
    public BroadcastJob applyTo(BroadcastJob job) {
        if (deactivate) {
            return job.toBuilder().active(false).build();
        }
        return job.toBuilder().nextRunAt(nextRunAt).build();
    }

    @Override
    public String toString() {
        return deactivate ? "ScheduleUpdate{deactivate}" : "ScheduleUpdate{nextRunAt=" + nextRunAt + "}";
    }
}
