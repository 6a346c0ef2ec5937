package com.umitunal.qcast.schedule;

import com.umitunal.qcast.config.BroadcastConfig;
import com.umitunal.qcast.core.BroadcastJob;
import com.umitunal.qcast.core.JobStore;
import com.umitunal.qcast.core.RecipientResolver;
import com.umitunal.qcast.core.ScheduleUpdate;
import com.umitunal.qcast.dispatch.DispatchManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Polls the job store on a fixed interval and launches an execution for every
 * due job that is not already running.
 *
 * Executions run on a small executor owned by this loop. The set of running
 * job ids guarantees at most one concurrent execution per job; an id is
 * always released when its execution ends, however it ends. On
 * {@link #stop()} in-flight executions are given a grace period to finish.
 */
public class SchedulerLoop implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SchedulerLoop.class);

    private final JobStore jobStore;
    private final RecipientResolver recipientResolver;
    private final DispatchManager dispatchManager;
    private final RecurrenceCalculator calculator;
    private final Clock clock;
    private final Duration tickInterval;
    private final Duration errorBackoff;
    private final Duration shutdownGracePeriod;
    private final ExecutorService executions;
    private final Set<String> runningJobs = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong tickCount = new AtomicLong(0);
    private final AtomicLong completedExecutions = new AtomicLong(0);
    private final AtomicLong failedExecutions = new AtomicLong(0);

    private Thread loopThread;

    private SchedulerLoop(Builder builder) {
        this.jobStore = builder.jobStore;
        this.recipientResolver = builder.recipientResolver;
        this.dispatchManager = builder.dispatchManager;
        this.calculator = builder.calculator;
        this.clock = builder.clock;
        this.tickInterval = builder.config.getTickInterval();
        this.errorBackoff = builder.config.getErrorBackoff();
        this.shutdownGracePeriod = builder.config.getShutdownGracePeriod();
        this.executions = Executors.newFixedThreadPool(
                builder.config.getExecutionThreads(), new ExecutionThreadFactory());
    }

    /**
     * Start polling in the background.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            loopThread = new Thread(this::run, "SchedulerLoop");
            loopThread.setDaemon(false);
            loopThread.start();
            log.info("Scheduler started, polling every {}", tickInterval);
        }
    }

    /**
     * Stop polling and wait up to the grace period for running executions.
     */
    public void stop() {
        running.set(false);
        if (loopThread != null) {
            loopThread.interrupt();
            try {
                loopThread.join(5000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        executions.shutdown();
        try {
            if (!executions.awaitTermination(shutdownGracePeriod.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Abandoning {} job executions still running after {}", runningJobs.size(), shutdownGracePeriod);
                executions.shutdownNow();
            }
        } catch (InterruptedException e) {
            executions.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Scheduler stopped after {} ticks ({} executions, {} failed)",
                tickCount.get(), completedExecutions.get(), failedExecutions.get());
    }

    /**
     * Run a single poll: find due jobs and launch those not already running.
     *
     * @return number of executions launched
     */
    public int tick() throws Exception {
        Instant now = clock.instant();
        List<BroadcastJob> due = jobStore.listDueActiveJobs(now);
        tickCount.incrementAndGet();

        int launched = 0;
        for (BroadcastJob job : due) {
            if (launch(job.getId(), now)) {
                launched++;
            }
        }
        if (launched > 0) {
            log.info("Launched {} of {} due jobs", launched, due.size());
        }
        return launched;
    }

    /**
     * Execute a job on the calling thread unless it is already running.
     *
     * @return false if another execution of the same job was in progress
     */
    public boolean executeIfIdle(String jobId, Instant now) {
        if (!runningJobs.add(jobId)) {
            log.debug("Job {} is already running", jobId);
            return false;
        }
        runAndRelease(jobId, now);
        return true;
    }

    private boolean launch(String jobId, Instant now) {
        if (!runningJobs.add(jobId)) {
            log.debug("Job {} is still running from an earlier tick", jobId);
            return false;
        }
        try {
            executions.execute(() -> runAndRelease(jobId, now));
            return true;
        } catch (RejectedExecutionException e) {
            runningJobs.remove(jobId);
            log.warn("Could not launch job {}: scheduler is shutting down", jobId);
            return false;
        }
    }

    private void runAndRelease(String jobId, Instant now) {
        try {
            executeJob(jobId, now);
            completedExecutions.incrementAndGet();
        } catch (InterruptedException e) {
            failedExecutions.incrementAndGet();
            Thread.currentThread().interrupt();
            log.warn("Execution of job {} interrupted", jobId);
        } catch (Exception e) {
            failedExecutions.incrementAndGet();
            log.error("Execution of job {} failed", jobId, e);
        } finally {
            runningJobs.remove(jobId);
        }
    }

    /**
     * Deliver one occurrence of a job and move its schedule forward.
     *
     * The job is re-read first because it may have been edited, deactivated or
     * deleted since it was found due. The next run is computed from
     * {@code now} truncated to the minute rather than from the old next run,
     * so a job that was missed during downtime fires once and not once per
     * missed period.
     */
    void executeJob(String jobId, Instant now) throws Exception {
        BroadcastJob job = jobStore.getJob(jobId);
        if (job == null) {
            log.debug("Job {} was deleted, skipping", jobId);
            return;
        }
        if (!job.isDue(now)) {
            log.debug("Job {} is no longer due (active={}, nextRunAt={}), skipping",
                    jobId, job.isActive(), job.getNextRunAt());
            return;
        }

        List<String> recipients = recipientResolver.listRecipients(job.getRecipientGroupIds());
        if (recipients.isEmpty()) {
            log.info("Job {} has no recipients in groups {}", jobId, job.getRecipientGroupIds());
        } else {
            for (String recipientId : recipients) {
                dispatchManager.enqueueJob(recipientId, job.getMessageText(), jobId);
            }
            log.info("Job {} queued for {} recipients", jobId, recipients.size());
        }

        Instant next = calculator.computeNext(job.getRecurrenceType(), job.getCronExpression(),
                now.truncatedTo(ChronoUnit.MINUTES));
        if (next == null) {
            log.info("Job {} has no further occurrence, deactivating", jobId);
        }
        if (!jobStore.updateJobSchedule(jobId, ScheduleUpdate.of(next))) {
            log.debug("Job {} was deleted during execution", jobId);
            return;
        }
        if (next != null) {
            log.debug("Job {} next run at {}", jobId, next);
        }
    }

    private void run() {
        while (running.get()) {
            try {
                tick();
                TimeUnit.MILLISECONDS.sleep(tickInterval.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                log.error("Scheduler tick failed, retrying in {}", errorBackoff, e);
                try {
                    TimeUnit.MILLISECONDS.sleep(errorBackoff.toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
    }

    public boolean isRunning() { return running.get(); }
    public boolean isExecuting(String jobId) { return runningJobs.contains(jobId); }
    public Set<String> getRunningJobIds() { return Set.copyOf(runningJobs); }
    public long getTickCount() { return tickCount.get(); }
    public long getCompletedExecutions() { return completedExecutions.get(); }
    public long getFailedExecutions() { return failedExecutions.get(); }

    @Override
    public void close() {
        stop();
    }

    public static Builder builder(JobStore jobStore, RecipientResolver recipientResolver,
                                  DispatchManager dispatchManager) {
        return new Builder(jobStore, recipientResolver, dispatchManager);
    }

    private static final class ExecutionThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger(0);

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "JobExecution-" + counter.incrementAndGet());
            thread.setDaemon(false);
            return thread;
        }
    }

    public static class Builder {
        private final JobStore jobStore;
        private final RecipientResolver recipientResolver;
        private final DispatchManager dispatchManager;
        private BroadcastConfig config = BroadcastConfig.defaults();
        private RecurrenceCalculator calculator = new RecurrenceCalculator();
        private Clock clock = Clock.systemUTC();

        private Builder(JobStore jobStore, RecipientResolver recipientResolver, DispatchManager dispatchManager) {
            this.jobStore = jobStore;
            this.recipientResolver = recipientResolver;
            this.dispatchManager = dispatchManager;
        }

        public Builder withConfig(BroadcastConfig config) {
            this.config = config;
            return this;
        }

        public Builder withCalculator(RecurrenceCalculator calculator) {
            this.calculator = calculator;
            return this;
        }

        public Builder withClock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public SchedulerLoop build() {
            return new SchedulerLoop(this);
        }
    }
}
