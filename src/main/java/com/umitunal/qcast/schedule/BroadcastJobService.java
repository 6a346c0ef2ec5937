package com.umitunal.qcast.schedule;

import com.umitunal.qcast.core.BroadcastJob;
import com.umitunal.qcast.core.JobStore;
import com.umitunal.qcast.core.RecurrenceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Operator-facing job administration: create, edit, deactivate and delete.
 *
 * Every edit is an atomic read-modify-write on the store, so an edit racing a
 * scheduler execution never loses either write. The scheduler re-reads jobs
 * on every tick and picks edits up without notification.
 */
public class BroadcastJobService {
    private static final Logger log = LoggerFactory.getLogger(BroadcastJobService.class);

    private final JobStore jobStore;
    private final Clock clock;

    public BroadcastJobService(JobStore jobStore) {
        this(jobStore, Clock.systemUTC());
    }

    public BroadcastJobService(JobStore jobStore, Clock clock) {
        this.jobStore = jobStore;
        this.clock = clock;
    }

    /**
     * Validate a definition and store it as a new active job.
     *
     * @throws InvalidJobException if the definition is incomplete or its cron expression is malformed
     */
    public BroadcastJob createJob(JobDefinition definition) throws Exception {
        requireMessage(definition.getMessageText());
        requireGroups(definition.getRecipientGroupIds());
        if (definition.getRecurrenceType() == null) {
            throw new InvalidJobException("Recurrence type is required");
        }

        Instant now = clock.instant();
        Instant firstRun = firstRun(definition.getRecurrenceType(), definition.getCronExpression(),
                definition.getFirstRunAt(), now);

        BroadcastJob job = BroadcastJob.newBuilder(UUID.randomUUID().toString())
                .messageText(definition.getMessageText())
                .recurrence(definition.getRecurrenceType(), definition.getCronExpression())
                .nextRunAt(firstRun)
                .active(true)
                .recipientGroupIds(definition.getRecipientGroupIds())
                .createdAt(now)
                .ownerId(definition.getOwnerId())
                .build();

        jobStore.saveJob(job);
        log.info("Created {} job {} for groups {}, first run at {}",
                job.getRecurrenceType(), job.getId(), job.getRecipientGroupIds(), firstRun);
        return job;
    }

    public BroadcastJob updateMessage(String jobId, String messageText) throws Exception {
        requireMessage(messageText);
        return update(jobId, job -> job.toBuilder().messageText(messageText).build());
    }

    public BroadcastJob updateRecipients(String jobId, Set<String> groupIds) throws Exception {
        requireGroups(groupIds);
        return update(jobId, job -> job.toBuilder().recipientGroupIds(groupIds).build());
    }

    /**
     * Replace the recurrence and re-activate the job. With a null
     * {@code nextRunAt} a CUSTOM job starts at its next cron match.
     */
    public BroadcastJob reschedule(String jobId, RecurrenceType type, String cronExpression, Instant nextRunAt)
            throws Exception {
        if (type == null) {
            throw new InvalidJobException("Recurrence type is required");
        }
        Instant next = firstRun(type, cronExpression, nextRunAt, clock.instant());
        BroadcastJob updated = update(jobId, job -> job.toBuilder()
                .recurrence(type, cronExpression)
                .nextRunAt(next)
                .active(true)
                .build());
        log.info("Rescheduled job {} as {}, next run at {}", jobId, type, next);
        return updated;
    }

    public BroadcastJob deactivate(String jobId) throws Exception {
        BroadcastJob updated = update(jobId, job -> job.toBuilder().active(false).build());
        log.info("Deactivated job {}", jobId);
        return updated;
    }

    public boolean deleteJob(String jobId) throws Exception {
        boolean deleted = jobStore.deleteJob(jobId);
        if (deleted) {
            log.info("Deleted job {}", jobId);
        }
        return deleted;
    }

    public BroadcastJob getJob(String jobId) throws Exception {
        return jobStore.getJob(jobId);
    }

    /**
     * All jobs, oldest first.
     */
    public List<BroadcastJob> listJobs() throws Exception {
        return jobStore.listJobs().stream()
                .sorted(Comparator.comparing(BroadcastJob::getCreatedAt,
                        Comparator.nullsFirst(Comparator.naturalOrder())))
                .collect(Collectors.toList());
    }

    public List<BroadcastJob> listJobsOwnedBy(String ownerId) throws Exception {
        return listJobs().stream()
                .filter(job -> ownerId.equals(job.getOwnerId()))
                .collect(Collectors.toList());
    }

    private BroadcastJob update(String jobId, UnaryOperator<BroadcastJob> change) throws Exception {
        BroadcastJob updated = jobStore.updateJob(jobId, change);
        if (updated == null) {
            throw new IllegalStateException("Job not found: " + jobId);
        }
        return updated;
    }

    private Instant firstRun(RecurrenceType type, String cronExpression, Instant requested, Instant now) {
        if (type == RecurrenceType.CUSTOM) {
            CronSchedule schedule;
            try {
                schedule = CronSchedule.parse(cronExpression);
            } catch (InvalidCronExpressionException e) {
                throw new InvalidJobException(e.getMessage(), e);
            }
            if (requested != null) {
                return requested;
            }
            Instant next = schedule.nextAfter(now.truncatedTo(ChronoUnit.MINUTES));
            if (next == null) {
                throw new InvalidJobException("Cron expression '" + cronExpression + "' never fires");
            }
            return next;
        }
        if (requested == null) {
            throw new InvalidJobException(type + " job requires a first run time");
        }
        return requested;
    }

    private static void requireMessage(String messageText) {
        if (messageText == null || messageText.isBlank()) {
            throw new InvalidJobException("Message text must not be blank");
        }
    }

    private static void requireGroups(Set<String> groupIds) {
        if (groupIds == null || groupIds.isEmpty()) {
            throw new InvalidJobException("At least one recipient group is required");
        }
    }
}
