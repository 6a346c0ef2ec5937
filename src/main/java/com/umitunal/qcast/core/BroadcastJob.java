package com.umitunal.qcast.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A persisted recurring broadcast: message, recurrence, audience and schedule state.
 *
 * Instances are immutable; edits produce a new instance through {@link #toBuilder()}.
 * An active job always has a next run time, and a CUSTOM job always carries a
 * cron expression.
 */
public final class BroadcastJob {
    private final String id;
    private final String messageText;
    private final RecurrenceType recurrenceType;
    private final String cronExpression;
    private final Instant nextRunAt;
    private final boolean active;
    private final Set<String> recipientGroupIds;
    private final Instant createdAt;
    private final String ownerId;

    @JsonCreator
    public BroadcastJob(@JsonProperty("id") String id,
                        @JsonProperty("messageText") String messageText,
                        @JsonProperty("recurrenceType") RecurrenceType recurrenceType,
                        @JsonProperty("cronExpression") String cronExpression,
                        @JsonProperty("nextRunAt") Instant nextRunAt,
                        @JsonProperty("active") boolean active,
                        @JsonProperty("recipientGroupIds") Set<String> recipientGroupIds,
                        @JsonProperty("createdAt") Instant createdAt,
                        @JsonProperty("ownerId") String ownerId) {
        this.id = Objects.requireNonNull(id, "id");
        this.messageText = Objects.requireNonNull(messageText, "messageText");
        this.recurrenceType = Objects.requireNonNull(recurrenceType, "recurrenceType");
        this.cronExpression = cronExpression;
        this.nextRunAt = nextRunAt;
        this.active = active;
        this.recipientGroupIds = recipientGroupIds == null
                ? Collections.emptySet()
                : Collections.unmodifiableSet(new LinkedHashSet<>(recipientGroupIds));
        this.createdAt = createdAt;
        this.ownerId = ownerId;

        if (active && nextRunAt == null) {
            throw new IllegalArgumentException("Active job " + id + " must have a next run time");
        }
        if (recurrenceType == RecurrenceType.CUSTOM && (cronExpression == null || cronExpression.isBlank())) {
            throw new IllegalArgumentException("CUSTOM job " + id + " requires a cron expression");
        }
    }

    @JsonProperty("id")
    public String getId() { return id; }

    @JsonProperty("messageText")
    public String getMessageText() { return messageText; }

    @JsonProperty("recurrenceType")
    public RecurrenceType getRecurrenceType() { return recurrenceType; }

    @JsonProperty("cronExpression")
    public String getCronExpression() { return cronExpression; }

    @JsonProperty("nextRunAt")
    public Instant getNextRunAt() { return nextRunAt; }

    @JsonProperty("active")
    public boolean isActive() { return active; }

    @JsonProperty("recipientGroupIds")
    public Set<String> getRecipientGroupIds() { return recipientGroupIds; }

    @JsonProperty("createdAt")
    public Instant getCreatedAt() { return createdAt; }

    @JsonProperty("ownerId")
    public String getOwnerId() { return ownerId; }

    /**
     * Checks if this job should run at {@code now}.
     */
    public boolean isDue(Instant now) {
        return active && nextRunAt != null && !nextRunAt.isAfter(now);
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public static Builder newBuilder(String id) {
        return new Builder(id);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BroadcastJob)) return false;
        BroadcastJob that = (BroadcastJob) o;
        return active == that.active
                && id.equals(that.id)
                && messageText.equals(that.messageText)
                && recurrenceType == that.recurrenceType
                && Objects.equals(cronExpression, that.cronExpression)
                && Objects.equals(nextRunAt, that.nextRunAt)
                && recipientGroupIds.equals(that.recipientGroupIds)
                && Objects.equals(createdAt, that.createdAt)
                && Objects.equals(ownerId, that.ownerId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, messageText, recurrenceType, cronExpression, nextRunAt,
                active, recipientGroupIds, createdAt, ownerId);
    }

    @Override
    public String toString() {
        return String.format("BroadcastJob{id='%s', type=%s, nextRunAt=%s, active=%s, groups=%s}",
                id, recurrenceType, nextRunAt, active, recipientGroupIds);
    }

    public static class Builder {
        private final String id;
        private String messageText;
        private RecurrenceType recurrenceType;
        private String cronExpression;
        private Instant nextRunAt;
        private boolean active = true;
        private Set<String> recipientGroupIds = new LinkedHashSet<>();
        private Instant createdAt;
        private String ownerId;

        private Builder(String id) {
            this.id = id;
        }

        private Builder(BroadcastJob job) {
            this.id = job.id;
            this.messageText = job.messageText;
            this.recurrenceType = job.recurrenceType;
            this.cronExpression = job.cronExpression;
            this.nextRunAt = job.nextRunAt;
            this.active = job.active;
            this.recipientGroupIds = new LinkedHashSet<>(job.recipientGroupIds);
            this.createdAt = job.createdAt;
            this.ownerId = job.ownerId;
        }

        public Builder messageText(String messageText) {
            this.messageText = messageText;
            return this;
        }

        public Builder weekly() {
            this.recurrenceType = RecurrenceType.WEEKLY;
            this.cronExpression = null;
            return this;
        }

        public Builder monthly() {
            this.recurrenceType = RecurrenceType.MONTHLY;
            this.cronExpression = null;
            return this;
        }

        public Builder custom(String cronExpression) {
            this.recurrenceType = RecurrenceType.CUSTOM;
            this.cronExpression = cronExpression;
            return this;
        }

        public Builder recurrence(RecurrenceType type, String cronExpression) {
            this.recurrenceType = type;
            this.cronExpression = type == RecurrenceType.CUSTOM ? cronExpression : null;
            return this;
        }

        public Builder nextRunAt(Instant nextRunAt) {
            this.nextRunAt = nextRunAt;
            return this;
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public Builder recipientGroupIds(Set<String> groupIds) {
            this.recipientGroupIds = new LinkedHashSet<>(groupIds);
            return this;
        }

        public Builder addRecipientGroup(String groupId) {
            this.recipientGroupIds.add(groupId);
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder ownerId(String ownerId) {
            this.ownerId = ownerId;
            return this;
        }

        public BroadcastJob build() {
            return new BroadcastJob(id, messageText, recurrenceType, cronExpression, nextRunAt,
                    active, recipientGroupIds, createdAt, ownerId);
        }
    }
}
