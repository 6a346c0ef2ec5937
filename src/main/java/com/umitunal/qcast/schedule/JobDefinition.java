package com.umitunal.qcast.schedule;

import com.umitunal.qcast.core.RecurrenceType;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * What an operator submits to create a broadcast job. Validation happens in
 * {@link BroadcastJobService#createJob(JobDefinition)}, not here.
 */
public final class JobDefinition {
    private final String messageText;
    private final RecurrenceType recurrenceType;
    private final String cronExpression;
    private final Instant firstRunAt;
    private final Set<String> recipientGroupIds;
    private final String ownerId;

    private JobDefinition(Builder builder) {
        this.messageText = builder.messageText;
        this.recurrenceType = builder.recurrenceType;
        this.cronExpression = builder.cronExpression;
        this.firstRunAt = builder.firstRunAt;
        this.recipientGroupIds = Collections.unmodifiableSet(new LinkedHashSet<>(builder.recipientGroupIds));
        this.ownerId = builder.ownerId;
    }

    public String getMessageText() { return messageText; }
    public RecurrenceType getRecurrenceType() { return recurrenceType; }
    public String getCronExpression() { return cronExpression; }
    public Instant getFirstRunAt() { return firstRunAt; }
    public Set<String> getRecipientGroupIds() { return recipientGroupIds; }
    public String getOwnerId() { return ownerId; }

    public static Builder newBuilder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "JobDefinition{type=" + recurrenceType + ", cron='" + cronExpression + "', firstRunAt=" + firstRunAt
                + ", groups=" + recipientGroupIds + ", owner='" + ownerId + "'}";
    }

    public static class Builder {
        private String messageText;
        private RecurrenceType recurrenceType;
        private String cronExpression;
        private Instant firstRunAt;
        private final Set<String> recipientGroupIds = new LinkedHashSet<>();
        private String ownerId;

        private Builder() {
        }

        public Builder messageText(String messageText) {
            this.messageText = messageText;
            return this;
        }

        /**
         * Every seven days starting at {@code firstRunAt}.
         */
        public Builder weekly(Instant firstRunAt) {
            this.recurrenceType = RecurrenceType.WEEKLY;
            this.cronExpression = null;
            this.firstRunAt = firstRunAt;
            return this;
        }

        /**
         * Same day every month starting at {@code firstRunAt}.
         */
        public Builder monthly(Instant firstRunAt) {
            this.recurrenceType = RecurrenceType.MONTHLY;
            this.cronExpression = null;
            this.firstRunAt = firstRunAt;
            return this;
        }

        /**
         * On a cron schedule. Without an explicit first run the first cron match
         * after creation is used.
         */
        public Builder custom(String cronExpression) {
            this.recurrenceType = RecurrenceType.CUSTOM;
            this.cronExpression = cronExpression;
            return this;
        }

        public Builder firstRunAt(Instant firstRunAt) {
            this.firstRunAt = firstRunAt;
            return this;
        }

        public Builder addRecipientGroup(String groupId) {
            this.recipientGroupIds.add(groupId);
            return this;
        }

        public Builder recipientGroups(Set<String> groupIds) {
            this.recipientGroupIds.addAll(groupIds);
            return this;
        }

        public Builder ownerId(String ownerId) {
            this.ownerId = ownerId;
            return this;
        }

        public JobDefinition build() {
            return new JobDefinition(this);
        }
    }
}
