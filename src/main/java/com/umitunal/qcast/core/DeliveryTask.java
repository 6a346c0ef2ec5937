package com.umitunal.qcast.core;

import java.util.Objects;

/**
 * One message to one recipient, as placed on the dispatch queue.
 * Has no identity beyond its fields.
 */
public final class DeliveryTask {
    private final String recipientId;
    private final String messageText;
    private final String jobId;

    public DeliveryTask(String recipientId, String messageText, String jobId) {
        this.recipientId = Objects.requireNonNull(recipientId, "recipientId");
        this.messageText = Objects.requireNonNull(messageText, "messageText");
        this.jobId = jobId;
    }

    public String getRecipientId() { return recipientId; }
    public String getMessageText() { return messageText; }
    public String getJobId() { return jobId; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DeliveryTask)) return false;
        DeliveryTask that = (DeliveryTask) o;
        return recipientId.equals(that.recipientId)
                && messageText.equals(that.messageText)
                && Objects.equals(jobId, that.jobId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(recipientId, messageText, jobId);
    }

    @Override
    public String toString() {
        return String.format("DeliveryTask{recipient='%s', job='%s'}", recipientId, jobId);
    }
}
