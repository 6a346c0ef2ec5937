package com.umitunal.qcast.core;

import java.time.Duration;

/**
 * Outcome of a single send attempt reported by a {@link MessageTransport}.
 */
public final class SendResult {
    private static final SendResult DELIVERED = new SendResult(Status.DELIVERED, null, null);

    private final Status status;
    private final Duration retryAfter;
    private final String message;

    private SendResult(Status status, Duration retryAfter, String message) {
        this.status = status;
        this.retryAfter = retryAfter;
        this.message = message;
    }

    public Status getStatus() { return status; }

    /**
     * Mandatory wait imposed by the provider; only set for {@link Status#RATE_LIMITED}.
     */
    public Duration getRetryAfter() { return retryAfter; }

    public String getMessage() { return message; }

    public static SendResult delivered() {
        return DELIVERED;
    }

    public static SendResult permanentFailure(String message) {
        return new SendResult(Status.PERMANENT_FAILURE, null, message);
    }

    public static SendResult rateLimited(Duration retryAfter) {
        if (retryAfter == null || retryAfter.isNegative()) {
            throw new IllegalArgumentException("retryAfter must be a non-negative duration");
        }
        return new SendResult(Status.RATE_LIMITED, retryAfter, null);
    }

    public static SendResult transientError(String message) {
        return new SendResult(Status.TRANSIENT_ERROR, null, message);
    }

    @Override
    public String toString() {
        return switch (status) {
            case DELIVERED -> "SendResult{DELIVERED}";
            case RATE_LIMITED -> "SendResult{RATE_LIMITED, retryAfter=" + retryAfter + "}";
            default -> "SendResult{" + status + ", message='" + message + "'}";
        };
    }

    public enum Status {
        DELIVERED,
        PERMANENT_FAILURE,  // Recipient blocked or gone, never retried
        RATE_LIMITED,       // Provider asked us to wait, not a fault
        TRANSIENT_ERROR     // Anything else, retried with backoff
    }
}
