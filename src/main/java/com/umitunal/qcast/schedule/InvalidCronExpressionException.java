package com.umitunal.qcast.schedule;

/**
 * Raised when a five-field cron expression cannot be parsed.
 */
public class InvalidCronExpressionException extends IllegalArgumentException {

    public InvalidCronExpressionException(String expression, String reason) {
        super("Invalid cron expression '" + expression + "': " + reason);
    }

    public InvalidCronExpressionException(String expression, String reason, Throwable cause) {
        super("Invalid cron expression '" + expression + "': " + reason, cause);
    }
}
