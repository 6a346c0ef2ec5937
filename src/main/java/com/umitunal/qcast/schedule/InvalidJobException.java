package com.umitunal.qcast.schedule;

/**
 * Raised when a job definition or edit is rejected.
 */
public class InvalidJobException extends IllegalArgumentException {

    public InvalidJobException(String message) {
        super(message);
    }

    public InvalidJobException(String message, Throwable cause) {
        super(message, cause);
    }
}
