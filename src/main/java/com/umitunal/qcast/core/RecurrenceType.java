package com.umitunal.qcast.core;

/**
 * How a broadcast job repeats after each execution.
 */
public enum RecurrenceType {
    WEEKLY,     // Every 7 days
    MONTHLY,    // Same day of the next calendar month
    CUSTOM      // Five-field cron expression
}
