package com.umitunal.qcast.schedule;

import com.umitunal.qcast.core.RecurrenceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/**
 * Maps a recurrence rule and a reference time to the next occurrence.
 *
 * <ul>
 *   <li>WEEKLY: exactly seven days later.</li>
 *   <li>MONTHLY: same day-of-month and time one calendar month later. When
 *       that day does not exist in the next month (e.g. the 31st before a
 *       30-day month) the reference time is advanced by {@value #MONTHLY_OVERFLOW_DAYS}
 *       days and floored to the first day of the resulting month, which is
 *       always the 1st of the month after the short one.</li>
 *   <li>CUSTOM: next five-field cron match strictly after the reference time.</li>
 * </ul>
 *
 * All arithmetic is done in UTC. A null result means there is no further
 * occurrence and the job should be deactivated.
 */
public class RecurrenceCalculator {
    private static final Logger log = LoggerFactory.getLogger(RecurrenceCalculator.class);

    static final int MONTHLY_OVERFLOW_DAYS = 31;
    private static final Duration ONE_WEEK = Duration.ofDays(7);

    /**
     * Compute the next occurrence after {@code from}.
     *
     * @param type recurrence rule
     * @param cronExpression five-field cron, used only for CUSTOM
     * @param from reference time
     * @return the next occurrence, or null if there is none
     */
    public Instant computeNext(RecurrenceType type, String cronExpression, Instant from) {
        if (type == null || from == null) {
            return null;
        }
        return switch (type) {
            case WEEKLY -> from.plus(ONE_WEEK);
            case MONTHLY -> nextMonthly(from);
            case CUSTOM -> nextCustom(cronExpression, from);
        };
    }

    private Instant nextMonthly(Instant from) {
        ZonedDateTime current = from.atZone(ZoneOffset.UTC);
        YearMonth target = YearMonth.from(current).plusMonths(1);

        if (target.isValidDay(current.getDayOfMonth())) {
            return current.plusMonths(1).toInstant();
        }
        return current.plusDays(MONTHLY_OVERFLOW_DAYS)
                .withDayOfMonth(1)
                .toInstant();
    }

    private Instant nextCustom(String cronExpression, Instant from) {
        try {
            return CronSchedule.parse(cronExpression).nextAfter(from);
        } catch (InvalidCronExpressionException e) {
            log.warn("Cannot evaluate cron schedule, treating as final occurrence: {}", e.getMessage());
            return null;
        }
    }
}
