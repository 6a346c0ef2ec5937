package com.umitunal.qcast.schedule;

import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.SortedSet;
import java.util.TimeZone;
import java.util.TreeSet;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * A standard five-field cron schedule (minute, hour, day-of-month, month,
 * day-of-week) evaluated in UTC.
 *
 * Evaluation is delegated to Quartz, which uses a six-field dialect with a
 * leading seconds field, 1-based days of week and a mandatory {@code ?} in one
 * of the two day fields. When both day fields are restricted a day matches if
 * either field matches, so the schedule is split into two Quartz expressions
 * and the earliest of their next fire times wins.
 */
public final class CronSchedule {
    private static final TimeZone UTC = TimeZone.getTimeZone("UTC");

    private static final Map<String, String> ALIASES = Map.of(
            "@yearly", "0 0 1 1 *",
            "@annually", "0 0 1 1 *",
            "@monthly", "0 0 1 * *",
            "@weekly", "0 0 * * 0",
            "@daily", "0 0 * * *",
            "@midnight", "0 0 * * *",
            "@hourly", "0 * * * *");

    private static final String[] DAY_NAMES = {"SUN", "MON", "TUE", "WED", "THU", "FRI", "SAT"};

    private static final Pattern NUMERIC_FIELD = Pattern.compile("[0-9*,/\\-]+");
    private static final Pattern NAMED_FIELD = Pattern.compile("[0-9A-Za-z*,/\\-]+");

    private final String expression;
    private final List<CronExpression> triggers;

    private CronSchedule(String expression, List<CronExpression> triggers) {
        this.expression = expression;
        this.triggers = triggers;
    }

    /**
     * Parse a five-field expression or one of the {@code @daily}-style aliases.
     *
     * @throws InvalidCronExpressionException if the expression is malformed
     */
    public static CronSchedule parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidCronExpressionException(String.valueOf(expression), "expression is empty");
        }
        String trimmed = expression.trim();
        String expanded = ALIASES.getOrDefault(trimmed.toLowerCase(Locale.ROOT), trimmed);

        String[] fields = expanded.split("\\s+");
        if (fields.length != 5) {
            throw new InvalidCronExpressionException(expression,
                    "expected 5 fields (minute hour day-of-month month day-of-week), got " + fields.length);
        }

        String minute = requireSyntax(expression, fields[0], NUMERIC_FIELD, "minute");
        String hour = requireSyntax(expression, fields[1], NUMERIC_FIELD, "hour");
        String dayOfMonth = requireSyntax(expression, fields[2], NUMERIC_FIELD, "day-of-month");
        String month = requireSyntax(expression, fields[3], NAMED_FIELD, "month");
        String dayOfWeek = requireSyntax(expression, fields[4], NAMED_FIELD, "day-of-week");

        boolean domRestricted = !dayOfMonth.equals("*");
        boolean dowRestricted = !dayOfWeek.equals("*");
        String quartzDow = dowRestricted ? toQuartzDaysOfWeek(expression, dayOfWeek) : "*";
        String prefix = "0 " + minute + " " + hour + " ";

        List<String> quartzExpressions = new ArrayList<>(2);
        if (dowRestricted) {
            quartzExpressions.add(prefix + "? " + month + " " + quartzDow);
            if (domRestricted) {
                quartzExpressions.add(prefix + dayOfMonth + " " + month + " ?");
            }
        } else {
            quartzExpressions.add(prefix + dayOfMonth + " " + month + " ?");
        }

        List<CronExpression> triggers = new ArrayList<>(quartzExpressions.size());
        for (String quartz : quartzExpressions) {
            try {
                CronExpression cron = new CronExpression(quartz);
                cron.setTimeZone(UTC);
                triggers.add(cron);
            } catch (ParseException e) {
                throw new InvalidCronExpressionException(expression, e.getMessage(), e);
            } catch (RuntimeException e) {
                // Quartz reports some malformed ranges and steps as unchecked errors
                throw new InvalidCronExpressionException(expression, String.valueOf(e.getMessage()), e);
            }
        }
        return new CronSchedule(trimmed, triggers);
    }

    /**
     * Checks if {@code expression} parses.
     */
    public static boolean isValid(String expression) {
        try {
            parse(expression);
            return true;
        } catch (InvalidCronExpressionException e) {
            return false;
        }
    }

    /**
     * First matching instant strictly after {@code from}.
     *
     * @return the next fire time, or null if the schedule never fires again
     */
    public Instant nextAfter(Instant from) {
        Date after = Date.from(from);
        Instant earliest = null;
        for (CronExpression trigger : triggers) {
            Date next;
            synchronized (trigger) {
                next = trigger.getNextValidTimeAfter(after);
            }
            if (next != null && (earliest == null || next.toInstant().isBefore(earliest))) {
                earliest = next.toInstant();
            }
        }
        return earliest;
    }

    public String getExpression() {
        return expression;
    }

    @Override
    public String toString() {
        return "CronSchedule{" + expression + "}";
    }

    private static String requireSyntax(String expression, String field, Pattern allowed, String name) {
        if (!allowed.matcher(field).matches()) {
            throw new InvalidCronExpressionException(expression, "unsupported characters in " + name + " field '" + field + "'");
        }
        return field;
    }

    /**
     * Expand a cron day-of-week field (0-7 or SUN-SAT, Sunday = 0 or 7) into an
     * explicit Quartz list (1-7, Sunday = 1).
     */
    private static String toQuartzDaysOfWeek(String expression, String field) {
        SortedSet<Integer> days = new TreeSet<>();
        for (String part : field.split(",", -1)) {
            if (part.isEmpty()) {
                throw new InvalidCronExpressionException(expression, "empty day-of-week list element");
            }
            String range = part;
            int step = 1;
            int slash = part.indexOf('/');
            if (slash >= 0) {
                range = part.substring(0, slash);
                step = parseStep(expression, part.substring(slash + 1));
            }

            int start;
            int end;
            if (range.equals("*")) {
                start = 0;
                end = 6;
            } else if (range.indexOf('-') > 0) {
                String[] bounds = range.split("-", -1);
                if (bounds.length != 2) {
                    throw new InvalidCronExpressionException(expression, "bad day-of-week range '" + range + "'");
                }
                start = dayValue(expression, bounds[0]);
                end = dayValue(expression, bounds[1]);
            } else {
                start = dayValue(expression, range);
                end = slash >= 0 ? 6 : start;
            }
            if (start > end) {
                throw new InvalidCronExpressionException(expression, "descending day-of-week range '" + range + "'");
            }
            for (int day = start; day <= end; day += step) {
                days.add(day % 7);
            }
        }
        return days.stream()
                .map(day -> String.valueOf(day + 1))
                .collect(Collectors.joining(","));
    }

    private static int parseStep(String expression, String value) {
        try {
            int step = Integer.parseInt(value);
            if (step < 1) {
                throw new InvalidCronExpressionException(expression, "step must be positive");
            }
            return step;
        } catch (NumberFormatException e) {
            throw new InvalidCronExpressionException(expression, "bad step '" + value + "'", e);
        }
    }

    private static int dayValue(String expression, String token) {
        if (!token.isEmpty() && token.chars().allMatch(Character::isDigit)) {
            int value = Integer.parseInt(token);
            if (value > 7) {
                throw new InvalidCronExpressionException(expression, "day-of-week out of range: " + token);
            }
            return value;
        }
        String upper = token.toUpperCase(Locale.ROOT);
        for (int i = 0; i < DAY_NAMES.length; i++) {
            if (DAY_NAMES[i].equals(upper)) {
                return i;
            }
        }
        throw new InvalidCronExpressionException(expression, "unknown day-of-week '" + token + "'");
    }
}
