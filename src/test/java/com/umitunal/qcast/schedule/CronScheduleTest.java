package com.umitunal.qcast.schedule;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class CronScheduleTest {

    // 2025-01-06 is a Monday
    private static final Instant MONDAY_9AM = Instant.parse("2025-01-06T09:00:00Z");

    @Test
    @DisplayName("Should treat both 0 and 7 as Sunday")
    void testSundayAliases() {
        // When
        Instant zero = CronSchedule.parse("0 12 * * 0").nextAfter(MONDAY_9AM);
        Instant seven = CronSchedule.parse("0 12 * * 7").nextAfter(MONDAY_9AM);

        // Then
        assertThat(zero).isEqualTo(Instant.parse("2025-01-12T12:00:00Z"));
        assertThat(seven).isEqualTo(zero);
    }

    @Test
    @DisplayName("Should accept day names and ranges")
    void testNamedWeekdayRange() {
        // Given - Friday
        Instant friday = Instant.parse("2025-01-10T09:00:00Z");

        // When
        Instant next = CronSchedule.parse("0 9 * * MON-FRI").nextAfter(friday);

        // Then
        assertThat(next).isEqualTo(Instant.parse("2025-01-13T09:00:00Z"));
    }

    @Test
    @DisplayName("Should match a day when either day-of-month or day-of-week matches")
    void testDayOfMonthOrDayOfWeek() {
        // Given - "08:00 on the 1st or on Mondays"
        CronSchedule schedule = CronSchedule.parse("0 8 1 * 1");

        // When
        Instant fromNewYear = schedule.nextAfter(Instant.parse("2025-01-01T08:00:00Z"));
        Instant fromLateJanuary = schedule.nextAfter(Instant.parse("2025-01-28T08:00:00Z"));

        // Then - first Monday, then Saturday Feb 1st ahead of Monday Feb 3rd
        assertThat(fromNewYear).isEqualTo(Instant.parse("2025-01-06T08:00:00Z"));
        assertThat(fromLateJanuary).isEqualTo(Instant.parse("2025-02-01T08:00:00Z"));
    }

    @Test
    @DisplayName("Should support minute steps")
    void testStep() {
        // When
        Instant next = CronSchedule.parse("*/15 * * * *").nextAfter(Instant.parse("2025-01-06T10:07:30Z"));

        // Then
        assertThat(next).isEqualTo(Instant.parse("2025-01-06T10:15:00Z"));
    }

    @Test
    @DisplayName("Should support day-of-week steps")
    void testWeekdayStep() {
        // Given - Sunday, Tuesday, Thursday, Saturday
        CronSchedule schedule = CronSchedule.parse("0 6 * * */2");

        // When
        Instant next = schedule.nextAfter(MONDAY_9AM);

        // Then
        assertThat(next).isEqualTo(Instant.parse("2025-01-07T06:00:00Z"));
    }

    @Test
    @DisplayName("Should expand aliases")
    void testAliases() {
        // When
        Instant daily = CronSchedule.parse("@daily").nextAfter(MONDAY_9AM);
        Instant hourly = CronSchedule.parse("@hourly").nextAfter(MONDAY_9AM);
        Instant weekly = CronSchedule.parse("@weekly").nextAfter(MONDAY_9AM);

        // Then
        assertThat(daily).isEqualTo(Instant.parse("2025-01-07T00:00:00Z"));
        assertThat(hourly).isEqualTo(Instant.parse("2025-01-06T10:00:00Z"));
        assertThat(weekly).isEqualTo(Instant.parse("2025-01-12T00:00:00Z"));
    }

    @Test
    @DisplayName("Should accept month names")
    void testMonthNames() {
        // When
        Instant next = CronSchedule.parse("30 7 15 MAR *").nextAfter(MONDAY_9AM);

        // Then
        assertThat(next).isEqualTo(Instant.parse("2025-03-15T07:30:00Z"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"0 9 * * 1", "*/5 * * * *", "0 0 1,15 * *", "0 9-17 * * MON-FRI", "@monthly"})
    @DisplayName("Should accept valid expressions")
    void testValid(String expression) {
        assertThat(CronSchedule.isValid(expression)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "every monday", "* * * *", "0 0 * * * *", "61 * * * *", "0 9 * * 8", "0 9 * * FOO"})
    @DisplayName("Should reject malformed expressions")
    void testInvalid(String expression) {
        assertThat(CronSchedule.isValid(expression)).isFalse();
        assertThatThrownBy(() -> CronSchedule.parse(expression))
                .isInstanceOf(InvalidCronExpressionException.class);
    }

    @Test
    @DisplayName("Should reject null expression")
    void testNull() {
        assertThatThrownBy(() -> CronSchedule.parse(null))
                .isInstanceOf(InvalidCronExpressionException.class)
                .hasMessageContaining("empty");
    }
}
