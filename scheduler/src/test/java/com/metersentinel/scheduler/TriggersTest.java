package com.metersentinel.scheduler;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for the {@link Trigger} implementations.
 */
class TriggersTest {

    private static final ZoneId UTC = ZoneId.of("UTC");

    @Test
    @DisplayName("Interval trigger fires one interval after the reference")
    void intervalShouldAddInterval() {
        IntervalTrigger trigger = new IntervalTrigger(Duration.ofMinutes(60));

        assertThat(trigger.nextFireAfter(at(2024, 3, 5, 10, 15)))
                .isEqualTo(at(2024, 3, 5, 11, 15));
        assertThat(trigger.describe()).isEqualTo("every 60 min");
    }

    @Test
    @DisplayName("Interval trigger rejects a non-positive interval")
    void intervalShouldRejectZero() {
        assertThatThrownBy(() -> new IntervalTrigger(Duration.ZERO)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Daily trigger fires later today or tomorrow, never at the reference itself")
    void dailyShouldFireStrictlyAfter() {
        DailyTrigger trigger = new DailyTrigger(LocalTime.of(3, 0));

        assertThat(trigger.nextFireAfter(at(2024, 3, 5, 1, 0))).isEqualTo(at(2024, 3, 5, 3, 0));
        assertThat(trigger.nextFireAfter(at(2024, 3, 5, 3, 0))).isEqualTo(at(2024, 3, 6, 3, 0));
        assertThat(trigger.nextFireAfter(at(2024, 3, 5, 9, 0))).isEqualTo(at(2024, 3, 6, 3, 0));
    }

    @Test
    @DisplayName("Weekly trigger fires on the configured weekday")
    void weeklyShouldFireOnDay() {
        WeeklyTrigger trigger = new WeeklyTrigger(DayOfWeek.MONDAY, LocalTime.of(9, 0));

        // 2024-03-05 is a Tuesday
        assertThat(trigger.nextFireAfter(at(2024, 3, 5, 10, 0))).isEqualTo(at(2024, 3, 11, 9, 0));
        // Monday before and after the firing time
        assertThat(trigger.nextFireAfter(at(2024, 3, 11, 8, 0))).isEqualTo(at(2024, 3, 11, 9, 0));
        assertThat(trigger.nextFireAfter(at(2024, 3, 11, 9, 0))).isEqualTo(at(2024, 3, 18, 9, 0));
    }

    @Test
    @DisplayName("Monthly trigger fires on the configured day of the next month when this one has passed")
    void monthlyShouldRollToNextMonth() {
        MonthlyTrigger trigger = new MonthlyTrigger(1, LocalTime.of(10, 0));

        assertThat(trigger.nextFireAfter(at(2024, 3, 5, 10, 0))).isEqualTo(at(2024, 4, 1, 10, 0));
        assertThat(trigger.nextFireAfter(at(2024, 3, 1, 9, 59))).isEqualTo(at(2024, 3, 1, 10, 0));
    }

    @Test
    @DisplayName("Monthly trigger clamps the day to the length of short months")
    void monthlyShouldClampDay() {
        MonthlyTrigger trigger = new MonthlyTrigger(31, LocalTime.of(10, 0));

        assertThat(trigger.nextFireAfter(at(2024, 2, 10, 0, 0))).isEqualTo(at(2024, 2, 29, 10, 0));
        assertThat(trigger.nextFireAfter(at(2024, 2, 29, 10, 0))).isEqualTo(at(2024, 3, 31, 10, 0));
        assertThat(trigger.nextFireAfter(at(2024, 4, 30, 11, 0))).isEqualTo(at(2024, 5, 31, 10, 0));
    }

    @Test
    @DisplayName("Monthly trigger rejects an impossible day")
    void monthlyShouldRejectBadDay() {
        assertThatThrownBy(() -> new MonthlyTrigger(0, LocalTime.NOON)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new MonthlyTrigger(32, LocalTime.NOON)).isInstanceOf(IllegalArgumentException.class);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static ZonedDateTime at(int year, int month, int day, int hour, int minute) {
        return ZonedDateTime.of(year, month, day, hour, minute, 0, 0, UTC);
    }
}
