package com.metersentinel.scheduler;

import java.time.LocalTime;
import java.time.YearMonth;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * Fires once a month on a fixed day at a fixed local time. A day beyond the
 * month's length fires on the month's last day.
 *
 * @since 1.0.0
 */
public final class MonthlyTrigger implements Trigger {

    private final int dayOfMonth;
    private final LocalTime time;

    public MonthlyTrigger(int dayOfMonth, LocalTime time) {
        if (dayOfMonth < 1 || dayOfMonth > 31) {
            throw new IllegalArgumentException("dayOfMonth must be in [1, 31], got: " + dayOfMonth);
        }
        this.dayOfMonth = dayOfMonth;
        this.time = Objects.requireNonNull(time, "time must not be null");
    }

    @Override
    public ZonedDateTime nextFireAfter(ZonedDateTime after) {
        ZonedDateTime candidate = inMonth(after);
        return candidate.isAfter(after) ? candidate : inMonth(after.withDayOfMonth(1).plusMonths(1));
    }

    @Override
    public String describe() {
        return "monthly on day " + dayOfMonth + " at " + time;
    }

    private ZonedDateTime inMonth(ZonedDateTime reference) {
        int length = YearMonth.from(reference).lengthOfMonth();
        return reference.withDayOfMonth(Math.min(dayOfMonth, length)).with(time);
    }
}
