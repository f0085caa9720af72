package com.metersentinel.scheduler;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.time.temporal.TemporalAdjusters;
import java.util.Objects;

/**
 * Fires once a week on a fixed day at a fixed local time.
 *
 * @since 1.0.0
 */
public final class WeeklyTrigger implements Trigger {

    private final DayOfWeek day;
    private final LocalTime time;

    public WeeklyTrigger(DayOfWeek day, LocalTime time) {
        this.day = Objects.requireNonNull(day, "day must not be null");
        this.time = Objects.requireNonNull(time, "time must not be null");
    }

    @Override
    public ZonedDateTime nextFireAfter(ZonedDateTime after) {
        ZonedDateTime candidate = after.with(TemporalAdjusters.nextOrSame(day)).with(time);
        return candidate.isAfter(after)
                ? candidate
                : after.with(TemporalAdjusters.next(day)).with(time);
    }

    @Override
    public String describe() {
        return "weekly on " + day + " at " + time;
    }
}
