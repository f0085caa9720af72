package com.metersentinel.scheduler;

import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * Fires once a day at a fixed local time.
 *
 * @since 1.0.0
 */
public final class DailyTrigger implements Trigger {

    private final LocalTime time;

    public DailyTrigger(LocalTime time) {
        this.time = Objects.requireNonNull(time, "time must not be null");
    }

    @Override
    public ZonedDateTime nextFireAfter(ZonedDateTime after) {
        ZonedDateTime candidate = after.with(time);
        return candidate.isAfter(after) ? candidate : after.plusDays(1).with(time);
    }

    @Override
    public String describe() {
        return "daily at " + time;
    }
}
