package com.metersentinel.scheduler;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * Fires at a fixed interval measured from the previous fire time.
 *
 * @since 1.0.0
 */
public final class IntervalTrigger implements Trigger {

    private final Duration interval;

    public IntervalTrigger(Duration interval) {
        Objects.requireNonNull(interval, "interval must not be null");
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive, got: " + interval);
        }
        this.interval = interval;
    }

    @Override
    public ZonedDateTime nextFireAfter(ZonedDateTime after) {
        return after.plus(interval);
    }

    @Override
    public String describe() {
        return "every " + interval.toMinutes() + " min";
    }

    public Duration getInterval() {
        return interval;
    }
}
