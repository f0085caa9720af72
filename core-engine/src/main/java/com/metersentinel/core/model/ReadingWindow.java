package com.metersentinel.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An ordered, bounded slice of readings covering {@code [start, end)}.
 *
 * <p>
 * A window is built for a single job invocation and is never persisted. The
 * constructor enforces that timestamps are strictly increasing and fall inside
 * the bounds, so every consumer can rely on ordering without re-checking.
 * </p>
 *
 * @since 1.0.0
 */
public final class ReadingWindow {

    private final Instant start;
    private final Instant end;
    private final List<Reading> readings;

    /**
     * @param start    inclusive lower bound
     * @param end      exclusive upper bound; must be after {@code start}
     * @param readings readings in strictly increasing timestamp order
     * @throws NullPointerException     if any argument is {@code null}
     * @throws IllegalArgumentException if ordering or bounds are violated
     */
    public ReadingWindow(Instant start, Instant end, List<Reading> readings) {
        this.start = Objects.requireNonNull(start, "start must not be null");
        this.end = Objects.requireNonNull(end, "end must not be null");
        Objects.requireNonNull(readings, "readings must not be null");
        if (!end.isAfter(start)) {
            throw new IllegalArgumentException("Window end must be after start: [" + start + ", " + end + ")");
        }

        Instant previous = null;
        for (int i = 0; i < readings.size(); i++) {
            Reading r = Objects.requireNonNull(readings.get(i), "Reading at index " + i + " is null");
            Instant ts = r.getTimestamp();
            if (ts.isBefore(start) || !ts.isBefore(end)) {
                throw new IllegalArgumentException(
                        "Reading at index " + i + " (" + ts + ") lies outside [" + start + ", " + end + ")");
            }
            if (previous != null && !ts.isAfter(previous)) {
                throw new IllegalArgumentException(
                        "Timestamps must be strictly increasing; index " + i + " has " + ts
                                + " after " + previous);
            }
            previous = ts;
        }
        this.readings = Collections.unmodifiableList(new ArrayList<>(readings));
    }

    /**
     * Build a window whose bounds are derived from the readings themselves.
     *
     * @param readings non-empty, strictly increasing readings
     * @return window covering first timestamp to one nanosecond past the last
     */
    public static ReadingWindow covering(List<Reading> readings) {
        if (readings.isEmpty()) {
            throw new IllegalArgumentException("Cannot derive bounds from an empty reading list");
        }
        Instant first = readings.get(0).getTimestamp();
        Instant last = readings.get(readings.size() - 1).getTimestamp();
        return new ReadingWindow(first, last.plusNanos(1), readings);
    }

    public Instant getStart() {
        return start;
    }

    public Instant getEnd() {
        return end;
    }

    public List<Reading> getReadings() {
        return readings;
    }

    public Reading get(int index) {
        return readings.get(index);
    }

    public int size() {
        return readings.size();
    }

    public boolean isEmpty() {
        return readings.isEmpty();
    }

    public Duration span() {
        return Duration.between(start, end);
    }

    /**
     * @return active power of every reading, in window order
     */
    public double[] activePower() {
        double[] values = new double[readings.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = readings.get(i).getActivePowerKw();
        }
        return values;
    }

    /**
     * Return a window with the same bounds and different readings.
     *
     * @param replacement readings for the new window
     * @return new window
     */
    public ReadingWindow withReadings(List<Reading> replacement) {
        return new ReadingWindow(start, end, replacement);
    }

    @Override
    public String toString() {
        return "ReadingWindow{start=" + start + ", end=" + end + ", size=" + readings.size() + '}';
    }
}
