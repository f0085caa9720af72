package com.metersentinel.core.source;

import com.metersentinel.core.error.SourceUnavailableException;
import com.metersentinel.core.model.ReadingWindow;

import java.time.Instant;
import java.util.Optional;

/**
 * Adapter over the authoritative store of meter readings.
 *
 * <p>
 * "No rows" is a normal answer and returns {@link Optional#empty()}; only a
 * connectivity failure raises {@link SourceUnavailableException}. Callers
 * rely on that split to tell an outage from insufficient data.
 * </p>
 *
 * @since 1.0.0
 */
public interface ReadingSource {

    /**
     * Fetch readings with timestamps in {@code [start, end)}.
     *
     * @param start inclusive lower bound
     * @param end   exclusive upper bound
     * @return ordered window, or empty when no readings fall in the range
     * @throws SourceUnavailableException if the store cannot be reached
     */
    Optional<ReadingWindow> fetch(Instant start, Instant end);
}
