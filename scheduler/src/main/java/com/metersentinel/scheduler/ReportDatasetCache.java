package com.metersentinel.scheduler;

import com.metersentinel.core.model.ReadingWindow;
import com.metersentinel.core.report.ReportKind;
import com.metersentinel.core.report.ReportPeriod;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Last-known-good dataset per report kind, used when the reading source is
 * down at report time. In memory only.
 *
 * @since 1.0.0
 */
public class ReportDatasetCache {

    private final Map<ReportKind, Entry> entries = new ConcurrentHashMap<>();

    public void put(ReportPeriod period, ReadingWindow window) {
        Objects.requireNonNull(period, "period must not be null");
        Objects.requireNonNull(window, "window must not be null");
        entries.put(period.getKind(), new Entry(period, window));
    }

    public Optional<Entry> get(ReportKind kind) {
        return Optional.ofNullable(entries.get(kind));
    }

    /**
     * A cached window together with the period it was fetched for.
     */
    public static final class Entry {
        private final ReportPeriod period;
        private final ReadingWindow window;

        Entry(ReportPeriod period, ReadingWindow window) {
            this.period = period;
            this.window = window;
        }

        public ReportPeriod getPeriod() {
            return period;
        }

        public ReadingWindow getWindow() {
            return window;
        }
    }
}
