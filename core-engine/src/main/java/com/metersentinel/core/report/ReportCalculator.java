package com.metersentinel.core.report;

import com.metersentinel.core.ml.Statistics;
import com.metersentinel.core.model.Reading;
import com.metersentinel.core.model.ReadingWindow;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Aggregates a reading window into a {@link ReportSummary}.
 *
 * <p>
 * Energy integrates active power over the window's typical sample spacing
 * (the median gap between consecutive readings, one minute when the window
 * has a single reading). Sub-metering channels are already watt-hours per
 * sample and are summed directly. Missing values are skipped.
 * </p>
 *
 * @since 1.0.0
 */
public class ReportCalculator {

    static final Duration DEFAULT_SAMPLE_INTERVAL = Duration.ofMinutes(1);

    private final Clock clock;

    public ReportCalculator(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public ReportSummary summarize(ReportPeriod period, ReadingWindow window, int anomalyCount, boolean fromCache) {
        Objects.requireNonNull(period, "period must not be null");
        Objects.requireNonNull(window, "window must not be null");

        List<Reading> readings = window.getReadings();
        double[] finite = Statistics.sortedFinite(window.activePower());

        double avg = finite.length == 0 ? Double.NaN : Statistics.mean(finite);
        double max = finite.length == 0 ? Double.NaN : finite[finite.length - 1];
        double min = finite.length == 0 ? Double.NaN : finite[0];

        double hoursPerSample = sampleInterval(readings).toMillis() / 3_600_000.0;
        double energy = 0.0;
        for (double kw : finite) {
            energy += kw * hoursPerSample;
        }

        double sub1 = 0.0;
        double sub2 = 0.0;
        double sub3 = 0.0;
        for (Reading r : readings) {
            sub1 += finiteOrZero(r.getSubMetering1());
            sub2 += finiteOrZero(r.getSubMetering2());
            sub3 += finiteOrZero(r.getSubMetering3());
        }

        return new ReportSummary(period.getKind(), period.getStartDate(), period.getEndDate(), clock.instant(),
                fromCache, readings.size(), avg, max, min, energy, sub1, sub2, sub3, anomalyCount);
    }

    static Duration sampleInterval(List<Reading> readings) {
        if (readings.size() < 2) {
            return DEFAULT_SAMPLE_INTERVAL;
        }
        double[] gaps = new double[readings.size() - 1];
        for (int i = 1; i < readings.size(); i++) {
            gaps[i - 1] = Duration.between(readings.get(i - 1).getTimestamp(), readings.get(i).getTimestamp())
                    .toMillis();
        }
        return Duration.ofMillis(Math.round(Statistics.median(gaps)));
    }

    private static double finiteOrZero(double value) {
        return Double.isFinite(value) ? value : 0.0;
    }
}
