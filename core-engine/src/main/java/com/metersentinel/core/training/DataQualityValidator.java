package com.metersentinel.core.training;

import com.metersentinel.core.config.ValidationSettings;
import com.metersentinel.core.ml.Statistics;
import com.metersentinel.core.model.Reading;
import com.metersentinel.core.model.ReadingWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Gatekeeper between raw history and model fitting.
 *
 * <p>
 * Checks record count, missing-value ratio, outlier ratio and the largest
 * gap between consecutive readings. All checks run, so the report lists every
 * problem at once.
 * </p>
 *
 * @since 1.0.0
 */
public class DataQualityValidator {

    private static final Logger LOG = LoggerFactory.getLogger(DataQualityValidator.class);

    private final ValidationSettings settings;

    public DataQualityValidator(ValidationSettings settings) {
        this.settings = Objects.requireNonNull(settings, "ValidationSettings must not be null");
    }

    /**
     * @param window training window; must not be {@code null}
     * @return report listing every violation
     */
    public ValidationReport validate(ReadingWindow window) {
        Objects.requireNonNull(window, "window must not be null");
        List<String> violations = new ArrayList<>();
        List<Reading> readings = window.getReadings();
        int count = readings.size();

        if (count < settings.minRecords()) {
            violations.add("record count " + count + " is below the minimum of " + settings.minRecords()
                    + " (" + settings.getMinDays() + " days)");
        }
        if (count == 0) {
            return new ValidationReport(0, 0.0, 0.0, Duration.ZERO, violations);
        }

        long missing = readings.stream().filter(Reading::hasMissingValues).count();
        double nullRatio = missing / (double) count;
        if (nullRatio > settings.getMaxNullRatio()) {
            violations.add(String.format("null ratio %.4f exceeds %.4f", nullRatio, settings.getMaxNullRatio()));
        }

        double[] power = window.activePower();
        double[] fences = Statistics.iqrFences(power, settings.getOutlierIqrMultiplier());
        long finite = 0;
        long outliers = 0;
        for (double v : power) {
            if (Double.isFinite(v)) {
                finite++;
                if (v < fences[0] || v > fences[1]) {
                    outliers++;
                }
            }
        }
        double outlierRatio = finite == 0 ? 0.0 : outliers / (double) finite;
        if (outlierRatio > settings.getMaxOutlierRatio()) {
            violations.add(String.format("outlier ratio %.4f exceeds %.4f", outlierRatio,
                    settings.getMaxOutlierRatio()));
        }

        Duration maxGap = Duration.ZERO;
        for (int i = 1; i < count; i++) {
            Duration gap = Duration.between(readings.get(i - 1).getTimestamp(), readings.get(i).getTimestamp());
            if (gap.compareTo(maxGap) > 0) {
                maxGap = gap;
            }
        }
        if (maxGap.compareTo(Duration.ofHours(settings.getMaxGapHours())) > 0) {
            violations.add("temporal gap of " + maxGap + " exceeds " + settings.getMaxGapHours() + "h");
        }

        ValidationReport report = new ValidationReport(count, nullRatio, outlierRatio, maxGap, violations);
        if (report.isValid()) {
            LOG.info("Data quality validation passed: {}", report);
        } else {
            LOG.warn("Data quality validation failed: {}", report);
        }
        return report;
    }
}
