package com.metersentinel.core.detection;

import com.metersentinel.core.config.ClassificationSettings;
import com.metersentinel.core.config.SeveritySettings;
import com.metersentinel.core.model.Reading;
import com.metersentinel.core.model.SeverityTier;

import java.util.Objects;

/**
 * Scores confirmed anomalies on a 0-100 scale and buckets them into tiers.
 *
 * <p>
 * Magnitude is the relative distance from the window median; duration is the
 * length of the run of consecutive confirmed anomalies containing the index.
 * A reading that breaks {@code I ≈ P / V} or whose voltage leaves the
 * critical band is raised to at least the critical score.
 * </p>
 *
 * @since 1.0.0
 */
public class SeverityScorer {

    static final double MIN_BASELINE = 0.001;

    private final SeveritySettings settings;
    private final double currentTolerance;

    public SeverityScorer(SeveritySettings settings, ClassificationSettings classification) {
        this.settings = Objects.requireNonNull(settings, "SeveritySettings must not be null");
        this.currentTolerance = Objects.requireNonNull(classification,
                "ClassificationSettings must not be null").getCurrentToleranceRatio();
    }

    /**
     * @param reading   the anomalous reading
     * @param median    median power of the window
     * @param runLength consecutive confirmed anomalies including this one
     * @return score in {@code [0, 100]}
     */
    public double score(Reading reading, double median, int runLength) {
        double baseline = Math.max(Math.abs(median), MIN_BASELINE);
        double deviation = Math.abs(reading.getActivePowerKw() - median) / baseline;
        double magnitude = settings.getMagnitudeWeight()
                * Math.min(1.0, deviation / settings.getFullMagnitudeRatio());
        double duration = settings.getDurationWeight()
                * Math.min(1.0, runLength / (double) settings.getFullDurationReadings());
        double score = magnitude + duration;

        if (PhysicalConsistency.violatesPowerLaw(reading, currentTolerance)
                || PhysicalConsistency.voltageOutside(reading,
                        settings.getCriticalVoltageMin(), settings.getCriticalVoltageMax())) {
            score = Math.max(score, settings.getCriticalScore());
        }
        return Math.max(0.0, Math.min(100.0, score));
    }

    public SeverityTier tier(double score) {
        return SeverityTier.fromScore(score, settings.getCriticalScore(), settings.getMediumScore());
    }
}
