package com.metersentinel.core.config;

import java.util.List;

/**
 * Weights and cut-offs for the 0-100 severity score.
 *
 * <p>
 * The score is {@code magnitudeWeight × min(1, deviation / fullMagnitudeRatio)
 * + durationWeight × min(1, runLength / fullDurationReadings)}, raised to at
 * least {@code criticalScore} when the reading breaks a physical law or its
 * voltage leaves the critical band.
 * </p>
 *
 * @since 1.0.0
 */
public class SeveritySettings {

    private double criticalScore = 80.0;
    private double mediumScore = 50.0;
    private double magnitudeWeight = 70.0;
    private double durationWeight = 30.0;
    private double fullMagnitudeRatio = 2.0;
    private int fullDurationReadings = 10;
    private double criticalVoltageMin = 200.0;
    private double criticalVoltageMax = 260.0;

    void validate(List<String> errors) {
        if (mediumScore <= 0 || mediumScore >= criticalScore || criticalScore > 100) {
            errors.add("severity scores must satisfy 0 < mediumScore < criticalScore <= 100, got: "
                    + mediumScore + " / " + criticalScore);
        }
        if (magnitudeWeight < 0 || durationWeight < 0 || magnitudeWeight + durationWeight > 100) {
            errors.add("severity weights must be >= 0 and sum to at most 100, got: "
                    + magnitudeWeight + " + " + durationWeight);
        }
        if (fullMagnitudeRatio <= 0) {
            errors.add("severity.fullMagnitudeRatio must be > 0, got: " + fullMagnitudeRatio);
        }
        if (fullDurationReadings < 1) {
            errors.add("severity.fullDurationReadings must be >= 1, got: " + fullDurationReadings);
        }
        if (criticalVoltageMin >= criticalVoltageMax) {
            errors.add("severity critical voltage band is empty: ["
                    + criticalVoltageMin + ", " + criticalVoltageMax + "]");
        }
    }

    public double getCriticalScore() {
        return criticalScore;
    }

    public void setCriticalScore(double criticalScore) {
        this.criticalScore = criticalScore;
    }

    public double getMediumScore() {
        return mediumScore;
    }

    public void setMediumScore(double mediumScore) {
        this.mediumScore = mediumScore;
    }

    public double getMagnitudeWeight() {
        return magnitudeWeight;
    }

    public void setMagnitudeWeight(double magnitudeWeight) {
        this.magnitudeWeight = magnitudeWeight;
    }

    public double getDurationWeight() {
        return durationWeight;
    }

    public void setDurationWeight(double durationWeight) {
        this.durationWeight = durationWeight;
    }

    public double getFullMagnitudeRatio() {
        return fullMagnitudeRatio;
    }

    public void setFullMagnitudeRatio(double fullMagnitudeRatio) {
        this.fullMagnitudeRatio = fullMagnitudeRatio;
    }

    public int getFullDurationReadings() {
        return fullDurationReadings;
    }

    public void setFullDurationReadings(int fullDurationReadings) {
        this.fullDurationReadings = fullDurationReadings;
    }

    public double getCriticalVoltageMin() {
        return criticalVoltageMin;
    }

    public void setCriticalVoltageMin(double criticalVoltageMin) {
        this.criticalVoltageMin = criticalVoltageMin;
    }

    public double getCriticalVoltageMax() {
        return criticalVoltageMax;
    }

    public void setCriticalVoltageMax(double criticalVoltageMax) {
        this.criticalVoltageMax = criticalVoltageMax;
    }
}
