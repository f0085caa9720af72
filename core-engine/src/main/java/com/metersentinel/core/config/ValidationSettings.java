package com.metersentinel.core.config;

import java.util.List;

/**
 * Data-quality gates a training window must pass before any model is fitted.
 *
 * @since 1.0.0
 */
public class ValidationSettings {

    private int samplesPerDay = 1440;
    private int minDays = 30;
    private double maxNullRatio = 0.05;
    private double maxOutlierRatio = 0.05;
    private double outlierIqrMultiplier = 3.0;
    private int maxGapHours = 6;

    void validate(List<String> errors) {
        if (samplesPerDay < 1) {
            errors.add("validation.samplesPerDay must be >= 1, got: " + samplesPerDay);
        }
        if (minDays < 1) {
            errors.add("validation.minDays must be >= 1, got: " + minDays);
        }
        if (maxNullRatio < 0 || maxNullRatio >= 1) {
            errors.add("validation.maxNullRatio must be in [0, 1), got: " + maxNullRatio);
        }
        if (maxOutlierRatio < 0 || maxOutlierRatio >= 1) {
            errors.add("validation.maxOutlierRatio must be in [0, 1), got: " + maxOutlierRatio);
        }
        if (outlierIqrMultiplier <= 0) {
            errors.add("validation.outlierIqrMultiplier must be > 0, got: " + outlierIqrMultiplier);
        }
        if (maxGapHours < 1) {
            errors.add("validation.maxGapHours must be >= 1, got: " + maxGapHours);
        }
    }

    /**
     * @return minimum number of records a training window must hold
     */
    public long minRecords() {
        return (long) samplesPerDay * minDays;
    }

    public int getSamplesPerDay() {
        return samplesPerDay;
    }

    public void setSamplesPerDay(int samplesPerDay) {
        this.samplesPerDay = samplesPerDay;
    }

    public int getMinDays() {
        return minDays;
    }

    public void setMinDays(int minDays) {
        this.minDays = minDays;
    }

    public double getMaxNullRatio() {
        return maxNullRatio;
    }

    public void setMaxNullRatio(double maxNullRatio) {
        this.maxNullRatio = maxNullRatio;
    }

    public double getMaxOutlierRatio() {
        return maxOutlierRatio;
    }

    public void setMaxOutlierRatio(double maxOutlierRatio) {
        this.maxOutlierRatio = maxOutlierRatio;
    }

    public double getOutlierIqrMultiplier() {
        return outlierIqrMultiplier;
    }

    public void setOutlierIqrMultiplier(double outlierIqrMultiplier) {
        this.outlierIqrMultiplier = outlierIqrMultiplier;
    }

    public int getMaxGapHours() {
        return maxGapHours;
    }

    public void setMaxGapHours(int maxGapHours) {
        this.maxGapHours = maxGapHours;
    }
}
