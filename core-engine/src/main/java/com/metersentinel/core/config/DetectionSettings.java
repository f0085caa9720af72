package com.metersentinel.core.config;

import java.util.List;

/**
 * Parameters of the five detectors and the consensus vote.
 *
 * <pre>
 * detection:
 *   consensusThreshold: 3
 *   minReadings: 30
 *   iqrMultiplier: 1.5
 *   zscoreThreshold: 3.0
 *   movingAverageWindow: 10
 *   movingAverageThreshold: 0.30
 *   forecastResidualThreshold: 0.30
 *   classify: true
 * </pre>
 *
 * <p>
 * The consensus default of 3 of 5 trades recall for fewer false positives
 * than any single detector. Change it only with labelled data to back the
 * new value.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionSettings {

    private int consensusThreshold = 3;
    private int minReadings = 30;
    private double iqrMultiplier = 1.5;
    private double zscoreThreshold = 3.0;
    private int movingAverageWindow = 10;
    private double movingAverageThreshold = 0.30;
    private double forecastResidualThreshold = 0.30;
    private boolean classify = true;

    void validate(List<String> errors) {
        if (consensusThreshold < 1 || consensusThreshold > 5) {
            errors.add("detection.consensusThreshold must be in [1, 5], got: " + consensusThreshold);
        }
        if (minReadings < 2) {
            errors.add("detection.minReadings must be >= 2, got: " + minReadings);
        }
        if (iqrMultiplier <= 0) {
            errors.add("detection.iqrMultiplier must be > 0, got: " + iqrMultiplier);
        }
        if (zscoreThreshold <= 0) {
            errors.add("detection.zscoreThreshold must be > 0, got: " + zscoreThreshold);
        }
        if (movingAverageWindow < 2) {
            errors.add("detection.movingAverageWindow must be >= 2, got: " + movingAverageWindow);
        }
        if (movingAverageThreshold <= 0) {
            errors.add("detection.movingAverageThreshold must be > 0, got: " + movingAverageThreshold);
        }
        if (forecastResidualThreshold <= 0) {
            errors.add("detection.forecastResidualThreshold must be > 0, got: " + forecastResidualThreshold);
        }
    }

    public int getConsensusThreshold() {
        return consensusThreshold;
    }

    public void setConsensusThreshold(int consensusThreshold) {
        this.consensusThreshold = consensusThreshold;
    }

    public int getMinReadings() {
        return minReadings;
    }

    public void setMinReadings(int minReadings) {
        this.minReadings = minReadings;
    }

    public double getIqrMultiplier() {
        return iqrMultiplier;
    }

    public void setIqrMultiplier(double iqrMultiplier) {
        this.iqrMultiplier = iqrMultiplier;
    }

    public double getZscoreThreshold() {
        return zscoreThreshold;
    }

    public void setZscoreThreshold(double zscoreThreshold) {
        this.zscoreThreshold = zscoreThreshold;
    }

    public int getMovingAverageWindow() {
        return movingAverageWindow;
    }

    public void setMovingAverageWindow(int movingAverageWindow) {
        this.movingAverageWindow = movingAverageWindow;
    }

    public double getMovingAverageThreshold() {
        return movingAverageThreshold;
    }

    public void setMovingAverageThreshold(double movingAverageThreshold) {
        this.movingAverageThreshold = movingAverageThreshold;
    }

    public double getForecastResidualThreshold() {
        return forecastResidualThreshold;
    }

    public void setForecastResidualThreshold(double forecastResidualThreshold) {
        this.forecastResidualThreshold = forecastResidualThreshold;
    }

    public boolean isClassify() {
        return classify;
    }

    public void setClassify(boolean classify) {
        this.classify = classify;
    }

    @Override
    public String toString() {
        return "DetectionSettings{consensusThreshold=" + consensusThreshold
                + ", minReadings=" + minReadings
                + ", iqrMultiplier=" + iqrMultiplier
                + ", zscoreThreshold=" + zscoreThreshold
                + ", movingAverageWindow=" + movingAverageWindow
                + ", movingAverageThreshold=" + movingAverageThreshold
                + ", forecastResidualThreshold=" + forecastResidualThreshold
                + ", classify=" + classify + '}';
    }
}
