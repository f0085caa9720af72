package com.metersentinel.core.config;

import java.util.List;

/**
 * Trainer parameters: training window, holdout split, cleaning and the
 * outlier forest's shape.
 *
 * @since 1.0.0
 */
public class TrainingSettings {

    private int windowDays = 90;
    private int testDays = 7;
    private double testFraction = 0.10;
    private double clipMultiplier = 3.0;
    private double contamination = 0.05;
    private int numberOfTrees = 100;
    private int sampleSize = 256;
    private long randomSeed = 42L;
    private long fetchTimeoutSeconds = 120;
    private long trainingTimeoutSeconds = 1800;

    void validate(List<String> errors) {
        if (windowDays < 1) {
            errors.add("training.windowDays must be >= 1, got: " + windowDays);
        }
        if (testDays < 1 || testDays >= windowDays) {
            errors.add("training.testDays must be in [1, windowDays), got: " + testDays);
        }
        if (testFraction <= 0 || testFraction >= 0.5) {
            errors.add("training.testFraction must be in (0, 0.5), got: " + testFraction);
        }
        if (clipMultiplier <= 0) {
            errors.add("training.clipMultiplier must be > 0, got: " + clipMultiplier);
        }
        if (contamination <= 0 || contamination >= 0.5) {
            errors.add("training.contamination must be in (0, 0.5), got: " + contamination);
        }
        if (numberOfTrees < 1) {
            errors.add("training.numberOfTrees must be >= 1, got: " + numberOfTrees);
        }
        if (sampleSize < 4) {
            errors.add("training.sampleSize must be >= 4, got: " + sampleSize);
        }
        if (fetchTimeoutSeconds < 1) {
            errors.add("training.fetchTimeoutSeconds must be >= 1, got: " + fetchTimeoutSeconds);
        }
        if (trainingTimeoutSeconds < 1) {
            errors.add("training.trainingTimeoutSeconds must be >= 1, got: " + trainingTimeoutSeconds);
        }
    }

    public int getWindowDays() {
        return windowDays;
    }

    public void setWindowDays(int windowDays) {
        this.windowDays = windowDays;
    }

    public int getTestDays() {
        return testDays;
    }

    public void setTestDays(int testDays) {
        this.testDays = testDays;
    }

    public double getTestFraction() {
        return testFraction;
    }

    public void setTestFraction(double testFraction) {
        this.testFraction = testFraction;
    }

    public double getClipMultiplier() {
        return clipMultiplier;
    }

    public void setClipMultiplier(double clipMultiplier) {
        this.clipMultiplier = clipMultiplier;
    }

    public double getContamination() {
        return contamination;
    }

    public void setContamination(double contamination) {
        this.contamination = contamination;
    }

    public int getNumberOfTrees() {
        return numberOfTrees;
    }

    public void setNumberOfTrees(int numberOfTrees) {
        this.numberOfTrees = numberOfTrees;
    }

    public int getSampleSize() {
        return sampleSize;
    }

    public void setSampleSize(int sampleSize) {
        this.sampleSize = sampleSize;
    }

    public long getRandomSeed() {
        return randomSeed;
    }

    public void setRandomSeed(long randomSeed) {
        this.randomSeed = randomSeed;
    }

    public long getFetchTimeoutSeconds() {
        return fetchTimeoutSeconds;
    }

    public void setFetchTimeoutSeconds(long fetchTimeoutSeconds) {
        this.fetchTimeoutSeconds = fetchTimeoutSeconds;
    }

    public long getTrainingTimeoutSeconds() {
        return trainingTimeoutSeconds;
    }

    public void setTrainingTimeoutSeconds(long trainingTimeoutSeconds) {
        this.trainingTimeoutSeconds = trainingTimeoutSeconds;
    }
}
