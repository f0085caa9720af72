package com.metersentinel.core.detection;

import com.metersentinel.core.model.DetectionMethod;

/**
 * Flags readings that deviate from the trailing rolling mean by more than a
 * relative threshold.
 *
 * <p>
 * The rolling mean at index {@code i} covers the last {@code window} values
 * up to and including {@code i}. Indices before the first full window are
 * never flagged.
 * </p>
 *
 * @since 1.0.0
 */
public class MovingAverageDetector implements WindowDetector {

    /** Floor applied to the rolling mean before dividing by it. */
    static final double MIN_BASELINE = 0.001;

    private final int window;
    private final double threshold;

    public MovingAverageDetector(int window, double threshold) {
        if (window < 2) {
            throw new IllegalArgumentException("Moving average window must be >= 2, got: " + window);
        }
        if (threshold <= 0) {
            throw new IllegalArgumentException("Moving average threshold must be > 0, got: " + threshold);
        }
        this.window = window;
        this.threshold = threshold;
    }

    @Override
    public boolean[] detect(DetectionContext context) {
        double[] values = context.getValues();
        boolean[] flags = new boolean[values.length];
        double sum = 0;
        for (int i = 0; i < values.length; i++) {
            sum += values[i];
            if (i >= window) {
                sum -= values[i - window];
            }
            if (i >= window - 1) {
                double rollingMean = sum / window;
                double baseline = Math.max(Math.abs(rollingMean), MIN_BASELINE);
                flags[i] = Math.abs(values[i] - rollingMean) / baseline > threshold;
            }
        }
        return flags;
    }

    @Override
    public DetectionMethod getMethod() {
        return DetectionMethod.MOVING_AVERAGE;
    }
}
