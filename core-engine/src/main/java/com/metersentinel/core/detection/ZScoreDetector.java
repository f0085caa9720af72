package com.metersentinel.core.detection;

import com.metersentinel.core.ml.Statistics;
import com.metersentinel.core.model.DetectionMethod;

/**
 * Flags readings more than {@code threshold} sample standard deviations from
 * the window mean.
 *
 * <p>
 * A window with zero spread flags nothing: with every value identical there
 * is no deviation to measure.
 * </p>
 *
 * @since 1.0.0
 */
public class ZScoreDetector implements WindowDetector {

    private final double threshold;

    public ZScoreDetector(double threshold) {
        if (threshold <= 0) {
            throw new IllegalArgumentException("Z-score threshold must be > 0, got: " + threshold);
        }
        this.threshold = threshold;
    }

    @Override
    public boolean[] detect(DetectionContext context) {
        double[] values = context.getValues();
        boolean[] flags = new boolean[values.length];
        double mean = Statistics.mean(values);
        double std = Statistics.sampleStdDev(values);
        if (!Double.isFinite(std) || std == 0) {
            return flags;
        }
        for (int i = 0; i < values.length; i++) {
            flags[i] = Math.abs(values[i] - mean) / std > threshold;
        }
        return flags;
    }

    @Override
    public DetectionMethod getMethod() {
        return DetectionMethod.Z_SCORE;
    }
}
