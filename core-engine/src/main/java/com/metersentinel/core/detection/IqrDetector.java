package com.metersentinel.core.detection;

import com.metersentinel.core.ml.Statistics;
import com.metersentinel.core.model.DetectionMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Flags readings outside the Tukey fences {@code [Q1 - k·IQR, Q3 + k·IQR]}.
 *
 * @since 1.0.0
 */
public class IqrDetector implements WindowDetector {

    private static final Logger LOG = LoggerFactory.getLogger(IqrDetector.class);

    private final double multiplier;

    /**
     * @param multiplier fence multiplier {@code k}; must be positive
     */
    public IqrDetector(double multiplier) {
        if (multiplier <= 0) {
            throw new IllegalArgumentException("IQR multiplier must be > 0, got: " + multiplier);
        }
        this.multiplier = multiplier;
    }

    @Override
    public boolean[] detect(DetectionContext context) {
        double[] values = context.getValues();
        double[] fences = Statistics.iqrFences(values, multiplier);
        boolean[] flags = new boolean[values.length];
        for (int i = 0; i < values.length; i++) {
            flags[i] = values[i] < fences[0] || values[i] > fences[1];
        }
        LOG.trace("IQR fences [{}, {}]", fences[0], fences[1]);
        return flags;
    }

    @Override
    public DetectionMethod getMethod() {
        return DetectionMethod.IQR;
    }
}
