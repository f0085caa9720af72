package com.metersentinel.core.training;

import java.time.Duration;
import java.util.List;

/**
 * Result of data-quality validation: the measured figures plus every
 * violation found.
 *
 * @since 1.0.0
 */
public final class ValidationReport {

    private final int recordCount;
    private final double nullRatio;
    private final double outlierRatio;
    private final Duration maxGap;
    private final List<String> violations;

    public ValidationReport(int recordCount, double nullRatio, double outlierRatio, Duration maxGap,
            List<String> violations) {
        this.recordCount = recordCount;
        this.nullRatio = nullRatio;
        this.outlierRatio = outlierRatio;
        this.maxGap = maxGap;
        this.violations = List.copyOf(violations);
    }

    public boolean isValid() {
        return violations.isEmpty();
    }

    public int getRecordCount() {
        return recordCount;
    }

    public double getNullRatio() {
        return nullRatio;
    }

    public double getOutlierRatio() {
        return outlierRatio;
    }

    public Duration getMaxGap() {
        return maxGap;
    }

    public List<String> getViolations() {
        return violations;
    }

    @Override
    public String toString() {
        return "ValidationReport{records=" + recordCount
                + ", nullRatio=" + String.format("%.4f", nullRatio)
                + ", outlierRatio=" + String.format("%.4f", outlierRatio)
                + ", maxGap=" + maxGap
                + ", violations=" + violations + '}';
    }
}
