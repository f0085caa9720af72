package com.metersentinel.core.config;

import java.util.List;

/**
 * Retraining cadence, promotion tolerance and version retention.
 *
 * @since 1.0.0
 */
public class RegistrySettings {

    private int retrainingIntervalDays = 7;
    private double promotionTolerance = 0.10;
    private int keepVersions = 10;

    void validate(List<String> errors) {
        if (retrainingIntervalDays < 0) {
            errors.add("registry.retrainingIntervalDays must be >= 0, got: " + retrainingIntervalDays);
        }
        if (promotionTolerance < 0) {
            errors.add("registry.promotionTolerance must be >= 0, got: " + promotionTolerance);
        }
        if (keepVersions < 1) {
            errors.add("registry.keepVersions must be >= 1, got: " + keepVersions);
        }
    }

    public int getRetrainingIntervalDays() {
        return retrainingIntervalDays;
    }

    public void setRetrainingIntervalDays(int retrainingIntervalDays) {
        this.retrainingIntervalDays = retrainingIntervalDays;
    }

    public double getPromotionTolerance() {
        return promotionTolerance;
    }

    public void setPromotionTolerance(double promotionTolerance) {
        this.promotionTolerance = promotionTolerance;
    }

    public int getKeepVersions() {
        return keepVersions;
    }

    public void setKeepVersions(int keepVersions) {
        this.keepVersions = keepVersions;
    }
}
