package com.metersentinel.core.config;

import java.util.List;

/**
 * Thresholds for categorising confirmed anomalies and for rejecting
 * physically implausible readings.
 *
 * @since 1.0.0
 */
public class ClassificationSettings {

    private double highQuantile = 0.95;
    private double lowQuantile = 0.05;
    private double highAbsoluteKw = 7.0;
    private double lowAbsoluteKw = 0.2;
    private int lowSustainedReadings = 3;
    private double currentToleranceRatio = 0.5;
    private double nominalVoltageMin = 207.0;
    private double nominalVoltageMax = 253.0;
    private double plausibleVoltageMin = 180.0;
    private double plausibleVoltageMax = 280.0;
    private double maxPlausiblePowerKw = 15.0;

    void validate(List<String> errors) {
        if (highQuantile <= 0 || highQuantile >= 1) {
            errors.add("classification.highQuantile must be in (0, 1), got: " + highQuantile);
        }
        if (lowQuantile <= 0 || lowQuantile >= highQuantile) {
            errors.add("classification.lowQuantile must be in (0, highQuantile), got: " + lowQuantile);
        }
        if (lowAbsoluteKw < 0 || lowAbsoluteKw >= highAbsoluteKw) {
            errors.add("classification.lowAbsoluteKw must be in [0, highAbsoluteKw), got: " + lowAbsoluteKw);
        }
        if (lowSustainedReadings < 1) {
            errors.add("classification.lowSustainedReadings must be >= 1, got: " + lowSustainedReadings);
        }
        if (currentToleranceRatio <= 0) {
            errors.add("classification.currentToleranceRatio must be > 0, got: " + currentToleranceRatio);
        }
        if (nominalVoltageMin >= nominalVoltageMax) {
            errors.add("classification nominal voltage band is empty: ["
                    + nominalVoltageMin + ", " + nominalVoltageMax + "]");
        }
        if (plausibleVoltageMin > nominalVoltageMin || plausibleVoltageMax < nominalVoltageMax) {
            errors.add("classification plausible voltage band must contain the nominal band");
        }
        if (maxPlausiblePowerKw <= highAbsoluteKw) {
            errors.add("classification.maxPlausiblePowerKw must exceed highAbsoluteKw, got: "
                    + maxPlausiblePowerKw);
        }
    }

    public double getHighQuantile() {
        return highQuantile;
    }

    public void setHighQuantile(double highQuantile) {
        this.highQuantile = highQuantile;
    }

    public double getLowQuantile() {
        return lowQuantile;
    }

    public void setLowQuantile(double lowQuantile) {
        this.lowQuantile = lowQuantile;
    }

    public double getHighAbsoluteKw() {
        return highAbsoluteKw;
    }

    public void setHighAbsoluteKw(double highAbsoluteKw) {
        this.highAbsoluteKw = highAbsoluteKw;
    }

    public double getLowAbsoluteKw() {
        return lowAbsoluteKw;
    }

    public void setLowAbsoluteKw(double lowAbsoluteKw) {
        this.lowAbsoluteKw = lowAbsoluteKw;
    }

    public int getLowSustainedReadings() {
        return lowSustainedReadings;
    }

    public void setLowSustainedReadings(int lowSustainedReadings) {
        this.lowSustainedReadings = lowSustainedReadings;
    }

    public double getCurrentToleranceRatio() {
        return currentToleranceRatio;
    }

    public void setCurrentToleranceRatio(double currentToleranceRatio) {
        this.currentToleranceRatio = currentToleranceRatio;
    }

    public double getNominalVoltageMin() {
        return nominalVoltageMin;
    }

    public void setNominalVoltageMin(double nominalVoltageMin) {
        this.nominalVoltageMin = nominalVoltageMin;
    }

    public double getNominalVoltageMax() {
        return nominalVoltageMax;
    }

    public void setNominalVoltageMax(double nominalVoltageMax) {
        this.nominalVoltageMax = nominalVoltageMax;
    }

    public double getPlausibleVoltageMin() {
        return plausibleVoltageMin;
    }

    public void setPlausibleVoltageMin(double plausibleVoltageMin) {
        this.plausibleVoltageMin = plausibleVoltageMin;
    }

    public double getPlausibleVoltageMax() {
        return plausibleVoltageMax;
    }

    public void setPlausibleVoltageMax(double plausibleVoltageMax) {
        this.plausibleVoltageMax = plausibleVoltageMax;
    }

    public double getMaxPlausiblePowerKw() {
        return maxPlausiblePowerKw;
    }

    public void setMaxPlausiblePowerKw(double maxPlausiblePowerKw) {
        this.maxPlausiblePowerKw = maxPlausiblePowerKw;
    }
}
