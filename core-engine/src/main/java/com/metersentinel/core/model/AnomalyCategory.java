package com.metersentinel.core.model;

/**
 * Category assigned to a confirmed anomaly.
 *
 * @since 1.0.0
 */
public enum AnomalyCategory {

    HIGH_CONSUMPTION("high_consumption"),
    LOW_CONSUMPTION("low_consumption"),
    TRANSIENT("transient"),
    SENSOR_FAULT("sensor_fault");

    private final String label;

    AnomalyCategory(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
