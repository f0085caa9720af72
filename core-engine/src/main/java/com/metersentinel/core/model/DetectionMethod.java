package com.metersentinel.core.model;

/**
 * The five independent detection methods that vote on every reading.
 *
 * @since 1.0.0
 */
public enum DetectionMethod {

    /** Interquartile-range fences around the window's power values. */
    IQR("iqr"),

    /** Distance from the window mean in sample standard deviations. */
    Z_SCORE("z_score"),

    /** Decision function of the trained outlier model. */
    MODEL_OUTLIER("model_outlier"),

    /** Relative deviation from a trailing rolling mean. */
    MOVING_AVERAGE("moving_average"),

    /** Relative deviation from the forecasting model's point prediction. */
    FORECAST_RESIDUAL("forecast_residual");

    private final String key;

    DetectionMethod(String key) {
        this.key = key;
    }

    /**
     * @return stable lower-case identifier used in logs and JSON output
     */
    public String getKey() {
        return key;
    }
}
