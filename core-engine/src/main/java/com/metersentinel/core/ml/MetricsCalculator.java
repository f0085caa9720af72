package com.metersentinel.core.ml;

import java.util.Objects;

/**
 * Forecast error metrics: MAE, RMSE, MAPE and R².
 *
 * @since 1.0.0
 */
public final class MetricsCalculator {

    /** Added to |actual| in the MAPE denominator to avoid division by zero. */
    static final double MAPE_EPSILON = 1e-8;

    private MetricsCalculator() {
        // utility class, not instantiable
    }

    /**
     * @param actual    observed values
     * @param predicted predicted values, same length as {@code actual}
     * @return computed metrics; MAPE is a percentage
     * @throws IllegalArgumentException if the arrays are empty or differ in
     *                                  length
     */
    public static ModelMetrics evaluate(double[] actual, double[] predicted) {
        Objects.requireNonNull(actual, "actual must not be null");
        Objects.requireNonNull(predicted, "predicted must not be null");
        if (actual.length == 0 || actual.length != predicted.length) {
            throw new IllegalArgumentException("Cannot evaluate " + actual.length
                    + " actual values against " + predicted.length + " predictions");
        }

        int n = actual.length;
        double absSum = 0;
        double sqSum = 0;
        double pctSum = 0;
        for (int i = 0; i < n; i++) {
            double err = actual[i] - predicted[i];
            absSum += Math.abs(err);
            sqSum += err * err;
            pctSum += Math.abs(err) / (Math.abs(actual[i]) + MAPE_EPSILON);
        }

        double mean = Statistics.mean(actual);
        double totalSum = 0;
        for (double a : actual) {
            totalSum += (a - mean) * (a - mean);
        }
        double r2 = totalSum == 0 ? 0.0 : 1.0 - sqSum / totalSum;

        return new ModelMetrics(absSum / n, Math.sqrt(sqSum / n), pctSum / n * 100.0, r2);
    }
}
