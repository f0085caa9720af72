package com.metersentinel.core.ml;

import java.util.Arrays;

/**
 * Descriptive statistics over {@code double[]} samples.
 *
 * <p>
 * {@link Double#NaN} entries are treated as missing and ignored by every
 * method. Quantiles use linear interpolation between closest ranks, the same
 * convention as most numerical libraries' default.
 * </p>
 *
 * @since 1.0.0
 */
public final class Statistics {

    private Statistics() {
        // utility class, not instantiable
    }

    /**
     * @return the finite values of {@code values}, sorted ascending
     */
    public static double[] sortedFinite(double[] values) {
        double[] finite = Arrays.stream(values).filter(Double::isFinite).toArray();
        Arrays.sort(finite);
        return finite;
    }

    public static double mean(double[] values) {
        double sum = 0;
        int n = 0;
        for (double v : values) {
            if (Double.isFinite(v)) {
                sum += v;
                n++;
            }
        }
        return n == 0 ? Double.NaN : sum / n;
    }

    /**
     * Sample standard deviation ({@code n - 1} denominator).
     *
     * @return the deviation, or {@code NaN} with fewer than two finite values
     */
    public static double sampleStdDev(double[] values) {
        double mean = mean(values);
        double sumSquaredDiff = 0;
        int n = 0;
        for (double v : values) {
            if (Double.isFinite(v)) {
                double diff = v - mean;
                sumSquaredDiff += diff * diff;
                n++;
            }
        }
        return n < 2 ? Double.NaN : Math.sqrt(sumSquaredDiff / (n - 1));
    }

    public static double median(double[] values) {
        return quantile(values, 0.5);
    }

    /**
     * Linear-interpolated quantile.
     *
     * @param values sample
     * @param q      quantile in {@code [0, 1]}
     * @return quantile value, or {@code NaN} if the sample has no finite values
     */
    public static double quantile(double[] values, double q) {
        return quantileOfSorted(sortedFinite(values), q);
    }

    /**
     * Quantile of an already sorted, NaN-free sample.
     */
    public static double quantileOfSorted(double[] sorted, double q) {
        if (q < 0 || q > 1) {
            throw new IllegalArgumentException("Quantile must be in [0, 1], got: " + q);
        }
        if (sorted.length == 0) {
            return Double.NaN;
        }
        double position = q * (sorted.length - 1);
        int lower = (int) Math.floor(position);
        int upper = (int) Math.ceil(position);
        double fraction = position - lower;
        return sorted[lower] + fraction * (sorted[upper] - sorted[lower]);
    }

    /**
     * Tukey fences {@code [Q1 - k·IQR, Q3 + k·IQR]}.
     *
     * @return two-element array {@code {lower, upper}}, both {@code NaN} for an
     *         empty sample
     */
    public static double[] iqrFences(double[] values, double k) {
        double[] sorted = sortedFinite(values);
        double q1 = quantileOfSorted(sorted, 0.25);
        double q3 = quantileOfSorted(sorted, 0.75);
        double iqr = q3 - q1;
        return new double[] {q1 - k * iqr, q3 + k * iqr};
    }
}
