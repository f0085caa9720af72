package com.metersentinel.core.ml;

import com.metersentinel.core.model.Reading;

/**
 * A trained multivariate outlier model.
 *
 * <p>
 * Implementations must be deterministic: scoring the same reading twice
 * returns the same score, and scoring never changes the model.
 * </p>
 *
 * @since 1.0.0
 */
public interface OutlierModel {

    /**
     * @param reading reading to score
     * @return anomaly score; higher is more anomalous
     */
    double score(Reading reading);

    /**
     * @return decision threshold; scores strictly above it are outliers
     */
    double getThreshold();

    /**
     * Decision function.
     *
     * @param reading reading to classify
     * @return {@code true} if the reading is an outlier
     */
    default boolean isOutlier(Reading reading) {
        return score(reading) > getThreshold();
    }
}
