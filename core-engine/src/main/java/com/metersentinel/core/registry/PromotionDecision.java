package com.metersentinel.core.registry;

/**
 * Outcome of comparing a candidate against the production artifact.
 *
 * @since 1.0.0
 */
public enum PromotionDecision {

    /** No production artifact existed; the candidate is promoted. */
    FIRST_TRAINING,

    /** The candidate is strictly better on both MAE and RMSE; it is promoted. */
    KEEP_NEW,

    /** The candidate is not strictly better; production is retained. */
    ROLLBACK_OLD
}
