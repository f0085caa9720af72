package com.metersentinel.core.error;

/**
 * Taxonomy of failures the core reports to its callers.
 *
 * <p>
 * Every kind is recoverable at the job level: the orchestrator logs it and
 * keeps serving other jobs. {@link #PROMOTION_CONSISTENCY_VIOLATION} is the
 * only kind that also requires an explicit alert, because it may leave the
 * production pointers divergent.
 * </p>
 *
 * @since 1.0.0
 */
public enum ErrorKind {

    /** Too few readings for reliable detection or training. The run is skipped. */
    INSUFFICIENT_DATA(false),

    /** Training data failed validation. The attempt is discarded. */
    DATA_QUALITY_VIOLATION(false),

    /** The reading source could not be reached. The run is skipped. */
    SOURCE_UNAVAILABLE(false),

    /** Model fitting failed or timed out. Nothing is persisted. */
    TRAINING_FAILURE(false),

    /** The production pointer swap failed midway. Fatal for the job cycle. */
    PROMOTION_CONSISTENCY_VIOLATION(true);

    private final boolean alert;

    ErrorKind(boolean alert) {
        this.alert = alert;
    }

    /**
     * @return {@code true} if this failure must be escalated to an operator
     */
    public boolean requiresAlert() {
        return alert;
    }
}
