package com.metersentinel.core.registry;

/**
 * States of one retraining attempt.
 *
 * <pre>
 * CHECK_DUE → FETCH_DATA → VALIDATE → PREPROCESS → TRAIN → EVALUATE → COMPARE
 *           → {PROMOTE | ROLLBACK | DISCARD} → RECORD_HISTORY
 * </pre>
 *
 * @since 1.0.0
 */
public enum RetrainingState {

    CHECK_DUE,
    FETCH_DATA,
    VALIDATE,
    PREPROCESS,
    TRAIN,
    EVALUATE,
    COMPARE,
    PROMOTE,
    ROLLBACK,
    DISCARD,
    RECORD_HISTORY;

    /**
     * @return {@code true} for the three outcome states of an attempt
     */
    public boolean isTerminal() {
        return this == PROMOTE || this == ROLLBACK || this == DISCARD;
    }

    /**
     * An attempt that got through evaluation, whatever the decision.
     *
     * @return {@code true} for {@link #PROMOTE} and {@link #ROLLBACK}
     */
    public boolean isCompletedTraining() {
        return this == PROMOTE || this == ROLLBACK;
    }
}
