package com.metersentinel.core.error;

/**
 * Model fitting failed or exceeded its time budget.
 *
 * @since 1.0.0
 */
public class TrainingFailureException extends MeterSentinelException {

    private static final long serialVersionUID = 1L;

    public TrainingFailureException(String message) {
        super(ErrorKind.TRAINING_FAILURE, message);
    }

    public TrainingFailureException(String message, Throwable cause) {
        super(ErrorKind.TRAINING_FAILURE, message, cause);
    }
}
