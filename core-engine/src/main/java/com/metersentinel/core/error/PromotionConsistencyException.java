package com.metersentinel.core.error;

/**
 * Promotion failed after the registry started mutating production state.
 *
 * @since 1.0.0
 */
public class PromotionConsistencyException extends MeterSentinelException {

    private static final long serialVersionUID = 1L;

    public PromotionConsistencyException(String message) {
        super(ErrorKind.PROMOTION_CONSISTENCY_VIOLATION, message);
    }

    public PromotionConsistencyException(String message, Throwable cause) {
        super(ErrorKind.PROMOTION_CONSISTENCY_VIOLATION, message, cause);
    }
}
