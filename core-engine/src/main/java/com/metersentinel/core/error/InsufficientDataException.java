package com.metersentinel.core.error;

/**
 * Too few readings to produce a reliable result.
 *
 * @since 1.0.0
 */
public class InsufficientDataException extends MeterSentinelException {

    private static final long serialVersionUID = 1L;

    public InsufficientDataException(String message) {
        super(ErrorKind.INSUFFICIENT_DATA, message);
    }

    public InsufficientDataException(String message, Throwable cause) {
        super(ErrorKind.INSUFFICIENT_DATA, message, cause);
    }
}
