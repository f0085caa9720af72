package com.metersentinel.core.error;

/**
 * The reading source could not be reached.
 *
 * @since 1.0.0
 */
public class SourceUnavailableException extends MeterSentinelException {

    private static final long serialVersionUID = 1L;

    public SourceUnavailableException(String message) {
        super(ErrorKind.SOURCE_UNAVAILABLE, message);
    }

    public SourceUnavailableException(String message, Throwable cause) {
        super(ErrorKind.SOURCE_UNAVAILABLE, message, cause);
    }
}
