package com.metersentinel.core.error;

import java.util.Objects;

/**
 * Base class for all domain failures raised inside the core.
 *
 * <p>
 * These exceptions stay inside the engine and lifecycle boundaries. Public
 * entry points catch them and convert them into result objects carrying the
 * {@link ErrorKind}.
 * </p>
 *
 * @since 1.0.0
 */
public class MeterSentinelException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;

    public MeterSentinelException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public MeterSentinelException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public ErrorKind getKind() {
        return kind;
    }
}
