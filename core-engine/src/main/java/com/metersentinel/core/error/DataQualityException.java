package com.metersentinel.core.error;

import java.util.List;

/**
 * Training data failed quality validation.
 *
 * <p>
 * Carries every violation found, not just the first, so the discard record
 * explains the whole problem.
 * </p>
 *
 * @since 1.0.0
 */
public class DataQualityException extends MeterSentinelException {

    private static final long serialVersionUID = 1L;

    private final List<String> reasons;

    public DataQualityException(String message) {
        super(ErrorKind.DATA_QUALITY_VIOLATION, message);
        this.reasons = List.of(message);
    }

    public DataQualityException(List<String> reasons) {
        super(ErrorKind.DATA_QUALITY_VIOLATION,
                "Data quality validation failed: " + String.join("; ", reasons));
        this.reasons = List.copyOf(reasons);
    }

    public List<String> getReasons() {
        return reasons;
    }
}
