package com.metersentinel.core.detection;

import com.metersentinel.core.error.ErrorKind;
import com.metersentinel.core.model.AnomalyVerdict;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of {@link AnomalyConsensusEngine#detect}.
 *
 * <p>
 * Either a success carrying one verdict per reading, or a failure carrying an
 * {@link ErrorKind} and message with no verdicts at all.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectionResult {

    private final boolean success;
    private final List<AnomalyVerdict> verdicts;
    private final ErrorKind errorKind;
    private final String errorMessage;

    private DetectionResult(boolean success, List<AnomalyVerdict> verdicts, ErrorKind errorKind,
            String errorMessage) {
        this.success = success;
        this.verdicts = verdicts;
        this.errorKind = errorKind;
        this.errorMessage = errorMessage;
    }

    public static DetectionResult success(List<AnomalyVerdict> verdicts) {
        return new DetectionResult(true, List.copyOf(Objects.requireNonNull(verdicts, "verdicts")), null, null);
    }

    public static DetectionResult failure(ErrorKind kind, String message) {
        return new DetectionResult(false, List.of(), Objects.requireNonNull(kind, "kind"), message);
    }

    public boolean isSuccess() {
        return success;
    }

    /**
     * @return every verdict; empty for a failure
     */
    public List<AnomalyVerdict> getVerdicts() {
        return verdicts;
    }

    /**
     * @return verdicts whose consensus is confirmed
     */
    public List<AnomalyVerdict> anomalies() {
        return verdicts.stream().filter(AnomalyVerdict::isConsensus).toList();
    }

    /**
     * @return confirmed anomalies the notification policy says to report
     */
    public List<AnomalyVerdict> notifiable() {
        return verdicts.stream().filter(AnomalyVerdict::shouldNotify).toList();
    }

    /**
     * @return readings excluded from voting as physically implausible
     */
    public long dataDefectCount() {
        return verdicts.stream().filter(AnomalyVerdict::isDataDefect).count();
    }

    public Optional<ErrorKind> getErrorKind() {
        return Optional.ofNullable(errorKind);
    }

    public Optional<String> getErrorMessage() {
        return Optional.ofNullable(errorMessage);
    }

    @Override
    public String toString() {
        if (!success) {
            return "DetectionResult{failure=" + errorKind + ", message='" + errorMessage + "'}";
        }
        return "DetectionResult{verdicts=" + verdicts.size() + ", anomalies=" + anomalies().size() + '}';
    }
}
