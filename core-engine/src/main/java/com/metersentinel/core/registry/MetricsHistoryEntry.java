package com.metersentinel.core.registry;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.metersentinel.core.error.ErrorKind;
import com.metersentinel.core.ml.ModelMetrics;

import java.time.Instant;
import java.util.Objects;

/**
 * One line of the append-only metrics history: the outcome of a single
 * retraining attempt, whatever that outcome was.
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class MetricsHistoryEntry {

    private final String versionId;
    private final Instant timestamp;
    private final RetrainingState terminalState;
    private final PromotionDecision decision;
    private final int trainingRecordCount;
    private final ModelMetrics metrics;
    private final ErrorKind errorKind;
    private final String errorMessage;

    @JsonCreator
    public MetricsHistoryEntry(@JsonProperty("versionId") String versionId,
            @JsonProperty("timestamp") Instant timestamp,
            @JsonProperty("terminalState") RetrainingState terminalState,
            @JsonProperty("decision") PromotionDecision decision,
            @JsonProperty("trainingRecordCount") int trainingRecordCount,
            @JsonProperty("metrics") ModelMetrics metrics,
            @JsonProperty("errorKind") ErrorKind errorKind,
            @JsonProperty("errorMessage") String errorMessage) {
        this.versionId = Objects.requireNonNull(versionId, "versionId must not be null");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.terminalState = Objects.requireNonNull(terminalState, "terminalState must not be null");
        this.decision = decision;
        this.trainingRecordCount = trainingRecordCount;
        this.metrics = metrics;
        this.errorKind = errorKind;
        this.errorMessage = errorMessage;
    }

    /**
     * Entry for an attempt that reached a promotion decision.
     */
    public static MetricsHistoryEntry completed(String versionId, Instant timestamp, RetrainingState state,
            PromotionDecision decision, int trainingRecordCount, ModelMetrics metrics) {
        return new MetricsHistoryEntry(versionId, timestamp, state, decision, trainingRecordCount, metrics,
                null, null);
    }

    /**
     * Entry for an attempt that was discarded.
     */
    public static MetricsHistoryEntry discarded(String versionId, Instant timestamp, int trainingRecordCount,
            ErrorKind errorKind, String errorMessage) {
        return new MetricsHistoryEntry(versionId, timestamp, RetrainingState.DISCARD, null,
                trainingRecordCount, null, errorKind, errorMessage);
    }

    public String getVersionId() {
        return versionId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public RetrainingState getTerminalState() {
        return terminalState;
    }

    public PromotionDecision getDecision() {
        return decision;
    }

    public int getTrainingRecordCount() {
        return trainingRecordCount;
    }

    public ModelMetrics getMetrics() {
        return metrics;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    @Override
    public String toString() {
        return "MetricsHistoryEntry{versionId='" + versionId + "', timestamp=" + timestamp
                + ", terminalState=" + terminalState + ", decision=" + decision
                + ", metrics=" + metrics
                + (errorKind != null ? ", error=" + errorKind + ": " + errorMessage : "") + '}';
    }
}
