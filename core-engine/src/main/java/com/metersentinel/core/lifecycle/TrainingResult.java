package com.metersentinel.core.lifecycle;

import com.metersentinel.core.error.ErrorKind;
import com.metersentinel.core.ml.ModelMetrics;
import com.metersentinel.core.registry.PromotionDecision;
import com.metersentinel.core.registry.RetrainingState;

import java.util.Optional;

/**
 * Outcome of one {@link ModelLifecycleManager#runRetrainingCycle(boolean)}
 * call.
 *
 * <p>
 * {@code success} is {@code false} exactly when {@link #getErrorKind()} is
 * present. A cycle that was not due succeeds with terminal state
 * {@code CHECK_DUE} and no decision.
 * </p>
 *
 * @since 1.0.0
 */
public final class TrainingResult {

    private final boolean success;
    private final boolean due;
    private final RetrainingState terminalState;
    private final PromotionDecision decision;
    private final PromotionPolicy.Reason reason;
    private final String versionId;
    private final ModelMetrics metrics;
    private final ModelMetrics previousMetrics;
    private final Long daysSinceLastTraining;
    private final ErrorKind errorKind;
    private final String errorMessage;

    private TrainingResult(Builder b) {
        this.success = b.errorKind == null;
        this.due = b.due;
        this.terminalState = b.terminalState;
        this.decision = b.decision;
        this.reason = b.reason;
        this.versionId = b.versionId;
        this.metrics = b.metrics;
        this.previousMetrics = b.previousMetrics;
        this.daysSinceLastTraining = b.daysSinceLastTraining;
        this.errorKind = b.errorKind;
        this.errorMessage = b.errorMessage;
    }

    static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public boolean isSuccess() {
        return success;
    }

    /**
     * @return {@code false} if the cycle stopped at CHECK_DUE
     */
    public boolean isDue() {
        return due;
    }

    public RetrainingState getTerminalState() {
        return terminalState;
    }

    public Optional<PromotionDecision> getDecision() {
        return Optional.ofNullable(decision);
    }

    public Optional<PromotionPolicy.Reason> getReason() {
        return Optional.ofNullable(reason);
    }

    public Optional<String> getVersionId() {
        return Optional.ofNullable(versionId);
    }

    public Optional<ModelMetrics> getMetrics() {
        return Optional.ofNullable(metrics);
    }

    public Optional<ModelMetrics> getPreviousMetrics() {
        return Optional.ofNullable(previousMetrics);
    }

    /**
     * @return whole days since the last completed training, empty if none
     */
    public Optional<Long> getDaysSinceLastTraining() {
        return Optional.ofNullable(daysSinceLastTraining);
    }

    public Optional<ErrorKind> getErrorKind() {
        return Optional.ofNullable(errorKind);
    }

    public Optional<String> getErrorMessage() {
        return Optional.ofNullable(errorMessage);
    }

    /**
     * @return {@code true} if the failure must be escalated to an operator
     */
    public boolean requiresAlert() {
        return errorKind != null && errorKind.requiresAlert();
    }

    /**
     * @return candidate MAE minus previous MAE; negative means better
     */
    public Optional<Double> getMaeDelta() {
        if (metrics == null || previousMetrics == null) {
            return Optional.empty();
        }
        return Optional.of(metrics.getMae() - previousMetrics.getMae());
    }

    /**
     * @return candidate RMSE minus previous RMSE; negative means better
     */
    public Optional<Double> getRmseDelta() {
        if (metrics == null || previousMetrics == null) {
            return Optional.empty();
        }
        return Optional.of(metrics.getRmse() - previousMetrics.getRmse());
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("TrainingResult{")
                .append("success=").append(success)
                .append(", state=").append(terminalState);
        if (versionId != null) {
            sb.append(", version=").append(versionId);
        }
        if (decision != null) {
            sb.append(", decision=").append(decision).append(" (").append(reason).append(')');
        }
        if (metrics != null) {
            sb.append(", metrics=").append(metrics);
        }
        if (daysSinceLastTraining != null) {
            sb.append(", daysSinceLastTraining=").append(daysSinceLastTraining);
        }
        if (errorKind != null) {
            sb.append(", error=").append(errorKind).append(": ").append(errorMessage);
        }
        return sb.append('}').toString();
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    static class Builder {
        private boolean due = true;
        private RetrainingState terminalState;
        private PromotionDecision decision;
        private PromotionPolicy.Reason reason;
        private String versionId;
        private ModelMetrics metrics;
        private ModelMetrics previousMetrics;
        private Long daysSinceLastTraining;
        private ErrorKind errorKind;
        private String errorMessage;

        Builder due(boolean due) {
            this.due = due;
            return this;
        }

        Builder terminalState(RetrainingState terminalState) {
            this.terminalState = terminalState;
            return this;
        }

        Builder comparison(PromotionPolicy.Comparison comparison) {
            this.decision = comparison.getDecision();
            this.reason = comparison.getReason();
            return this;
        }

        Builder versionId(String versionId) {
            this.versionId = versionId;
            return this;
        }

        Builder metrics(ModelMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        Builder previousMetrics(ModelMetrics previousMetrics) {
            this.previousMetrics = previousMetrics;
            return this;
        }

        Builder daysSinceLastTraining(Long daysSinceLastTraining) {
            this.daysSinceLastTraining = daysSinceLastTraining;
            return this;
        }

        Builder error(ErrorKind errorKind, String errorMessage) {
            this.errorKind = errorKind;
            this.errorMessage = errorMessage;
            return this;
        }

        TrainingResult build() {
            if (terminalState == null) {
                throw new IllegalStateException("terminalState is required");
            }
            return new TrainingResult(this);
        }
    }
}
