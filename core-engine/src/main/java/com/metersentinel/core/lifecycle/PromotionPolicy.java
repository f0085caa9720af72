package com.metersentinel.core.lifecycle;

import com.metersentinel.core.ml.ModelMetrics;
import com.metersentinel.core.registry.PromotionDecision;

import java.util.Objects;

/**
 * Decides whether a candidate replaces the production forecaster.
 *
 * <ul>
 * <li>No production artifact: {@code FIRST_TRAINING}.</li>
 * <li>MAE <em>and</em> RMSE strictly lower: {@code KEEP_NEW}.</li>
 * <li>MAE above {@code previous × (1 + tolerance)}: {@code ROLLBACK_OLD},
 * reported as a regression.</li>
 * <li>Anything else: {@code ROLLBACK_OLD}, reported as not improved.</li>
 * </ul>
 *
 * <p>
 * Promotion requires strict improvement on both metrics, while the explicit
 * regression message needs the tolerance to be exceeded. The two rollback
 * reasons lead to the same action and differ only in how they are reported.
 * </p>
 *
 * @since 1.0.0
 */
public final class PromotionPolicy {

    /** Why a decision was reached. */
    public enum Reason {
        FIRST,
        IMPROVED,
        REGRESSION,
        NOT_IMPROVED
    }

    private final double tolerance;

    /**
     * @param tolerance relative MAE increase tolerated before a rollback is
     *                  reported as a regression, e.g. {@code 0.10}
     */
    public PromotionPolicy(double tolerance) {
        if (tolerance < 0) {
            throw new IllegalArgumentException("tolerance must be >= 0, got: " + tolerance);
        }
        this.tolerance = tolerance;
    }

    /**
     * @param previous  production metrics, or {@code null} if nothing is in
     *                  production
     * @param candidate candidate metrics
     * @return decision and its reason
     */
    public Comparison compare(ModelMetrics previous, ModelMetrics candidate) {
        Objects.requireNonNull(candidate, "candidate metrics must not be null");
        if (previous == null) {
            return new Comparison(PromotionDecision.FIRST_TRAINING, Reason.FIRST);
        }
        if (candidate.getMae() < previous.getMae() && candidate.getRmse() < previous.getRmse()) {
            return new Comparison(PromotionDecision.KEEP_NEW, Reason.IMPROVED);
        }
        if (candidate.getMae() > previous.getMae() * (1.0 + tolerance)) {
            return new Comparison(PromotionDecision.ROLLBACK_OLD, Reason.REGRESSION);
        }
        return new Comparison(PromotionDecision.ROLLBACK_OLD, Reason.NOT_IMPROVED);
    }

    public double getTolerance() {
        return tolerance;
    }

    /**
     * Decision plus reason.
     */
    public static final class Comparison {

        private final PromotionDecision decision;
        private final Reason reason;

        Comparison(PromotionDecision decision, Reason reason) {
            this.decision = decision;
            this.reason = reason;
        }

        public PromotionDecision getDecision() {
            return decision;
        }

        public Reason getReason() {
            return reason;
        }

        public boolean promotes() {
            return decision != PromotionDecision.ROLLBACK_OLD;
        }

        @Override
        public String toString() {
            return decision + " (" + reason + ")";
        }
    }
}
