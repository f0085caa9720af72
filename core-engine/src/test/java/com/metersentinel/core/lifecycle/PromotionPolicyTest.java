package com.metersentinel.core.lifecycle;

import com.metersentinel.core.TestModels;
import com.metersentinel.core.registry.PromotionDecision;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link PromotionPolicy}.
 */
class PromotionPolicyTest {

    private final PromotionPolicy policy = new PromotionPolicy(0.10);

    @Test
    @DisplayName("The first candidate is always promoted")
    void shouldPromoteFirstCandidate() {
        PromotionPolicy.Comparison comparison = policy.compare(null, TestModels.metrics(0.5, 0.7));

        assertThat(comparison.getDecision()).isEqualTo(PromotionDecision.FIRST_TRAINING);
        assertThat(comparison.promotes()).isTrue();
    }

    @Test
    @DisplayName("A candidate better on both MAE and RMSE is promoted")
    void shouldKeepStrictlyBetterCandidate() {
        PromotionPolicy.Comparison comparison = policy.compare(TestModels.metrics(0.179, 0.252),
                TestModels.metrics(0.168, 0.241));

        assertThat(comparison.getDecision()).isEqualTo(PromotionDecision.KEEP_NEW);
        assertThat(comparison.getReason()).isEqualTo(PromotionPolicy.Reason.IMPROVED);
    }

    @Test
    @DisplayName("An MAE increase beyond the tolerance is a regression")
    void shouldRollBackRegression() {
        PromotionPolicy.Comparison comparison = policy.compare(TestModels.metrics(0.179, 0.252),
                TestModels.metrics(0.205, 0.262));

        assertThat(comparison.getDecision()).isEqualTo(PromotionDecision.ROLLBACK_OLD);
        assertThat(comparison.getReason()).isEqualTo(PromotionPolicy.Reason.REGRESSION);
        assertThat(comparison.promotes()).isFalse();
    }

    @Test
    @DisplayName("Better MAE with worse RMSE is not an improvement")
    void shouldRollBackMixedResult() {
        PromotionPolicy.Comparison comparison = policy.compare(TestModels.metrics(0.179, 0.252),
                TestModels.metrics(0.170, 0.260));

        assertThat(comparison.getDecision()).isEqualTo(PromotionDecision.ROLLBACK_OLD);
        assertThat(comparison.getReason()).isEqualTo(PromotionPolicy.Reason.NOT_IMPROVED);
    }

    @Test
    @DisplayName("Equal metrics keep the current production model")
    void shouldRollBackTie() {
        PromotionPolicy.Comparison comparison = policy.compare(TestModels.metrics(0.179, 0.252),
                TestModels.metrics(0.179, 0.252));

        assertThat(comparison.getDecision()).isEqualTo(PromotionDecision.ROLLBACK_OLD);
        assertThat(comparison.getReason()).isEqualTo(PromotionPolicy.Reason.NOT_IMPROVED);
    }

    @Test
    @DisplayName("Should reject a negative tolerance")
    void shouldRejectNegativeTolerance() {
        assertThatThrownBy(() -> new PromotionPolicy(-0.1)).isInstanceOf(IllegalArgumentException.class);
    }
}
