package com.metersentinel.core.ml;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link Statistics} and {@link MetricsCalculator}.
 */
class StatisticsTest {

    @Test
    @DisplayName("Quantiles interpolate linearly between order statistics")
    void shouldInterpolateQuantiles() {
        double[] values = {4, 1, 3, 2};

        assertThat(Statistics.quantile(values, 0.0)).isEqualTo(1.0);
        assertThat(Statistics.quantile(values, 0.25)).isEqualTo(1.75);
        assertThat(Statistics.median(values)).isEqualTo(2.5);
        assertThat(Statistics.quantile(values, 1.0)).isEqualTo(4.0);
    }

    @Test
    @DisplayName("Non-finite values are ignored")
    void shouldIgnoreNaN() {
        double[] values = {1, Double.NaN, 3, Double.POSITIVE_INFINITY};

        assertThat(Statistics.mean(values)).isEqualTo(2.0);
        assertThat(Statistics.median(values)).isEqualTo(2.0);
        assertThat(Statistics.sortedFinite(values)).containsExactly(1.0, 3.0);
    }

    @Test
    @DisplayName("Sample standard deviation uses n - 1")
    void shouldComputeSampleStdDev() {
        double[] values = {2, 4, 4, 4, 5, 5, 7, 9};

        assertThat(Statistics.sampleStdDev(values)).isCloseTo(Math.sqrt(32.0 / 7.0), within(1e-12));
        assertThat(Statistics.sampleStdDev(new double[] {5})).isNaN();
    }

    @Test
    @DisplayName("Tukey fences span k IQRs beyond the quartiles")
    void shouldComputeIqrFences() {
        double[] fences = Statistics.iqrFences(new double[] {1, 2, 3, 4}, 1.5);

        assertThat(fences[0]).isCloseTo(-0.5, within(1e-12));
        assertThat(fences[1]).isCloseTo(5.5, within(1e-12));
    }

    @Test
    @DisplayName("Should reject quantiles outside [0, 1]")
    void shouldRejectBadQuantile() {
        assertThatThrownBy(() -> Statistics.quantile(new double[] {1, 2}, 1.5))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Forecast metrics: MAE, RMSE, MAPE as percent, R squared")
    void shouldEvaluateForecastMetrics() {
        ModelMetrics m = MetricsCalculator.evaluate(new double[] {1, 2, 3}, new double[] {1, 2, 4});

        assertThat(m.getMae()).isCloseTo(1.0 / 3.0, within(1e-9));
        assertThat(m.getRmse()).isCloseTo(Math.sqrt(1.0 / 3.0), within(1e-9));
        assertThat(m.getMape()).isCloseTo(100.0 / 9.0, within(1e-6));
        assertThat(m.getR2()).isCloseTo(0.5, within(1e-9));
        assertThat(m.toMap()).containsOnlyKeys("MAE", "RMSE", "MAPE", "R2");
    }

    @Test
    @DisplayName("R squared is zero for a constant actual series")
    void shouldReturnZeroR2ForConstantActuals() {
        ModelMetrics m = MetricsCalculator.evaluate(new double[] {2, 2}, new double[] {1, 3});

        assertThat(m.getR2()).isZero();
    }

    @Test
    @DisplayName("Should reject mismatched lengths")
    void shouldRejectMismatchedLengths() {
        assertThatThrownBy(() -> MetricsCalculator.evaluate(new double[] {1}, new double[] {1, 2}))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
