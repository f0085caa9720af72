package com.metersentinel.core.detection;

import com.metersentinel.core.TestReadings;
import com.metersentinel.core.ml.ForecastModel;
import com.metersentinel.core.model.Reading;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ModelOutlierDetector} and
 * {@link ForecastResidualDetector}.
 */
class ModelDetectorsTest {

    private final List<Reading> readings = TestReadings.minutely(1.0, 1.2, 1.5, 0.5, 9.0).getReadings();

    @Test
    @DisplayName("Outlier detector applies the model's decision function")
    void shouldUseOutlierModel() {
        DetectionContext ctx = new DetectionContext(readings, TestReadings.powerAbove(5.0), null);

        assertThat(new ModelOutlierDetector().detect(ctx)).containsExactly(false, false, false, false, true);
    }

    @Test
    @DisplayName("Forecast residual detector flags relative residuals above the threshold")
    void shouldFlagLargeResiduals() {
        ForecastModel flat = timestamp -> 1.0;
        DetectionContext ctx = new DetectionContext(readings, null, flat);

        assertThat(new ForecastResidualDetector(0.30).detect(ctx))
                .containsExactly(false, false, true, true, true);
    }

    @Test
    @DisplayName("Both abstain without a model")
    void shouldAbstainWithoutModels() {
        DetectionContext ctx = new DetectionContext(readings, null, null);

        assertThat(new ModelOutlierDetector().detect(ctx)).containsOnly(false);
        assertThat(new ForecastResidualDetector(0.30).detect(ctx)).containsOnly(false);
    }
}
