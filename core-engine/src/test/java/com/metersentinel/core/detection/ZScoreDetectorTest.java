package com.metersentinel.core.detection;

import com.metersentinel.core.model.DetectionMethod;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static com.metersentinel.core.detection.IqrDetectorTest.context;
import static com.metersentinel.core.detection.IqrDetectorTest.count;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ZScoreDetector}.
 */
class ZScoreDetectorTest {

    private final ZScoreDetector detector = new ZScoreDetector(3.0);

    @Test
    @DisplayName("Should flag a spike more than 3 sigma from the window mean")
    void shouldFlagSpike() {
        double[] values = new double[30];
        Arrays.fill(values, 1.0);
        values[12] = 10.0;

        boolean[] flags = detector.detect(context(values));

        assertThat(flags[12]).isTrue();
        assertThat(count(flags)).isEqualTo(1);
    }

    @Test
    @DisplayName("Should NOT flag anything when the window is constant")
    void shouldNotFlagConstantWindow() {
        double[] values = new double[30];
        Arrays.fill(values, 2.0);

        assertThat(count(detector.detect(context(values)))).isZero();
    }

    @Test
    @DisplayName("Should report its method")
    void shouldReportMethod() {
        assertThat(detector.getMethod()).isEqualTo(DetectionMethod.Z_SCORE);
    }
}
