package com.metersentinel.core.detection;

import com.metersentinel.core.TestReadings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link IqrDetector}.
 */
class IqrDetectorTest {

    private final IqrDetector detector = new IqrDetector(1.5);

    @Test
    @DisplayName("Should flag values beyond either fence")
    void shouldFlagBothTails() {
        double[] values = TestReadings.steady(30);
        values[5] = 5.0;
        values[20] = 0.1;

        boolean[] flags = detector.detect(context(values));

        assertThat(flags[5]).isTrue();
        assertThat(flags[20]).isTrue();
        assertThat(count(flags)).isEqualTo(2);
    }

    @Test
    @DisplayName("Should NOT flag a steady window")
    void shouldNotFlagSteadyWindow() {
        assertThat(count(detector.detect(context(TestReadings.steady(30))))).isZero();
    }

    @Test
    @DisplayName("Should reject a non-positive multiplier")
    void shouldRejectBadMultiplier() {
        assertThatThrownBy(() -> new IqrDetector(0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    static DetectionContext context(double[] values) {
        return new DetectionContext(TestReadings.minutely(values).getReadings(), null, null);
    }

    static int count(boolean[] flags) {
        int n = 0;
        for (boolean f : flags) {
            if (f) {
                n++;
            }
        }
        return n;
    }
}
