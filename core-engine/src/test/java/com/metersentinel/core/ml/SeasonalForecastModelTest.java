package com.metersentinel.core.ml;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.metersentinel.core.TestReadings;
import com.metersentinel.core.model.Reading;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link SeasonalForecastModel}.
 */
class SeasonalForecastModelTest {

    @Test
    @DisplayName("Should reproduce a daily cycle it was fitted on")
    void shouldLearnDailyCycle() {
        List<Reading> history = TestReadings.hourlyPattern(28);
        SeasonalForecastModel model = SeasonalForecastModel.fit(history, ZoneOffset.UTC);

        // 06:00 is the peak of the cycle, 18:00 the trough
        Reading peak = history.get(27 * 24 + 6);
        Reading trough = history.get(27 * 24 + 18);
        assertThat(model.predict(peak.getTimestamp())).isCloseTo(peak.getActivePowerKw(), within(0.1));
        assertThat(model.predict(trough.getTimestamp())).isCloseTo(trough.getActivePowerKw(), within(0.1));
        assertThat(model.predict(peak.getTimestamp())).isGreaterThan(model.predict(trough.getTimestamp()));
    }

    @Test
    @DisplayName("Predictions are never negative")
    void shouldClampAtZero() {
        SeasonalForecastModel model = new SeasonalForecastModel("UTC", 0L, -5.0, 0.0,
                new double[SeasonalForecastModel.SLOTS]);

        assertThat(model.predict(TestReadings.START)).isZero();
    }

    @Test
    @DisplayName("A fitted model cannot be changed through its accessors")
    void shouldNotExposeSeasonalTable() {
        SeasonalForecastModel model = SeasonalForecastModel.fit(TestReadings.hourlyPattern(14), ZoneOffset.UTC);
        Instant t = TestReadings.START.plus(Duration.ofDays(15)).plus(Duration.ofHours(3));
        double before = model.predict(t);

        double[] table = model.getSeasonal();
        Arrays.fill(table, 100.0);

        assertThat(model.predict(t)).isEqualTo(before);
    }

    @Test
    @DisplayName("Should reject a seasonal table of the wrong size")
    void shouldRejectWrongSlotCount() {
        assertThatThrownBy(() -> new SeasonalForecastModel("UTC", 0L, 1.0, 0.0, new double[24]))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("168");
    }

    @Test
    @DisplayName("Should survive a JSON round trip with identical predictions")
    void shouldSerializeWithJackson() throws Exception {
        SeasonalForecastModel model = SeasonalForecastModel.fit(TestReadings.hourlyPattern(14), ZoneOffset.UTC);
        ObjectMapper mapper = new ObjectMapper();

        SeasonalForecastModel copy = mapper.readValue(mapper.writeValueAsBytes(model), SeasonalForecastModel.class);

        Instant t = TestReadings.START.plus(Duration.ofDays(20)).plus(Duration.ofHours(7));
        assertThat(copy.predict(t)).isEqualTo(model.predict(t));
    }

    @Test
    @DisplayName("Should refuse to fit without usable readings")
    void shouldRejectEmptyHistory() {
        assertThatThrownBy(() -> SeasonalForecastModel.fit(List.of(), ZoneOffset.UTC))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
