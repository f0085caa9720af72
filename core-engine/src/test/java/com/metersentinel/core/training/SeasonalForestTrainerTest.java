package com.metersentinel.core.training;

import com.metersentinel.core.TestReadings;
import com.metersentinel.core.config.SentinelConfig;
import com.metersentinel.core.ml.ModelMetrics;
import com.metersentinel.core.model.Reading;
import com.metersentinel.core.model.ReadingWindow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link SeasonalForestTrainer}.
 */
class SeasonalForestTrainerTest {

    private SentinelConfig config;
    private SeasonalForestTrainer trainer;

    @BeforeEach
    void setUp() {
        config = new SentinelConfig();
        config.getValidation().setSamplesPerDay(24);
        config.getValidation().setMinDays(14);
        config.getTraining().setTestDays(2);
        config.getTraining().setNumberOfTrees(20);
        config.getTraining().setSampleSize(64);
        trainer = new SeasonalForestTrainer(config, ZoneOffset.UTC);
    }

    @Test
    @DisplayName("Should validate, clean, fit and evaluate a regular history")
    void shouldTrainAndEvaluate() {
        ReadingWindow raw = ReadingWindow.covering(TestReadings.hourlyPattern(21));

        assertThat(trainer.validate(raw).isValid()).isTrue();
        TrainedModels models = trainer.fit(trainer.preprocess(raw));
        ModelMetrics metrics = trainer.evaluate(models);

        assertThat(models.getTrainingRecordCount()).isEqualTo(504);
        assertThat(models.getTestSet()).hasSize(48);
        assertThat(metrics.getMae()).isLessThan(0.1);
        assertThat(metrics.getRmse()).isGreaterThanOrEqualTo(metrics.getMae());
    }

    @Test
    @DisplayName("Holds out the most recent test days")
    void shouldHoldOutRecentDays() {
        List<Reading> readings = TestReadings.hourlyPattern(21);

        assertThat(trainer.splitIndex(readings)).isEqualTo(456);
    }

    @Test
    @DisplayName("Falls back to the test fraction when the day split leaves too little training data")
    void shouldFallBackToFraction() {
        config.getTraining().setTestDays(15);
        SeasonalForestTrainer wide = new SeasonalForestTrainer(config, ZoneOffset.UTC);

        assertThat(wide.splitIndex(TestReadings.hourlyPattern(21))).isEqualTo(504 - 50);
    }
}
