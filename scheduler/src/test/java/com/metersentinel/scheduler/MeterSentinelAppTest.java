package com.metersentinel.scheduler;

import com.metersentinel.core.config.SentinelConfig;
import com.metersentinel.core.error.InsufficientDataException;
import com.metersentinel.core.lifecycle.ModelLifecycleManager;
import com.metersentinel.core.lifecycle.TrainingResult;
import com.metersentinel.core.model.Reading;
import com.metersentinel.core.registry.FileModelRegistry;
import com.metersentinel.core.registry.PromotionDecision;
import com.metersentinel.core.registry.RetrainingState;
import com.metersentinel.core.training.SeasonalForestTrainer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for the {@link MeterSentinelApp} initialization mode.
 */
class MeterSentinelAppTest {

    private static final Instant NOW = Instant.parse("2024-03-05T03:00:00Z");
    private static final Instant EXPORT_START = Instant.parse("2010-10-01T00:00:00Z");
    private static final String HEADER = "Date;Time;Global_active_power;Global_reactive_power;Voltage;"
            + "Global_intensity;Sub_metering_1;Sub_metering_2;Sub_metering_3";
    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("d/M/yyyy");
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss");

    @TempDir
    Path dir;

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private SentinelConfig config;

    @BeforeEach
    void setUp() {
        config = new SentinelConfig();
        config.getValidation().setSamplesPerDay(24);
        config.getValidation().setMinDays(14);
        config.getTraining().setTestDays(2);
        config.getTraining().setNumberOfTrees(20);
        config.getTraining().setSampleSize(64);
    }

    @Test
    @DisplayName("Initialization promotes first models from a historical export")
    void shouldPromoteFromHistoricalExport() throws IOException {
        Path csv = export(SchedulerFixtures.hourly(EXPORT_START, 21).getReadings());
        FileModelRegistry registry = new FileModelRegistry(dir.resolve("models"), clock);

        CsvReadingSource source = new CsvReadingSource(csv, ZoneOffset.UTC);

        TrainingResult result;
        try (ModelLifecycleManager lifecycle = lifecycle(source, registry)) {
            result = MeterSentinelApp.initialize(source, lifecycle);
        }

        assertThat(result.getTerminalState()).isEqualTo(RetrainingState.PROMOTE);
        assertThat(result.getDecision()).contains(PromotionDecision.FIRST_TRAINING);
        assertThat(registry.currentProduction()).hasValueSatisfying(s ->
                assertThat(s.getForecastingVersion()).isEqualTo(result.getVersionId().orElseThrow()));
        assertThat(registry.history()).singleElement()
                .satisfies(e -> assertThat(e.getTimestamp()).isEqualTo(NOW));
    }

    @Test
    @DisplayName("Initialization refuses an export without readings")
    void shouldRejectEmptyExport() throws IOException {
        Path csv = export(List.of());
        FileModelRegistry registry = new FileModelRegistry(dir.resolve("models"), clock);

        CsvReadingSource source = new CsvReadingSource(csv, ZoneOffset.UTC);

        try (ModelLifecycleManager lifecycle = lifecycle(source, registry)) {
            assertThatThrownBy(() -> MeterSentinelApp.initialize(source, lifecycle))
                    .isInstanceOf(InsufficientDataException.class);
        }
        assertThat(registry.history()).isEmpty();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private ModelLifecycleManager lifecycle(CsvReadingSource source, FileModelRegistry registry) {
        return new ModelLifecycleManager(source, new SeasonalForestTrainer(config, ZoneOffset.UTC), registry,
                config, clock);
    }

    private Path export(List<Reading> readings) throws IOException {
        List<String> lines = new ArrayList<>(readings.size() + 1);
        lines.add(HEADER);
        for (Reading r : readings) {
            LocalDateTime local = LocalDateTime.ofInstant(r.getTimestamp(), ZoneOffset.UTC);
            lines.add(String.format(Locale.ROOT, "%s;%s;%.3f;0.100;%.3f;%.3f;%.3f;%.3f;%.3f",
                    DATE.format(local), TIME.format(local), r.getActivePowerKw(), r.getVoltage(), r.getCurrentA(),
                    r.getSubMetering1(), r.getSubMetering2(), r.getSubMetering3()));
        }
        Path file = dir.resolve("household_power_consumption.txt");
        Files.write(file, lines, StandardCharsets.UTF_8);
        return file;
    }
}
