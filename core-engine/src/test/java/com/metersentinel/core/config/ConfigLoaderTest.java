package com.metersentinel.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DayOfWeek;
import java.time.LocalTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should load the bundled default configuration")
    void shouldLoadDefaults() {
        SentinelConfig config = ConfigLoader.fromClasspath(ConfigLoader.DEFAULT_RESOURCE);

        assertThat(config.getDetection().getConsensusThreshold()).isEqualTo(3);
        assertThat(config.getDetection().getMinReadings()).isEqualTo(30);
        assertThat(config.getRegistry().getRetrainingIntervalDays()).isEqualTo(7);
        assertThat(config.getRegistry().getPromotionTolerance()).isEqualTo(0.10);
        assertThat(config.getSeverity().getCriticalScore()).isEqualTo(80.0);
        assertThat(config.getJobs().retrainingCheckLocalTime()).isEqualTo(LocalTime.of(3, 0));
        assertThat(config.getJobs().monthlyReportLocalTime()).isEqualTo(LocalTime.of(10, 0));
    }

    @Test
    @DisplayName("Should overlay partial YAML on defaults")
    void shouldOverlayPartialYaml() {
        SentinelConfig config = ConfigLoader.fromClasspath("test-sentinel.yml");

        assertThat(config.getDetection().getConsensusThreshold()).isEqualTo(2);
        assertThat(config.getDetection().getMinReadings()).isEqualTo(10);
        assertThat(config.getDetection().getZscoreThreshold()).isEqualTo(3.0);
        assertThat(config.getTraining().getNumberOfTrees()).isEqualTo(10);
        assertThat(config.getRegistry().getRetrainingIntervalDays()).isEqualTo(3);
        assertThat(config.getJobs().weeklyReportDayOfWeek()).isEqualTo(DayOfWeek.FRIDAY);
        assertThat(config.getJobs().dailyReportLocalTime()).isEqualTo(LocalTime.of(6, 30));
    }

    @Test
    @DisplayName("Should throw when classpath resource does not exist")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> ConfigLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should throw when config file does not exist")
    void shouldThrowForMissingFile() {
        assertThatThrownBy(() -> ConfigLoader.fromFile(tempDir.resolve("missing.yml").toString()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should collect every invalid value into one validation error")
    void shouldReportAllViolations() throws IOException {
        Path file = tempDir.resolve("bad.yml");
        Files.writeString(file, String.join("\n",
                "detection:",
                "  consensusThreshold: 6",
                "registry:",
                "  keepVersions: 0",
                "jobs:",
                "  dailyReportTime: \"25:00\""));

        assertThatThrownBy(() -> ConfigLoader.fromFile(file.toString()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("detection.consensusThreshold")
                .hasMessageContaining("registry.keepVersions")
                .hasMessageContaining("jobs.dailyReportTime");
    }

    @Test
    @DisplayName("Should name the file when a key is unknown")
    void shouldRejectUnknownKey() throws IOException {
        Path file = tempDir.resolve("typo.yml");
        Files.writeString(file, String.join("\n",
                "detection:",
                "  consensusTreshold: 2"));

        assertThatThrownBy(() -> ConfigLoader.fromFile(file.toString()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("typo.yml")
                .hasMessageContaining("consensusTreshold");
    }

    @Test
    @DisplayName("Should reject a document that repeats a key")
    void shouldRejectDuplicateKey() throws IOException {
        Path file = tempDir.resolve("twice.yml");
        Files.writeString(file, String.join("\n",
                "registry:",
                "  keepVersions: 3",
                "  keepVersions: 4"));

        assertThatThrownBy(() -> ConfigLoader.fromFile(file.toString()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("twice.yml");
    }

    @Test
    @DisplayName("Should fall back to defaults for an empty document")
    void shouldUseDefaultsForEmptyFile() throws IOException {
        Path file = tempDir.resolve("empty.yml");
        Files.writeString(file, "");

        SentinelConfig config = ConfigLoader.fromFile(file.toString());

        assertThat(config.getDetection().getConsensusThreshold()).isEqualTo(3);
    }
}
