package com.metersentinel.scheduler;

import com.metersentinel.core.config.SentinelConfig;
import com.metersentinel.core.detection.AnomalyConsensusEngine;
import com.metersentinel.core.model.AnomalyVerdict;
import com.metersentinel.core.notify.AnomalyNotifier;
import com.metersentinel.core.registry.FileModelRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

/**
 * Unit tests for {@link AnomalyScanJob}.
 */
class AnomalyScanJobTest {

    private static final Instant NOW = Instant.parse("2024-03-05T11:00:00Z");
    private static final Instant WINDOW_START = Instant.parse("2024-03-05T10:00:00Z");

    @TempDir
    Path registryDir;

    private final SentinelConfig config = new SentinelConfig();
    private final List<AnomalyVerdict> notified = new ArrayList<>();
    private final AnomalyNotifier notifier = (window, verdicts) -> notified.addAll(verdicts);
    private SchedulerFixtures.StubSource source;
    private AnomalyScanJob job;

    @BeforeEach
    void setUp() {
        source = new SchedulerFixtures.StubSource(SchedulerFixtures.minutely(WINDOW_START, 60, 40, 8.0));
        job = new AnomalyScanJob(source, new FileModelRegistry(registryDir, Clock.fixed(NOW, ZoneOffset.UTC)),
                new AnomalyConsensusEngine(config), notifier, config, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Confirmed anomalies are handed to the notifier even before the first training")
    void shouldNotifyConfirmedAnomalies() throws Exception {
        job.run();

        assertThat(notified).singleElement().satisfies(v -> {
            assertThat(v.getTimestamp()).isEqualTo(WINDOW_START.plusSeconds(40 * 60));
            assertThat(v.isConsensus()).isTrue();
        });
    }

    @Test
    @DisplayName("A quiet window notifies nobody")
    void shouldStayQuietWithoutAnomalies() throws Exception {
        source.setWindow(SchedulerFixtures.minutely(WINDOW_START, 60, -1, 0.0));

        job.run();

        assertThat(notified).isEmpty();
    }

    @Test
    @DisplayName("An unavailable source skips the cycle without failing the job")
    void shouldSkipWhenSourceUnavailable() {
        source.setUnavailable(true);

        assertThatCode(job::run).doesNotThrowAnyException();
        assertThat(notified).isEmpty();
    }

    @Test
    @DisplayName("Too few readings skip the cycle without failing the job")
    void shouldSkipShortWindow() {
        source.setWindow(SchedulerFixtures.minutely(WINDOW_START, 10, 5, 8.0));

        assertThatCode(job::run).doesNotThrowAnyException();
        assertThat(notified).isEmpty();
    }

    @Test
    @DisplayName("An empty fetch is not an error")
    void shouldSkipEmptyFetch() {
        source.setWindow(null);

        assertThatCode(job::run).doesNotThrowAnyException();
        assertThat(source.getFetches()).isEqualTo(1);
        assertThat(notified).isEmpty();
    }
}
