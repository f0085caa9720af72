package com.metersentinel.scheduler;

import com.metersentinel.core.config.SentinelConfig;
import com.metersentinel.core.detection.AnomalyConsensusEngine;
import com.metersentinel.core.registry.FileModelRegistry;
import com.metersentinel.core.report.ReportKind;
import com.metersentinel.core.report.ReportSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ReportJob}.
 */
class ReportJobTest {

    private static final Instant NOW = Instant.parse("2024-03-05T06:00:00Z");
    private static final Instant DAY_START = Instant.parse("2024-03-04T00:00:00Z");

    @TempDir
    Path registryDir;

    private final SentinelConfig config = new SentinelConfig();
    private final List<ReportSummary> published = new ArrayList<>();
    private final ReportDatasetCache cache = new ReportDatasetCache();
    private SchedulerFixtures.StubSource source;

    @BeforeEach
    void setUp() {
        source = new SchedulerFixtures.StubSource(SchedulerFixtures.minutely(DAY_START, 60, 40, 8.0));
    }

    @Test
    @DisplayName("Publishes a summary of the previous day with its anomaly count")
    void shouldPublishDailySummary() throws Exception {
        ReportJob job = job(ReportKind.DAILY, NOW);

        job.run();

        assertThat(job.name()).isEqualTo("daily-report");
        assertThat(published).singleElement().satisfies(summary -> {
            assertThat(summary.getKind()).isEqualTo(ReportKind.DAILY);
            assertThat(summary.getPeriodStart()).isEqualTo(LocalDate.of(2024, 3, 4));
            assertThat(summary.getPeriodEnd()).isEqualTo(LocalDate.of(2024, 3, 5));
            assertThat(summary.getRecordCount()).isEqualTo(60);
            assertThat(summary.getMaxPowerKw()).isEqualTo(8.0);
            assertThat(summary.getAnomalyCount()).isEqualTo(1);
            assertThat(summary.isFromCache()).isFalse();
        });
    }

    @Test
    @DisplayName("Falls back to the last fetched dataset when the source is down")
    void shouldFallBackToCachedDataset() throws Exception {
        job(ReportKind.DAILY, NOW).run();
        source.setUnavailable(true);

        job(ReportKind.DAILY, NOW.plusSeconds(86_400)).run();

        assertThat(published).hasSize(2);
        ReportSummary fallback = published.get(1);
        assertThat(fallback.isFromCache()).isTrue();
        assertThat(fallback.getPeriodStart()).isEqualTo(LocalDate.of(2024, 3, 4));
        assertThat(fallback.getRecordCount()).isEqualTo(60);
    }

    @Test
    @DisplayName("Skips the report when the source is down and nothing is cached")
    void shouldSkipWithoutCache() throws Exception {
        source.setUnavailable(true);

        job(ReportKind.DAILY, NOW).run();

        assertThat(published).isEmpty();
    }

    @Test
    @DisplayName("Does not fall back when the fallback is disabled")
    void shouldSkipWhenFallbackDisabled() throws Exception {
        job(ReportKind.DAILY, NOW).run();
        config.getJobs().setReportFallbackEnabled(false);
        source.setUnavailable(true);

        job(ReportKind.DAILY, NOW).run();

        assertThat(published).hasSize(1);
    }

    @Test
    @DisplayName("Cached datasets are kept per report kind")
    void shouldNotShareCacheAcrossKinds() throws Exception {
        job(ReportKind.DAILY, NOW).run();
        source.setUnavailable(true);

        job(ReportKind.WEEKLY, NOW).run();

        assertThat(published).hasSize(1);
    }

    @Test
    @DisplayName("An empty period publishes nothing")
    void shouldSkipEmptyPeriod() throws Exception {
        source.setWindow(null);

        job(ReportKind.MONTHLY, NOW).run();

        assertThat(published).isEmpty();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private ReportJob job(ReportKind kind, Instant now) {
        Clock clock = Clock.fixed(now, ZoneOffset.UTC);
        return new ReportJob(kind, source, new FileModelRegistry(registryDir, clock),
                new AnomalyConsensusEngine(config), published::add, cache, config, ZoneId.of("UTC"), clock);
    }
}
