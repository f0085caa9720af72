package com.metersentinel.scheduler;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.metersentinel.core.registry.FileModelRegistry;
import com.metersentinel.core.report.ReportCalculator;
import com.metersentinel.core.report.ReportKind;
import com.metersentinel.core.report.ReportPeriod;
import com.metersentinel.core.report.ReportSummary;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JsonReportPublisher}.
 */
class JsonReportPublisherTest {

    private static final Instant NOW = Instant.parse("2024-03-05T06:00:00Z");

    @TempDir
    Path dir;

    private final ObjectMapper mapper = FileModelRegistry.newMapper();

    @Test
    @DisplayName("Writes one JSON document per report kind and period")
    void shouldWriteSummary() throws IOException {
        Path out = dir.resolve("reports");
        JsonReportPublisher publisher = new JsonReportPublisher(out, mapper);

        publisher.publish(summary(false));

        Path file = out.resolve("daily_2024-03-04.json");
        assertThat(file).exists();
        JsonNode json = mapper.readTree(file.toFile());
        assertThat(json.get("kind").asText()).isEqualTo("DAILY");
        assertThat(json.get("periodStart").asText()).isEqualTo("2024-03-04");
        assertThat(json.get("recordCount").asInt()).isEqualTo(60);
        assertThat(json.get("anomalyCount").asInt()).isEqualTo(2);
        assertThat(json.get("fromCache").asBoolean()).isFalse();
    }

    @Test
    @DisplayName("Republishing a period replaces the earlier document and leaves no temp files")
    void shouldReplaceExistingReport() throws IOException {
        JsonReportPublisher publisher = new JsonReportPublisher(dir, mapper);

        publisher.publish(summary(false));
        publisher.publish(summary(true));

        try (Stream<Path> files = Files.list(dir)) {
            assertThat(files).extracting(p -> p.getFileName().toString()).containsExactly("daily_2024-03-04.json");
        }
        assertThat(mapper.readTree(dir.resolve("daily_2024-03-04.json").toFile()).get("fromCache").asBoolean())
                .isTrue();
    }

    @Test
    @DisplayName("A failed write leaves neither a report nor a temp file behind")
    void shouldRemoveTempFileWhenWriteFails() throws IOException {
        ObjectMapper failing = FileModelRegistry.newMapper().registerModule(new SimpleModule()
                .addSerializer(ReportSummary.class, new StdSerializer<ReportSummary>(ReportSummary.class) {
                    @Override
                    public void serialize(ReportSummary value, JsonGenerator gen, SerializerProvider provider)
                            throws IOException {
                        throw new IOException("disk full");
                    }
                }));
        JsonReportPublisher publisher = new JsonReportPublisher(dir, failing);

        assertThatThrownBy(() -> publisher.publish(summary(false)))
                .isInstanceOf(UncheckedIOException.class)
                .hasMessageContaining("daily_2024-03-04.json");

        try (Stream<Path> files = Files.list(dir)) {
            assertThat(files).isEmpty();
        }
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static ReportSummary summary(boolean fromCache) {
        ReportPeriod period = ReportKind.DAILY.periodFor(LocalDate.of(2024, 3, 5), ZoneOffset.UTC);
        return new ReportCalculator(Clock.fixed(NOW, ZoneOffset.UTC)).summarize(period,
                SchedulerFixtures.minutely(period.startInstant(), 60, -1, 0.0), 2, fromCache);
    }
}
