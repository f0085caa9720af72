package com.metersentinel.scheduler;

import com.metersentinel.core.error.SourceUnavailableException;
import com.metersentinel.core.model.Reading;
import com.metersentinel.core.model.ReadingWindow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link CsvReadingSource}.
 */
class CsvReadingSourceTest {

    private static final String HEADER = "Date;Time;Global_active_power;Global_reactive_power;Voltage;"
            + "Global_intensity;Sub_metering_1;Sub_metering_2;Sub_metering_3";

    @TempDir
    Path dir;

    @Test
    @DisplayName("Should parse rows inside the requested range in timestamp order")
    void shouldFetchRange() throws IOException {
        Path file = write(HEADER,
                "16/12/2006;17:26:00;5.374;0.498;233.290;23.000;0.000;2.000;17.000",
                "16/12/2006;17:24:00;4.216;0.418;234.840;18.400;0.000;1.000;17.000",
                "16/12/2006;17:25:00;5.360;0.436;233.630;23.000;0.000;1.000;16.000",
                "16/12/2006;17:27:00;5.388;0.502;233.740;23.000;0.000;1.000;17.000");
        CsvReadingSource source = new CsvReadingSource(file, ZoneOffset.UTC);

        Optional<ReadingWindow> window = source.fetch(Instant.parse("2006-12-16T17:24:00Z"),
                Instant.parse("2006-12-16T17:27:00Z"));

        assertThat(window).isPresent();
        assertThat(window.get().getReadings()).extracting(Reading::getTimestamp).containsExactly(
                Instant.parse("2006-12-16T17:24:00Z"),
                Instant.parse("2006-12-16T17:25:00Z"),
                Instant.parse("2006-12-16T17:26:00Z"));
        Reading first = window.get().get(0);
        assertThat(first.getActivePowerKw()).isEqualTo(4.216);
        assertThat(first.getVoltage()).isEqualTo(234.84);
        assertThat(first.getCurrentA()).isEqualTo(18.4);
        assertThat(first.getSubMetering3()).isEqualTo(17.0);
    }

    @Test
    @DisplayName("Question marks and empty cells become missing values")
    void shouldTreatQuestionMarkAsMissing() throws IOException {
        Path file = write(HEADER,
                "21/12/2006;11:23:00;?;?;?;?;?;?;",
                "21/12/2006;11:24:00;1.500;0.100;240.000;6.200;0.000;0.000;1.000");
        CsvReadingSource source = new CsvReadingSource(file, ZoneOffset.UTC);

        ReadingWindow window = source.fetch(Instant.parse("2006-12-21T00:00:00Z"),
                Instant.parse("2006-12-22T00:00:00Z")).orElseThrow();

        assertThat(window.size()).isEqualTo(2);
        assertThat(window.get(0).hasMissingValues()).isTrue();
        assertThat(window.get(0).getSubMetering3()).isNaN();
        assertThat(window.get(1).hasMissingValues()).isFalse();
    }

    @Test
    @DisplayName("Duplicate timestamps keep the first row and bad timestamps are dropped")
    void shouldDropDuplicatesAndBadTimestamps() throws IOException {
        Path file = write(HEADER,
                "16/12/2006;17:24:00;4.216;0.418;234.840;18.400;0.000;1.000;17.000",
                "16/12/2006;17:24:00;9.999;0.418;234.840;18.400;0.000;1.000;17.000",
                "not-a-date;17:25:00;5.360;0.436;233.630;23.000;0.000;1.000;16.000");
        CsvReadingSource source = new CsvReadingSource(file, ZoneOffset.UTC);

        ReadingWindow window = source.fetch(Instant.parse("2006-12-16T00:00:00Z"),
                Instant.parse("2006-12-17T00:00:00Z")).orElseThrow();

        assertThat(window.size()).isEqualTo(1);
        assertThat(window.get(0).getActivePowerKw()).isEqualTo(4.216);
    }

    @Test
    @DisplayName("Comma-separated files are accepted too")
    void shouldAcceptCommaSeparator() throws IOException {
        Path file = write(HEADER.replace(';', ','),
                "16/12/2006,17:24:00,4.216,0.418,234.840,18.400,0.000,1.000,17.000");
        CsvReadingSource source = new CsvReadingSource(file, ZoneOffset.UTC);

        assertThat(source.fetch(Instant.parse("2006-12-16T00:00:00Z"), Instant.parse("2006-12-17T00:00:00Z")))
                .hasValueSatisfying(w -> assertThat(w.size()).isEqualTo(1));
    }

    @Test
    @DisplayName("A range without rows yields an empty result")
    void shouldReturnEmptyOutsideData() throws IOException {
        Path file = write(HEADER, "16/12/2006;17:24:00;4.216;0.418;234.840;18.400;0.000;1.000;17.000");
        CsvReadingSource source = new CsvReadingSource(file, ZoneOffset.UTC);

        assertThat(source.fetch(Instant.parse("2007-01-01T00:00:00Z"), Instant.parse("2007-01-02T00:00:00Z")))
                .isEmpty();
    }

    @Test
    @DisplayName("A missing file makes the source unavailable")
    void shouldReportMissingFile() {
        CsvReadingSource source = new CsvReadingSource(dir.resolve("absent.txt"), ZoneOffset.UTC);

        assertThatThrownBy(() -> source.fetch(Instant.parse("2007-01-01T00:00:00Z"),
                Instant.parse("2007-01-02T00:00:00Z")))
                .isInstanceOf(SourceUnavailableException.class)
                .hasMessageContaining("absent.txt");
    }

    @Test
    @DisplayName("Should reject an inverted range")
    void shouldRejectInvertedRange() throws IOException {
        CsvReadingSource source = new CsvReadingSource(write(HEADER), ZoneOffset.UTC);
        Instant t = Instant.parse("2007-01-01T00:00:00Z");

        assertThatThrownBy(() -> source.fetch(t, t)).isInstanceOf(IllegalArgumentException.class);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private Path write(String... lines) throws IOException {
        Path file = dir.resolve("household_power_consumption.txt");
        Files.write(file, Arrays.asList(lines), StandardCharsets.UTF_8);
        return file;
    }
}
