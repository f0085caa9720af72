package com.metersentinel.scheduler;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.metersentinel.core.error.SourceUnavailableException;
import com.metersentinel.core.model.Reading;
import com.metersentinel.core.model.ReadingWindow;
import com.metersentinel.core.source.ReadingSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Reading source backed by a household power consumption export.
 *
 * <h3>Format</h3>
 * <pre>
 *   Date;Time;Global_active_power;Global_reactive_power;Voltage;Global_intensity;Sub_metering_1;Sub_metering_2;Sub_metering_3
 *   16/12/2006;17:24:00;4.216;0.418;234.840;18.400;0.000;1.000;17.000
 * </pre>
 * <p>
 * Semicolon or comma separated, detected from the header. {@code ?} or an
 * empty cell is a missing value. Dates are {@code d/M/yyyy} in the configured
 * zone. Rows whose timestamp cannot be parsed are dropped; duplicate
 * timestamps keep the first row.
 * </p>
 *
 * <p>
 * The parsed file is cached and reloaded when its modification time changes.
 * A missing or unreadable file raises {@link SourceUnavailableException}.
 * </p>
 *
 * @since 1.0.0
 */
public class CsvReadingSource implements ReadingSource {

    private static final Logger LOG = LoggerFactory.getLogger(CsvReadingSource.class);
    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("d/M/yyyy");
    private static final String MISSING = "?";

    private final Path file;
    private final ZoneId zone;
    private final CsvMapper csvMapper = new CsvMapper();

    private FileTime loadedModified;
    private List<Reading> cached = List.of();

    public CsvReadingSource(Path file, ZoneId zone) {
        this.file = Objects.requireNonNull(file, "file must not be null");
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
    }

    @Override
    public Optional<ReadingWindow> fetch(Instant start, Instant end) {
        Objects.requireNonNull(start, "start must not be null");
        Objects.requireNonNull(end, "end must not be null");
        if (!start.isBefore(end)) {
            throw new IllegalArgumentException("start must be before end: " + start + " / " + end);
        }

        List<Reading> all = readings();
        int from = lowerBound(all, start);
        int to = lowerBound(all, end);
        if (from >= to) {
            return Optional.empty();
        }
        return Optional.of(new ReadingWindow(start, end, all.subList(from, to)));
    }

    /**
     * @return timestamp of the newest parsed reading, empty if the file has none
     * @throws SourceUnavailableException if the file cannot be read
     */
    public Optional<Instant> latestTimestamp() {
        List<Reading> all = readings();
        return all.isEmpty() ? Optional.empty() : Optional.of(all.get(all.size() - 1).getTimestamp());
    }

    // ---------------------------------------------------------------
    // Loading
    // ---------------------------------------------------------------

    private synchronized List<Reading> readings() {
        if (!Files.isRegularFile(file)) {
            throw new SourceUnavailableException("Readings file not found: " + file);
        }
        try {
            FileTime modified = Files.getLastModifiedTime(file);
            if (!modified.equals(loadedModified)) {
                cached = parse();
                loadedModified = modified;
                LOG.info("Loaded {} reading(s) from {}", cached.size(), file);
            }
            return cached;
        } catch (IOException | RuntimeException e) {
            throw new SourceUnavailableException("Failed to read " + file + ": " + e.getMessage(), e);
        }
    }

    private List<Reading> parse() throws IOException {
        char separator = detectSeparator();
        CsvSchema schema = CsvSchema.emptySchema().withHeader().withColumnSeparator(separator);

        List<Reading> readings = new ArrayList<>();
        int dropped = 0;
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
                MappingIterator<Map<String, String>> rows =
                        csvMapper.readerFor(Map.class).with(schema).readValues(reader)) {
            while (rows.hasNextValue()) {
                Optional<Reading> reading = toReading(rows.nextValue());
                if (reading.isPresent()) {
                    readings.add(reading.get());
                } else {
                    dropped++;
                }
            }
        }
        if (dropped > 0) {
            LOG.warn("Dropped {} row(s) with an unparseable timestamp from {}", dropped, file);
        }

        readings.sort((a, b) -> a.getTimestamp().compareTo(b.getTimestamp()));
        List<Reading> unique = new ArrayList<>(readings.size());
        for (Reading r : readings) {
            if (unique.isEmpty() || unique.get(unique.size() - 1).getTimestamp().isBefore(r.getTimestamp())) {
                unique.add(r);
            }
        }
        return Collections.unmodifiableList(unique);
    }

    private char detectSeparator() throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String header = reader.readLine();
            return header != null && header.indexOf(';') >= 0 ? ';' : ',';
        }
    }

    private Optional<Reading> toReading(Map<String, String> row) {
        Instant timestamp;
        try {
            LocalDate date = LocalDate.parse(row.getOrDefault("Date", "").trim(), DATE);
            LocalTime time = LocalTime.parse(row.getOrDefault("Time", "").trim());
            timestamp = LocalDateTime.of(date, time).atZone(zone).toInstant();
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
        return Optional.of(Reading.builder()
                .timestamp(timestamp)
                .activePowerKw(number(row.get("Global_active_power")))
                .voltage(number(row.get("Voltage")))
                .currentA(number(row.get("Global_intensity")))
                .subMetering1(number(row.get("Sub_metering_1")))
                .subMetering2(number(row.get("Sub_metering_2")))
                .subMetering3(number(row.get("Sub_metering_3")))
                .build());
    }

    private static double number(String raw) {
        if (raw == null) {
            return Double.NaN;
        }
        String value = raw.trim();
        if (value.isEmpty() || MISSING.equals(value)) {
            return Double.NaN;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }

    private static int lowerBound(List<Reading> readings, Instant instant) {
        int lo = 0;
        int hi = readings.size();
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (readings.get(mid).getTimestamp().isBefore(instant)) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }
}
