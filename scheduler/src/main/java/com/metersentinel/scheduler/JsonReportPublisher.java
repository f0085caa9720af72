package com.metersentinel.scheduler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.metersentinel.core.notify.ReportPublisher;
import com.metersentinel.core.report.ReportSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;

/**
 * Writes each report summary to {@code <outputDir>/<kind>_<periodStart>.json}.
 * A rerun for the same period overwrites the previous file.
 *
 * @since 1.0.0
 */
public class JsonReportPublisher implements ReportPublisher {

    private static final Logger LOG = LoggerFactory.getLogger(JsonReportPublisher.class);

    private final Path outputDir;
    private final ObjectMapper mapper;

    public JsonReportPublisher(Path outputDir, ObjectMapper mapper) {
        this.outputDir = Objects.requireNonNull(outputDir, "outputDir must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null").copy()
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public void publish(ReportSummary summary) {
        Path target = fileFor(summary);
        try {
            Files.createDirectories(outputDir);
            Path tmp = Files.createTempFile(outputDir, ".report", ".tmp");
            try {
                mapper.writeValue(tmp.toFile(), summary);
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } finally {
                Files.deleteIfExists(tmp);
            }
            LOG.info("Report written to {}", target);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write report " + target, e);
        }
    }

    Path fileFor(ReportSummary summary) {
        return outputDir.resolve(summary.getKind().getKey() + "_" + summary.getPeriodStart() + ".json");
    }
}
