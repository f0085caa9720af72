package com.metersentinel.scheduler;

import com.metersentinel.core.config.SentinelConfig;
import com.metersentinel.core.detection.AnomalyConsensusEngine;
import com.metersentinel.core.detection.DetectionResult;
import com.metersentinel.core.error.SourceUnavailableException;
import com.metersentinel.core.ml.ForecastModel;
import com.metersentinel.core.ml.OutlierModel;
import com.metersentinel.core.model.ReadingWindow;
import com.metersentinel.core.notify.ReportPublisher;
import com.metersentinel.core.registry.ModelRegistry;
import com.metersentinel.core.registry.ProductionModels;
import com.metersentinel.core.report.ReportCalculator;
import com.metersentinel.core.report.ReportKind;
import com.metersentinel.core.report.ReportPeriod;
import com.metersentinel.core.report.ReportSummary;
import com.metersentinel.core.source.ReadingSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Objects;
import java.util.Optional;

/**
 * Daily, weekly or monthly consumption report.
 *
 * <h3>Fallback</h3>
 * <p>
 * Every successful fetch refreshes the {@link ReportDatasetCache}. When the
 * source is unavailable and fallback is enabled, the report is built from the
 * cached dataset of the same kind and marked {@code fromCache}. Without a
 * cached dataset, or with fallback disabled, the cycle is skipped.
 * </p>
 *
 * @since 1.0.0
 */
public class ReportJob implements Job {

    private static final Logger LOG = LoggerFactory.getLogger(ReportJob.class);

    private final ReportKind kind;
    private final ReadingSource source;
    private final ModelRegistry registry;
    private final AnomalyConsensusEngine engine;
    private final ReportCalculator calculator;
    private final ReportPublisher publisher;
    private final ReportDatasetCache cache;
    private final boolean fallbackEnabled;
    private final int consensusThreshold;
    private final ZoneId zone;
    private final Clock clock;

    public ReportJob(ReportKind kind, ReadingSource source, ModelRegistry registry, AnomalyConsensusEngine engine,
            ReportPublisher publisher, ReportDatasetCache cache, SentinelConfig config, ZoneId zone, Clock clock) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        Objects.requireNonNull(config, "config must not be null");
        this.fallbackEnabled = config.getJobs().isReportFallbackEnabled();
        this.consensusThreshold = config.getDetection().getConsensusThreshold();
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.calculator = new ReportCalculator(clock);
    }

    @Override
    public String name() {
        return kind.getKey() + "-report";
    }

    @Override
    public void run() {
        ReportPeriod period = kind.periodFor(LocalDate.now(clock.withZone(zone)), zone);

        ReadingWindow window;
        boolean fromCache = false;
        try {
            Optional<ReadingWindow> fetched = source.fetch(period.startInstant(), period.endInstant());
            if (fetched.isEmpty()) {
                LOG.warn("No readings for {}; report not generated", period);
                return;
            }
            window = fetched.get();
            cache.put(period, window);
        } catch (SourceUnavailableException e) {
            Optional<ReportDatasetCache.Entry> cached = fallbackEnabled ? cache.get(kind) : Optional.empty();
            if (cached.isEmpty()) {
                LOG.warn("Reading source unavailable and no cached dataset for {}; skipping: {}",
                        period, e.getMessage());
                return;
            }
            period = cached.get().getPeriod();
            window = cached.get().getWindow();
            fromCache = true;
            LOG.warn("Reading source unavailable; building {} report from cached dataset {}",
                    kind.getKey(), period);
        }

        ReportSummary summary = calculator.summarize(period, window, countAnomalies(window), fromCache);
        publisher.publish(summary);
        LOG.info("Published {}", summary);
    }

    private int countAnomalies(ReadingWindow window) {
        Optional<ProductionModels> production = registry.loadProductionModels();
        OutlierModel outlier = production.map(ProductionModels::getOutlierModel).orElse(null);
        ForecastModel forecast = production.map(ProductionModels::getForecastModel).orElse(null);
        DetectionResult result = engine.detect(window, outlier, forecast, consensusThreshold, false);
        return result.isSuccess() ? result.anomalies().size() : 0;
    }
}
