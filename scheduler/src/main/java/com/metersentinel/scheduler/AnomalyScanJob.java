package com.metersentinel.scheduler;

import com.metersentinel.core.config.SentinelConfig;
import com.metersentinel.core.detection.AnomalyConsensusEngine;
import com.metersentinel.core.detection.DetectionResult;
import com.metersentinel.core.error.SourceUnavailableException;
import com.metersentinel.core.ml.ForecastModel;
import com.metersentinel.core.ml.OutlierModel;
import com.metersentinel.core.model.AnomalyVerdict;
import com.metersentinel.core.model.ReadingWindow;
import com.metersentinel.core.notify.AnomalyNotifier;
import com.metersentinel.core.registry.ModelRegistry;
import com.metersentinel.core.registry.ProductionModels;
import com.metersentinel.core.source.ReadingSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Scans the most recent readings with the production models and forwards
 * notifiable anomalies.
 *
 * <p>
 * An unavailable source, an empty window or too few readings end the cycle
 * with a log line; none of them fail the job. Without production models the
 * model-based detectors abstain and the statistical ones still vote.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyScanJob implements Job {

    public static final String NAME = "anomaly-scan";

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyScanJob.class);

    private final ReadingSource source;
    private final ModelRegistry registry;
    private final AnomalyConsensusEngine engine;
    private final AnomalyNotifier notifier;
    private final Duration lookback;
    private final int consensusThreshold;
    private final boolean classify;
    private final Clock clock;

    public AnomalyScanJob(ReadingSource source, ModelRegistry registry, AnomalyConsensusEngine engine,
            AnomalyNotifier notifier, SentinelConfig config, Clock clock) {
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.notifier = Objects.requireNonNull(notifier, "notifier must not be null");
        Objects.requireNonNull(config, "config must not be null");
        this.lookback = Duration.ofMinutes(config.getJobs().getAnomalyScanLookbackMinutes());
        this.consensusThreshold = config.getDetection().getConsensusThreshold();
        this.classify = config.getDetection().isClassify();
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void run() {
        Instant end = clock.instant();
        Instant start = end.minus(lookback);

        Optional<ReadingWindow> fetched;
        try {
            fetched = source.fetch(start, end);
        } catch (SourceUnavailableException e) {
            LOG.warn("Reading source unavailable; skipping anomaly scan: {}", e.getMessage());
            return;
        }
        if (fetched.isEmpty()) {
            LOG.info("No readings in [{}, {}); nothing to scan", start, end);
            return;
        }
        ReadingWindow window = fetched.get();

        Optional<ProductionModels> production = registry.loadProductionModels();
        if (production.isEmpty()) {
            LOG.info("No production models yet; model-based detectors abstain");
        }
        OutlierModel outlier = production.map(ProductionModels::getOutlierModel).orElse(null);
        ForecastModel forecast = production.map(ProductionModels::getForecastModel).orElse(null);

        DetectionResult result = engine.detect(window, outlier, forecast, consensusThreshold, classify);
        if (!result.isSuccess()) {
            LOG.info("Anomaly scan skipped ({}): {}", result.getErrorKind().orElse(null),
                    result.getErrorMessage().orElse(""));
            return;
        }
        if (result.dataDefectCount() > 0) {
            LOG.warn("{} implausible reading(s) in [{}, {}) excluded from detection",
                    result.dataDefectCount(), start, end);
        }

        List<AnomalyVerdict> notifiable = result.notifiable();
        LOG.info("Anomaly scan over {} reading(s): {} confirmed, {} notifiable",
                window.size(), result.anomalies().size(), notifiable.size());
        if (!notifiable.isEmpty()) {
            notifier.notifyAnomalies(window, notifiable);
        }
    }
}
