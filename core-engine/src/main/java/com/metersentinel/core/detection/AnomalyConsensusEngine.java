package com.metersentinel.core.detection;

import com.metersentinel.core.config.ClassificationSettings;
import com.metersentinel.core.config.SentinelConfig;
import com.metersentinel.core.error.InsufficientDataException;
import com.metersentinel.core.error.MeterSentinelException;
import com.metersentinel.core.ml.ForecastModel;
import com.metersentinel.core.ml.OutlierModel;
import com.metersentinel.core.ml.Statistics;
import com.metersentinel.core.model.AnomalyVerdict;
import com.metersentinel.core.model.DetectionMethod;
import com.metersentinel.core.model.Reading;
import com.metersentinel.core.model.ReadingWindow;
import com.metersentinel.core.model.SeverityTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs the independent detectors over a reading window and turns their votes
 * into per-reading verdicts.
 *
 * <h3>Pipeline</h3>
 * <pre>
 *   window
 *     → split plausible readings from data defects
 *     → every detector votes on the plausible readings
 *     → consensus = votes ≥ threshold
 *     → classify confirmed anomalies (optional)
 *     → score severity of confirmed anomalies
 * </pre>
 *
 * <h3>Consensus trade-off</h3>
 * <p>
 * Requiring several detectors to agree cuts false positives compared with any
 * single method, at the cost of missing anomalies only one method sees. The
 * default of 3 of 5 should only move when labelled data supports it.
 * </p>
 *
 * <h3>Failure semantics</h3>
 * <p>
 * Fewer plausible readings than {@code minReadings} yields a failed
 * {@link DetectionResult} of kind {@code INSUFFICIENT_DATA} and no verdicts.
 * Callers treat that as "skip this run".
 * </p>
 *
 * <p>
 * The engine holds no mutable state; running it twice on the same window and
 * models produces identical verdicts.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyConsensusEngine {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyConsensusEngine.class);

    private final List<WindowDetector> detectors;
    private final AnomalyClassifier classifier;
    private final SeverityScorer scorer;
    private final ClassificationSettings classification;
    private final int minReadings;

    /**
     * Build an engine with the standard five detectors.
     *
     * @param config validated configuration
     */
    public AnomalyConsensusEngine(SentinelConfig config) {
        this(DetectorFactory.createAll(config.getDetection()),
                new AnomalyClassifier(config.getClassification()),
                new SeverityScorer(config.getSeverity(), config.getClassification()),
                config.getClassification(),
                config.getDetection().getMinReadings());
    }

    /**
     * @param detectors      detectors that vote; at least one
     * @param classifier     category rule table
     * @param scorer         severity scorer
     * @param classification plausibility bounds for data-defect screening
     * @param minReadings    minimum plausible readings per run
     */
    public AnomalyConsensusEngine(List<WindowDetector> detectors, AnomalyClassifier classifier,
            SeverityScorer scorer, ClassificationSettings classification, int minReadings) {
        Objects.requireNonNull(detectors, "detectors must not be null");
        if (detectors.isEmpty()) {
            throw new IllegalArgumentException("At least one detector is required");
        }
        this.detectors = List.copyOf(detectors);
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.scorer = Objects.requireNonNull(scorer, "scorer must not be null");
        this.classification = Objects.requireNonNull(classification, "classification must not be null");
        if (minReadings < 1) {
            throw new IllegalArgumentException("minReadings must be >= 1, got: " + minReadings);
        }
        this.minReadings = minReadings;
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Detect without a forecasting model; the forecast-residual detector then
     * votes {@code false} everywhere.
     *
     * @see #detect(ReadingWindow, OutlierModel, ForecastModel, int, boolean)
     */
    public DetectionResult detect(ReadingWindow window, OutlierModel outlierModel,
            int consensusThreshold, boolean classify) {
        return detect(window, outlierModel, null, consensusThreshold, classify);
    }

    /**
     * Run every detector and build one verdict per reading.
     *
     * @param window             readings to examine; must not be {@code null}
     * @param outlierModel       trained outlier model, or {@code null}
     * @param forecastModel      trained forecasting model, or {@code null}
     * @param consensusThreshold votes needed to confirm an anomaly
     * @param classify           whether to categorise confirmed anomalies
     * @return verdicts, or a failure when there are too few readings
     * @throws IllegalArgumentException if {@code consensusThreshold} is not in
     *                                  {@code [1, detectors]}
     */
    public DetectionResult detect(ReadingWindow window, OutlierModel outlierModel, ForecastModel forecastModel,
            int consensusThreshold, boolean classify) {
        Objects.requireNonNull(window, "window must not be null");
        if (consensusThreshold < 1 || consensusThreshold > detectors.size()) {
            throw new IllegalArgumentException("consensusThreshold must be in [1, " + detectors.size()
                    + "], got: " + consensusThreshold);
        }

        try {
            List<AnomalyVerdict> verdicts = run(window, outlierModel, forecastModel, consensusThreshold, classify);
            long confirmed = verdicts.stream().filter(AnomalyVerdict::isConsensus).count();
            LOG.info("Detection over {} reading(s): {} confirmed anomal(ies) at threshold {}",
                    window.size(), confirmed, consensusThreshold);
            return DetectionResult.success(verdicts);
        } catch (MeterSentinelException e) {
            LOG.warn("Detection refused ({}): {}", e.getKind(), e.getMessage());
            return DetectionResult.failure(e.getKind(), e.getMessage());
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private List<AnomalyVerdict> run(ReadingWindow window, OutlierModel outlierModel, ForecastModel forecastModel,
            int consensusThreshold, boolean classify) {
        List<Reading> all = window.getReadings();
        List<Integer> validIndexes = new ArrayList<>();
        List<Reading> valid = new ArrayList<>();
        for (int i = 0; i < all.size(); i++) {
            Reading r = all.get(i);
            if (r.isPhysicallyPlausible(classification.getPlausibleVoltageMin(),
                    classification.getPlausibleVoltageMax(), classification.getMaxPlausiblePowerKw())) {
                validIndexes.add(i);
                valid.add(r);
            }
        }

        if (valid.size() < minReadings) {
            throw new InsufficientDataException("Need at least " + minReadings
                    + " plausible readings, got " + valid.size() + " of " + all.size());
        }
        if (valid.size() < all.size()) {
            LOG.warn("Excluded {} physically implausible reading(s) from voting", all.size() - valid.size());
        }

        DetectionContext context = new DetectionContext(valid, outlierModel, forecastModel);
        Map<DetectionMethod, boolean[]> votes = new EnumMap<>(DetectionMethod.class);
        for (WindowDetector detector : detectors) {
            boolean[] flags = detector.detect(context);
            if (flags.length != valid.size()) {
                throw new IllegalStateException(detector.getMethod() + " returned " + flags.length
                        + " flags for " + valid.size() + " readings");
            }
            votes.put(detector.getMethod(), flags);
            LOG.debug("{} flagged {} reading(s)", detector.getMethod(), count(flags));
        }

        boolean[] confirmed = new boolean[valid.size()];
        for (int i = 0; i < confirmed.length; i++) {
            int n = 0;
            for (boolean[] flags : votes.values()) {
                if (flags[i]) {
                    n++;
                }
            }
            confirmed[i] = n >= consensusThreshold;
        }

        AnomalyClassifier.ClassifiedWindow classified = classify ? classifier.prepare(valid) : null;
        double median = Statistics.median(context.getValues());

        List<AnomalyVerdict> verdicts = new ArrayList<>(all.size());
        int next = 0;
        for (int i = 0; i < all.size(); i++) {
            Reading reading = all.get(i);
            AnomalyVerdict.Builder builder = AnomalyVerdict.builder()
                    .index(i)
                    .timestamp(reading.getTimestamp())
                    .activePowerKw(reading.getActivePowerKw());

            if (next >= validIndexes.size() || validIndexes.get(next) != i) {
                verdicts.add(builder.dataDefect(true).severity(SeverityTier.LOW).build());
                continue;
            }

            int v = next++;
            for (Map.Entry<DetectionMethod, boolean[]> entry : votes.entrySet()) {
                builder.flag(entry.getKey(), entry.getValue()[v]);
            }
            if (confirmed[v]) {
                double score = scorer.score(reading, median, runLength(confirmed, v));
                builder.consensus(true).score(score).severity(scorer.tier(score));
                if (classified != null) {
                    builder.category(classified.classify(v));
                }
            }
            verdicts.add(builder.build());
        }
        return verdicts;
    }

    private static int runLength(boolean[] confirmed, int index) {
        int start = index;
        while (start > 0 && confirmed[start - 1]) {
            start--;
        }
        int end = index;
        while (end < confirmed.length - 1 && confirmed[end + 1]) {
            end++;
        }
        return end - start + 1;
    }

    private static int count(boolean[] flags) {
        int n = 0;
        for (boolean f : flags) {
            if (f) {
                n++;
            }
        }
        return n;
    }
}
