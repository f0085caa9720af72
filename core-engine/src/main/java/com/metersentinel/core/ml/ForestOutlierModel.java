package com.metersentinel.core.ml;

import com.amazon.randomcutforest.RandomCutForest;
import com.amazon.randomcutforest.state.RandomCutForestMapper;
import com.metersentinel.core.config.TrainingSettings;
import com.metersentinel.core.model.Reading;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outlier model backed by a Random Cut Forest.
 *
 * <h3>Features</h3>
 * <p>
 * Each reading becomes a five-dimensional point: active power, voltage,
 * current, hour of day and day of week. Every dimension is standardised with
 * the training mean and standard deviation; a missing value maps to the mean.
 * </p>
 *
 * <h3>Decision threshold</h3>
 * <p>
 * After the forest has absorbed the whole training window, training points
 * are scored and the {@code (1 - contamination)} quantile of those scores
 * becomes the threshold, so roughly {@code contamination} of normal traffic
 * is expected to be flagged.
 * </p>
 *
 * <h3>Determinism</h3>
 * <p>
 * Scoring never updates the forest. The same reading always receives the same
 * score, and a model restored from {@link #toState()} keeps its trees intact.
 * </p>
 *
 * @since 1.0.0
 */
public class ForestOutlierModel implements OutlierModel {

    private static final Logger LOG = LoggerFactory.getLogger(ForestOutlierModel.class);

    static final int DIMENSIONS = 5;

    /** Upper bound on the number of training points scored for the threshold. */
    static final int MAX_THRESHOLD_SAMPLES = 20_000;

    private final RandomCutForest forest;
    private final ZoneId zone;
    private final double[] means;
    private final double[] scales;
    private final double threshold;
    private final double contamination;
    private final long randomSeed;

    private ForestOutlierModel(RandomCutForest forest, ZoneId zone, double[] means, double[] scales,
            double threshold, double contamination, long randomSeed) {
        this.forest = forest;
        this.zone = zone;
        this.means = means;
        this.scales = scales;
        this.threshold = threshold;
        this.contamination = contamination;
        this.randomSeed = randomSeed;
    }

    // ---------------------------------------------------------------
    // Training
    // ---------------------------------------------------------------

    /**
     * Train a forest on the given readings.
     *
     * @param readings cleaned training readings; at least {@code sampleSize}
     * @param settings forest shape and contamination
     * @param zone     zone used to derive hour and day of week
     * @return trained model
     * @throws IllegalArgumentException if there are fewer readings than the
     *                                  forest's sample size
     */
    public static ForestOutlierModel train(List<Reading> readings, TrainingSettings settings, ZoneId zone) {
        Objects.requireNonNull(readings, "readings must not be null");
        Objects.requireNonNull(settings, "settings must not be null");
        Objects.requireNonNull(zone, "zone must not be null");
        if (readings.size() < settings.getSampleSize()) {
            throw new IllegalArgumentException("Outlier model needs at least " + settings.getSampleSize()
                    + " readings, got: " + readings.size());
        }

        double[][] raw = new double[readings.size()][];
        for (int i = 0; i < raw.length; i++) {
            raw[i] = rawFeatures(readings.get(i), zone);
        }

        double[] means = new double[DIMENSIONS];
        double[] scales = new double[DIMENSIONS];
        double[] column = new double[raw.length];
        for (int d = 0; d < DIMENSIONS; d++) {
            for (int i = 0; i < raw.length; i++) {
                column[i] = raw[i][d];
            }
            double mean = Statistics.mean(column);
            double std = Statistics.sampleStdDev(column);
            means[d] = Double.isFinite(mean) ? mean : 0.0;
            scales[d] = Double.isFinite(std) && std > 0 ? std : 1.0;
        }

        RandomCutForest forest = RandomCutForest.builder()
                .dimensions(DIMENSIONS)
                .numberOfTrees(settings.getNumberOfTrees())
                .sampleSize(settings.getSampleSize())
                .randomSeed(settings.getRandomSeed())
                .parallelExecutionEnabled(false)
                .build();

        double[][] points = new double[raw.length][];
        for (int i = 0; i < raw.length; i++) {
            points[i] = normalise(raw[i], means, scales);
            forest.update(points[i]);
        }

        int stride = Math.max(1, points.length / MAX_THRESHOLD_SAMPLES);
        double[] scores = new double[(points.length + stride - 1) / stride];
        for (int i = 0, j = 0; i < points.length; i += stride, j++) {
            scores[j] = forest.getAnomalyScore(points[i]);
        }
        double threshold = Statistics.quantile(scores, 1.0 - settings.getContamination());

        LOG.info("Trained outlier forest on {} readings (trees={}, sampleSize={}, threshold={})",
                points.length, settings.getNumberOfTrees(), settings.getSampleSize(),
                String.format("%.4f", threshold));
        return new ForestOutlierModel(forest, zone, means, scales, threshold,
                settings.getContamination(), settings.getRandomSeed());
    }

    // ---------------------------------------------------------------
    // OutlierModel
    // ---------------------------------------------------------------

    @Override
    public synchronized double score(Reading reading) {
        Objects.requireNonNull(reading, "reading must not be null");
        return forest.getAnomalyScore(normalise(rawFeatures(reading, zone), means, scales));
    }

    @Override
    public double getThreshold() {
        return threshold;
    }

    /**
     * @return descriptive metadata stored alongside the artifact
     */
    public Map<String, Double> describe() {
        Map<String, Double> meta = new LinkedHashMap<>();
        meta.put("contamination", contamination);
        meta.put("numberOfTrees", (double) forest.getNumberOfTrees());
        meta.put("sampleSize", (double) forest.getSampleSize());
        meta.put("threshold", threshold);
        return meta;
    }

    // ---------------------------------------------------------------
    // Persistence
    // ---------------------------------------------------------------

    /**
     * @return snapshot including full tree state
     */
    public synchronized ForestOutlierState toState() {
        ForestOutlierState state = new ForestOutlierState();
        state.setZoneId(zone.getId());
        state.setMeans(means.clone());
        state.setScales(scales.clone());
        state.setThreshold(threshold);
        state.setContamination(contamination);
        state.setRandomSeed(randomSeed);
        state.setForest(mapper().toState(forest));
        return state;
    }

    /**
     * Restore a model from a snapshot.
     *
     * @param state snapshot produced by {@link #toState()}
     * @return restored model
     */
    public static ForestOutlierModel fromState(ForestOutlierState state) {
        Objects.requireNonNull(state, "state must not be null");
        Objects.requireNonNull(state.getForest(), "forest state must not be null");
        RandomCutForest forest = mapper().toModel(state.getForest(), state.getRandomSeed());
        return new ForestOutlierModel(forest, ZoneId.of(state.getZoneId()), state.getMeans().clone(),
                state.getScales().clone(), state.getThreshold(), state.getContamination(),
                state.getRandomSeed());
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static RandomCutForestMapper mapper() {
        RandomCutForestMapper mapper = new RandomCutForestMapper();
        mapper.setSaveExecutorContextEnabled(true);
        mapper.setSaveTreeStateEnabled(true);
        return mapper;
    }

    static double[] rawFeatures(Reading reading, ZoneId zone) {
        ZonedDateTime local = reading.getTimestamp().atZone(zone);
        return new double[] {
                reading.getActivePowerKw(),
                reading.getVoltage(),
                reading.getCurrentA(),
                local.getHour(),
                local.getDayOfWeek().getValue() - 1
        };
    }

    private static double[] normalise(double[] raw, double[] means, double[] scales) {
        double[] point = new double[raw.length];
        for (int d = 0; d < raw.length; d++) {
            point[d] = Double.isFinite(raw[d]) ? (raw[d] - means[d]) / scales[d] : 0.0;
        }
        return point;
    }

    @Override
    public String toString() {
        return "ForestOutlierModel{threshold=" + threshold
                + ", contamination=" + contamination
                + ", means=" + Arrays.toString(means) + '}';
    }
}
