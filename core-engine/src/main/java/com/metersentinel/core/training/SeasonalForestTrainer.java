package com.metersentinel.core.training;

import com.metersentinel.core.config.SentinelConfig;
import com.metersentinel.core.config.TrainingSettings;
import com.metersentinel.core.error.TrainingFailureException;
import com.metersentinel.core.ml.ForestOutlierModel;
import com.metersentinel.core.ml.MetricsCalculator;
import com.metersentinel.core.ml.ModelMetrics;
import com.metersentinel.core.ml.SeasonalForecastModel;
import com.metersentinel.core.model.Reading;
import com.metersentinel.core.model.ReadingWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Objects;

/**
 * Default {@link Trainer}: a {@link SeasonalForecastModel} for forecasting and
 * a {@link ForestOutlierModel} for outliers.
 *
 * <h3>Holdout split</h3>
 * <p>
 * The last {@code testDays} of the window are held out. When that would
 * leave less than half the data for training, the last {@code testFraction}
 * of readings is held out instead.
 * </p>
 *
 * @since 1.0.0
 */
public class SeasonalForestTrainer implements Trainer {

    private static final Logger LOG = LoggerFactory.getLogger(SeasonalForestTrainer.class);

    private final TrainingSettings settings;
    private final DataQualityValidator validator;
    private final Preprocessor preprocessor;
    private final ZoneId zone;

    public SeasonalForestTrainer(SentinelConfig config, ZoneId zone) {
        Objects.requireNonNull(config, "config must not be null");
        this.settings = config.getTraining();
        this.validator = new DataQualityValidator(config.getValidation());
        this.preprocessor = new Preprocessor(config.getTraining(), config.getClassification());
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
    }

    @Override
    public ValidationReport validate(ReadingWindow window) {
        return validator.validate(window);
    }

    @Override
    public ReadingWindow preprocess(ReadingWindow window) {
        return preprocessor.clean(window);
    }

    @Override
    public TrainedModels fit(ReadingWindow cleaned) {
        Objects.requireNonNull(cleaned, "cleaned window must not be null");
        List<Reading> readings = cleaned.getReadings();
        int split = splitIndex(readings);
        List<Reading> train = readings.subList(0, split);
        List<Reading> test = readings.subList(split, readings.size());
        LOG.info("Training split: {} train / {} test reading(s)", train.size(), test.size());

        try {
            SeasonalForecastModel forecast = SeasonalForecastModel.fit(train, zone);
            ForestOutlierModel outlier = ForestOutlierModel.train(readings, settings, zone);
            return new TrainedModels(forecast, outlier, readings.size(), test);
        } catch (RuntimeException e) {
            throw new TrainingFailureException("Model fitting failed: " + e.getMessage(), e);
        }
    }

    @Override
    public ModelMetrics evaluate(TrainedModels models) {
        List<Reading> test = models.getTestSet();
        if (test.isEmpty()) {
            throw new TrainingFailureException("Empty test split; cannot evaluate");
        }
        double[] actual = new double[test.size()];
        for (int i = 0; i < actual.length; i++) {
            actual[i] = test.get(i).getActivePowerKw();
        }
        double[] predicted = models.getForecastModel().predictAll(test);
        ModelMetrics metrics = MetricsCalculator.evaluate(actual, predicted);
        if (!Double.isFinite(metrics.getMae()) || !Double.isFinite(metrics.getRmse())) {
            throw new TrainingFailureException("Evaluation produced non-finite metrics: " + metrics);
        }
        LOG.info("Evaluation on {} held-out reading(s): {}", test.size(), metrics);
        return metrics;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    int splitIndex(List<Reading> readings) {
        int n = readings.size();
        if (n < 2) {
            throw new TrainingFailureException("Need at least two readings to split, got: " + n);
        }
        Instant cutoff = readings.get(n - 1).getTimestamp().minus(Duration.ofDays(settings.getTestDays()));
        int split = n;
        for (int i = 0; i < n; i++) {
            if (readings.get(i).getTimestamp().isAfter(cutoff)) {
                split = i;
                break;
            }
        }
        if (split < n / 2 || split >= n) {
            split = n - Math.max(1, (int) Math.round(n * settings.getTestFraction()));
        }
        return split;
    }
}
