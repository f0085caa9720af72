package com.metersentinel.core;

import com.metersentinel.core.config.TrainingSettings;
import com.metersentinel.core.ml.ForestOutlierModel;
import com.metersentinel.core.ml.ModelMetrics;
import com.metersentinel.core.ml.SeasonalForecastModel;
import com.metersentinel.core.model.Reading;
import com.metersentinel.core.registry.ModelCandidate;
import com.metersentinel.core.training.TrainedModels;

import java.time.ZoneOffset;
import java.util.List;

/**
 * Small trained models for registry and lifecycle tests.
 */
public final class TestModels {

    private TestModels() {
    }

    public static TrainedModels trained() {
        List<Reading> history = TestReadings.hourlyPattern(7);
        TrainingSettings settings = new TrainingSettings();
        settings.setNumberOfTrees(10);
        settings.setSampleSize(64);
        return new TrainedModels(
                SeasonalForecastModel.fit(history, ZoneOffset.UTC),
                ForestOutlierModel.train(history, settings, ZoneOffset.UTC),
                history.size(),
                history.subList(history.size() - 24, history.size()));
    }

    public static ModelCandidate candidate(String versionId, double mae, double rmse) {
        TrainedModels models = trained();
        return new ModelCandidate(versionId, TestReadings.START, models.getForecastModel(),
                models.getOutlierModel(), metrics(mae, rmse), models.getTrainingRecordCount());
    }

    public static ModelMetrics metrics(double mae, double rmse) {
        return new ModelMetrics(mae, rmse, 10.0, 0.8);
    }
}
