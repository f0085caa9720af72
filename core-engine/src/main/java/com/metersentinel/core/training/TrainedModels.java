package com.metersentinel.core.training;

import com.metersentinel.core.ml.ForestOutlierModel;
import com.metersentinel.core.ml.SeasonalForecastModel;
import com.metersentinel.core.model.Reading;

import java.util.List;
import java.util.Objects;

/**
 * Freshly fitted models plus the holdout split they will be evaluated on.
 *
 * <p>
 * Nothing here is persisted until the lifecycle manager decides the models'
 * fate.
 * </p>
 *
 * @since 1.0.0
 */
public final class TrainedModels {

    private final SeasonalForecastModel forecastModel;
    private final ForestOutlierModel outlierModel;
    private final int trainingRecordCount;
    private final List<Reading> testSet;

    public TrainedModels(SeasonalForecastModel forecastModel, ForestOutlierModel outlierModel,
            int trainingRecordCount, List<Reading> testSet) {
        this.forecastModel = Objects.requireNonNull(forecastModel, "forecastModel must not be null");
        this.outlierModel = Objects.requireNonNull(outlierModel, "outlierModel must not be null");
        this.trainingRecordCount = trainingRecordCount;
        this.testSet = List.copyOf(testSet);
    }

    public SeasonalForecastModel getForecastModel() {
        return forecastModel;
    }

    public ForestOutlierModel getOutlierModel() {
        return outlierModel;
    }

    public int getTrainingRecordCount() {
        return trainingRecordCount;
    }

    public List<Reading> getTestSet() {
        return testSet;
    }
}
