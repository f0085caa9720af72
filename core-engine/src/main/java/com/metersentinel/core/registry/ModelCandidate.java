package com.metersentinel.core.registry;

import com.metersentinel.core.ml.ForestOutlierModel;
import com.metersentinel.core.ml.ModelMetrics;
import com.metersentinel.core.ml.SeasonalForecastModel;

import java.time.Instant;
import java.util.Objects;

/**
 * Newly trained and evaluated models awaiting a promotion decision.
 *
 * @since 1.0.0
 */
public final class ModelCandidate {

    private final String versionId;
    private final Instant trainedAt;
    private final SeasonalForecastModel forecastModel;
    private final ForestOutlierModel outlierModel;
    private final ModelMetrics metrics;
    private final int trainingRecordCount;

    public ModelCandidate(String versionId, Instant trainedAt, SeasonalForecastModel forecastModel,
            ForestOutlierModel outlierModel, ModelMetrics metrics, int trainingRecordCount) {
        this.versionId = Objects.requireNonNull(versionId, "versionId must not be null");
        this.trainedAt = Objects.requireNonNull(trainedAt, "trainedAt must not be null");
        this.forecastModel = Objects.requireNonNull(forecastModel, "forecastModel must not be null");
        this.outlierModel = Objects.requireNonNull(outlierModel, "outlierModel must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.trainingRecordCount = trainingRecordCount;
    }

    public String getVersionId() {
        return versionId;
    }

    public Instant getTrainedAt() {
        return trainedAt;
    }

    public SeasonalForecastModel getForecastModel() {
        return forecastModel;
    }

    public ForestOutlierModel getOutlierModel() {
        return outlierModel;
    }

    public ModelMetrics getMetrics() {
        return metrics;
    }

    public int getTrainingRecordCount() {
        return trainingRecordCount;
    }
}
