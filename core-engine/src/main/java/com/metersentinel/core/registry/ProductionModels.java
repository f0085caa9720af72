package com.metersentinel.core.registry;

import com.metersentinel.core.ml.ForecastModel;
import com.metersentinel.core.ml.OutlierModel;

import java.util.Objects;

/**
 * The models referenced by one production snapshot, loaded together so a
 * reader never pairs a forecaster from one version with an outlier model from
 * another.
 *
 * @since 1.0.0
 */
public final class ProductionModels {

    private final ProductionSnapshot snapshot;
    private final ForecastModel forecastModel;
    private final OutlierModel outlierModel;

    public ProductionModels(ProductionSnapshot snapshot, ForecastModel forecastModel, OutlierModel outlierModel) {
        this.snapshot = Objects.requireNonNull(snapshot, "snapshot must not be null");
        this.forecastModel = Objects.requireNonNull(forecastModel, "forecastModel must not be null");
        this.outlierModel = Objects.requireNonNull(outlierModel, "outlierModel must not be null");
    }

    public ProductionSnapshot getSnapshot() {
        return snapshot;
    }

    public ForecastModel getForecastModel() {
        return forecastModel;
    }

    public OutlierModel getOutlierModel() {
        return outlierModel;
    }
}
