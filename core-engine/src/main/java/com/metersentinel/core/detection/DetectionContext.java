package com.metersentinel.core.detection;

import com.metersentinel.core.ml.ForecastModel;
import com.metersentinel.core.ml.OutlierModel;
import com.metersentinel.core.model.Reading;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Input shared by every {@link WindowDetector} in one detection run.
 *
 * <p>
 * Holds only the physically plausible readings of the window; data defects
 * have already been removed by the engine. Models are optional: a detector
 * whose model is absent votes {@code false} everywhere.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectionContext {

    private final List<Reading> readings;
    private final double[] values;
    private final OutlierModel outlierModel;
    private final ForecastModel forecastModel;

    public DetectionContext(List<Reading> readings, OutlierModel outlierModel, ForecastModel forecastModel) {
        this.readings = List.copyOf(Objects.requireNonNull(readings, "readings must not be null"));
        this.values = new double[this.readings.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = this.readings.get(i).getActivePowerKw();
        }
        this.outlierModel = outlierModel;
        this.forecastModel = forecastModel;
    }

    public List<Reading> getReadings() {
        return readings;
    }

    /**
     * @return active power of every reading; callers must not modify it
     */
    public double[] getValues() {
        return values;
    }

    public int size() {
        return values.length;
    }

    public Optional<OutlierModel> getOutlierModel() {
        return Optional.ofNullable(outlierModel);
    }

    public Optional<ForecastModel> getForecastModel() {
        return Optional.ofNullable(forecastModel);
    }
}
