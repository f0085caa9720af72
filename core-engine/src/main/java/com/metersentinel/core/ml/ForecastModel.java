package com.metersentinel.core.ml;

import com.metersentinel.core.model.Reading;

import java.time.Instant;
import java.util.List;

/**
 * Point forecast of active power.
 *
 * @since 1.0.0
 */
public interface ForecastModel {

    /**
     * @param timestamp instant to forecast
     * @return predicted active power in kW
     */
    double predict(Instant timestamp);

    /**
     * Forecast every reading's timestamp.
     *
     * @param readings readings whose timestamps are forecast
     * @return predictions in reading order
     */
    default double[] predictAll(List<Reading> readings) {
        double[] predictions = new double[readings.size()];
        for (int i = 0; i < predictions.length; i++) {
            predictions[i] = predict(readings.get(i).getTimestamp());
        }
        return predictions;
    }
}
