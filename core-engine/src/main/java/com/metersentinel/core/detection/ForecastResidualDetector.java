package com.metersentinel.core.detection;

import com.metersentinel.core.ml.ForecastModel;
import com.metersentinel.core.model.DetectionMethod;

import java.util.Optional;

/**
 * Flags readings whose deviation from the forecast exceeds a threshold
 * relative to the predicted value.
 *
 * <p>
 * A prediction of zero is floored at {@value #MIN_PREDICTION} kW so an idle
 * forecast still yields a finite relative deviation.
 * </p>
 *
 * @since 1.0.0
 */
public class ForecastResidualDetector implements WindowDetector {

    static final double MIN_PREDICTION = 0.001;

    private final double threshold;

    public ForecastResidualDetector(double threshold) {
        if (threshold <= 0) {
            throw new IllegalArgumentException("Forecast residual threshold must be > 0, got: " + threshold);
        }
        this.threshold = threshold;
    }

    @Override
    public boolean[] detect(DetectionContext context) {
        boolean[] flags = new boolean[context.size()];
        Optional<ForecastModel> model = context.getForecastModel();
        if (model.isEmpty()) {
            return flags;
        }
        double[] values = context.getValues();
        double[] predictions = model.get().predictAll(context.getReadings());
        for (int i = 0; i < flags.length; i++) {
            double baseline = Math.max(Math.abs(predictions[i]), MIN_PREDICTION);
            flags[i] = Math.abs(values[i] - predictions[i]) / baseline > threshold;
        }
        return flags;
    }

    @Override
    public DetectionMethod getMethod() {
        return DetectionMethod.FORECAST_RESIDUAL;
    }
}
