package com.metersentinel.core.training;

import com.metersentinel.core.error.DataQualityException;
import com.metersentinel.core.error.TrainingFailureException;
import com.metersentinel.core.ml.ModelMetrics;
import com.metersentinel.core.model.ReadingWindow;

/**
 * Validates, cleans, fits and evaluates models for one retraining attempt.
 *
 * <p>
 * Each step maps onto a state of the retraining state machine, so the
 * lifecycle manager can log and time them separately.
 * </p>
 *
 * @since 1.0.0
 */
public interface Trainer {

    /**
     * @param window raw training window
     * @return report listing every quality violation
     */
    ValidationReport validate(ReadingWindow window);

    /**
     * @param window validated window
     * @return cleaned window
     * @throws DataQualityException if the window cannot be cleaned
     */
    ReadingWindow preprocess(ReadingWindow window);

    /**
     * Fit the forecaster on the training split and the outlier model on the
     * whole cleaned window.
     *
     * @param cleaned preprocessed window
     * @return fitted models and the held-out test split
     * @throws TrainingFailureException if fitting fails
     */
    TrainedModels fit(ReadingWindow cleaned);

    /**
     * @param models fitted models
     * @return forecast metrics on the held-out split
     * @throws TrainingFailureException if the metrics are not finite
     */
    ModelMetrics evaluate(TrainedModels models);
}
