package com.metersentinel.core.notify;

import com.metersentinel.core.lifecycle.TrainingResult;

/**
 * Receives retraining outcomes.
 *
 * @since 1.0.0
 */
public interface TrainingNotifier {

    /**
     * Called for every attempt that was due, whatever its terminal state.
     */
    void trainingCompleted(TrainingResult result);

    /**
     * Operator alert for failures that threaten production model state.
     */
    void alert(String subject, String detail);
}
