package com.metersentinel.scheduler;

import com.metersentinel.core.lifecycle.ModelLifecycleManager;
import com.metersentinel.core.lifecycle.TrainingResult;
import com.metersentinel.core.notify.TrainingNotifier;
import com.metersentinel.core.registry.RetrainingState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Daily retraining check. Delegates the attempt to the lifecycle manager and
 * forwards the outcome; raises an operator alert when promotion left the
 * registry inconsistent.
 *
 * @since 1.0.0
 */
public class RetrainingCheckJob implements Job {

    public static final String NAME = "retraining-check";

    private static final Logger LOG = LoggerFactory.getLogger(RetrainingCheckJob.class);

    private final ModelLifecycleManager manager;
    private final TrainingNotifier notifier;

    public RetrainingCheckJob(ModelLifecycleManager manager, TrainingNotifier notifier) {
        this.manager = Objects.requireNonNull(manager, "manager must not be null");
        this.notifier = Objects.requireNonNull(notifier, "notifier must not be null");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void run() {
        TrainingResult result = manager.runRetrainingCycle(false);
        if (!result.isDue()) {
            return;
        }
        if (result.getTerminalState() == RetrainingState.FETCH_DATA) {
            LOG.warn("Retraining deferred to the next check: {}", result.getErrorMessage().orElse(""));
            return;
        }

        LOG.info("Retraining finished: {}", result);
        notifier.trainingCompleted(result);
        if (result.requiresAlert()) {
            notifier.alert("Model promotion failed",
                    "Production models may be inconsistent after attempt "
                            + result.getVersionId().orElse("?") + ": "
                            + result.getErrorMessage().orElse("unknown error"));
        }
    }
}
