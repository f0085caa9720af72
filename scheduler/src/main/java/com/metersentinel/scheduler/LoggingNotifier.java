package com.metersentinel.scheduler;

import com.metersentinel.core.lifecycle.TrainingResult;
import com.metersentinel.core.model.AnomalyCategory;
import com.metersentinel.core.model.AnomalyVerdict;
import com.metersentinel.core.model.ReadingWindow;
import com.metersentinel.core.model.SeverityTier;
import com.metersentinel.core.notify.AnomalyNotifier;
import com.metersentinel.core.notify.TrainingNotifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Notifier that writes to the log. Critical anomalies and alerts go out at
 * ERROR so log-based alerting can pick them up.
 *
 * @since 1.0.0
 */
public class LoggingNotifier implements AnomalyNotifier, TrainingNotifier {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingNotifier.class);

    @Override
    public void notifyAnomalies(ReadingWindow window, List<AnomalyVerdict> verdicts) {
        LOG.info("{} anomal(ies) to report in [{}, {})", verdicts.size(), window.getStart(), window.getEnd());
        for (AnomalyVerdict v : verdicts) {
            String category = v.getCategory().map(AnomalyCategory::getLabel).orElse("unclassified");
            if (v.getSeverity() == SeverityTier.CRITICAL) {
                LOG.error("CRITICAL anomaly at {}: {} kW, {} (score {}, {} vote(s))",
                        v.getTimestamp(), v.getActivePowerKw(), category, Math.round(v.getScore()), v.getVotes());
            } else {
                LOG.warn("{} anomaly at {}: {} kW, {} (score {}, {} vote(s))", v.getSeverity(),
                        v.getTimestamp(), v.getActivePowerKw(), category, Math.round(v.getScore()), v.getVotes());
            }
        }
    }

    @Override
    public void trainingCompleted(TrainingResult result) {
        if (result.isSuccess()) {
            LOG.info("Training {} ended in {} ({}); MAE delta {}, RMSE delta {}",
                    result.getVersionId().orElse("-"), result.getTerminalState(),
                    result.getDecision().map(Enum::name).orElse("-"),
                    result.getMaeDelta().map(LoggingNotifier::signed).orElse("n/a"),
                    result.getRmseDelta().map(LoggingNotifier::signed).orElse("n/a"));
        } else {
            LOG.warn("Training {} ended in {}: {} {}", result.getVersionId().orElse("-"),
                    result.getTerminalState(), result.getErrorKind().map(Enum::name).orElse("-"),
                    result.getErrorMessage().orElse(""));
        }
    }

    @Override
    public void alert(String subject, String detail) {
        LOG.error("ALERT {}: {}", subject, detail);
    }

    private static String signed(double delta) {
        return String.format("%+.4f", delta);
    }
}
