package com.metersentinel.core.notify;

import com.metersentinel.core.model.AnomalyVerdict;
import com.metersentinel.core.model.ReadingWindow;

import java.util.List;

/**
 * Receives confirmed anomalies worth notifying (severity MEDIUM and above).
 *
 * <p>
 * Delivery is fire-and-forget: implementations must not throw for transport
 * problems, only log them.
 * </p>
 *
 * @since 1.0.0
 */
public interface AnomalyNotifier {

    /**
     * @param window   the scanned window, for reading context
     * @param verdicts notifiable verdicts, never empty
     */
    void notifyAnomalies(ReadingWindow window, List<AnomalyVerdict> verdicts);
}
