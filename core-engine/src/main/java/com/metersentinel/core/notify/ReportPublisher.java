package com.metersentinel.core.notify;

import com.metersentinel.core.report.ReportSummary;

/**
 * Renders or delivers a report summary.
 *
 * @since 1.0.0
 */
public interface ReportPublisher {

    void publish(ReportSummary summary);
}
