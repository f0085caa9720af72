package com.metersentinel.scheduler;

import java.time.ZonedDateTime;

/**
 * Logical fire times of a scheduled job, independent of any scheduler
 * library or cron syntax.
 *
 * @since 1.0.0
 */
public interface Trigger {

    /**
     * @param after reference time, in the scheduler's zone
     * @return the first fire time strictly after {@code after}
     */
    ZonedDateTime nextFireAfter(ZonedDateTime after);

    /**
     * @return human-readable schedule, for logs and {@code /status}
     */
    String describe();
}
