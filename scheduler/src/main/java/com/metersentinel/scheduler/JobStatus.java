package com.metersentinel.scheduler;

/**
 * Outcome of a job cycle.
 *
 * @since 1.0.0
 */
public enum JobStatus {
    NEVER_RUN,
    RUNNING,
    SUCCEEDED,
    FAILED,
    /** Trigger fired while the previous cycle was still running. */
    SKIPPED
}
