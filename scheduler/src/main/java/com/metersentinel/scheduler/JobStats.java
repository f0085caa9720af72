package com.metersentinel.scheduler;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-job counters and last-cycle details, exposed on {@code /status}.
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({"schedule", "lastStatus", "executed", "failed", "skipped", "lastStartedAt",
        "lastDurationMs", "lastError", "nextFireAt"})
public final class JobStats {

    private final String schedule;
    private final AtomicLong executed = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong skipped = new AtomicLong();
    private volatile JobStatus lastStatus = JobStatus.NEVER_RUN;
    private volatile Instant lastStartedAt;
    private volatile long lastDurationMs;
    private volatile String lastError;
    private volatile Instant nextFireAt;

    JobStats(String schedule) {
        this.schedule = schedule;
    }

    void started(Instant at) {
        lastStartedAt = at;
        lastStatus = JobStatus.RUNNING;
    }

    void succeeded(Duration took) {
        executed.incrementAndGet();
        lastDurationMs = took.toMillis();
        lastError = null;
        lastStatus = JobStatus.SUCCEEDED;
    }

    void failed(Duration took, Throwable error) {
        executed.incrementAndGet();
        failed.incrementAndGet();
        lastDurationMs = took.toMillis();
        lastError = error.getClass().getSimpleName() + ": " + error.getMessage();
        lastStatus = JobStatus.FAILED;
    }

    void skipped() {
        skipped.incrementAndGet();
    }

    void nextFireAt(Instant at) {
        nextFireAt = at;
    }

    public String getSchedule() {
        return schedule;
    }

    public long getExecuted() {
        return executed.get();
    }

    public long getFailed() {
        return failed.get();
    }

    public long getSkipped() {
        return skipped.get();
    }

    /**
     * A skip leaves this unchanged; it reflects the last cycle that ran.
     */
    public JobStatus getLastStatus() {
        return lastStatus;
    }

    public Instant getLastStartedAt() {
        return lastStartedAt;
    }

    public long getLastDurationMs() {
        return lastDurationMs;
    }

    public String getLastError() {
        return lastError;
    }

    public Instant getNextFireAt() {
        return nextFireAt;
    }
}
