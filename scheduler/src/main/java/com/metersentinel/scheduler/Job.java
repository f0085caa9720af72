package com.metersentinel.scheduler;

/**
 * A unit of scheduled work. Implementations must be safe to run repeatedly;
 * the orchestrator guarantees a job never overlaps itself.
 *
 * @since 1.0.0
 */
public interface Job {

    /**
     * @return unique job name
     */
    String name();

    /**
     * Execute one cycle. Any exception marks this cycle failed and nothing
     * more.
     */
    void run() throws Exception;
}
