/**
 * Scheduler process for Meter Sentinel.
 *
 * <p>
 * Wires the core engine, lifecycle manager and reporting into five
 * time-triggered jobs with per-job mutual exclusion.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.metersentinel.scheduler.MeterSentinelApp}: main entry
 * point</li>
 * <li>{@link com.metersentinel.scheduler.JobOrchestrator}: timer, worker pool
 * and per-job locks</li>
 * <li>{@link com.metersentinel.scheduler.SchedulerConfig}: environment-driven
 * configuration</li>
 * <li>{@link com.metersentinel.scheduler.HealthServer}: HTTP health, readiness
 * and status endpoints</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.metersentinel.scheduler;
