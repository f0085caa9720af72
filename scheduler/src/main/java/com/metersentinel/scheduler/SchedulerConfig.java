package com.metersentinel.scheduler;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Typed, immutable process-level configuration for the scheduler.
 *
 * <p>
 * Values are resolved from environment variables with defaults. Detection,
 * training and schedule tuning live in the YAML file that
 * {@link #getSentinelConfigPath()} points to.
 * </p>
 *
 * <h3>Environment</h3>
 * <ul>
 * <li>{@code HEALTH_PORT} (8080)</li>
 * <li>{@code REGISTRY_DIR} ({@code ./models})</li>
 * <li>{@code READINGS_CSV_PATH} ({@code ./data/household_power_consumption.txt})</li>
 * <li>{@code REPORT_OUTPUT_DIR} ({@code ./reports})</li>
 * <li>{@code SCHEDULER_TIMEZONE} ({@code UTC})</li>
 * <li>{@code SCHEDULER_WORKER_THREADS} (5)</li>
 * <li>{@code SENTINEL_CONFIG_PATH} (empty: classpath default)</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class SchedulerConfig {

    private final int healthPort;
    private final String registryDir;
    private final String readingsCsvPath;
    private final String reportOutputDir;
    private final ZoneId zone;
    private final int workerThreads;
    private final String sentinelConfigPath;

    private SchedulerConfig(Builder b) {
        this.healthPort = b.healthPort;
        this.registryDir = b.registryDir;
        this.readingsCsvPath = b.readingsCsvPath;
        this.reportOutputDir = b.reportOutputDir;
        this.zone = b.zone;
        this.workerThreads = b.workerThreads;
        this.sentinelConfigPath = b.sentinelConfigPath;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * @return configuration resolved from environment variables
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static SchedulerConfig fromEnvironment() {
        try {
            return new Builder()
                    .healthPort(parseIntEnv("HEALTH_PORT", "8080"))
                    .registryDir(env("REGISTRY_DIR", "./models"))
                    .readingsCsvPath(env("READINGS_CSV_PATH", "./data/household_power_consumption.txt"))
                    .reportOutputDir(env("REPORT_OUTPUT_DIR", "./reports"))
                    .zone(ZoneId.of(env("SCHEDULER_TIMEZONE", "UTC")))
                    .workerThreads(parseIntEnv("SCHEDULER_WORKER_THREADS", "5"))
                    .sentinelConfigPath(env("SENTINEL_CONFIG_PATH", ""))
                    .build();
        } catch (NumberFormatException | DateTimeException e) {
            throw new IllegalStateException(
                    "Failed to parse environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public int getHealthPort() {
        return healthPort;
    }

    public String getRegistryDir() {
        return registryDir;
    }

    public String getReadingsCsvPath() {
        return readingsCsvPath;
    }

    public String getReportOutputDir() {
        return reportOutputDir;
    }

    public ZoneId getZone() {
        return zone;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public String getSentinelConfigPath() {
        return sentinelConfigPath;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder. {@link #build()} checks the port range, a positive
     * worker count and non-blank paths.
     */
    public static class Builder {
        private int healthPort = 8080;
        private String registryDir = "./models";
        private String readingsCsvPath = "./data/household_power_consumption.txt";
        private String reportOutputDir = "./reports";
        private ZoneId zone = ZoneId.of("UTC");
        private int workerThreads = 5;
        private String sentinelConfigPath = "";

        public Builder healthPort(int v) {
            this.healthPort = v;
            return this;
        }

        public Builder registryDir(String v) {
            this.registryDir = v;
            return this;
        }

        public Builder readingsCsvPath(String v) {
            this.readingsCsvPath = v;
            return this;
        }

        public Builder reportOutputDir(String v) {
            this.reportOutputDir = v;
            return this;
        }

        public Builder zone(ZoneId v) {
            this.zone = v;
            return this;
        }

        public Builder workerThreads(int v) {
            this.workerThreads = v;
            return this;
        }

        public Builder sentinelConfigPath(String v) {
            this.sentinelConfigPath = v;
            return this;
        }

        /**
         * @return a validated {@link SchedulerConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public SchedulerConfig build() {
            requireNonBlank(registryDir, "registryDir");
            requireNonBlank(readingsCsvPath, "readingsCsvPath");
            requireNonBlank(reportOutputDir, "reportOutputDir");
            Objects.requireNonNull(zone, "zone required");
            Objects.requireNonNull(sentinelConfigPath, "sentinelConfigPath required");

            if (healthPort < 1 || healthPort > 65_535) {
                throw new IllegalArgumentException(
                        "healthPort must be in [1, 65535], got: " + healthPort);
            }
            if (workerThreads < 1) {
                throw new IllegalArgumentException("workerThreads must be >= 1, got: " + workerThreads);
            }
            return new SchedulerConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    private static int parseIntEnv(String name, String defaultValue) {
        return Integer.parseInt(env(name, defaultValue));
    }

    @Override
    public String toString() {
        return "SchedulerConfig{" +
                "healthPort=" + healthPort +
                ", registryDir='" + registryDir + '\'' +
                ", readingsCsvPath='" + readingsCsvPath + '\'' +
                ", reportOutputDir='" + reportOutputDir + '\'' +
                ", zone=" + zone +
                ", workerThreads=" + workerThreads +
                ", sentinelConfigPath='" + sentinelConfigPath + '\'' +
                '}';
    }
}
