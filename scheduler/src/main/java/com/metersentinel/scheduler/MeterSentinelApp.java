package com.metersentinel.scheduler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.metersentinel.core.config.ConfigLoader;
import com.metersentinel.core.config.JobSettings;
import com.metersentinel.core.config.SentinelConfig;
import com.metersentinel.core.detection.AnomalyConsensusEngine;
import com.metersentinel.core.error.InsufficientDataException;
import com.metersentinel.core.lifecycle.ModelLifecycleManager;
import com.metersentinel.core.lifecycle.TrainingResult;
import com.metersentinel.core.registry.FileModelRegistry;
import com.metersentinel.core.registry.ModelRegistry;
import com.metersentinel.core.report.ReportKind;
import com.metersentinel.core.source.ReadingSource;
import com.metersentinel.core.training.SeasonalForestTrainer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Main entry point for the Meter Sentinel scheduler.
 *
 * <h3>Jobs</h3>
 *
 * <pre>
 *   anomaly-scan       every N minutes     CsvReadingSource → AnomalyConsensusEngine → LoggingNotifier
 *   retraining-check   daily               ModelLifecycleManager → FileModelRegistry
 *   daily-report       daily               ReportCalculator → JsonReportPublisher
 *   weekly-report      weekly
 *   monthly-report     monthly
 * </pre>
 *
 * <h3>Initialization</h3>
 * <p>
 * Started with {@code --initialize}, the application trains and promotes a
 * first model pair from the readings file, using the window that ends at its
 * newest reading, then exits. Run it once on a fresh deployment so anomaly
 * scans have production models before the first scheduled retraining.
 * </p>
 *
 * <h3>Configuration</h3>
 * <p>
 * Process settings come from environment variables via
 * {@link SchedulerConfig}; detection, training and schedule settings from
 * the YAML file loaded by {@link ConfigLoader}.
 * </p>
 *
 * @since 1.0.0
 */
public final class MeterSentinelApp {

    private static final Logger LOG = LoggerFactory.getLogger(MeterSentinelApp.class);

    static final String INITIALIZE_FLAG = "--initialize";

    private MeterSentinelApp() {
        // entry-point class, not instantiable
    }

    public static void main(String[] args) throws Exception {
        // 1. Load configuration
        SchedulerConfig schedulerConfig = SchedulerConfig.fromEnvironment();
        LOG.info("Starting Meter Sentinel with config: {}", schedulerConfig);
        SentinelConfig config = ConfigLoader.load(schedulerConfig.getSentinelConfigPath());

        // 2. Build components
        Clock clock = Clock.system(schedulerConfig.getZone());
        ObjectMapper mapper = FileModelRegistry.newMapper();
        CsvReadingSource source = new CsvReadingSource(Path.of(schedulerConfig.getReadingsCsvPath()),
                schedulerConfig.getZone());
        FileModelRegistry registry = new FileModelRegistry(Path.of(schedulerConfig.getRegistryDir()), clock);
        AnomalyConsensusEngine engine = new AnomalyConsensusEngine(config);
        ModelLifecycleManager lifecycle = new ModelLifecycleManager(source,
                new SeasonalForestTrainer(config, schedulerConfig.getZone()), registry, config, clock);

        if (Arrays.asList(args).contains(INITIALIZE_FLAG)) {
            TrainingResult result;
            try {
                result = initialize(source, lifecycle);
            } finally {
                lifecycle.close();
            }
            System.exit(result.isSuccess() ? 0 : 1);
            return;
        }

        // 3. Register jobs
        JobOrchestrator orchestrator = buildOrchestrator(schedulerConfig, config, clock, source, registry,
                engine, lifecycle, new JsonReportPublisher(Path.of(schedulerConfig.getReportOutputDir()), mapper));

        // 4. Health server, with shutdown hook
        HealthServer healthServer = new HealthServer(orchestrator::isRunning,
                () -> registry.currentProduction().isPresent(), () -> status(orchestrator, registry), mapper);
        healthServer.start(schedulerConfig.getHealthPort());
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            orchestrator.close();
            lifecycle.close();
            healthServer.stop();
        }, "sentinel-shutdown"));

        // 5. Run until killed
        orchestrator.start();
        Thread.currentThread().join();
    }

    // ---------------------------------------------------------------
    // Assembly
    // ---------------------------------------------------------------

    static JobOrchestrator buildOrchestrator(SchedulerConfig schedulerConfig, SentinelConfig config, Clock clock,
            ReadingSource source, ModelRegistry registry, AnomalyConsensusEngine engine,
            ModelLifecycleManager lifecycle, JsonReportPublisher publisher) {
        JobSettings jobs = config.getJobs();
        LoggingNotifier notifier = new LoggingNotifier();
        ReportDatasetCache cache = new ReportDatasetCache();

        JobOrchestrator orchestrator = new JobOrchestrator(clock, schedulerConfig.getZone(),
                schedulerConfig.getWorkerThreads());
        orchestrator.register(new AnomalyScanJob(source, registry, engine, notifier, config, clock),
                new IntervalTrigger(Duration.ofMinutes(jobs.getAnomalyScanIntervalMinutes())));
        orchestrator.register(new RetrainingCheckJob(lifecycle, notifier),
                new DailyTrigger(jobs.retrainingCheckLocalTime()));
        orchestrator.register(reportJob(ReportKind.DAILY, schedulerConfig, config, clock, source, registry,
                engine, publisher, cache), new DailyTrigger(jobs.dailyReportLocalTime()));
        orchestrator.register(reportJob(ReportKind.WEEKLY, schedulerConfig, config, clock, source, registry,
                engine, publisher, cache),
                new WeeklyTrigger(jobs.weeklyReportDayOfWeek(), jobs.weeklyReportLocalTime()));
        orchestrator.register(reportJob(ReportKind.MONTHLY, schedulerConfig, config, clock, source, registry,
                engine, publisher, cache),
                new MonthlyTrigger(jobs.getMonthlyReportDay(), jobs.monthlyReportLocalTime()));
        return orchestrator;
    }

    /**
     * Bootstrap the registry from the newest readings in {@code source}.
     *
     * @return outcome of the forced cycle
     * @throws InsufficientDataException if the readings file is empty
     */
    static TrainingResult initialize(CsvReadingSource source, ModelLifecycleManager lifecycle) {
        Instant newest = source.latestTimestamp()
                .orElseThrow(() -> new InsufficientDataException("Readings file has no parsable rows"));
        LOG.info("Initializing models from readings ending at {}", newest);
        TrainingResult result = lifecycle.bootstrap(newest.plusSeconds(1));
        if (result.isSuccess()) {
            LOG.info("Initial models ready: {}", result);
        } else {
            LOG.error("Model initialization failed: {}", result);
        }
        return result;
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static ReportJob reportJob(ReportKind kind, SchedulerConfig schedulerConfig, SentinelConfig config,
            Clock clock, ReadingSource source, ModelRegistry registry, AnomalyConsensusEngine engine,
            JsonReportPublisher publisher, ReportDatasetCache cache) {
        return new ReportJob(kind, source, registry, engine, publisher, cache, config,
                schedulerConfig.getZone(), clock);
    }

    static Map<String, Object> status(JobOrchestrator orchestrator, ModelRegistry registry) {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("status", orchestrator.isRunning() ? "UP" : "STOPPED");
        status.put("production", registry.currentProduction().orElse(null));
        status.put("jobs", orchestrator.stats());
        return status;
    }
}
