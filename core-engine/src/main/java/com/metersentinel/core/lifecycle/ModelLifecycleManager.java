package com.metersentinel.core.lifecycle;

import com.metersentinel.core.config.SentinelConfig;
import com.metersentinel.core.config.TrainingSettings;
import com.metersentinel.core.error.ErrorKind;
import com.metersentinel.core.error.MeterSentinelException;
import com.metersentinel.core.error.SourceUnavailableException;
import com.metersentinel.core.error.TrainingFailureException;
import com.metersentinel.core.ml.ModelMetrics;
import com.metersentinel.core.model.ReadingWindow;
import com.metersentinel.core.registry.MetricsHistoryEntry;
import com.metersentinel.core.registry.ModelCandidate;
import com.metersentinel.core.registry.ModelRegistry;
import com.metersentinel.core.registry.ProductionSnapshot;
import com.metersentinel.core.registry.RetrainingState;
import com.metersentinel.core.source.ReadingSource;
import com.metersentinel.core.training.TrainedModels;
import com.metersentinel.core.training.Trainer;
import com.metersentinel.core.training.ValidationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BiFunction;

/**
 * Drives one retraining attempt through its state machine.
 *
 * <h3>States</h3>
 * <pre>
 *   CHECK_DUE → FETCH_DATA → VALIDATE → PREPROCESS → TRAIN → EVALUATE → COMPARE
 *             → PROMOTE | ROLLBACK | DISCARD → RECORD_HISTORY
 * </pre>
 *
 * <ul>
 * <li><b>CHECK_DUE</b>: due when whole days since the last completed training
 * reach the configured interval, or when nothing was ever trained.</li>
 * <li><b>FETCH_DATA</b>: the last {@code windowDays} of readings, bounded by
 * the fetch timeout. An unreachable source ends the cycle without a history
 * entry so the next check retries.</li>
 * <li><b>VALIDATE</b> to <b>EVALUATE</b>: any failure, including a timeout,
 * ends in DISCARD and nothing is persisted.</li>
 * <li><b>COMPARE</b>: {@link PromotionPolicy}.</li>
 * <li><b>RECORD_HISTORY</b>: exactly one entry per attempt that got past
 * FETCH_DATA.</li>
 * </ul>
 *
 * <h3>Errors</h3>
 * <p>
 * Failures never escape; every path returns a {@link TrainingResult}. An
 * unexpected runtime error from the trainer is discarded as a training failure.
 * A {@code PROMOTION_CONSISTENCY_VIOLATION} result carries
 * {@link TrainingResult#requiresAlert()} so the caller escalates it.
 * </p>
 *
 * @since 1.0.0
 */
public class ModelLifecycleManager implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ModelLifecycleManager.class);

    private final ReadingSource source;
    private final Trainer trainer;
    private final ModelRegistry registry;
    private final PromotionPolicy policy;
    private final TrainingSettings training;
    private final int intervalDays;
    private final int keepVersions;
    private final Clock clock;
    private final ExecutorService worker;

    public ModelLifecycleManager(ReadingSource source, Trainer trainer, ModelRegistry registry,
            SentinelConfig config, Clock clock) {
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.trainer = Objects.requireNonNull(trainer, "trainer must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        Objects.requireNonNull(config, "config must not be null");
        this.policy = new PromotionPolicy(config.getRegistry().getPromotionTolerance());
        this.training = config.getTraining();
        this.intervalDays = config.getRegistry().getRetrainingIntervalDays();
        this.keepVersions = config.getRegistry().getKeepVersions();
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.worker = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "lifecycle-worker");
            t.setDaemon(true);
            return t;
        });
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Run one retraining attempt.
     *
     * @param force skip the CHECK_DUE gate
     * @return structured outcome; never {@code null}
     */
    public TrainingResult runRetrainingCycle(boolean force) {
        return runCycle(force, null);
    }

    /**
     * Forced attempt over the training window that ends at {@code dataEnd}
     * rather than now. Seeds an empty registry from a historical export.
     *
     * @param dataEnd exclusive end of the readings to train on
     * @return structured outcome; never {@code null}
     */
    public TrainingResult bootstrap(Instant dataEnd) {
        Objects.requireNonNull(dataEnd, "dataEnd must not be null");
        return runCycle(true, dataEnd);
    }

    /**
     * @param now reference instant
     * @return whole days since the last completed training, empty if none
     */
    public Optional<Long> daysSinceLastTraining(Instant now) {
        return registry.lastCompletedTraining()
                .map(entry -> Duration.between(entry.getTimestamp(), now).toDays());
    }

    @Override
    public void close() {
        worker.shutdownNow();
    }

    // ---------------------------------------------------------------
    // Cycle
    // ---------------------------------------------------------------

    private TrainingResult runCycle(boolean force, Instant dataEnd) {
        Instant now = clock.instant();

        // CHECK_DUE
        Optional<Long> daysSince = daysSinceLastTraining(now);
        Long days = daysSince.orElse(null);
        if (!force && daysSince.isPresent() && daysSince.get() < intervalDays) {
            LOG.info("Retraining not due: {} day(s) since last training, interval {}", days, intervalDays);
            return TrainingResult.builder()
                    .due(false)
                    .terminalState(RetrainingState.CHECK_DUE)
                    .daysSinceLastTraining(days)
                    .build();
        }
        LOG.info("Retraining due ({} day(s) since last training{})",
                daysSince.map(String::valueOf).orElse("never"), force ? ", forced" : "");

        // FETCH_DATA
        Instant end = dataEnd != null ? dataEnd : now;
        Instant start = end.minus(Duration.ofDays(training.getWindowDays()));
        Optional<ReadingWindow> fetched;
        try {
            fetched = withTimeout(() -> source.fetch(start, end), training.getFetchTimeoutSeconds(), "fetch",
                    SourceUnavailableException::new);
        } catch (SourceUnavailableException e) {
            LOG.warn("Reading source unavailable; deferring retraining to the next check: {}", e.getMessage());
            return TrainingResult.builder()
                    .terminalState(RetrainingState.FETCH_DATA)
                    .daysSinceLastTraining(days)
                    .error(ErrorKind.SOURCE_UNAVAILABLE, e.getMessage())
                    .build();
        } catch (TimeoutException e) {
            return discard(registry.nextVersionId(), 0, days, ErrorKind.SOURCE_UNAVAILABLE,
                    "Reading fetch exceeded " + training.getFetchTimeoutSeconds() + "s");
        }

        String versionId = registry.nextVersionId();
        if (fetched.isEmpty()) {
            return discard(versionId, 0, days, ErrorKind.INSUFFICIENT_DATA,
                    "No readings in [" + start + ", " + end + ")");
        }
        ReadingWindow raw = fetched.get();

        try {
            // VALIDATE
            ValidationReport report = trainer.validate(raw);
            if (!report.isValid()) {
                return discard(versionId, raw.size(), days, ErrorKind.DATA_QUALITY_VIOLATION,
                        String.join("; ", report.getViolations()));
            }

            // PREPROCESS
            ReadingWindow cleaned = trainer.preprocess(raw);

            // TRAIN
            TrainedModels models;
            try {
                models = withTimeout(() -> trainer.fit(cleaned), training.getTrainingTimeoutSeconds(), "training",
                        TrainingFailureException::new);
            } catch (TimeoutException e) {
                throw new TrainingFailureException("Training exceeded " + training.getTrainingTimeoutSeconds() + "s", e);
            }

            // EVALUATE
            ModelMetrics metrics = trainer.evaluate(models);

            // COMPARE
            ModelMetrics previous = registry.currentProduction()
                    .map(ProductionSnapshot::getForecastMetrics)
                    .orElse(null);
            PromotionPolicy.Comparison comparison = policy.compare(previous, metrics);
            LOG.info("Candidate {} {}: MAE {} vs {}, RMSE {} vs {}", versionId, comparison,
                    fmt(metrics.getMae()), previous != null ? fmt(previous.getMae()) : "-",
                    fmt(metrics.getRmse()), previous != null ? fmt(previous.getRmse()) : "-");

            ModelCandidate candidate = new ModelCandidate(versionId, clock.instant(), models.getForecastModel(),
                    models.getOutlierModel(), metrics, models.getTrainingRecordCount());
            return comparison.promotes()
                    ? promote(candidate, comparison, previous, days)
                    : rollback(candidate, comparison, previous, days);
        } catch (MeterSentinelException e) {
            return discard(versionId, raw.size(), days, e.getKind(), e.getMessage());
        } catch (RuntimeException e) {
            LOG.error("Unexpected failure while training {}", versionId, e);
            return discard(versionId, raw.size(), days, ErrorKind.TRAINING_FAILURE, e.toString());
        }
    }

    // ---------------------------------------------------------------
    // Terminal states
    // ---------------------------------------------------------------

    private TrainingResult promote(ModelCandidate candidate, PromotionPolicy.Comparison comparison,
            ModelMetrics previous, Long days) {
        try {
            registry.promote(candidate);
        } catch (MeterSentinelException e) {
            LOG.error("Promotion of {} failed; production state must be checked: {}",
                    candidate.getVersionId(), e.getMessage(), e);
            return discard(candidate.getVersionId(), candidate.getTrainingRecordCount(), days,
                    e.getKind(), e.getMessage());
        } catch (RuntimeException e) {
            LOG.error("Promotion of {} failed; production state must be checked", candidate.getVersionId(), e);
            return discard(candidate.getVersionId(), candidate.getTrainingRecordCount(), days,
                    ErrorKind.PROMOTION_CONSISTENCY_VIOLATION, e.toString());
        }
        recordHistory(MetricsHistoryEntry.completed(candidate.getVersionId(), clock.instant(),
                RetrainingState.PROMOTE, comparison.getDecision(), candidate.getTrainingRecordCount(),
                candidate.getMetrics()));
        cleanup();
        return TrainingResult.builder()
                .terminalState(RetrainingState.PROMOTE)
                .comparison(comparison)
                .versionId(candidate.getVersionId())
                .metrics(candidate.getMetrics())
                .previousMetrics(previous)
                .daysSinceLastTraining(days)
                .build();
    }

    private TrainingResult rollback(ModelCandidate candidate, PromotionPolicy.Comparison comparison,
            ModelMetrics previous, Long days) {
        if (comparison.getReason() == PromotionPolicy.Reason.REGRESSION) {
            LOG.warn("Candidate {} regressed beyond the {}% tolerance; keeping production",
                    candidate.getVersionId(), Math.round(policy.getTolerance() * 100));
        } else {
            LOG.info("Candidate {} is not strictly better; keeping production", candidate.getVersionId());
        }
        try {
            registry.backup(candidate);
        } catch (RuntimeException e) {
            LOG.warn("Could not store backup of {}: {}", candidate.getVersionId(), e.getMessage(), e);
        }
        recordHistory(MetricsHistoryEntry.completed(candidate.getVersionId(), clock.instant(),
                RetrainingState.ROLLBACK, comparison.getDecision(), candidate.getTrainingRecordCount(),
                candidate.getMetrics()));
        return TrainingResult.builder()
                .terminalState(RetrainingState.ROLLBACK)
                .comparison(comparison)
                .versionId(candidate.getVersionId())
                .metrics(candidate.getMetrics())
                .previousMetrics(previous)
                .daysSinceLastTraining(days)
                .build();
    }

    private TrainingResult discard(String versionId, int records, Long days, ErrorKind kind, String message) {
        if (kind.requiresAlert()) {
            LOG.error("Retraining attempt {} discarded ({}): {}", versionId, kind, message);
        } else {
            LOG.warn("Retraining attempt {} discarded ({}): {}", versionId, kind, message);
        }
        recordHistory(MetricsHistoryEntry.discarded(versionId, clock.instant(), records, kind, message));
        return TrainingResult.builder()
                .terminalState(RetrainingState.DISCARD)
                .versionId(versionId)
                .daysSinceLastTraining(days)
                .error(kind, message)
                .build();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void recordHistory(MetricsHistoryEntry entry) {
        try {
            registry.appendHistory(entry);
        } catch (RuntimeException e) {
            LOG.error("Failed to record metrics history for {}: {}", entry.getVersionId(), e.getMessage(), e);
        }
    }

    private void cleanup() {
        try {
            registry.cleanupOldVersions(keepVersions);
        } catch (RuntimeException e) {
            LOG.warn("Old version cleanup failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Run {@code task} on the worker pool. Domain exceptions pass through;
     * any other failure is wrapped by {@code wrap}.
     */
    private <T> T withTimeout(Callable<T> task, long timeoutSeconds, String what,
            BiFunction<String, Throwable, ? extends MeterSentinelException> wrap) throws TimeoutException {
        Future<T> future = worker.submit(task);
        try {
            return future.get(timeoutSeconds, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            LOG.warn("{} timed out after {}s", what, timeoutSeconds);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof MeterSentinelException) {
                throw (MeterSentinelException) cause;
            }
            throw wrap.apply(what + " failed: " + cause, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw wrap.apply(what + " interrupted", e);
        }
    }

    private static String fmt(double value) {
        return String.format("%.4f", value);
    }
}
