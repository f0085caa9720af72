package com.metersentinel.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs registered jobs on their triggers.
 *
 * <h3>Threading</h3>
 * <p>
 * A single timer thread only computes fire times and hands each firing to a
 * worker pool, so a slow job never delays another job's trigger. Each job owns
 * a {@link ReentrantLock}; a firing that cannot take the lock immediately is
 * skipped and counted, never queued. There is no global lock: different jobs
 * run concurrently.
 * </p>
 *
 * <h3>Failure isolation</h3>
 * <p>
 * Exceptions thrown by a job are caught, logged with the job name and
 * recorded in its {@link JobStats}. The next firing is scheduled regardless.
 * </p>
 *
 * @since 1.0.0
 */
public class JobOrchestrator implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(JobOrchestrator.class);

    private final Map<String, Registration> registrations = new LinkedHashMap<>();
    private final Clock clock;
    private final ZoneId zone;
    private final int workerThreads;
    private final AtomicBoolean started = new AtomicBoolean(false);

    private ScheduledExecutorService timer;
    private ExecutorService workers;

    public JobOrchestrator(Clock clock, ZoneId zone, int workerThreads) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
        if (workerThreads < 1) {
            throw new IllegalArgumentException("workerThreads must be >= 1, got: " + workerThreads);
        }
        this.workerThreads = workerThreads;
    }

    // ---------------------------------------------------------------
    // Registration
    // ---------------------------------------------------------------

    /**
     * Register a job. Must be called before {@link #start()}.
     *
     * @throws IllegalArgumentException if a job with the same name exists
     * @throws IllegalStateException    if the orchestrator already started
     */
    public synchronized JobOrchestrator register(Job job, Trigger trigger) {
        Objects.requireNonNull(job, "job must not be null");
        Objects.requireNonNull(trigger, "trigger must not be null");
        if (started.get()) {
            throw new IllegalStateException("Cannot register '" + job.name() + "' after start");
        }
        if (registrations.containsKey(job.name())) {
            throw new IllegalArgumentException("Duplicate job name: " + job.name());
        }
        registrations.put(job.name(), new Registration(job, trigger));
        return this;
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    /**
     * Start the timer and schedule every registered job's first firing.
     */
    public synchronized void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        timer = Executors.newSingleThreadScheduledExecutor(daemonFactory("orchestrator-timer"));
        workers = Executors.newFixedThreadPool(Math.max(workerThreads, registrations.size()),
                daemonFactory("job-worker"));

        ZonedDateTime now = clock.instant().atZone(zone);
        for (Registration registration : registrations.values()) {
            scheduleAfter(registration, now);
            LOG.info("Scheduled job '{}' ({}), first run at {}", registration.job.name(),
                    registration.trigger.describe(), registration.stats.getNextFireAt());
        }
        LOG.info("Job orchestrator started with {} job(s)", registrations.size());
    }

    /**
     * Stop firing new cycles and wait briefly for running ones.
     */
    @Override
    public synchronized void close() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        timer.shutdownNow();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(30, TimeUnit.SECONDS)) {
                LOG.warn("Jobs still running after 30s; interrupting");
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
        LOG.info("Job orchestrator stopped");
    }

    // ---------------------------------------------------------------
    // Execution
    // ---------------------------------------------------------------

    /**
     * Run a job now on the calling thread, through the same per-job guard as
     * a scheduled firing.
     *
     * @return {@link JobStatus#SKIPPED} if the job was already running
     * @throws NoSuchElementException if no such job is registered
     */
    public JobStatus runNow(String name) {
        Registration registration;
        synchronized (this) {
            registration = registrations.get(name);
        }
        if (registration == null) {
            throw new NoSuchElementException("Unknown job: " + name);
        }
        return execute(registration);
    }

    /**
     * @return snapshot view of each job's stats, in registration order
     */
    public synchronized Map<String, JobStats> stats() {
        Map<String, JobStats> view = new LinkedHashMap<>();
        registrations.forEach((name, registration) -> view.put(name, registration.stats));
        return Collections.unmodifiableMap(view);
    }

    public boolean isRunning() {
        return started.get();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void scheduleAfter(Registration registration, ZonedDateTime after) {
        ZonedDateTime next = registration.trigger.nextFireAfter(after);
        registration.stats.nextFireAt(next.toInstant());
        long delayMs = Math.max(0L, Duration.between(clock.instant(), next.toInstant()).toMillis());
        try {
            timer.schedule(() -> fire(registration, next), delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            LOG.debug("Timer stopped; not rescheduling '{}'", registration.job.name());
        }
    }

    private void fire(Registration registration, ZonedDateTime firedAt) {
        try {
            workers.execute(() -> execute(registration));
        } catch (RejectedExecutionException e) {
            LOG.debug("Workers stopped; dropping firing of '{}'", registration.job.name());
            return;
        }
        scheduleAfter(registration, firedAt);
    }

    private JobStatus execute(Registration registration) {
        String name = registration.job.name();
        if (!registration.lock.tryLock()) {
            registration.stats.skipped();
            LOG.warn("Job '{}' is still running; skipping this cycle", name);
            return JobStatus.SKIPPED;
        }
        Instant start = clock.instant();
        try {
            registration.stats.started(start);
            LOG.info("Job '{}' started", name);
            registration.job.run();
            Duration took = Duration.between(start, clock.instant());
            registration.stats.succeeded(took);
            LOG.info("Job '{}' finished in {} ms", name, took.toMillis());
            return JobStatus.SUCCEEDED;
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            registration.stats.failed(Duration.between(start, clock.instant()), e);
            LOG.error("Job '{}' failed: {}", name, e.getMessage(), e);
            return JobStatus.FAILED;
        } finally {
            registration.lock.unlock();
        }
    }

    private static ThreadFactory daemonFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private static final class Registration {
        private final Job job;
        private final Trigger trigger;
        private final ReentrantLock lock = new ReentrantLock();
        private final JobStats stats;

        private Registration(Job job, Trigger trigger) {
            this.job = job;
            this.trigger = trigger;
            this.stats = new JobStats(trigger.describe());
        }
    }
}
