package com.vibeblog.scheduler.cron;

import com.vibeblog.common.config.VibeBlogConfig.CronConfig;
import com.vibeblog.common.infra.Backoff;
import com.vibeblog.scheduler.cron.CronErrors.AlreadyRunningError;
import com.vibeblog.scheduler.cron.CronErrors.JobNotFoundError;
import com.vibeblog.scheduler.cron.CronErrors.NotDueError;
import com.vibeblog.scheduler.cron.CronErrors.PersistenceError;
import com.vibeblog.scheduler.cron.CronState.CronRunMode;
import com.vibeblog.scheduler.cron.CronState.CronStatusSummary;
import com.vibeblog.scheduler.cron.CronTypes.CronJob;
import com.vibeblog.scheduler.cron.CronTypes.CronJobCreate;
import com.vibeblog.scheduler.cron.CronTypes.CronJobFilter;
import com.vibeblog.scheduler.cron.CronTypes.CronJobPatch;
import com.vibeblog.scheduler.cron.CronTypes.CronJobState;
import com.vibeblog.scheduler.cron.CronTypes.CronSchedule;
import com.vibeblog.scheduler.cron.CronTypes.ScheduleKind;
import com.vibeblog.scheduler.cron.CronTypes.TriggerSource;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Self-driven job scheduler: owns the timer loop, dispatches due jobs to a
 * worker pool and exposes the management operations.
 * <p>
 * The timer runs on one daemon thread and re-arms itself after every wake,
 * every finished run and every mutation. Only {@link #tick()} dispatches
 * scheduled runs, so a job is never claimed twice by the loop.
 */
@Slf4j
public class CronScheduler implements AutoCloseable {

    /** Minimum re-arm delay while every dispatch permit is taken. */
    static final long THROTTLE_FLOOR_MS = 1000;

    static final String RESTART_REASON = "stale execution cleared (restart)";

    private final CronJobStore store;
    private final CronExecutor executor;
    private final CronTimer timer;
    private final Clock clock;
    private final CronConfig config;

    private final ScheduledExecutorService timerThread;
    private final ExecutorService workers;
    private final Semaphore permits;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private ScheduledFuture<?> pendingWake;

    public CronScheduler(CronJobStore store, ExecutionCallback callback, Clock clock, CronConfig config) {
        this.store = store;
        this.clock = clock;
        this.config = config;
        this.executor = new CronExecutor(store, callback, clock, Backoff.Ladder.ERROR_RETRY,
                config.getDefaultTimeoutSeconds());
        this.timer = new CronTimer(store, executor, config.getMaxTimerDelayMs(), config.getStuckRunMs());
        this.permits = new Semaphore(Math.max(1, config.getMaxConcurrentRuns()));
        this.timerThread = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "cron-timer");
            t.setDaemon(true);
            return t;
        });
        AtomicInteger workerSeq = new AtomicInteger();
        this.workers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "cron-worker-" + workerSeq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    // =========================================================================
    // Lifecycle
    // =========================================================================

    /**
     * Recover from the previous process and arm the timer.
     *
     * @throws IllegalStateException if the scheduler was already stopped
     */
    public void start() {
        if (workers.isShutdown()) {
            throw new IllegalStateException("cron scheduler was stopped and cannot be restarted");
        }
        if (!running.compareAndSet(false, true)) {
            log.debug("Cron scheduler already running");
            return;
        }
        try {
            recover();
        } catch (PersistenceError e) {
            log.error("Cron startup recovery failed, continuing with next wake: {}", e.getMessage());
        }
        arm();
        log.info("Cron scheduler started (store: {}, max concurrent runs: {})",
                store.getDbPath(), permits.availablePermits());
    }

    /**
     * Cancel the timer and shut the dispatch pool down. Runs already on a
     * worker may finish; if the process exits first their markers are left
     * for the next startup.
     */
    public void stop() {
        boolean wasRunning = running.getAndSet(false);
        synchronized (this) {
            if (pendingWake != null) {
                pendingWake.cancel(false);
                pendingWake = null;
            }
        }
        timerThread.shutdownNow();
        workers.shutdown();
        if (wasRunning) {
            log.info("Cron scheduler stopped");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    @Override
    public void close() {
        stop();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Cron workers did not terminate within 5s, interrupting");
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Clear markers left by a crashed process, skip one-shot jobs missed
     * beyond the grace window and give unscheduled jobs a next run time.
     */
    void recover() {
        long now = clock.millis();
        for (CronJob job : store.list(CronJobFilter.builder().running(true).build())) {
            executor.abandon(job.getId(), RESTART_REASON, Long.MAX_VALUE);
        }
        for (CronJob job : store.list(CronJobFilter.enabledOnly())) {
            Long next = job.getState().getNextRunAtMs();
            if (job.getSchedule().getKind() == ScheduleKind.AT && next != null
                    && next + config.getMissedAtGraceMs() < now) {
                executor.skip(job.getId(), "missed: scheduled at " + Instant.ofEpochMilli(next)
                        + ", grace window elapsed");
            }
        }
        repairSchedules(now);
    }

    // =========================================================================
    // Timer loop
    // =========================================================================

    /**
     * Cancel the pending wake and schedule the next one from the store.
     */
    synchronized void arm() {
        if (!running.get()) {
            return;
        }
        if (pendingWake != null) {
            pendingWake.cancel(false);
        }
        long delay;
        try {
            delay = timer.computeSleepDurationMs(store.list(CronJobFilter.enabledOnly()), clock.millis());
        } catch (PersistenceError e) {
            log.error("Cron arm failed, retrying in {}ms: {}", timer.getMaxTimerDelayMs(), e.getMessage());
            delay = timer.getMaxTimerDelayMs();
        }
        if (permits.availablePermits() == 0) {
            delay = Math.max(delay, THROTTLE_FLOOR_MS);
        }
        try {
            pendingWake = timerThread.schedule(this::onWake, delay, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Cron timer already shut down");
        }
    }

    void onWake() {
        if (!running.get()) {
            return;
        }
        try {
            tick();
        } catch (PersistenceError e) {
            log.error("Cron tick failed, retrying on next wake: {}", e.getMessage());
        } catch (RuntimeException e) {
            log.error("Cron tick crashed: {}", e.getMessage(), e);
        } finally {
            arm();
        }
    }

    /**
     * One pass of the loop: stall detection, schedule repair, then dispatch
     * of due jobs in {@code next_run_at} order while permits last.
     *
     * @return futures of the runs dispatched by this pass
     */
    List<CompletableFuture<ExecutionRecord>> tick() {
        long now = clock.millis();
        timer.detectStalls(now);
        repairSchedules(now);

        List<CompletableFuture<ExecutionRecord>> dispatched = new ArrayList<>();
        CronJobFilter due = CronJobFilter.builder().enabled(true).running(false).dueAtOrBeforeMs(now).build();
        for (CronJob job : store.list(due)) {
            if (!permits.tryAcquire()) {
                log.debug("Cron dispatch throttled, remaining due jobs wait for the next wake");
                break;
            }
            CronJob claimed;
            try {
                claimed = executor.claim(job.getId(), TriggerSource.SCHEDULE);
            } catch (AlreadyRunningError | NotDueError | JobNotFoundError e) {
                permits.release();
                log.debug("Cron job {} not dispatched: {}", job.getId(), e.getMessage());
                continue;
            } catch (RuntimeException e) {
                permits.release();
                throw e;
            }
            dispatched.add(submit(claimed, TriggerSource.SCHEDULE, true));
        }
        return dispatched;
    }

    private void repairSchedules(long now) {
        for (CronJob job : store.list(CronJobFilter.builder().enabled(true).running(false).build())) {
            if (job.getState().getNextRunAtMs() != null) {
                continue;
            }
            store.compute(job.getId(), j -> {
                if (j.isEnabled() && !j.isRunning() && j.getState().getNextRunAtMs() == null) {
                    CronExecutor.recompute(j, now);
                }
                return j;
            });
        }
    }

    private CompletableFuture<ExecutionRecord> submit(CronJob claimed, TriggerSource trigger, boolean holdsPermit) {
        CompletableFuture<ExecutionRecord> run;
        try {
            run = CompletableFuture.supplyAsync(() -> executor.run(claimed, trigger), workers);
        } catch (RejectedExecutionException e) {
            if (holdsPermit) {
                permits.release();
            }
            executor.abandon(claimed.getId(), "dispatch rejected: scheduler shut down", Long.MAX_VALUE);
            throw e;
        }
        return run.whenComplete((record, err) -> {
            if (holdsPermit) {
                permits.release();
            }
            if (err != null) {
                log.error("Cron job {} run could not be recorded: {}", claimed.getId(), err.getMessage());
            }
            arm();
        });
    }

    // =========================================================================
    // Management
    // =========================================================================

    /**
     * Create a job. Missing timezone, timeout and interval anchor take the
     * configured defaults.
     *
     * @throws IllegalArgumentException               for missing fields or a duplicate id
     * @throws CronErrors.ScheduleComputationError    if the trigger cannot produce a run
     */
    public CronJob add(CronJobCreate input) {
        if (input.getName() == null || input.getName().isBlank()) {
            throw new IllegalArgumentException("name is required");
        }
        if (input.getSchedule() == null || input.getSchedule().getKind() == null) {
            throw new IllegalArgumentException("trigger is required");
        }
        long now = clock.millis();
        CronSchedule schedule = withDefaults(input.getSchedule(), now);
        ScheduleCalculator.validate(schedule, now);

        CronJob job = CronJob.builder()
                .id(input.getId() != null && !input.getId().isBlank()
                        ? input.getId().trim()
                        : UUID.randomUUID().toString().substring(0, 8))
                .name(input.getName().trim())
                .description(input.getDescription())
                .enabled(input.isEnabled())
                .deleteAfterRun(input.isDeleteAfterRun())
                .schedule(schedule)
                .payload(input.getPayload())
                .timeoutSeconds(input.getTimeoutSeconds() != null && input.getTimeoutSeconds() > 0
                        ? input.getTimeoutSeconds()
                        : config.getDefaultTimeoutSeconds())
                .tags(input.getTags() != null ? new ArrayList<>(input.getTags()) : new ArrayList<>())
                .createdAtMs(now)
                .updatedAtMs(now)
                .state(new CronJobState())
                .build();
        if (job.isEnabled()) {
            CronExecutor.recompute(job, now);
        }
        store.create(job);
        log.info("Added cron job {} '{}' ({}), next run at {}", job.getId(), job.getName(),
                schedule.getKind().key(), job.getState().getNextRunAtMs());
        arm();
        return job;
    }

    /**
     * Apply a partial edit. Changing the trigger or the enabled flag
     * reschedules; the in-flight marker is never touched.
     */
    public CronJob update(String id, CronJobPatch patch) {
        long now = clock.millis();
        CronJob updated = store.compute(id, job -> {
            boolean reschedule = false;
            if (patch.getName() != null) {
                if (patch.getName().isBlank()) {
                    throw new IllegalArgumentException("name must not be blank");
                }
                job.setName(patch.getName().trim());
            }
            if (patch.getDescription() != null) {
                job.setDescription(patch.getDescription());
            }
            if (patch.getPayload() != null) {
                job.setPayload(patch.getPayload());
            }
            if (patch.getTimeoutSeconds() != null && patch.getTimeoutSeconds() > 0) {
                job.setTimeoutSeconds(patch.getTimeoutSeconds());
            }
            if (patch.getTags() != null) {
                job.setTags(new ArrayList<>(patch.getTags()));
            }
            if (patch.getDeleteAfterRun() != null) {
                job.setDeleteAfterRun(patch.getDeleteAfterRun());
            }
            if (patch.getSchedule() != null) {
                CronSchedule schedule = withDefaults(patch.getSchedule(), now);
                ScheduleCalculator.validate(schedule, now);
                job.setSchedule(schedule);
                job.getState().setScheduleErrorCount(0);
                reschedule = true;
            }
            if (patch.getEnabled() != null && patch.getEnabled() != job.isEnabled()) {
                job.setEnabled(patch.getEnabled());
                reschedule = true;
            }
            if (reschedule) {
                reschedule(job, now);
            }
            job.setUpdatedAtMs(now);
            return job;
        }).orElseThrow(() -> new JobNotFoundError(id));
        log.info("Updated cron job {} '{}', next run at {}", id, updated.getName(),
                updated.getState().getNextRunAtMs());
        arm();
        return updated;
    }

    /**
     * Delete a job. A run in flight finishes and keeps only its record.
     */
    public void remove(String id) {
        if (!store.delete(id)) {
            throw new JobNotFoundError(id);
        }
        log.info("Removed cron job {}", id);
        arm();
    }

    public Optional<CronJob> get(String id) {
        return store.get(id);
    }

    public List<CronJob> list(boolean includeDisabled) {
        return store.list(includeDisabled ? CronJobFilter.all() : CronJobFilter.enabledOnly());
    }

    public CronJob pause(String id) {
        CronJob job = mutate(id, j -> {
            j.setEnabled(false);
            j.getState().setNextRunAtMs(null);
        });
        log.info("Paused cron job {} '{}'", id, job.getName());
        return job;
    }

    /**
     * Re-enable a job, forget its failure streak and schedule it normally.
     */
    public CronJob resume(String id) {
        long now = clock.millis();
        CronJob job = mutate(id, j -> {
            j.setEnabled(true);
            j.getState().setConsecutiveErrors(0);
            j.getState().setScheduleErrorCount(0);
            reschedule(j, now);
        });
        log.info("Resumed cron job {} '{}', next run at {}", id, job.getName(), job.getState().getNextRunAtMs());
        return job;
    }

    /**
     * Re-enable a job and make it due immediately.
     */
    public CronJob retry(String id) {
        long now = clock.millis();
        CronJob job = mutate(id, j -> {
            j.setEnabled(true);
            j.getState().setConsecutiveErrors(0);
            j.getState().setScheduleErrorCount(0);
            j.getState().setNextRunAtMs(now);
        });
        log.info("Retrying cron job {} '{}' now", id, job.getName());
        return job;
    }

    public CompletableFuture<ExecutionRecord> runNow(String id) {
        return runNow(id, CronRunMode.FORCE);
    }

    /**
     * Run a job outside its schedule on the worker pool. Manual runs do not
     * take a dispatch permit.
     *
     * @throws JobNotFoundError    if the job does not exist
     * @throws AlreadyRunningError if a run is in flight
     * @throws NotDueError         in {@link CronRunMode#DUE} mode when the job is not due
     */
    public CompletableFuture<ExecutionRecord> runNow(String id, CronRunMode mode) {
        if (mode == CronRunMode.DUE) {
            CronJob job = store.get(id).orElseThrow(() -> new JobNotFoundError(id));
            Long next = job.getState().getNextRunAtMs();
            if (!job.isEnabled() || next == null || next > clock.millis()) {
                throw new NotDueError(id);
            }
        }
        CronJob claimed = executor.claim(id, TriggerSource.MANUAL);
        log.info("Manual run of cron job {} '{}'", id, claimed.getName());
        return submit(claimed, TriggerSource.MANUAL, false);
    }

    /**
     * Execution history, newest first.
     *
     * @param id    job id, or null for all jobs
     * @param limit maximum records; non-positive means the configured default
     */
    public List<ExecutionRecord> runs(String id, int limit) {
        return store.listRecords(id, limit > 0 ? limit : config.getHistoryLimit());
    }

    public CronStatusSummary status() {
        List<CronJob> jobs = store.list(CronJobFilter.all());
        int enabled = 0;
        int inFlight = 0;
        for (CronJob job : jobs) {
            if (job.isEnabled()) {
                enabled++;
            }
            if (job.isRunning()) {
                inFlight++;
            }
        }
        return CronStatusSummary.builder()
                .enabled(config.isEnabled())
                .running(running.get())
                .storePath(store.getDbPath().toString())
                .totalJobs(jobs.size())
                .enabledJobs(enabled)
                .runningJobs(inFlight)
                .nextWakeAtMs(CronTimer.nextWakeAtMs(jobs))
                .build();
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private CronJob mutate(String id, Consumer<CronJob> change) {
        long now = clock.millis();
        CronJob job = store.update(id, j -> {
            change.accept(j);
            j.setUpdatedAtMs(now);
        }).orElseThrow(() -> new JobNotFoundError(id));
        arm();
        return job;
    }

    private static void reschedule(CronJob job, long now) {
        if (job.isEnabled()) {
            CronExecutor.recompute(job, now);
        } else {
            job.getState().setNextRunAtMs(null);
        }
    }

    private CronSchedule withDefaults(CronSchedule schedule, long now) {
        CronSchedule.CronScheduleBuilder b = schedule.toBuilder();
        if (schedule.getKind() == ScheduleKind.CRON && (schedule.getTz() == null || schedule.getTz().isBlank())) {
            b.tz(config.getDefaultTimezone());
        }
        if (schedule.getKind() == ScheduleKind.EVERY && schedule.getAnchorMs() == null) {
            b.anchorMs(now);
        }
        return b.build();
    }
}
