package com.vibeblog.scheduler.cron;

import com.vibeblog.common.infra.Backoff;
import com.vibeblog.common.infra.ErrorUtils;
import com.vibeblog.scheduler.cron.CronErrors.AlreadyRunningError;
import com.vibeblog.scheduler.cron.CronErrors.ExecutionFailure;
import com.vibeblog.scheduler.cron.CronErrors.ExecutionTimeoutError;
import com.vibeblog.scheduler.cron.CronErrors.JobNotFoundError;
import com.vibeblog.scheduler.cron.CronErrors.NotDueError;
import com.vibeblog.scheduler.cron.CronErrors.ScheduleComputationError;
import com.vibeblog.scheduler.cron.CronTypes.CronJob;
import com.vibeblog.scheduler.cron.CronTypes.CronJobState;
import com.vibeblog.scheduler.cron.CronTypes.RunStatus;
import com.vibeblog.scheduler.cron.CronTypes.ScheduleKind;
import com.vibeblog.scheduler.cron.CronTypes.TriggerSource;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs one job through the execution callback and writes the outcome back.
 * <p>
 * A run is bracketed by the in-flight marker: {@link #claim} sets
 * {@code running_at}, and every exit path of {@link #run} clears it again.
 * The marker value doubles as the claim token: a run whose marker was
 * abandoned in the meantime only leaves its record behind and never touches
 * the state of a newer claim. The executor is the only producer of
 * {@link ExecutionRecord}s.
 */
@Slf4j
public class CronExecutor {

    static final int MAX_SCHEDULE_ERRORS = 3;

    private final CronJobStore store;
    private final ExecutionCallback callback;
    private final Clock clock;
    private final Backoff.Ladder backoff;
    private final int defaultTimeoutSeconds;

    public CronExecutor(CronJobStore store, ExecutionCallback callback, Clock clock,
            Backoff.Ladder backoff, int defaultTimeoutSeconds) {
        this.store = store;
        this.callback = callback;
        this.clock = clock;
        this.backoff = backoff;
        this.defaultTimeoutSeconds = defaultTimeoutSeconds;
    }

    /**
     * Set the in-flight marker on a job.
     *
     * @param trigger {@link TriggerSource#SCHEDULE} additionally requires the job
     *                to be enabled and due at this instant
     * @return the job as stored after the marker was set
     * @throws JobNotFoundError     if the job does not exist
     * @throws AlreadyRunningError  if another run holds the marker
     * @throws NotDueError          for a scheduled claim on a disabled or not-yet-due job
     */
    public CronJob claim(String jobId, TriggerSource trigger) {
        long now = clock.millis();
        return store.compute(jobId, job -> {
            if (job.isRunning()) {
                throw new AlreadyRunningError(jobId);
            }
            Long next = job.getState().getNextRunAtMs();
            if (trigger == TriggerSource.SCHEDULE && (!job.isEnabled() || next == null || next > now)) {
                throw new NotDueError(jobId);
            }
            job.getState().setRunningAtMs(now);
            return job;
        }).orElseThrow(() -> new JobNotFoundError(jobId));
    }

    /**
     * Invoke the callback for a claimed job, wait for it under the job's
     * timeout and apply the outcome.
     */
    public ExecutionRecord run(CronJob job, TriggerSource trigger) {
        Long claimToken = job.getState().getRunningAtMs();
        long startedAt = claimToken != null ? claimToken : clock.millis();
        int timeoutSeconds = job.getTimeoutSeconds() > 0 ? job.getTimeoutSeconds() : defaultTimeoutSeconds;

        String summary = null;
        ExecutionFailure failure = null;
        CompletableFuture<String> future = null;
        try {
            future = callback.execute(job.getPayload(), Duration.ofSeconds(timeoutSeconds));
            summary = future.get(timeoutSeconds, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            failure = new ExecutionTimeoutError(timeoutSeconds);
        } catch (ExecutionException e) {
            Throwable cause = ErrorUtils.unwrap(e);
            failure = cause instanceof TimeoutException
                    ? new ExecutionTimeoutError(timeoutSeconds)
                    : new ExecutionFailure(ErrorUtils.formatErrorMessage(cause), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (future != null) {
                future.cancel(true);
            }
            failure = new ExecutionFailure("execution interrupted", e);
        } catch (RuntimeException e) {
            failure = new ExecutionFailure(ErrorUtils.formatErrorMessage(e), e);
        }

        long completedAt = clock.millis();
        ExecutionRecord record = ExecutionRecord.builder()
                .id(UUID.randomUUID().toString())
                .jobId(job.getId())
                .jobName(job.getName())
                .triggeredBy(trigger)
                .startedAtMs(startedAt)
                .completedAtMs(completedAt)
                .durationMs(Math.max(completedAt - startedAt, 0))
                .status(failure == null ? RunStatus.OK : RunStatus.ERROR)
                .error(failure == null ? null : failure.getMessage())
                .summary(summary)
                .build();

        AtomicBoolean superseded = new AtomicBoolean(false);
        Optional<CronJob> stored = applyResult(job.getId(), claimToken, record, superseded);
        store.appendRecord(record);

        if (superseded.get()) {
            log.warn("Cron job {} '{}' finished after its run was cleared as stale; outcome kept in history only",
                    job.getId(), job.getName());
            return record;
        }

        if (failure == null) {
            log.info("Cron job {} '{}' finished ok in {}ms ({})", job.getId(), job.getName(),
                    record.getDurationMs(), trigger.key());
        } else {
            log.warn("Cron job {} '{}' failed after {}ms: {} (consecutive errors: {})", job.getId(),
                    job.getName(), record.getDurationMs(), failure.getMessage(),
                    stored.map(j -> j.getState().getConsecutiveErrors()).orElse(0));
        }
        if (stored.isEmpty()) {
            log.info("Cron job {} no longer stored after run", job.getId());
        }
        return record;
    }

    /**
     * Clear the in-flight marker of a run that never completed (crash or
     * stall) and count it as a failure.
     *
     * @param staleAtOrBeforeMs only clear markers set at or before this instant
     * @return the record written, or empty if the marker was already gone
     */
    public Optional<ExecutionRecord> abandon(String jobId, String reason, long staleAtOrBeforeMs) {
        long now = clock.millis();
        AtomicReference<CronJob> cleared = new AtomicReference<>();
        AtomicReference<Long> startedAt = new AtomicReference<>();
        store.compute(jobId, job -> {
            CronJobState state = job.getState();
            Long runningAt = state.getRunningAtMs();
            if (runningAt == null || runningAt > staleAtOrBeforeMs) {
                return job;
            }
            startedAt.set(runningAt);
            state.setRunningAtMs(null);
            state.setLastRunAtMs(runningAt);
            state.setLastStatus(RunStatus.ERROR);
            state.setLastError(reason);
            state.setLastDurationMs(Math.max(now - runningAt, 0));
            state.setConsecutiveErrors(state.getConsecutiveErrors() + 1);
            if (job.isEnabled()) {
                recompute(job, now);
            } else {
                state.setNextRunAtMs(null);
            }
            cleared.set(job);
            return job;
        });
        CronJob job = cleared.get();
        if (job == null) {
            return Optional.empty();
        }
        ExecutionRecord record = ExecutionRecord.builder()
                .id(UUID.randomUUID().toString())
                .jobId(job.getId())
                .jobName(job.getName())
                .triggeredBy(TriggerSource.RECOVERY)
                .startedAtMs(startedAt.get())
                .completedAtMs(now)
                .durationMs(Math.max(now - startedAt.get(), 0))
                .status(RunStatus.ERROR)
                .error(reason)
                .build();
        store.appendRecord(record);
        log.warn("Cron job {} '{}' cleared: {} (running since {})", job.getId(), job.getName(), reason,
                startedAt.get());
        return Optional.of(record);
    }

    /**
     * Mark a missed one-shot job as skipped and disable it.
     *
     * @return the record written, or empty if the job is gone or running
     */
    public Optional<ExecutionRecord> skip(String jobId, String reason) {
        long now = clock.millis();
        AtomicReference<CronJob> skipped = new AtomicReference<>();
        store.compute(jobId, job -> {
            if (job.isRunning()) {
                return job;
            }
            CronJobState state = job.getState();
            state.setLastStatus(RunStatus.SKIPPED);
            state.setLastError(reason);
            state.setNextRunAtMs(null);
            job.setEnabled(false);
            job.setUpdatedAtMs(now);
            skipped.set(job);
            return job;
        });
        CronJob job = skipped.get();
        if (job == null) {
            return Optional.empty();
        }
        ExecutionRecord record = ExecutionRecord.builder()
                .id(UUID.randomUUID().toString())
                .jobId(job.getId())
                .jobName(job.getName())
                .triggeredBy(TriggerSource.RECOVERY)
                .startedAtMs(now)
                .completedAtMs(now)
                .durationMs(0)
                .status(RunStatus.SKIPPED)
                .error(reason)
                .build();
        store.appendRecord(record);
        log.info("Cron job {} '{}' skipped: {}", job.getId(), job.getName(), reason);
        return Optional.of(record);
    }

    /**
     * Retry delay after {@code consecutiveErrors} failures in a row.
     */
    public long backoffMs(int consecutiveErrors) {
        return Backoff.compute(backoff, consecutiveErrors);
    }

    private Optional<CronJob> applyResult(String jobId, Long claimToken, ExecutionRecord record,
            AtomicBoolean superseded) {
        long end = record.getCompletedAtMs();
        return store.compute(jobId, job -> {
            CronJobState state = job.getState();
            if (!Objects.equals(state.getRunningAtMs(), claimToken)) {
                superseded.set(true);
                return job;
            }
            state.setRunningAtMs(null);
            state.setLastRunAtMs(record.getStartedAtMs());
            state.setLastStatus(record.getStatus());
            state.setLastError(record.getError());
            state.setLastDurationMs(record.getDurationMs());
            job.setUpdatedAtMs(end);

            boolean ok = record.getStatus() == RunStatus.OK;
            if (ok) {
                state.setConsecutiveErrors(0);
            } else {
                state.setConsecutiveErrors(state.getConsecutiveErrors() + 1);
            }

            if (job.getSchedule().getKind() == ScheduleKind.AT) {
                if (ok && job.isDeleteAfterRun()) {
                    log.info("One-shot cron job {} '{}' deleted after run", job.getId(), job.getName());
                    return null;
                }
                job.setEnabled(false);
                state.setNextRunAtMs(null);
            } else if (!job.isEnabled()) {
                state.setNextRunAtMs(null);
            } else if (ok) {
                recompute(job, end);
            } else {
                long delay = backoffMs(state.getConsecutiveErrors());
                state.setNextRunAtMs(end + delay);
                log.info("Cron job {} backing off {}s (consecutive errors: {})", job.getId(), delay / 1000,
                        state.getConsecutiveErrors());
            }
            return job;
        });
    }

    /**
     * Recompute {@code next_run_at} from {@code fromMs}. A failure counts
     * towards {@code schedule_error_count}; at {@value #MAX_SCHEDULE_ERRORS}
     * the job is disabled and kept with its last error.
     *
     * @return true if a next run time was computed
     */
    static boolean recompute(CronJob job, long fromMs) {
        CronJobState state = job.getState();
        ScheduleKind kind = job.getSchedule() != null ? job.getSchedule().getKind() : null;
        try {
            Long next = ScheduleCalculator.nextRun(job.getSchedule(), fromMs);
            if (next == null && kind == ScheduleKind.AT) {
                // nothing left to fire
                job.setEnabled(false);
                state.setNextRunAtMs(null);
                state.setScheduleErrorCount(0);
                return false;
            }
            if (next == null) {
                throw new ScheduleComputationError("no next run for " + kind.key() + " schedule");
            }
            state.setNextRunAtMs(next);
            state.setScheduleErrorCount(0);
            return true;
        } catch (ScheduleComputationError e) {
            state.setNextRunAtMs(null);
            state.setScheduleErrorCount(state.getScheduleErrorCount() + 1);
            state.setLastError(e.getMessage());
            if (state.getScheduleErrorCount() >= MAX_SCHEDULE_ERRORS) {
                job.setEnabled(false);
                log.error("Cron job {} '{}' disabled after {} schedule errors: {}", job.getId(), job.getName(),
                        state.getScheduleErrorCount(), e.getReason());
            } else {
                log.warn("Cron job {} '{}' schedule error ({}/{}): {}", job.getId(), job.getName(),
                        state.getScheduleErrorCount(), MAX_SCHEDULE_ERRORS, e.getReason());
            }
            return false;
        }
    }
}
