package com.vibeblog.scheduler.cron;

import com.vibeblog.scheduler.cron.CronTypes.CronJob;
import com.vibeblog.scheduler.cron.CronTypes.CronJobFilter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Wake-time arithmetic and stall detection for the scheduler loop.
 */
@Slf4j
public class CronTimer {

    static final String STALE_REASON = "stale execution cleared";

    private final CronJobStore store;
    private final CronExecutor executor;
    private final long maxTimerDelayMs;
    private final long stuckRunMs;

    public CronTimer(CronJobStore store, CronExecutor executor, long maxTimerDelayMs, long stuckRunMs) {
        this.store = store;
        this.executor = executor;
        this.maxTimerDelayMs = maxTimerDelayMs;
        this.stuckRunMs = stuckRunMs;
    }

    /**
     * Delay until the earliest enabled, idle job is due, clamped to
     * {@code [0, maxTimerDelayMs]}. With nothing to wait for the cap is returned.
     */
    public long computeSleepDurationMs(List<CronJob> jobs, long nowMs) {
        Long earliest = nextWakeAtMs(jobs);
        if (earliest == null) {
            return maxTimerDelayMs;
        }
        return Math.max(0, Math.min(earliest - nowMs, maxTimerDelayMs));
    }

    /**
     * Earliest {@code next_run_at} among enabled jobs that are not running.
     */
    public static Long nextWakeAtMs(List<CronJob> jobs) {
        Long earliest = null;
        for (CronJob job : jobs) {
            if (!job.isEnabled() || job.isRunning()) {
                continue;
            }
            Long next = job.getState().getNextRunAtMs();
            if (next != null && (earliest == null || next < earliest)) {
                earliest = next;
            }
        }
        return earliest;
    }

    /**
     * Clear every in-flight marker held for longer than the stall threshold.
     * A run exactly at the threshold is left alone.
     *
     * @return records written for the cleared runs
     */
    public List<ExecutionRecord> detectStalls(long nowMs) {
        long staleAtOrBefore = nowMs - stuckRunMs - 1;
        CronJobFilter running = CronJobFilter.builder().running(true).build();

        List<ExecutionRecord> cleared = new ArrayList<>();
        for (CronJob job : store.list(running)) {
            Long runningAt = job.getState().getRunningAtMs();
            if (runningAt == null || runningAt > staleAtOrBefore) {
                continue;
            }
            log.warn("Cron job {} '{}' stuck for {}ms", job.getId(), job.getName(), nowMs - runningAt);
            executor.abandon(job.getId(), STALE_REASON, staleAtOrBefore).ifPresent(cleared::add);
        }
        return cleared;
    }

    public long getMaxTimerDelayMs() {
        return maxTimerDelayMs;
    }

    public long getStuckRunMs() {
        return stuckRunMs;
    }
}
