package com.vibeblog.common.config;

import lombok.Data;

/**
 * Root configuration type for the Vibe Blog backend.
 * Only the sections the scheduler process reads are modelled; unknown keys are
 * ignored on load.
 */
@Data
public class VibeBlogConfig {

    /** State directory holding the database and logs (default ~/.vibe-blog). */
    private String stateDir;

    /** Cron/scheduling settings. */
    private CronConfig cron;

    @Data
    public static class CronConfig {
        private boolean enabled = true;
        /** SQLite database path; relative paths resolve against the state dir. */
        private String store;
        /** Upper bound on concurrently dispatched runs per tick. */
        private int maxConcurrentRuns = 2;
        private int defaultTimeoutSeconds = 600;
        private String defaultTimezone = "Asia/Shanghai";
        private long maxTimerDelayMs = 60_000;
        /** Runs older than this are treated as crashed. */
        private long stuckRunMs = 2 * 60 * 60 * 1000L;
        /** Missed one-shot jobs older than this are skipped on startup. */
        private long missedAtGraceMs = 2 * 60 * 60 * 1000L;
        private int historyLimit = 50;
        /** Endpoint the default execution callback posts job payloads to. */
        private String dispatchUrl;
    }
}
