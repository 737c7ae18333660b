package com.vibeblog.scheduler.cron;

import lombok.Builder;
import lombok.Data;

/**
 * Scheduler-level result and status types.
 */
public final class CronState {

    private CronState() {
    }

    // =========================================================================
    // Enums
    // =========================================================================

    /** How a manual run treats a job that is not yet due. */
    public enum CronRunMode {
        /** Run regardless of the schedule. */
        FORCE,
        /** Run only if the job is enabled and due now. */
        DUE;

        public static CronRunMode fromKey(String key) {
            if (key == null || key.isBlank()) {
                return FORCE;
            }
            return switch (key.trim().toLowerCase()) {
                case "force" -> FORCE;
                case "due" -> DUE;
                default -> throw new IllegalArgumentException("unknown run mode: " + key);
            };
        }
    }

    // =========================================================================
    // Status
    // =========================================================================

    /**
     * Scheduler status summary for diagnostics.
     */
    @Data
    @Builder
    public static class CronStatusSummary {
        private boolean enabled;
        private boolean running;
        private String storePath;
        private int totalJobs;
        private int enabledJobs;
        private int runningJobs;
        private Long nextWakeAtMs;
    }
}
