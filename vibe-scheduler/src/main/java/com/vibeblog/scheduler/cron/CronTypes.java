package com.vibeblog.scheduler.cron;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Cron job type definitions: schedule variants, runtime state, the job row and
 * the create/patch inputs accepted by {@link CronScheduler}.
 * All timestamps are epoch milliseconds.
 */
public final class CronTypes {

    private CronTypes() {
    }

    // =========================================================================
    // Schedule
    // =========================================================================

    public enum ScheduleKind {
        AT, EVERY, CRON;

        public String key() {
            return name().toLowerCase();
        }

        /**
         * Accepts the kind names plus the legacy "once" alias for AT.
         */
        public static ScheduleKind fromKey(String key) {
            if (key == null)
                return null;
            return switch (key.trim().toLowerCase()) {
                case "at", "once" -> AT;
                case "every", "interval" -> EVERY;
                case "cron" -> CRON;
                default -> null;
            };
        }
    }

    @Data
    @Builder(toBuilder = true)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CronSchedule {
        private ScheduleKind kind;
        /** Absolute fire time for "at" schedules. */
        private Long atMs;
        /** Interval in milliseconds for "every" schedules. */
        private Long everyMs;
        /** Anchor the "every" cadence is computed from. */
        private Long anchorMs;
        /** 5-field cron expression for "cron" schedules (e.g. "0 8 * * *"). */
        private String expr;
        /** IANA time zone for "cron" schedules. */
        private String tz;
    }

    // =========================================================================
    // Job state
    // =========================================================================

    public enum RunStatus {
        OK, ERROR, SKIPPED;

        public String key() {
            return name().toLowerCase();
        }

        public static RunStatus fromKey(String key) {
            return key == null ? null : RunStatus.valueOf(key.toUpperCase());
        }
    }

    /** What caused a run. */
    public enum TriggerSource {
        SCHEDULE, MANUAL, RECOVERY;

        public String key() {
            return name().toLowerCase();
        }

        public static TriggerSource fromKey(String key) {
            return key == null ? SCHEDULE : TriggerSource.valueOf(key.toUpperCase());
        }
    }

    @Data
    @Builder(toBuilder = true)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CronJobState {
        private Long nextRunAtMs;
        /** Set only while a run is in flight. */
        private Long runningAtMs;
        private Long lastRunAtMs;
        /** null until the first run. */
        private RunStatus lastStatus;
        private String lastError;
        private Long lastDurationMs;
        private int consecutiveErrors;
        private int scheduleErrorCount;
    }

    // =========================================================================
    // Job
    // =========================================================================

    @Data
    @Builder(toBuilder = true)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CronJob {
        private String id;
        private String name;
        private String description;
        private boolean enabled;
        private boolean deleteAfterRun;
        private CronSchedule schedule;
        /** Opaque work descriptor handed to the execution callback unopened. */
        private String payload;
        private int timeoutSeconds;
        @Builder.Default
        private List<String> tags = new ArrayList<>();
        private long createdAtMs;
        private long updatedAtMs;
        @Builder.Default
        private CronJobState state = new CronJobState();

        public boolean isRunning() {
            return state != null && state.getRunningAtMs() != null;
        }
    }

    // =========================================================================
    // Create/Patch inputs
    // =========================================================================

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CronJobCreate {
        private String id;
        private String name;
        private String description;
        @Builder.Default
        private boolean enabled = true;
        private boolean deleteAfterRun;
        private CronSchedule schedule;
        private String payload;
        /** null means the configured default. */
        private Integer timeoutSeconds;
        private List<String> tags;
    }

    /** Partial edit; null fields are left untouched. */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CronJobPatch {
        private String name;
        private String description;
        private Boolean enabled;
        private Boolean deleteAfterRun;
        private CronSchedule schedule;
        private String payload;
        private Integer timeoutSeconds;
        private List<String> tags;
    }

    /** Filter for {@link CronJobStore#list(CronJobFilter)}; null fields match everything. */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CronJobFilter {
        private Boolean enabled;
        private ScheduleKind kind;
        /** Only jobs with next_run_at at or before this instant. */
        private Long dueAtOrBeforeMs;
        /** Only jobs with a running marker set. */
        private Boolean running;

        public static CronJobFilter all() {
            return new CronJobFilter();
        }

        public static CronJobFilter enabledOnly() {
            return CronJobFilter.builder().enabled(true).build();
        }
    }
}
