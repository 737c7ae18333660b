package com.vibeblog.app.scheduler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vibeblog.scheduler.cron.CronState.CronStatusSummary;
import com.vibeblog.scheduler.cron.CronTypes.CronJob;
import com.vibeblog.scheduler.cron.CronTypes.CronJobState;
import com.vibeblog.scheduler.cron.CronTypes.CronSchedule;
import com.vibeblog.scheduler.cron.ExecutionRecord;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON views of scheduler objects, in the snake_case shape the dashboard reads.
 */
final class TaskViews {

    private TaskViews() {
    }

    static Map<String, Object> task(CronJob job, ObjectMapper mapper) {
        CronJobState state = job.getState();
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", job.getId());
        view.put("name", job.getName());
        view.put("description", job.getDescription());
        view.put("enabled", job.isEnabled());
        view.put("trigger", trigger(job.getSchedule()));
        view.put("generation", generation(job.getPayload(), mapper));
        view.put("delete_after_run", job.isDeleteAfterRun());
        view.put("timeout_seconds", job.getTimeoutSeconds());
        view.put("tags", job.getTags());
        view.put("next_run_at", iso(state.getNextRunAtMs()));
        view.put("running_at", iso(state.getRunningAtMs()));
        view.put("last_run_at", iso(state.getLastRunAtMs()));
        view.put("last_status", state.getLastStatus() != null ? state.getLastStatus().key() : null);
        view.put("last_error", state.getLastError());
        view.put("last_duration_ms", state.getLastDurationMs());
        view.put("consecutive_errors", state.getConsecutiveErrors());
        view.put("schedule_error_count", state.getScheduleErrorCount());
        view.put("created_at", iso(job.getCreatedAtMs()));
        view.put("updated_at", iso(job.getUpdatedAtMs()));
        return view;
    }

    static Map<String, Object> trigger(CronSchedule schedule) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("type", schedule.getKind().key());
        switch (schedule.getKind()) {
            case CRON -> view.put("cron_expression", schedule.getExpr());
            case AT -> view.put("scheduled_at", iso(schedule.getAtMs()));
            case EVERY -> {
                view.put("every_seconds", schedule.getEveryMs() / 1000);
                view.put("anchor_at", iso(schedule.getAnchorMs()));
            }
        }
        view.put("timezone", schedule.getTz());
        return view;
    }

    static Map<String, Object> record(ExecutionRecord record) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", record.getId());
        view.put("task_id", record.getJobId());
        view.put("task_name", record.getJobName());
        view.put("triggered_by", record.getTriggeredBy().key());
        view.put("status", record.getStatus().key());
        view.put("started_at", iso(record.getStartedAtMs()));
        view.put("completed_at", iso(record.getCompletedAtMs()));
        view.put("duration_ms", record.getDurationMs());
        view.put("error", record.getError());
        view.put("summary", record.getSummary());
        return view;
    }

    static Map<String, Object> status(CronStatusSummary status) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("enabled", status.isEnabled());
        view.put("running", status.isRunning());
        view.put("store_path", status.getStorePath());
        view.put("total_jobs", status.getTotalJobs());
        view.put("enabled_jobs", status.getEnabledJobs());
        view.put("running_jobs", status.getRunningJobs());
        view.put("next_wake_at", iso(status.getNextWakeAtMs()));
        return view;
    }

    // Payloads that are not JSON are shown verbatim.
    private static Object generation(String payload, ObjectMapper mapper) {
        if (payload == null) {
            return null;
        }
        try {
            return mapper.readTree(payload);
        } catch (JsonProcessingException e) {
            return payload;
        }
    }

    static String iso(Long epochMs) {
        return epochMs == null ? null : Instant.ofEpochMilli(epochMs).toString();
    }
}
