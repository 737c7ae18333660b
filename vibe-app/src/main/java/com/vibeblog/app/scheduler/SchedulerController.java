package com.vibeblog.app.scheduler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vibeblog.common.config.VibeBlogConfig;
import com.vibeblog.scheduler.cron.CronErrors.JobNotFoundError;
import com.vibeblog.scheduler.cron.CronNormalize;
import com.vibeblog.scheduler.cron.CronScheduler;
import com.vibeblog.scheduler.cron.CronState.CronRunMode;
import com.vibeblog.scheduler.cron.CronTypes.CronJob;
import com.vibeblog.scheduler.cron.CronTypes.CronJobCreate;
import com.vibeblog.scheduler.cron.CronTypes.CronJobPatch;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Management surface for scheduled generation tasks.
 */
@Slf4j
@RestController
@RequestMapping("/api/scheduler")
public class SchedulerController {

    private final CronScheduler scheduler;
    private final ObjectMapper objectMapper;
    private final ZoneId defaultZone;

    public SchedulerController(CronScheduler scheduler, VibeBlogConfig config, ObjectMapper objectMapper) {
        this.scheduler = scheduler;
        this.objectMapper = objectMapper;
        this.defaultZone = ZoneId.of(config.getCron().getDefaultTimezone());
    }

    @PostMapping("/tasks")
    public ResponseEntity<Map<String, Object>> create(@RequestBody(required = false) Map<String, Object> body) {
        if (body == null || body.get("name") == null) {
            throw new IllegalArgumentException("name is required");
        }
        if (!(body.get("trigger") instanceof Map<?, ?>)) {
            throw new IllegalArgumentException("trigger is required");
        }
        if (!(body.get("generation") instanceof Map<?, ?> generation) || generation.get("topic") == null) {
            throw new IllegalArgumentException("generation.topic is required");
        }
        CronJobCreate create = CronNormalize.normalizeCreate(body, defaultZone, objectMapper);
        CronJob job = scheduler.add(create);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("task_id", job.getId());
        result.put("status", "created");
        result.put("next_run_at", TaskViews.iso(job.getState().getNextRunAtMs()));
        return ResponseEntity.status(HttpStatus.CREATED).body(result);
    }

    @GetMapping("/tasks")
    public List<Map<String, Object>> list(
            @RequestParam(name = "include_disabled", defaultValue = "true") boolean includeDisabled) {
        return scheduler.list(includeDisabled).stream()
                .map(job -> TaskViews.task(job, objectMapper))
                .toList();
    }

    @GetMapping("/tasks/{id}")
    public Map<String, Object> get(@PathVariable String id) {
        CronJob job = scheduler.get(id).orElseThrow(() -> new JobNotFoundError(id));
        return TaskViews.task(job, objectMapper);
    }

    @PatchMapping("/tasks/{id}")
    public Map<String, Object> update(@PathVariable String id, @RequestBody Map<String, Object> body) {
        CronJobPatch patch = CronNormalize.normalizePatch(body, defaultZone, objectMapper);
        return TaskViews.task(scheduler.update(id, patch), objectMapper);
    }

    @DeleteMapping("/tasks/{id}")
    public Map<String, Object> delete(@PathVariable String id) {
        scheduler.remove(id);
        return ack("deleted", id);
    }

    @PostMapping("/tasks/{id}/pause")
    public Map<String, Object> pause(@PathVariable String id) {
        scheduler.pause(id);
        return ack("paused", id);
    }

    @PostMapping("/tasks/{id}/resume")
    public Map<String, Object> resume(@PathVariable String id) {
        scheduler.resume(id);
        return ack("resumed", id);
    }

    @PostMapping("/tasks/{id}/retry")
    public Map<String, Object> retry(@PathVariable String id) {
        scheduler.retry(id);
        return ack("retrying", id);
    }

    /**
     * Start a run on the worker pool and answer without waiting for it;
     * the outcome lands in the task's run history.
     */
    @PostMapping("/tasks/{id}/run")
    public ResponseEntity<Map<String, Object>> run(@PathVariable String id,
            @RequestParam(name = "mode", required = false) String mode) {
        scheduler.runNow(id, CronRunMode.fromKey(mode))
                .whenComplete((record, err) -> {
                    if (err != null) {
                        log.error("Manual run of task {} could not be recorded: {}", id, err.getMessage());
                    }
                });
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(ack("started", id));
    }

    @GetMapping("/tasks/{id}/runs")
    public List<Map<String, Object>> runs(@PathVariable String id,
            @RequestParam(name = "limit", defaultValue = "0") int limit) {
        return scheduler.runs(id, limit).stream().map(TaskViews::record).toList();
    }

    @GetMapping("/status")
    public Map<String, Object> status() {
        return TaskViews.status(scheduler.status());
    }

    private static Map<String, Object> ack(String status, String id) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("status", status);
        result.put("task_id", id);
        return result;
    }
}
