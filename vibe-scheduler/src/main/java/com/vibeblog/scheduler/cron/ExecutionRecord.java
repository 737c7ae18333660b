package com.vibeblog.scheduler.cron;

import com.vibeblog.scheduler.cron.CronTypes.RunStatus;
import com.vibeblog.scheduler.cron.CronTypes.TriggerSource;
import lombok.Builder;
import lombok.Value;

/**
 * Append-only history entry for one dispatch of a cron job.
 */
@Value
@Builder
public class ExecutionRecord {
    String id;
    String jobId;
    String jobName;
    TriggerSource triggeredBy;
    long startedAtMs;
    long completedAtMs;
    long durationMs;
    RunStatus status;
    String error;
    /** Text returned by the execution callback, if any. */
    String summary;
}
