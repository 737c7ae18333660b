package com.vibeblog.scheduler.cron;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * The work a job performs, supplied by the host application.
 * <p>
 * The scheduler never inspects {@code payload}. Completing exceptionally marks
 * the run as failed; a future that does not complete within {@code timeout}
 * is cancelled and the run is marked as timed out.
 */
@FunctionalInterface
public interface ExecutionCallback {

    /**
     * @param payload opaque work descriptor stored with the job
     * @param timeout the bound the scheduler will wait for
     * @return a future completing with an optional summary (e.g. a task id or URL)
     */
    CompletableFuture<String> execute(String payload, Duration timeout);
}
