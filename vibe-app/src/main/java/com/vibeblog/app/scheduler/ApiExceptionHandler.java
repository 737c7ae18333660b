package com.vibeblog.app.scheduler;

import com.vibeblog.common.infra.ErrorUtils;
import com.vibeblog.scheduler.cron.CronErrors.AlreadyRunningError;
import com.vibeblog.scheduler.cron.CronErrors.JobNotFoundError;
import com.vibeblog.scheduler.cron.CronErrors.NotDueError;
import com.vibeblog.scheduler.cron.CronErrors.PersistenceError;
import com.vibeblog.scheduler.cron.CronErrors.ScheduleComputationError;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;
import java.util.concurrent.RejectedExecutionException;

/**
 * Maps scheduler errors to HTTP statuses with an {@code {"error": ...}} body.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(JobNotFoundError.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, String> handleNotFound(JobNotFoundError ex) {
        return error(ex);
    }

    @ExceptionHandler({IllegalArgumentException.class, ScheduleComputationError.class, NotDueError.class})
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, String> handleBadRequest(RuntimeException ex) {
        return error(ex);
    }

    @ExceptionHandler(AlreadyRunningError.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Map<String, String> handleAlreadyRunning(AlreadyRunningError ex) {
        return error(ex);
    }

    @ExceptionHandler(PersistenceError.class)
    @ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
    public Map<String, String> handlePersistence(PersistenceError ex) {
        log.error("Scheduler store unavailable: {}", ex.getMessage(), ex);
        return error(ex);
    }

    @ExceptionHandler(RejectedExecutionException.class)
    @ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
    public Map<String, String> handleStopped(RejectedExecutionException ex) {
        return Map.of("error", "scheduler is stopped");
    }

    private static Map<String, String> error(Throwable ex) {
        return Map.of("error", ErrorUtils.formatErrorMessage(ex));
    }
}
