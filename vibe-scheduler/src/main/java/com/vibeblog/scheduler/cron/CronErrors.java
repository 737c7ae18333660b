package com.vibeblog.scheduler.cron;

/**
 * Error taxonomy of the scheduler.
 * <p>
 * Job-level failures ({@link ScheduleComputationError}, {@link ExecutionFailure},
 * {@link ExecutionTimeoutError}) are recorded on the job and never abort the
 * loop. {@link PersistenceError} is the only systemic failure and always
 * reaches the caller.
 */
public final class CronErrors {

    private CronErrors() {
    }

    /** A trigger definition that cannot produce a next run time. */
    public static class ScheduleComputationError extends RuntimeException {
        private final String reason;

        public ScheduleComputationError(String reason) {
            super("schedule error: " + reason);
            this.reason = reason;
        }

        public ScheduleComputationError(String reason, Throwable cause) {
            super("schedule error: " + reason, cause);
            this.reason = reason;
        }

        public String getReason() {
            return reason;
        }
    }

    /** The execution callback reported an error. */
    public static class ExecutionFailure extends RuntimeException {
        public ExecutionFailure(String message) {
            super(message);
        }

        public ExecutionFailure(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /** The execution callback exceeded the job's timeout. */
    public static class ExecutionTimeoutError extends ExecutionFailure {
        public ExecutionTimeoutError(long timeoutSeconds) {
            super("execution timed out after " + timeoutSeconds + "s");
        }
    }

    /** The job store could not be read or written. */
    public static class PersistenceError extends RuntimeException {
        public PersistenceError(String message, Throwable cause) {
            super(message, cause);
        }
    }

    public static class JobNotFoundError extends RuntimeException {
        private final String jobId;

        public JobNotFoundError(String jobId) {
            super("job not found: " + jobId);
            this.jobId = jobId;
        }

        public String getJobId() {
            return jobId;
        }
    }

    /** Dispatch rejected because the job already has a run in flight. */
    public static class AlreadyRunningError extends RuntimeException {
        public AlreadyRunningError(String jobId) {
            super("already-running: " + jobId);
        }
    }

    /** Scheduled dispatch rejected because the job is disabled or no longer due. */
    public static class NotDueError extends RuntimeException {
        public NotDueError(String jobId) {
            super("not-due: " + jobId);
        }
    }
}
