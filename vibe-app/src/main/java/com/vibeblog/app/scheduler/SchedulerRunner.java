package com.vibeblog.app.scheduler;

import com.vibeblog.common.config.VibeBlogConfig;
import com.vibeblog.scheduler.cron.CronScheduler;
import lombok.extern.slf4j.Slf4j;

/**
 * Starts and stops the scheduler loop with the application.
 * <p>
 * The loop stays off when {@code cron.enabled} is false or the environment
 * sets {@code VIBE_BLOG_SKIP_CRON=1}; management operations keep working.
 */
@Slf4j
public class SchedulerRunner {

    static final String SKIP_ENV = "VIBE_BLOG_SKIP_CRON";

    private final CronScheduler scheduler;
    private final boolean loopEnabled;

    public SchedulerRunner(CronScheduler scheduler, VibeBlogConfig config) {
        this(scheduler, config, System.getenv(SKIP_ENV));
    }

    SchedulerRunner(CronScheduler scheduler, VibeBlogConfig config, String skipEnv) {
        this.scheduler = scheduler;
        this.loopEnabled = !"1".equals(skipEnv)
                && (config.getCron() == null || config.getCron().isEnabled());
    }

    public void start() {
        if (!loopEnabled) {
            log.info("cron: loop disabled by config or {}", SKIP_ENV);
            return;
        }
        scheduler.start();
        log.info("cron: started");
    }

    public void stop() {
        scheduler.stop();
        log.info("cron: stopped");
    }

    public boolean isLoopEnabled() {
        return loopEnabled;
    }
}
