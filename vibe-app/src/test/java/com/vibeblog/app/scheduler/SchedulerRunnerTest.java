package com.vibeblog.app.scheduler;

import com.vibeblog.common.config.VibeBlogConfig;
import com.vibeblog.scheduler.cron.CronJobStore;
import com.vibeblog.scheduler.cron.CronScheduler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

class SchedulerRunnerTest {

    @TempDir
    Path tempDir;

    private VibeBlogConfig config;
    private CronJobStore store;
    private CronScheduler scheduler;

    @BeforeEach
    void setUp() {
        store = new CronJobStore(tempDir.resolve("cron.db"));
        store.init();
        config = new VibeBlogConfig();
        config.setCron(new VibeBlogConfig.CronConfig());
        scheduler = new CronScheduler(store, (payload, timeout) -> CompletableFuture.completedFuture("ok"),
                Clock.systemUTC(), config.getCron());
    }

    @AfterEach
    void tearDown() {
        scheduler.close();
        store.close();
    }

    @Test
    void startsAndStopsTheLoop() {
        SchedulerRunner runner = new SchedulerRunner(scheduler, config, null);
        runner.start();
        assertTrue(scheduler.isRunning());
        runner.stop();
        assertFalse(scheduler.isRunning());
    }

    @Test
    void skipEnvironmentKeepsLoopOff() {
        SchedulerRunner runner = new SchedulerRunner(scheduler, config, "1");
        runner.start();
        assertFalse(runner.isLoopEnabled());
        assertFalse(scheduler.isRunning());
    }

    @Test
    void disabledConfigKeepsLoopOff() {
        config.getCron().setEnabled(false);
        SchedulerRunner runner = new SchedulerRunner(scheduler, config, null);
        runner.start();
        assertFalse(scheduler.isRunning());
    }
}
