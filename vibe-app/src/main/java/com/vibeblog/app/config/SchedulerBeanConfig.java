package com.vibeblog.app.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vibeblog.app.scheduler.HttpExecutionCallback;
import com.vibeblog.app.scheduler.SchedulerRunner;
import com.vibeblog.common.config.ConfigService;
import com.vibeblog.common.config.VibeBlogConfig;
import com.vibeblog.scheduler.cron.CronJobStore;
import com.vibeblog.scheduler.cron.CronScheduler;
import com.vibeblog.scheduler.cron.ExecutionCallback;
import com.zaxxer.hikari.HikariDataSource;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Spring configuration for the scheduler beans.
 */
@Configuration
public class SchedulerBeanConfig {

    @Value("${vibeblog.config.path:~/.vibe-blog/config.json}")
    private String configPath;

    @Bean
    public ConfigService configService() {
        return new ConfigService(ConfigService.expandHome(configPath));
    }

    @Bean
    public VibeBlogConfig vibeBlogConfig(ConfigService configService) {
        return configService.loadConfig();
    }

    @Bean
    public Clock schedulerClock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "close")
    public HikariDataSource cronStoreDataSource(ConfigService configService, VibeBlogConfig config) {
        return CronJobStore.pooledDataSource(configService.resolveStorePath(config));
    }

    @Bean
    public CronJobStore cronJobStore(ConfigService configService, VibeBlogConfig config,
            HikariDataSource cronStoreDataSource) {
        CronJobStore store = new CronJobStore(configService.resolveStorePath(config), cronStoreDataSource);
        store.init();
        return store;
    }

    @Bean
    public ExecutionCallback executionCallback(VibeBlogConfig config, ObjectMapper objectMapper) {
        return new HttpExecutionCallback(config.getCron().getDispatchUrl(), objectMapper);
    }

    @Bean
    public CronScheduler cronScheduler(CronJobStore store, ExecutionCallback callback, Clock schedulerClock,
            VibeBlogConfig config) {
        return new CronScheduler(store, callback, schedulerClock, config.getCron());
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public SchedulerRunner schedulerRunner(CronScheduler scheduler, VibeBlogConfig config) {
        return new SchedulerRunner(scheduler, config);
    }
}
