package com.vibeblog.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration;
import org.springframework.context.annotation.ComponentScan;

/**
 * Vibe Blog scheduler service entry point.
 * <p>
 * Flyway runs from {@code CronJobStore#init()} against the scheduler's own
 * SQLite file, so Spring Boot's auto-configured migration is switched off.
 */
@SpringBootApplication(exclude = FlywayAutoConfiguration.class)
@ComponentScan(basePackages = "com.vibeblog")
public class VibeBlogApplication {

    public static void main(String[] args) {
        SpringApplication.run(VibeBlogApplication.class, args);
    }
}
