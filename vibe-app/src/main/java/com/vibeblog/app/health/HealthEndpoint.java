package com.vibeblog.app.health;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.vibeblog.scheduler.cron.CronScheduler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.lang.management.ManagementFactory;

/**
 * Liveness check.
 */
@RestController
public class HealthEndpoint {

    private final ObjectMapper mapper = new ObjectMapper();
    private final CronScheduler scheduler;

    public HealthEndpoint(CronScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @GetMapping("/health")
    public ObjectNode health() {
        var node = mapper.createObjectNode();
        node.put("status", "ok");
        node.put("uptime", ManagementFactory.getRuntimeMXBean().getUptime());
        node.put("scheduler_running", scheduler.isRunning());

        var memory = node.putObject("memory");
        Runtime rt = Runtime.getRuntime();
        memory.put("used_mb", (rt.totalMemory() - rt.freeMemory()) / (1024 * 1024));
        memory.put("max_mb", rt.maxMemory() / (1024 * 1024));

        var threads = node.putObject("threads");
        threads.put("active", Thread.activeCount());
        return node;
    }
}
