package com.vibeblog.common.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ConfigServiceTest {

    @TempDir
    Path tempDir;
    private Path configPath;

    @BeforeEach
    void setUp() {
        configPath = tempDir.resolve("config.json");
    }

    @Test
    void loadConfig_validJson_returnsConfig() throws IOException {
        String json = """
                {
                  "stateDir": "/var/lib/vibe",
                  "cron": {
                    "maxConcurrentRuns": 4,
                    "defaultTimezone": "UTC",
                    "dispatchUrl": "http://localhost:5001/api/tasks"
                  },
                  "unknownSection": { "x": 1 }
                }
                """;
        Files.writeString(configPath, json);

        ConfigService service = new ConfigService(configPath);
        VibeBlogConfig config = service.loadConfig();

        assertEquals("/var/lib/vibe", config.getStateDir());
        assertEquals(4, config.getCron().getMaxConcurrentRuns());
        assertEquals("UTC", config.getCron().getDefaultTimezone());
        assertEquals("http://localhost:5001/api/tasks", config.getCron().getDispatchUrl());
        // untouched defaults survive
        assertEquals(600, config.getCron().getDefaultTimeoutSeconds());
        assertEquals(60_000, config.getCron().getMaxTimerDelayMs());
    }

    @Test
    void loadConfig_missingFile_returnsDefaults() {
        ConfigService service = new ConfigService(tempDir.resolve("nonexistent.json"));
        VibeBlogConfig config = service.loadConfig();

        assertNotNull(config.getCron());
        assertTrue(config.getCron().isEnabled());
        assertEquals(2, config.getCron().getMaxConcurrentRuns());
        assertEquals("Asia/Shanghai", config.getCron().getDefaultTimezone());
        assertEquals(ConfigService.DEFAULT_STATE_DIR, config.getStateDir());
    }

    @Test
    void loadConfig_invalidConcurrency_clampedToOne() throws IOException {
        Files.writeString(configPath, "{ \"cron\": { \"maxConcurrentRuns\": 0 } }");

        VibeBlogConfig config = new ConfigService(configPath).loadConfig();

        assertEquals(1, config.getCron().getMaxConcurrentRuns());
    }

    @Test
    void substituteEnvVars_plainString_noChange() {
        ConfigService service = new ConfigService(configPath);
        assertEquals("hello", service.substituteEnvVars("hello"));
    }

    @Test
    void substituteEnvVars_withDefault_usesDefault() {
        ConfigService service = new ConfigService(configPath);
        String result = service.substituteEnvVars("${__UNLIKELY_VAR_XYZ:-fallback}");
        assertEquals("fallback", result);
    }

    @Test
    void loadConfig_isCached() throws IOException {
        Files.writeString(configPath, "{ \"cron\": { \"historyLimit\": 10 } }");

        ConfigService service = new ConfigService(configPath, Duration.ofMinutes(5));
        VibeBlogConfig first = service.loadConfig();
        Files.writeString(configPath, "{ \"cron\": { \"historyLimit\": 20 } }");
        VibeBlogConfig second = service.loadConfig();

        assertSame(first, second);
        assertEquals(20, service.reloadConfig().getCron().getHistoryLimit());
    }

    @Test
    void resolveStorePath_relativeUnderStateDir() throws IOException {
        Files.writeString(configPath, "{ \"stateDir\": \"" + tempDir.toString().replace("\\", "\\\\")
                + "\", \"cron\": { \"store\": \"db/jobs.db\" } }");
        ConfigService service = new ConfigService(configPath);

        Path store = service.resolveStorePath(service.loadConfig());

        assertEquals(tempDir.resolve("db/jobs.db"), store);
    }

    @Test
    void resolveStorePath_defaultStore() {
        ConfigService service = new ConfigService(configPath);
        VibeBlogConfig config = service.loadConfig();
        config.setStateDir(tempDir.toString());

        assertEquals(tempDir.resolve("data/task_queue.db"), service.resolveStorePath(config));
    }
}
