package com.vibeblog.common.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads and caches the Vibe Blog configuration file.
 */
@Slf4j
public class ConfigService {

    private static final Duration DEFAULT_CACHE_TTL = Duration.ofMillis(200);
    private static final Pattern ENV_VAR_PATTERN = Pattern.compile("\\$\\{([^}:]+)(?::-(.*?))?}");
    static final String DEFAULT_STATE_DIR = "~/.vibe-blog";
    static final String DEFAULT_STORE = "data/task_queue.db";

    private final ObjectMapper objectMapper;
    private final Cache<String, VibeBlogConfig> cache;
    private final Path configPath;

    public ConfigService(Path configPath) {
        this(configPath, DEFAULT_CACHE_TTL);
    }

    public ConfigService(Path configPath, Duration cacheTtl) {
        this.configPath = expandHome(configPath.toString());
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(cacheTtl)
                .maximumSize(1)
                .build();
    }

    /**
     * Load config with caching.
     */
    public VibeBlogConfig loadConfig() {
        return cache.get(configPath.toString(), key -> doLoadConfig());
    }

    /**
     * Force reload config, bypassing cache.
     */
    public VibeBlogConfig reloadConfig() {
        cache.invalidateAll();
        return loadConfig();
    }

    public Path getConfigPath() {
        return configPath;
    }

    /**
     * Resolve the scheduler database path: absolute {@code cron.store} as-is,
     * relative paths under the state directory.
     */
    public Path resolveStorePath(VibeBlogConfig config) {
        Path stateDir = expandHome(config.getStateDir());
        String store = config.getCron().getStore();
        Path storePath = expandHome(store == null || store.isBlank() ? DEFAULT_STORE : store);
        return storePath.isAbsolute() ? storePath : stateDir.resolve(storePath);
    }

    private VibeBlogConfig doLoadConfig() {
        if (!Files.exists(configPath)) {
            log.warn("Config file not found: {}, using defaults", configPath);
            return applyDefaults(new VibeBlogConfig());
        }
        try {
            String raw = substituteEnvVars(Files.readString(configPath));
            VibeBlogConfig config = applyDefaults(objectMapper.readValue(raw, VibeBlogConfig.class));
            log.info("Config loaded from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to load config from: {}", configPath, e);
            return applyDefaults(new VibeBlogConfig());
        }
    }

    /**
     * Substitute ${VAR} and ${VAR:-default} patterns.
     */
    String substituteEnvVars(String raw) {
        Map<String, String> env = System.getenv();
        Matcher matcher = ENV_VAR_PATTERN.matcher(raw);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            String varName = matcher.group(1);
            String defaultValue = matcher.group(2);
            String value = env.getOrDefault(varName,
                    defaultValue != null ? defaultValue : "");
            matcher.appendReplacement(result, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Apply default values to missing config fields.
     */
    VibeBlogConfig applyDefaults(VibeBlogConfig config) {
        if (config.getStateDir() == null || config.getStateDir().isBlank()) {
            config.setStateDir(DEFAULT_STATE_DIR);
        }
        if (config.getCron() == null) {
            config.setCron(new VibeBlogConfig.CronConfig());
        }
        VibeBlogConfig.CronConfig cron = config.getCron();
        if (cron.getMaxConcurrentRuns() < 1) {
            log.warn("cron.maxConcurrentRuns must be >= 1, got {}; using 1", cron.getMaxConcurrentRuns());
            cron.setMaxConcurrentRuns(1);
        }
        if (cron.getDefaultTimeoutSeconds() <= 0) {
            cron.setDefaultTimeoutSeconds(600);
        }
        if (cron.getDefaultTimezone() == null || cron.getDefaultTimezone().isBlank()) {
            cron.setDefaultTimezone("Asia/Shanghai");
        }
        return config;
    }

    public static Path expandHome(String path) {
        if (path.startsWith("~")) {
            return Path.of(System.getProperty("user.home") + path.substring(1));
        }
        return Path.of(path);
    }
}
