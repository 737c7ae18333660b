package com.vibeblog.scheduler.cron;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vibeblog.scheduler.cron.CronTypes.CronJobCreate;
import com.vibeblog.scheduler.cron.CronTypes.CronJobPatch;
import com.vibeblog.scheduler.cron.CronTypes.CronSchedule;
import com.vibeblog.scheduler.cron.CronTypes.ScheduleKind;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Task input normalization: coerces raw request maps (snake_case or
 * camelCase keys) into typed create/patch objects.
 */
public final class CronNormalize {

    private CronNormalize() {
    }

    /**
     * Coerce a raw trigger map. The kind is auto-detected when {@code type}
     * is missing.
     *
     * @param defaultZone zone for local date-times when the trigger names none
     * @throws IllegalArgumentException on an unknown kind or unparseable time
     */
    public static CronSchedule coerceSchedule(Map<String, Object> trigger, ZoneId defaultZone) {
        String type = string(trigger, "type", "kind");
        String expr = string(trigger, "cron_expression", "cronExpression", "expr");
        String tz = string(trigger, "timezone", "tz");
        Object at = first(trigger, "scheduled_at", "scheduledAt", "at", "atMs");
        Object every = first(trigger, "every_seconds", "everySeconds");
        Object everyMs = first(trigger, "everyMs");

        ScheduleKind kind;
        if (type != null) {
            kind = ScheduleKind.fromKey(type);
            if (kind == null) {
                throw new IllegalArgumentException("unknown trigger type: " + type);
            }
        } else if (at != null) {
            kind = ScheduleKind.AT;
        } else if (every != null || everyMs != null) {
            kind = ScheduleKind.EVERY;
        } else if (expr != null) {
            kind = ScheduleKind.CRON;
        } else {
            throw new IllegalArgumentException("trigger type is required");
        }

        ZoneId zone = defaultZone;
        if (tz != null) {
            zone = CronParse.parseZone(tz);
            if (zone == null) {
                throw new IllegalArgumentException("unknown timezone: " + tz);
            }
        }

        CronSchedule.CronScheduleBuilder b = CronSchedule.builder().kind(kind).tz(tz);
        switch (kind) {
            case AT -> b.atMs(requireTime(at, zone, "scheduled_at"));
            case EVERY -> {
                if (every != null) {
                    b.everyMs(toLong(every, "every_seconds") * 1000L);
                } else if (everyMs != null) {
                    b.everyMs(toLong(everyMs, "everyMs"));
                } else {
                    throw new IllegalArgumentException("every_seconds is required");
                }
                Object anchor = first(trigger, "anchor_at", "anchorAt", "anchorMs");
                if (anchor != null) {
                    b.anchorMs(requireTime(anchor, zone, "anchor_at"));
                }
            }
            case CRON -> b.expr(expr);
        }
        return b.build();
    }

    /**
     * Normalize a task create body.
     */
    public static CronJobCreate normalizeCreate(Map<String, Object> raw, ZoneId defaultZone, ObjectMapper mapper) {
        Map<String, Object> next = unwrapJob(raw);
        Map<String, Object> trigger = map(next, "trigger", "schedule");
        Boolean enabled = bool(next, "enabled");
        return CronJobCreate.builder()
                .id(string(next, "id"))
                .name(string(next, "name"))
                .description(string(next, "description"))
                .enabled(enabled == null || enabled)
                .deleteAfterRun(Boolean.TRUE.equals(bool(next, "delete_after_run", "deleteAfterRun")))
                .schedule(trigger != null ? coerceSchedule(trigger, defaultZone) : null)
                .payload(payload(next, mapper))
                .timeoutSeconds(integer(next, "timeout_seconds", "timeoutSeconds"))
                .tags(tags(next))
                .build();
    }

    /**
     * Normalize a task patch body. Absent keys stay null.
     */
    public static CronJobPatch normalizePatch(Map<String, Object> raw, ZoneId defaultZone, ObjectMapper mapper) {
        Map<String, Object> next = unwrapJob(raw);
        Map<String, Object> trigger = map(next, "trigger", "schedule");
        return CronJobPatch.builder()
                .name(string(next, "name"))
                .description(string(next, "description"))
                .enabled(bool(next, "enabled"))
                .deleteAfterRun(bool(next, "delete_after_run", "deleteAfterRun"))
                .schedule(trigger != null ? coerceSchedule(trigger, defaultZone) : null)
                .payload(payload(next, mapper))
                .timeoutSeconds(integer(next, "timeout_seconds", "timeoutSeconds"))
                .tags(tags(next))
                .build();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> unwrapJob(Map<String, Object> raw) {
        if (raw == null) {
            return new LinkedHashMap<>();
        }
        if (raw.get("data") instanceof Map<?, ?> data) {
            return new LinkedHashMap<>((Map<String, Object>) data);
        }
        if (raw.get("job") instanceof Map<?, ?> job) {
            return new LinkedHashMap<>((Map<String, Object>) job);
        }
        return new LinkedHashMap<>(raw);
    }

    // The generation config travels as an opaque JSON string.
    private static String payload(Map<String, Object> m, ObjectMapper mapper) {
        Object generation = first(m, "generation", "payload");
        if (generation == null || generation instanceof String) {
            return (String) generation;
        }
        try {
            return mapper.writeValueAsString(generation);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("generation is not serializable: " + e.getOriginalMessage(), e);
        }
    }

    private static List<String> tags(Map<String, Object> m) {
        Object raw = m.get("tags");
        if (raw == null) {
            return null;
        }
        if (!(raw instanceof List<?> list)) {
            throw new IllegalArgumentException("tags must be a list");
        }
        List<String> tags = new ArrayList<>();
        for (Object tag : list) {
            if (tag != null && !tag.toString().isBlank()) {
                tags.add(tag.toString().trim());
            }
        }
        return tags;
    }

    private static Long requireTime(Object value, ZoneId zone, String field) {
        Long ms = value instanceof Number n ? Long.valueOf(n.longValue())
                : CronParse.parseAbsoluteTimeMs(value.toString(), zone);
        if (ms == null) {
            throw new IllegalArgumentException("invalid " + field + ": " + value);
        }
        return ms;
    }

    private static long toLong(Object value, String field) {
        if (value instanceof Number n) {
            return n.longValue();
        }
        try {
            return Long.parseLong(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid " + field + ": " + value, e);
        }
    }

    private static Object first(Map<String, Object> m, String... keys) {
        for (String key : keys) {
            Object v = m.get(key);
            if (v != null) {
                return v;
            }
        }
        return null;
    }

    private static String string(Map<String, Object> m, String... keys) {
        Object v = first(m, keys);
        if (v == null) {
            return null;
        }
        String s = v.toString().trim();
        return s.isEmpty() ? null : s;
    }

    private static Boolean bool(Map<String, Object> m, String... keys) {
        Object v = first(m, keys);
        if (v == null) {
            return null;
        }
        return v instanceof Boolean b ? b : Boolean.parseBoolean(v.toString().trim());
    }

    private static Integer integer(Map<String, Object> m, String... keys) {
        Object v = first(m, keys);
        return v == null ? null : Math.toIntExact(toLong(v, keys[0]));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> map(Map<String, Object> m, String... keys) {
        Object v = first(m, keys);
        if (v == null) {
            return null;
        }
        if (!(v instanceof Map<?, ?>)) {
            throw new IllegalArgumentException(keys[0] + " must be an object");
        }
        return (Map<String, Object>) v;
    }
}
