package com.vibeblog.scheduler.cron;

import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinition;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.vibeblog.scheduler.cron.CronErrors.ScheduleComputationError;
import com.vibeblog.scheduler.cron.CronTypes.CronSchedule;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Computes when a trigger is next due.
 * <p>
 * Every result is strictly after the reference time. Only CRON triggers can
 * fail, with {@link ScheduleComputationError}; AT and EVERY answer {@code null}
 * when there is nothing left to run.
 */
public final class ScheduleCalculator {

    private static final CronDefinition UNIX_CRON = CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX);
    private static final CronParser PARSER = new CronParser(UNIX_CRON);
    private static final Cache<String, Cron> PARSED = Caffeine.newBuilder()
            .maximumSize(256)
            .build();

    private ScheduleCalculator() {
    }

    /**
     * @param schedule    trigger definition
     * @param referenceMs reference time in epoch ms
     * @return next due time in epoch ms, or null when the trigger has no future run
     * @throws ScheduleComputationError if a CRON expression or its time zone is malformed
     */
    public static Long nextRun(CronSchedule schedule, long referenceMs) {
        if (schedule == null || schedule.getKind() == null) {
            throw new ScheduleComputationError("missing schedule kind");
        }
        return switch (schedule.getKind()) {
            case AT -> nextAt(schedule, referenceMs);
            case EVERY -> nextEvery(schedule, referenceMs);
            case CRON -> nextCron(schedule, referenceMs);
        };
    }

    /**
     * Validate a trigger before it is accepted into the store.
     *
     * @throws ScheduleComputationError describing the first problem found
     */
    public static void validate(CronSchedule schedule, long nowMs) {
        if (schedule == null || schedule.getKind() == null) {
            throw new ScheduleComputationError("missing schedule kind");
        }
        switch (schedule.getKind()) {
            case AT -> {
                if (schedule.getAtMs() == null) {
                    throw new ScheduleComputationError("at schedule requires a timestamp");
                }
                if (schedule.getAtMs() <= nowMs) {
                    throw new ScheduleComputationError("at time " + Instant.ofEpochMilli(schedule.getAtMs())
                            + " has already passed");
                }
            }
            case EVERY -> {
                if (schedule.getEveryMs() == null || schedule.getEveryMs() <= 0) {
                    throw new ScheduleComputationError("every schedule requires a positive interval");
                }
            }
            case CRON -> nextCron(schedule, nowMs);
        }
    }

    private static Long nextAt(CronSchedule schedule, long referenceMs) {
        Long at = schedule.getAtMs();
        return at != null && at > referenceMs ? at : null;
    }

    private static Long nextEvery(CronSchedule schedule, long referenceMs) {
        Long every = schedule.getEveryMs();
        if (every == null || every <= 0) {
            return null;
        }
        Long anchor = schedule.getAnchorMs();
        if (anchor == null) {
            return referenceMs + every;
        }
        if (referenceMs < anchor) {
            return anchor;
        }
        long periods = (referenceMs - anchor) / every + 1;
        return anchor + periods * every;
    }

    private static Long nextCron(CronSchedule schedule, long referenceMs) {
        String expr = schedule.getExpr();
        if (expr == null || expr.isBlank()) {
            throw new ScheduleComputationError("cron schedule requires an expression");
        }
        ZoneId zone = resolveZone(schedule.getTz());
        ExecutionTime executionTime = ExecutionTime.forCron(parse(expr.trim()));

        ZonedDateTime reference = Instant.ofEpochMilli(referenceMs).atZone(zone);
        Optional<ZonedDateTime> next = executionTime.nextExecution(reference);
        // guard against a match on the reference instant itself
        while (next.isPresent() && !next.get().isAfter(reference)) {
            next = executionTime.nextExecution(next.get());
        }
        return next
                .map(t -> t.toInstant().toEpochMilli())
                .orElseThrow(() -> new ScheduleComputationError("cron expression '" + expr + "' never fires"));
    }

    private static Cron parse(String expr) {
        try {
            return PARSED.get(expr, key -> PARSER.parse(key).validate());
        } catch (IllegalArgumentException e) {
            throw new ScheduleComputationError("invalid cron expression '" + expr + "': " + e.getMessage(), e);
        }
    }

    private static ZoneId resolveZone(String tz) {
        if (tz == null || tz.isBlank()) {
            return ZoneOffset.UTC;
        }
        ZoneId zone = CronParse.parseZone(tz);
        if (zone == null) {
            throw new ScheduleComputationError("unknown time zone '" + tz + "'");
        }
        return zone;
    }
}
