package com.vibeblog.scheduler.cron;

import com.vibeblog.scheduler.cron.CronTypes.CronJob;
import com.vibeblog.scheduler.cron.CronTypes.CronJobState;
import com.vibeblog.scheduler.cron.CronTypes.CronSchedule;
import com.vibeblog.scheduler.cron.CronTypes.ScheduleKind;

import java.time.Instant;
import java.util.List;

final class CronFixtures {

    static final long T0 = Instant.parse("2024-01-01T00:00:00Z").toEpochMilli();
    static final long MINUTE = 60_000L;

    private CronFixtures() {
    }

    static CronSchedule cron(String expr) {
        return CronSchedule.builder().kind(ScheduleKind.CRON).expr(expr).tz("UTC").build();
    }

    static CronSchedule every(long everyMs, long anchorMs) {
        return CronSchedule.builder().kind(ScheduleKind.EVERY).everyMs(everyMs).anchorMs(anchorMs).build();
    }

    static CronSchedule at(long atMs) {
        return CronSchedule.builder().kind(ScheduleKind.AT).atMs(atMs).build();
    }

    /** An enabled job due at {@code nextRunAtMs}. */
    static CronJob job(String id, CronSchedule schedule, Long nextRunAtMs) {
        return CronJob.builder()
                .id(id)
                .name("job " + id)
                .enabled(true)
                .schedule(schedule)
                .payload("{\"topic\":\"" + id + "\"}")
                .timeoutSeconds(600)
                .tags(List.of("test"))
                .createdAtMs(T0)
                .updatedAtMs(T0)
                .state(CronJobState.builder().nextRunAtMs(nextRunAtMs).build())
                .build();
    }
}
