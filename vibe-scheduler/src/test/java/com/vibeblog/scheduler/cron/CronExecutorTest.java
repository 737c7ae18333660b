package com.vibeblog.scheduler.cron;

import com.vibeblog.common.infra.Backoff;
import com.vibeblog.scheduler.cron.CronErrors.AlreadyRunningError;
import com.vibeblog.scheduler.cron.CronErrors.JobNotFoundError;
import com.vibeblog.scheduler.cron.CronErrors.NotDueError;
import com.vibeblog.scheduler.cron.CronTypes.CronJob;
import com.vibeblog.scheduler.cron.CronTypes.RunStatus;
import com.vibeblog.scheduler.cron.CronTypes.TriggerSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.vibeblog.scheduler.cron.CronFixtures.MINUTE;
import static com.vibeblog.scheduler.cron.CronFixtures.T0;
import static com.vibeblog.scheduler.cron.CronFixtures.at;
import static com.vibeblog.scheduler.cron.CronFixtures.cron;
import static com.vibeblog.scheduler.cron.CronFixtures.every;
import static com.vibeblog.scheduler.cron.CronFixtures.job;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link CronExecutor}: claiming, outcome bookkeeping and recovery paths.
 */
class CronExecutorTest {

    @TempDir
    Path tempDir;

    private CronJobStore store;
    private MutableClock clock;
    private ScriptedCallback callback;
    private CronExecutor executor;

    @BeforeEach
    void setUp() {
        store = new CronJobStore(tempDir.resolve("cron.db"));
        store.init();
        clock = new MutableClock(T0);
        callback = new ScriptedCallback();
        executor = new CronExecutor(store, callback, clock, Backoff.Ladder.ERROR_RETRY, 600);
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    private ExecutionRecord claimAndRun(String id, TriggerSource trigger) {
        return executor.run(executor.claim(id, trigger), trigger);
    }

    private CronJob stored(String id) {
        return store.get(id).orElseThrow();
    }

    @Nested
    class Claim {

        @Test
        void setsRunningMarker() {
            store.create(job("c1", cron("0 9 * * *"), T0));
            CronJob claimed = executor.claim("c1", TriggerSource.SCHEDULE);
            assertEquals(T0, claimed.getState().getRunningAtMs());
            assertTrue(stored("c1").isRunning());
        }

        @Test
        void secondClaimIsRejected() {
            store.create(job("c2", cron("0 9 * * *"), T0));
            executor.claim("c2", TriggerSource.SCHEDULE);
            assertThrows(AlreadyRunningError.class, () -> executor.claim("c2", TriggerSource.MANUAL));
        }

        @Test
        void scheduledClaimRequiresDueAndEnabled() {
            store.create(job("future", cron("0 9 * * *"), T0 + MINUTE));
            CronJob off = job("off", cron("0 9 * * *"), T0);
            off.setEnabled(false);
            store.create(off);

            assertThrows(NotDueError.class, () -> executor.claim("future", TriggerSource.SCHEDULE));
            assertThrows(NotDueError.class, () -> executor.claim("off", TriggerSource.SCHEDULE));
            assertFalse(stored("future").isRunning());
        }

        @Test
        void manualClaimIgnoresSchedule() {
            CronJob off = job("manual", cron("0 9 * * *"), null);
            off.setEnabled(false);
            store.create(off);
            assertNotNull(executor.claim("manual", TriggerSource.MANUAL).getState().getRunningAtMs());
        }

        @Test
        void missingJobIsNotFound() {
            assertThrows(JobNotFoundError.class, () -> executor.claim("ghost", TriggerSource.MANUAL));
        }

        @Test
        void concurrentClaimsHaveExactlyOneWinner() throws Exception {
            store.create(job("race", cron("0 9 * * *"), T0));
            int threads = 8;
            ExecutorService pool = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<Boolean>> attempts = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                attempts.add(pool.submit(() -> {
                    start.await();
                    try {
                        executor.claim("race", TriggerSource.SCHEDULE);
                        return true;
                    } catch (AlreadyRunningError e) {
                        return false;
                    }
                }));
            }
            start.countDown();
            int winners = 0;
            for (Future<Boolean> attempt : attempts) {
                if (attempt.get(30, TimeUnit.SECONDS)) {
                    winners++;
                }
            }
            pool.shutdown();
            assertEquals(1, winners);
        }
    }

    @Nested
    class Outcomes {

        @Test
        void successResetsErrorsAndStaysOnGrid() {
            CronJob j = job("ok", every(15 * MINUTE, T0), T0);
            j.getState().setConsecutiveErrors(3);
            store.create(j);
            callback.then(ScriptedCallback.ok("published 1 post"));
            clock.advance(Duration.ofMinutes(12));

            ExecutionRecord record = claimAndRun("ok", TriggerSource.SCHEDULE);

            assertEquals(RunStatus.OK, record.getStatus());
            assertEquals("published 1 post", record.getSummary());
            CronJob after = stored("ok");
            assertFalse(after.isRunning());
            assertEquals(RunStatus.OK, after.getState().getLastStatus());
            assertEquals(0, after.getState().getConsecutiveErrors());
            assertNull(after.getState().getLastError());
            assertEquals(T0 + 15 * MINUTE, after.getState().getNextRunAtMs());
            assertEquals("{\"topic\":\"ok\"}", callback.payloads.get(0));
            assertEquals(1, store.listRecords("ok", 10).size());
        }

        @Test
        void failuresFollowTheBackoffLadder() {
            store.create(job("flaky", cron("0 9 * * *"), T0));
            callback.always(ScriptedCallback.fail("upstream 502"));
            long[] expected = {30_000, 60_000, 300_000, 900_000, 3_600_000, 3_600_000};

            for (int i = 0; i < expected.length; i++) {
                ExecutionRecord record = claimAndRun("flaky", TriggerSource.MANUAL);
                assertEquals(RunStatus.ERROR, record.getStatus());
                CronJob after = stored("flaky");
                assertEquals(i + 1, after.getState().getConsecutiveErrors());
                assertEquals(clock.millis() + expected[i], after.getState().getNextRunAtMs());
                assertTrue(after.getState().getLastError().contains("upstream 502"));
                assertTrue(after.isEnabled());
                clock.advance(Duration.ofSeconds(5));
            }
        }

        @Test
        void timeoutCancelsCallbackAndCountsAsFailure() {
            CronJob j = job("slow", cron("0 9 * * *"), T0);
            j.setTimeoutSeconds(1);
            store.create(j);
            callback.then(ScriptedCallback.hang());

            ExecutionRecord record = claimAndRun("slow", TriggerSource.SCHEDULE);

            assertEquals(RunStatus.ERROR, record.getStatus());
            assertEquals("execution timed out after 1s", record.getError());
            assertTrue(callback.futures.get(0).isCancelled());
            CronJob after = stored("slow");
            assertFalse(after.isRunning());
            assertEquals(1, after.getState().getConsecutiveErrors());
            assertEquals(T0 + 30_000, after.getState().getNextRunAtMs());
        }

        @Test
        void callbackThrowingSynchronouslyIsAFailure() {
            store.create(job("throws", cron("0 9 * * *"), T0));
            callback.then(() -> {
                throw new IllegalArgumentException("bad payload");
            });

            ExecutionRecord record = claimAndRun("throws", TriggerSource.SCHEDULE);

            assertEquals(RunStatus.ERROR, record.getStatus());
            assertTrue(record.getError().contains("bad payload"));
            assertFalse(stored("throws").isRunning());
        }

        @Test
        void oneShotDeleteAfterRunIsRemovedOnSuccess() {
            CronJob j = job("once", at(T0), T0);
            j.setDeleteAfterRun(true);
            store.create(j);

            ExecutionRecord record = claimAndRun("once", TriggerSource.SCHEDULE);

            assertEquals(RunStatus.OK, record.getStatus());
            assertTrue(store.get("once").isEmpty());
            assertEquals(1, store.listRecords("once", 10).size());
        }

        @Test
        void oneShotWithoutDeleteIsDisabledAfterRun() {
            store.create(job("keep", at(T0), T0));
            claimAndRun("keep", TriggerSource.SCHEDULE);
            CronJob after = stored("keep");
            assertFalse(after.isEnabled());
            assertNull(after.getState().getNextRunAtMs());
        }

        @Test
        void failedOneShotIsDisabledNotRetried() {
            CronJob j = job("once-bad", at(T0), T0);
            j.setDeleteAfterRun(true);
            store.create(j);
            callback.then(ScriptedCallback.fail("nope"));

            claimAndRun("once-bad", TriggerSource.SCHEDULE);

            CronJob after = stored("once-bad");
            assertFalse(after.isEnabled());
            assertNull(after.getState().getNextRunAtMs());
            assertEquals(RunStatus.ERROR, after.getState().getLastStatus());
        }

        @Test
        void jobDeletedMidRunKeepsOnlyTheRecord() {
            store.create(job("vanish", cron("0 9 * * *"), T0));
            CompletableFuture<String> gate = new CompletableFuture<>();
            callback.then(() -> gate);
            CronJob claimed = executor.claim("vanish", TriggerSource.SCHEDULE);
            store.delete("vanish");
            gate.complete("late result");

            ExecutionRecord record = executor.run(claimed, TriggerSource.SCHEDULE);

            assertEquals(RunStatus.OK, record.getStatus());
            assertTrue(store.get("vanish").isEmpty());
            assertEquals(1, store.listRecords("vanish", 10).size());
        }

        @Test
        void jobDisabledMidRunIsNotRescheduled() {
            store.create(job("paused", cron("0 9 * * *"), T0));
            CronJob claimed = executor.claim("paused", TriggerSource.SCHEDULE);
            store.update("paused", j -> j.setEnabled(false));

            executor.run(claimed, TriggerSource.SCHEDULE);

            CronJob after = stored("paused");
            assertFalse(after.isRunning());
            assertNull(after.getState().getNextRunAtMs());
        }
    }

    @Nested
    class Recovery {

        @Test
        void abandonClearsMarkerAndCountsFailure() {
            CronJob j = job("stuck", every(15 * MINUTE, T0), T0);
            j.getState().setRunningAtMs(T0);
            store.create(j);
            clock.advance(Duration.ofHours(3));

            ExecutionRecord record = executor.abandon("stuck", "stale execution cleared", clock.millis())
                    .orElseThrow();

            assertEquals(TriggerSource.RECOVERY, record.getTriggeredBy());
            assertEquals(RunStatus.ERROR, record.getStatus());
            assertEquals(Duration.ofHours(3).toMillis(), record.getDurationMs());
            CronJob after = stored("stuck");
            assertFalse(after.isRunning());
            assertEquals(1, after.getState().getConsecutiveErrors());
            assertEquals("stale execution cleared", after.getState().getLastError());
            assertEquals(T0 + 3 * 60 * MINUTE + 15 * MINUTE, after.getState().getNextRunAtMs());
        }

        @Test
        void abandonLeavesFreshMarkersAlone() {
            CronJob j = job("fresh", cron("0 9 * * *"), T0);
            j.getState().setRunningAtMs(T0);
            store.create(j);

            assertTrue(executor.abandon("fresh", "stale", T0 - 1).isEmpty());
            assertTrue(stored("fresh").isRunning());
            assertTrue(store.listRecords("fresh", 10).isEmpty());
        }

        @Test
        void lateFinishOfClearedRunLeavesNewerClaimAlone() throws Exception {
            CronJob j = job("long", cron("0 9 * * *"), T0);
            j.setTimeoutSeconds(3 * 60 * 60);
            store.create(j);
            CompletableFuture<String> firstGate = new CompletableFuture<>();
            callback.then(() -> firstGate);

            CronJob first = executor.claim("long", TriggerSource.MANUAL);
            ExecutorService pool = Executors.newSingleThreadExecutor();
            try {
                Future<ExecutionRecord> firstRun = pool.submit(() -> executor.run(first, TriggerSource.MANUAL));

                clock.advance(Duration.ofHours(2).plusMillis(1));
                long staleCutoff = clock.millis() - Duration.ofHours(2).toMillis() - 1;
                assertTrue(executor.abandon("long", CronTimer.STALE_REASON, staleCutoff).isPresent());
                CronJob second = executor.claim("long", TriggerSource.MANUAL);

                firstGate.complete("late");
                ExecutionRecord late = firstRun.get(10, TimeUnit.SECONDS);

                assertEquals(RunStatus.OK, late.getStatus());
                CronJob after = stored("long");
                assertEquals(second.getState().getRunningAtMs(), after.getState().getRunningAtMs());
                assertEquals(RunStatus.ERROR, after.getState().getLastStatus());
                assertEquals(CronTimer.STALE_REASON, after.getState().getLastError());
                assertEquals(1, after.getState().getConsecutiveErrors());
                assertThrows(AlreadyRunningError.class, () -> executor.claim("long", TriggerSource.MANUAL));
                assertEquals(2, store.listRecords("long", 10).size());
            } finally {
                pool.shutdownNow();
            }
        }

        @Test
        void skipDisablesMissedOneShot() {
            store.create(job("missed", at(T0 - 5 * 60 * MINUTE), T0 - 5 * 60 * MINUTE));

            ExecutionRecord record = executor.skip("missed", "grace window elapsed").orElseThrow();

            assertEquals(RunStatus.SKIPPED, record.getStatus());
            CronJob after = stored("missed");
            assertFalse(after.isEnabled());
            assertNull(after.getState().getNextRunAtMs());
            assertEquals(RunStatus.SKIPPED, after.getState().getLastStatus());
        }
    }

    @Nested
    class ScheduleRepair {

        @Test
        void invalidExpressionDisablesAfterThreeAttempts() {
            CronJob j = job("broken", cron("61 * * * *"), null);
            for (int i = 1; i <= CronExecutor.MAX_SCHEDULE_ERRORS; i++) {
                assertFalse(CronExecutor.recompute(j, T0));
                assertEquals(i, j.getState().getScheduleErrorCount());
            }
            assertFalse(j.isEnabled());
            assertTrue(j.getState().getLastError().contains("invalid cron expression"));
        }

        @Test
        void successfulRecomputeResetsErrorCount() {
            CronJob j = job("fixed", cron("0 9 * * *"), null);
            j.getState().setScheduleErrorCount(2);
            assertTrue(CronExecutor.recompute(j, T0));
            assertEquals(0, j.getState().getScheduleErrorCount());
            assertEquals(T0 + 9 * 60 * MINUTE, j.getState().getNextRunAtMs());
        }
    }
}
