package com.autorestart.cron;

import com.autorestart.common.testutil.ManualScheduledExecutor;
import com.autorestart.common.testutil.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Scheduler behaviour under a simulated clock. Nothing here sleeps: time only
 * moves when the manual executor is advanced.
 */
class JobSchedulerTest {

    private static final ZoneId SHANGHAI = ZoneId.of("Asia/Shanghai");
    private static final ZoneId NEW_YORK = ZoneId.of("America/New_York");
    private static final String JOB = "auto-restart";

    private MutableClock clock;
    private ManualScheduledExecutor executor;
    private JobScheduler scheduler;
    private final List<Instant> fired = new ArrayList<>();

    private JobScheduler newScheduler(ZoneId zone, Instant start) {
        clock = new MutableClock(start, zone);
        executor = new ManualScheduledExecutor(clock);
        scheduler = new JobScheduler(zone, clock, executor, new JobRunLog());
        return scheduler;
    }

    private Runnable recordFiring() {
        return () -> fired.add(clock.instant());
    }

    @AfterEach
    void tearDown() {
        if (scheduler != null) {
            scheduler.close();
        }
    }

    // =========================================================================
    // Cron
    // =========================================================================

    @Nested
    class CronTriggers {

        @Test
        void firesOncePerDayAtConfiguredTimeInZone() {
            // 08:00 in Shanghai
            newScheduler(SHANGHAI, Instant.parse("2024-05-01T00:00:00Z"));

            scheduler.register(JOB, RestartTrigger.cron("0 3 * * *"), recordFiring());
            assertEquals(ZonedDateTime.of(2024, 5, 2, 3, 0, 0, 0, SHANGHAI),
                    scheduler.nextFireTime(JOB).orElseThrow());

            executor.advance(Duration.ofDays(3));

            assertEquals(List.of(
                    Instant.parse("2024-05-01T19:00:00Z"),
                    Instant.parse("2024-05-02T19:00:00Z"),
                    Instant.parse("2024-05-03T19:00:00Z")), fired);
            assertEquals(ZonedDateTime.of(2024, 5, 5, 3, 0, 0, 0, SHANGHAI),
                    scheduler.nextFireTime(JOB).orElseThrow());
        }

        @Test
        void sameExpression_differentZone_firesAtDifferentInstant() {
            newScheduler(ZoneId.of("UTC"), Instant.parse("2024-05-01T00:00:00Z"));

            scheduler.register(JOB, RestartTrigger.cron("0 3 * * *"), recordFiring());
            executor.advance(Duration.ofDays(1));

            assertEquals(List.of(Instant.parse("2024-05-01T03:00:00Z")), fired);
        }

        @Test
        void malformedExpression_neverReachesScheduler() {
            newScheduler(SHANGHAI, Instant.parse("2024-05-01T00:00:00Z"));
            scheduler.register(JOB, RestartTrigger.cron("0 3 * * *"), recordFiring());

            assertThrows(SchedulingError.class, () -> RestartTrigger.cron("* *"));

            assertEquals(RestartTrigger.cron("0 3 * * *"), scheduler.activeTrigger(JOB).orElseThrow());
            assertEquals(1, executor.pendingCount());
        }
    }

    // =========================================================================
    // Interval and daily time
    // =========================================================================

    @Nested
    class IntervalAndDaily {

        @Test
        void interval_isAnchoredAtRegistration() {
            Instant start = Instant.parse("2024-05-01T00:00:10Z");
            newScheduler(SHANGHAI, start);

            scheduler.register(JOB, RestartTrigger.interval(3600), recordFiring());
            executor.advance(Duration.ofHours(3));

            assertEquals(List.of(
                    start.plusSeconds(3600),
                    start.plusSeconds(7200),
                    start.plusSeconds(10800)), fired);
        }

        @Test
        void interval_longestAllowed_isArmedOneYearOut() {
            Instant start = Instant.parse("2024-05-01T00:00:00Z");
            newScheduler(SHANGHAI, start);

            scheduler.register(JOB, TriggerParse.parse(String.valueOf(RestartTrigger.MAX_INTERVAL_SECONDS)),
                    recordFiring());

            assertEquals(start.plus(Duration.ofDays(366)), scheduler.nextFireTime(JOB).orElseThrow().toInstant());
        }

        @Test
        void interval_beyondOneYear_isRejectedBeforeRegistration() {
            newScheduler(SHANGHAI, Instant.parse("2024-05-01T00:00:00Z"));
            scheduler.register(JOB, RestartTrigger.interval(600), recordFiring());

            assertThrows(SchedulingError.class, () -> TriggerParse.parse("99999999999999999"));

            assertEquals(RestartTrigger.interval(600), scheduler.activeTrigger(JOB).orElseThrow());
            assertEquals(1, executor.pendingCount());
        }

        @Test
        void interval_slowAction_skipsMissedPeriodsAndKeepsPhase() {
            Instant start = Instant.parse("2024-05-01T00:00:00Z");
            newScheduler(SHANGHAI, start);

            scheduler.register(JOB, RestartTrigger.interval(60), () -> {
                fired.add(clock.instant());
                clock.advance(Duration.ofSeconds(150));
            });
            executor.advance(Duration.ofSeconds(60));

            assertEquals(List.of(start.plusSeconds(60)), fired);
            assertEquals(start.plusSeconds(240), scheduler.nextFireTime(JOB).orElseThrow().toInstant());
        }

        @Test
        void dailyTime_laterToday_thenEveryDay() {
            newScheduler(SHANGHAI, ZonedDateTime.of(2024, 5, 1, 1, 0, 0, 0, SHANGHAI).toInstant());

            scheduler.register(JOB, RestartTrigger.dailyAt(4, 30), recordFiring());
            executor.advance(Duration.ofDays(2));

            assertEquals(List.of(
                    ZonedDateTime.of(2024, 5, 1, 4, 30, 0, 0, SHANGHAI).toInstant(),
                    ZonedDateTime.of(2024, 5, 2, 4, 30, 0, 0, SHANGHAI).toInstant()), fired);
        }

        @Test
        void dailyTime_inDstGap_runsAfterTransition() {
            ZonedDateTime after = ZonedDateTime.of(2024, 3, 10, 0, 0, 0, 0, NEW_YORK);

            ZonedDateTime next = JobScheduler.nextFireTime(RestartTrigger.dailyAt(2, 30), after);

            assertEquals(ZonedDateTime.of(2024, 3, 10, 3, 30, 0, 0, NEW_YORK), next);
        }

        @Test
        void dailyTime_inDstOverlap_runsOnce() {
            newScheduler(NEW_YORK, ZonedDateTime.of(2024, 11, 3, 0, 0, 0, 0, NEW_YORK).toInstant());

            scheduler.register(JOB, RestartTrigger.dailyAt(1, 30), recordFiring());
            executor.advance(Duration.ofHours(20));

            assertEquals(List.of(Instant.parse("2024-11-03T05:30:00Z")), fired);
        }
    }

    // =========================================================================
    // Registration
    // =========================================================================

    @Nested
    class Registration {

        @Test
        void reRegister_leavesExactlyOneTrigger() {
            newScheduler(SHANGHAI, Instant.parse("2024-05-01T00:00:00Z"));
            AtomicInteger oldRuns = new AtomicInteger();
            AtomicInteger newRuns = new AtomicInteger();

            scheduler.register(JOB, RestartTrigger.interval(60), oldRuns::incrementAndGet);
            scheduler.register(JOB, RestartTrigger.interval(100), newRuns::incrementAndGet);

            assertEquals(1, executor.pendingCount());
            executor.advance(Duration.ofSeconds(99));
            assertEquals(0, oldRuns.get());
            assertEquals(0, newRuns.get());
            executor.advance(Duration.ofSeconds(1));
            assertEquals(1, newRuns.get());
            assertEquals(1, executor.pendingCount());
        }

        @Test
        void concurrentRegistrations_leaveExactlyOneTrigger() throws Exception {
            newScheduler(SHANGHAI, Instant.parse("2024-05-01T00:00:00Z"));
            int threads = 8;
            ExecutorService pool = Executors.newFixedThreadPool(threads);
            CountDownLatch go = new CountDownLatch(1);
            try {
                for (int i = 0; i < threads; i++) {
                    long seconds = 60L + i;
                    pool.submit(() -> {
                        go.await();
                        for (int k = 0; k < 50; k++) {
                            scheduler.register(JOB, RestartTrigger.interval(seconds), recordFiring());
                        }
                        return null;
                    });
                }
                go.countDown();
            } finally {
                pool.shutdown();
                assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
            }

            assertTrue(scheduler.isArmed(JOB));
            assertEquals(1, executor.pendingCount());
        }

        @Test
        void noneTrigger_emptiesSlot() {
            newScheduler(SHANGHAI, Instant.parse("2024-05-01T00:00:00Z"));
            scheduler.register(JOB, RestartTrigger.interval(60), recordFiring());

            scheduler.register(JOB, RestartTrigger.none(), recordFiring());

            assertFalse(scheduler.isArmed(JOB));
            assertEquals(0, executor.pendingCount());
            executor.advance(Duration.ofMinutes(5));
            assertTrue(fired.isEmpty());
        }

        @Test
        void remove_stopsFiring() {
            newScheduler(SHANGHAI, Instant.parse("2024-05-01T00:00:00Z"));
            scheduler.register(JOB, RestartTrigger.interval(60), recordFiring());
            executor.advance(Duration.ofSeconds(60));

            assertTrue(scheduler.remove(JOB));
            assertFalse(scheduler.remove(JOB));
            executor.advance(Duration.ofMinutes(5));

            assertEquals(1, fired.size());
            assertTrue(scheduler.nextFireTime(JOB).isEmpty());
        }

        @Test
        void removeDuringRun_isNotReArmed() {
            newScheduler(SHANGHAI, Instant.parse("2024-05-01T00:00:00Z"));
            scheduler.register(JOB, RestartTrigger.interval(60), () -> scheduler.remove(JOB));

            executor.advance(Duration.ofMinutes(5));

            assertFalse(scheduler.isArmed(JOB));
            assertEquals(0, executor.pendingCount());
        }

        @Test
        void slotsAreIndependent() {
            newScheduler(SHANGHAI, Instant.parse("2024-05-01T00:00:00Z"));
            scheduler.register("a", RestartTrigger.interval(60), recordFiring());
            scheduler.register("b", RestartTrigger.interval(90), recordFiring());

            scheduler.remove("a");

            assertTrue(scheduler.isArmed("b"));
            assertEquals(1, executor.pendingCount());
        }

        @Test
        void afterClose_registrationIsRefused() {
            newScheduler(SHANGHAI, Instant.parse("2024-05-01T00:00:00Z"));
            scheduler.register(JOB, RestartTrigger.interval(60), recordFiring());

            scheduler.close();
            scheduler.close();

            assertFalse(scheduler.isArmed(JOB));
            assertThrows(IllegalStateException.class,
                    () -> scheduler.register(JOB, RestartTrigger.interval(60), recordFiring()));
        }
    }

    // =========================================================================
    // Failures
    // =========================================================================

    @Test
    void throwingAction_keepsFiringAndIsLogged() {
        newScheduler(SHANGHAI, Instant.parse("2024-05-01T00:00:00Z"));
        AtomicInteger attempts = new AtomicInteger();
        scheduler.register(JOB, RestartTrigger.interval(60), () -> {
            attempts.incrementAndGet();
            throw new IllegalStateException("dashboard unreachable");
        });

        executor.advance(Duration.ofMinutes(3));

        assertEquals(3, attempts.get());
        assertTrue(scheduler.isArmed(JOB));
        List<JobRun> runs = scheduler.getRunLog().recent(JOB, 10);
        assertEquals(3, runs.size());
        assertFalse(runs.get(0).isSuccess());
        assertEquals("dashboard unreachable", runs.get(0).getError());
    }

    @Test
    void successfulRun_isRecorded() {
        newScheduler(SHANGHAI, Instant.parse("2024-05-01T00:00:00Z"));
        scheduler.register(JOB, RestartTrigger.interval(60), recordFiring());

        executor.advance(Duration.ofSeconds(60));

        JobRun run = scheduler.getRunLog().last(JOB).orElseThrow();
        assertTrue(run.isSuccess());
        assertEquals(Instant.parse("2024-05-01T00:01:00Z"), run.getScheduledFor());
        assertEquals("every 60s", run.getTrigger());
    }
}
