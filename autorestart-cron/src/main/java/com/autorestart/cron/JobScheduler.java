package com.autorestart.cron;

import com.cronutils.model.Cron;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Timezone-aware scheduler with named trigger slots.
 * <p>
 * Each slot holds at most one armed trigger. A firing is a one-shot task
 * that re-arms itself for the following occurrence once the action returns,
 * so a slow action never overlaps its own next run. Registration and removal
 * are serialized; firing runs on the scheduler thread and never blocks them.
 */
@Slf4j
public class JobScheduler implements AutoCloseable {

    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(15);

    private final ZoneId zone;
    private final Clock clock;
    private final ScheduledExecutorService executor;
    private final JobRunLog runLog;
    private final ReentrantLock registrationLock = new ReentrantLock();
    private final Map<String, Slot> slots = new ConcurrentHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public JobScheduler(ZoneId zone) {
        this(zone, Clock.system(zone), newTimerExecutor(), new JobRunLog());
    }

    public JobScheduler(ZoneId zone, Clock clock, ScheduledExecutorService executor, JobRunLog runLog) {
        this.zone = zone;
        this.clock = clock;
        this.executor = executor;
        this.runLog = runLog;
    }

    /**
     * Single daemon timer thread; cancelled firings are dropped from its queue.
     */
    public static ScheduledExecutorService newTimerExecutor() {
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, "restart-scheduler");
            t.setDaemon(true);
            return t;
        });
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }

    // =========================================================================
    // Registration
    // =========================================================================

    /**
     * Arm {@code trigger} in slot {@code name}, replacing whatever the slot
     * held. A {@link RestartTrigger.Kind#NONE} trigger just empties the slot.
     *
     * @throws SchedulingError if the trigger has no future occurrence; the slot
     *                         keeps its previous trigger
     */
    public void register(String name, RestartTrigger trigger, Runnable action) {
        if (trigger.isNone()) {
            remove(name);
            return;
        }
        registrationLock.lock();
        try {
            if (closed.get()) {
                throw new IllegalStateException("Scheduler is shut down");
            }
            ZonedDateTime first = nextFireTime(trigger, now());

            Slot previous = slots.remove(name);
            if (previous != null) {
                previous.cancel();
            }
            Slot slot = new Slot(name, trigger, action);
            slots.put(name, slot);
            arm(slot, first);
            log.info("Registered job '{}' ({}), next run at {}", name, trigger.describe(), first);
        } finally {
            registrationLock.unlock();
        }
    }

    /**
     * Empty a slot.
     *
     * @return true if a trigger was armed there
     */
    public boolean remove(String name) {
        registrationLock.lock();
        try {
            Slot slot = slots.remove(name);
            if (slot == null) {
                return false;
            }
            slot.cancel();
            log.info("Removed job '{}' ({})", name, slot.trigger.describe());
            return true;
        } finally {
            registrationLock.unlock();
        }
    }

    public boolean isArmed(String name) {
        return slots.containsKey(name);
    }

    public Optional<RestartTrigger> activeTrigger(String name) {
        Slot slot = slots.get(name);
        return slot == null ? Optional.empty() : Optional.of(slot.trigger);
    }

    public Optional<ZonedDateTime> nextFireTime(String name) {
        Slot slot = slots.get(name);
        return slot == null ? Optional.empty() : Optional.ofNullable(slot.nextFire);
    }

    public ZoneId getZone() {
        return zone;
    }

    public JobRunLog getRunLog() {
        return runLog;
    }

    // =========================================================================
    // Firing
    // =========================================================================

    private void arm(Slot slot, ZonedDateTime at) {
        long delayMs = Math.max(0, Duration.between(clock.instant(), at.toInstant()).toMillis());
        slot.nextFire = at;
        slot.future = executor.schedule(() -> fire(slot), delayMs, TimeUnit.MILLISECONDS);
    }

    private void fire(Slot slot) {
        if (!isCurrent(slot)) {
            return;
        }
        Instant scheduledFor = slot.nextFire.toInstant();
        Instant start = clock.instant();
        JobRun.JobRunBuilder run = JobRun.builder()
                .jobName(slot.name)
                .trigger(slot.trigger.describe())
                .scheduledFor(scheduledFor)
                .startedAt(start);

        try {
            slot.action.run();
            Instant end = clock.instant();
            runLog.record(run.finishedAt(end)
                    .durationMs(Duration.between(start, end).toMillis())
                    .success(true)
                    .build());
            log.info("Scheduled job '{}' ran", slot.name);
        } catch (Exception e) {
            Instant end = clock.instant();
            runLog.record(run.finishedAt(end)
                    .durationMs(Duration.between(start, end).toMillis())
                    .success(false)
                    .error(e.getMessage())
                    .build());
            log.warn("Scheduled job '{}' failed, trigger stays armed: {}", slot.name, e.getMessage(), e);
        }

        registrationLock.lock();
        try {
            if (isCurrent(slot)) {
                arm(slot, followingFire(slot));
                log.debug("Job '{}' next run at {}", slot.name, slot.nextFire);
            }
        } catch (RuntimeException e) {
            slots.remove(slot.name, slot);
            log.error("Job '{}' could not be re-armed and was removed: {}", slot.name, e.getMessage(), e);
        } finally {
            registrationLock.unlock();
        }
    }

    private boolean isCurrent(Slot slot) {
        return !closed.get() && !slot.cancelled && slots.get(slot.name) == slot;
    }

    /**
     * Occurrence after the one that just fired. Intervals keep their phase
     * relative to registration and skip periods that were missed entirely.
     */
    private ZonedDateTime followingFire(Slot slot) {
        ZonedDateTime now = now();
        ZonedDateTime previous = slot.nextFire;
        if (slot.trigger.kind() == RestartTrigger.Kind.INTERVAL) {
            long period = slot.trigger.intervalSeconds();
            long behind = Duration.between(previous, now).getSeconds();
            long missed = behind < 0 ? 0 : behind / period;
            return previous.plusSeconds((missed + 1) * period);
        }
        return nextFireTime(slot.trigger, previous.isAfter(now) ? previous : now);
    }

    private ZonedDateTime now() {
        return ZonedDateTime.ofInstant(clock.instant(), zone);
    }

    /**
     * First occurrence of {@code trigger} strictly after {@code after}, in
     * {@code after}'s zone. An interval counts from {@code after} itself.
     * <p>
     * A daily time that falls in a DST gap runs at the same offset past the
     * transition (02:30 becomes 03:30); one that occurs twice runs once, at
     * the earlier offset.
     *
     * @throws SchedulingError if the trigger never fires again
     */
    static ZonedDateTime nextFireTime(RestartTrigger trigger, ZonedDateTime after) {
        switch (trigger.kind()) {
            case INTERVAL:
                return after.plusSeconds(trigger.intervalSeconds());
            case DAILY_TIME: {
                LocalDate date = after.toLocalDate();
                ZonedDateTime candidate = ZonedDateTime.of(date, trigger.timeOfDay(), after.getZone());
                if (!candidate.isAfter(after)) {
                    candidate = ZonedDateTime.of(date.plusDays(1), trigger.timeOfDay(), after.getZone());
                }
                return candidate;
            }
            case CRON: {
                Cron cron = CronExpressions.parse(trigger.cronExpression());
                return CronExpressions.nextAfter(cron, after)
                        .orElseThrow(() -> new SchedulingError(
                                "Cron expression never fires: '" + trigger.cronExpression() + "'"));
            }
            default:
                throw new SchedulingError("Trigger " + trigger.describe() + " has no fire time");
        }
    }

    // =========================================================================
    // Lifecycle
    // =========================================================================

    /**
     * Cancel every trigger and stop the timer thread. A job that is already
     * running is allowed to finish.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        registrationLock.lock();
        try {
            slots.values().forEach(Slot::cancel);
            slots.clear();
        } finally {
            registrationLock.unlock();
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Scheduled job still running after {}s, interrupting", SHUTDOWN_GRACE.toSeconds());
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
        log.info("Job scheduler stopped");
    }

    private static final class Slot {
        private final String name;
        private final RestartTrigger trigger;
        private final Runnable action;
        private volatile ZonedDateTime nextFire;
        private volatile ScheduledFuture<?> future;
        private volatile boolean cancelled;

        Slot(String name, RestartTrigger trigger, Runnable action) {
            this.name = name;
            this.trigger = trigger;
            this.action = action;
        }

        void cancel() {
            cancelled = true;
            ScheduledFuture<?> f = future;
            if (f != null) {
                f.cancel(false);
            }
        }
    }
}
