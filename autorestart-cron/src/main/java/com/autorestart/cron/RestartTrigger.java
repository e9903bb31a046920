package com.autorestart.cron;

import java.time.LocalTime;
import java.util.Objects;

/**
 * When the recurring restart fires. Exactly one of the payload fields is
 * meaningful, selected by {@link #kind()}; construction validates it, so an
 * instance is always schedulable as far as its own fields go.
 *
 * @param kind            which rule this is
 * @param intervalSeconds period for {@link Kind#INTERVAL}, otherwise 0
 * @param timeOfDay       wall-clock time for {@link Kind#DAILY_TIME}, otherwise null
 * @param cronExpression  normalized expression for {@link Kind#CRON}, otherwise null
 */
public record RestartTrigger(Kind kind, long intervalSeconds, LocalTime timeOfDay, String cronExpression) {

    public enum Kind {
        NONE,
        INTERVAL,
        DAILY_TIME,
        CRON
    }

    /** Longest accepted interval: one leap year. */
    public static final long MAX_INTERVAL_SECONDS = 366L * 24 * 3600;

    private static final RestartTrigger NONE = new RestartTrigger(Kind.NONE, 0, null, null);

    public RestartTrigger {
        Objects.requireNonNull(kind, "kind");
        switch (kind) {
            case NONE -> {
                intervalSeconds = 0;
                timeOfDay = null;
                cronExpression = null;
            }
            case INTERVAL -> {
                if (intervalSeconds <= 0) {
                    throw new SchedulingError("Restart interval must be a positive number of seconds, got "
                            + intervalSeconds);
                }
                if (intervalSeconds > MAX_INTERVAL_SECONDS) {
                    throw new SchedulingError("Restart interval may be at most " + MAX_INTERVAL_SECONDS
                            + " seconds (366 days), got " + intervalSeconds);
                }
                timeOfDay = null;
                cronExpression = null;
            }
            case DAILY_TIME -> {
                if (timeOfDay == null) {
                    throw new SchedulingError("Daily restart needs a time of day");
                }
                timeOfDay = timeOfDay.withSecond(0).withNano(0);
                intervalSeconds = 0;
                cronExpression = null;
            }
            case CRON -> {
                CronExpressions.parse(cronExpression);
                cronExpression = CronExpressions.normalize(cronExpression);
                intervalSeconds = 0;
                timeOfDay = null;
            }
        }
    }

    public static RestartTrigger none() {
        return NONE;
    }

    public static RestartTrigger interval(long seconds) {
        return new RestartTrigger(Kind.INTERVAL, seconds, null, null);
    }

    public static RestartTrigger dailyAt(int hour, int minute) {
        if (hour < 0 || hour > 23 || minute < 0 || minute > 59) {
            throw new SchedulingError(String.format("Invalid time of day %02d:%02d", hour, minute));
        }
        return new RestartTrigger(Kind.DAILY_TIME, 0, LocalTime.of(hour, minute), null);
    }

    public static RestartTrigger cron(String expression) {
        return new RestartTrigger(Kind.CRON, 0, null, expression);
    }

    public boolean isNone() {
        return kind == Kind.NONE;
    }

    /**
     * Short human-readable form, e.g. {@code every 3600s} or {@code daily at 03:00}.
     */
    public String describe() {
        return switch (kind) {
            case NONE -> "none";
            case INTERVAL -> "every " + intervalSeconds + "s";
            case DAILY_TIME -> String.format("daily at %02d:%02d", timeOfDay.getHour(), timeOfDay.getMinute());
            case CRON -> "cron '" + cronExpression + "'";
        };
    }
}
