package com.autorestart.cron;

import com.autorestart.common.config.PluginConfig;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns schedule input into a {@link RestartTrigger}. The shape of the input
 * is decided here once; everything downstream works with the typed trigger.
 */
public final class TriggerParse {

    private TriggerParse() {
    }

    private static final Pattern INTERVAL_RE = Pattern.compile("^\\d+$");
    private static final Pattern TIME_RE = Pattern.compile("^(\\d{1,2}):(\\d{2})$");
    private static final Pattern WHITESPACE_RE = Pattern.compile("\\s");

    /**
     * Parse a schedule as typed by an operator:
     * <ul>
     * <li>digits only: an interval in seconds ({@code 3600})</li>
     * <li>{@code H:MM} or {@code HH:MM}: a daily wall-clock time ({@code 03:30})</li>
     * <li>anything containing whitespace: a cron expression ({@code 0 3 * * *})</li>
     * </ul>
     *
     * @throws SchedulingError if the input matches none of these or is out of range
     */
    public static RestartTrigger parse(String input) {
        if (input == null || input.isBlank()) {
            throw new SchedulingError("Schedule is empty; expected seconds, HH:MM or a 5-field cron expression");
        }
        String raw = input.trim();

        if (INTERVAL_RE.matcher(raw).matches()) {
            return RestartTrigger.interval(parseSeconds(raw));
        }
        Matcher time = TIME_RE.matcher(raw);
        if (time.matches()) {
            return RestartTrigger.dailyAt(Integer.parseInt(time.group(1)), Integer.parseInt(time.group(2)));
        }
        if (WHITESPACE_RE.matcher(raw).find()) {
            return RestartTrigger.cron(raw);
        }
        throw new SchedulingError("Unrecognised schedule '" + raw
                + "'; expected seconds, HH:MM or a 5-field cron expression");
    }

    /**
     * Pick the configured trigger. {@code restart_cron} wins over
     * {@code restart_time}, which wins over {@code restart_interval}; with
     * none of them set the result is {@link RestartTrigger#none()}.
     *
     * @throws SchedulingError if the winning key holds an invalid value
     */
    public static RestartTrigger fromConfig(PluginConfig config) {
        if (notBlank(config.getRestartCron())) {
            return RestartTrigger.cron(config.getRestartCron());
        }
        if (notBlank(config.getRestartTime())) {
            Matcher time = TIME_RE.matcher(config.getRestartTime().trim());
            if (!time.matches()) {
                throw new SchedulingError("restart_time must be HH:MM, got '" + config.getRestartTime() + "'");
            }
            return RestartTrigger.dailyAt(Integer.parseInt(time.group(1)), Integer.parseInt(time.group(2)));
        }
        Long interval = config.getRestartInterval();
        if (interval != null && interval > 0) {
            return RestartTrigger.interval(interval);
        }
        return RestartTrigger.none();
    }

    private static long parseSeconds(String raw) {
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new SchedulingError("Interval out of range: " + raw, e);
        }
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }
}
