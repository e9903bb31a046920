package com.autorestart.common.infra;

import java.time.Duration;
import java.util.Locale;

/**
 * Duration formatting utilities.
 */
public final class FormatDuration {

    private FormatDuration() {
    }

    /**
     * Format a duration as seconds with a fixed number of decimals.
     *
     * @return e.g. "7.30 seconds"; negative durations format as zero
     */
    public static String formatSeconds(Duration duration, int decimals) {
        long ms = Math.max(0, duration.toMillis());
        double seconds = ms / 1000.0;
        return String.format(Locale.ROOT, "%." + Math.max(0, decimals) + "f seconds", seconds);
    }

    /**
     * Compact form for log lines, e.g. "1d 2h 5m", "45s".
     */
    public static String formatCompact(Duration duration) {
        long totalSeconds = Math.max(0, duration.getSeconds());
        long days = totalSeconds / 86_400;
        long hours = (totalSeconds % 86_400) / 3_600;
        long minutes = (totalSeconds % 3_600) / 60;
        long seconds = totalSeconds % 60;

        StringBuilder sb = new StringBuilder();
        if (days > 0)
            sb.append(days).append("d ");
        if (hours > 0)
            sb.append(hours).append("h ");
        if (minutes > 0)
            sb.append(minutes).append("m ");
        if (seconds > 0 || sb.length() == 0)
            sb.append(seconds).append("s");
        return sb.toString().trim();
    }
}
