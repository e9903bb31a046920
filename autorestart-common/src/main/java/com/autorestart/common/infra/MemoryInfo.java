package com.autorestart.common.infra;

import lombok.extern.slf4j.Slf4j;

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.util.Locale;

/**
 * Host memory usage, formatted as {@code used/total(pct%)}.
 */
@Slf4j
public final class MemoryInfo {

    private MemoryInfo() {
    }

    private static final double GB = 1024.0 * 1024 * 1024;

    /**
     * Describe current system memory use, e.g. "8.5GB/16.0GB(53.2%)".
     *
     * @return the description, or null when the platform does not expose
     *         physical memory figures
     */
    public static String describeSystemMemory(int decimals) {
        OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
        if (os instanceof com.sun.management.OperatingSystemMXBean sunOs) {
            return format(sunOs.getTotalMemorySize() - sunOs.getFreeMemorySize(),
                    sunOs.getTotalMemorySize(), decimals);
        }
        log.debug("Physical memory figures unavailable on {}", os.getName());
        return null;
    }

    static String format(long usedBytes, long totalBytes, int decimals) {
        if (totalBytes <= 0) {
            return null;
        }
        String pattern = "%." + decimals + "fGB/%." + decimals + "fGB(%.1f%%)";
        return String.format(Locale.ROOT, pattern,
                usedBytes / GB, totalBytes / GB, usedBytes * 100.0 / totalBytes);
    }
}
