package com.autorestart.cron;

import lombok.extern.slf4j.Slf4j;

import java.time.DateTimeException;
import java.time.ZoneId;

/**
 * Resolves the configured timezone. Never fails: an empty or unknown name
 * falls back to the system zone.
 */
@Slf4j
public final class TimezoneResolver {

    private TimezoneResolver() {
    }

    public static ZoneId resolve(String name) {
        return resolve(name, ZoneId.systemDefault());
    }

    static ZoneId resolve(String name, ZoneId fallback) {
        if (name == null || name.isBlank()) {
            log.info("No timezone configured, scheduling in system timezone {}", fallback);
            return fallback;
        }
        try {
            return ZoneId.of(name.trim());
        } catch (DateTimeException e) {
            log.warn("Invalid timezone '{}', scheduling in system timezone {}: {}", name, fallback, e.getMessage());
            return fallback;
        }
    }
}
