package com.autorestart.cron;

/**
 * A trigger that cannot be scheduled: malformed input, or a rule that never
 * fires. Raised before any scheduler state changes.
 */
public class SchedulingError extends RuntimeException {

    public SchedulingError(String message) {
        super(message);
    }

    public SchedulingError(String message, Throwable cause) {
        super(message, cause);
    }
}
