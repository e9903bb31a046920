package com.autorestart.dashboard;

import lombok.Getter;

/**
 * Base type for failures talking to the dashboard control plane.
 * Carries the HTTP status when one was received.
 */
@Getter
public class DashboardError extends RuntimeException {

    private final Integer status;

    public DashboardError(String message, Integer status) {
        this(message, status, null);
    }

    public DashboardError(String message, Integer status, Throwable cause) {
        super(message, cause);
        this.status = status;
    }
}
