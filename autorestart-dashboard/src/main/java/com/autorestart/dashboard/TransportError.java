package com.autorestart.dashboard;

/**
 * Network failure, non-2xx status, or a response body that is not an envelope.
 */
public class TransportError extends DashboardError {

    public TransportError(String message, Integer status) {
        super(message, status);
    }

    public TransportError(String message, Integer status, Throwable cause) {
        super(message, status, cause);
    }
}
