package com.autorestart.dashboard;

/**
 * The server answered 2xx but the envelope status was not {@code "ok"}.
 */
public class BusinessError extends DashboardError {

    private final String envelopeStatus;

    public BusinessError(String message, int status, String envelopeStatus) {
        super(message, status);
        this.envelopeStatus = envelopeStatus;
    }

    public String getEnvelopeStatus() {
        return envelopeStatus;
    }
}
