package com.autorestart.dashboard;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Uniform {@code {status, message, data}} wrapper returned by every dashboard
 * endpoint, whatever the HTTP status.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DashboardEnvelope(
        String status,
        @JsonAlias("msg") String message,
        JsonNode data) {

    public static final String STATUS_OK = "ok";

    public boolean isOk() {
        return STATUS_OK.equals(status);
    }
}
