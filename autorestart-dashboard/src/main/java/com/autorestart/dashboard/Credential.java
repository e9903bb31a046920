package com.autorestart.dashboard;

import com.autorestart.common.logging.LogRedact;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Bearer token issued by the dashboard login endpoint.
 */
public record Credential(String token, Instant issuedAt) {

    public Credential {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(issuedAt, "issuedAt");
    }

    /**
     * Valid while less than {@code threshold} has passed since issue.
     */
    public boolean isValidAt(Instant now, Duration threshold) {
        return Duration.between(issuedAt, now).compareTo(threshold) < 0;
    }

    @Override
    public String toString() {
        return "Credential[token=" + LogRedact.maskToken(token) + ", issuedAt=" + issuedAt + "]";
    }
}
