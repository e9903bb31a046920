package com.autorestart.plugin;

import java.time.Instant;
import java.util.Objects;

/**
 * A restart that was requested and has not yet been reported.
 *
 * @param platformId    platform whose reconnection completes the restart;
 *                      empty for scheduled restarts, which any platform completes
 * @param originSession where to send the completion notice; empty for none
 * @param requestedAt   when the restart was requested
 */
public record PendingRestartMarker(String platformId, String originSession, Instant requestedAt) {

    public PendingRestartMarker {
        platformId = platformId == null ? "" : platformId;
        originSession = originSession == null ? "" : originSession;
        Objects.requireNonNull(requestedAt, "requestedAt");
    }

    public boolean matches(String connectedPlatformId) {
        return platformId.isEmpty() || platformId.equals(connectedPlatformId);
    }

    public boolean hasOriginSession() {
        return !originSession.isBlank();
    }
}
