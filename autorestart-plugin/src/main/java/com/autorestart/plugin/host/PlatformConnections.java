package com.autorestart.plugin.host;

import java.time.Duration;

/**
 * Readiness of a platform's underlying transport connection.
 */
@FunctionalInterface
public interface PlatformConnections {

    /**
     * Block until the platform's connection is live or the timeout elapses.
     *
     * @return true if the connection became live in time
     */
    boolean awaitLive(String platformId, Duration timeout) throws InterruptedException;
}
