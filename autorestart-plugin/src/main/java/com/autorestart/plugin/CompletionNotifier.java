package com.autorestart.plugin;

import com.autorestart.common.config.ConfigStore;
import com.autorestart.common.infra.FormatDuration;
import com.autorestart.plugin.host.MemoryProbe;
import com.autorestart.plugin.host.MessageSender;
import com.autorestart.plugin.host.PlatformConnections;
import lombok.extern.slf4j.Slf4j;

import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Reports a finished restart once the platform that asked for it reconnects.
 * The marker is cleared after the message is sent, or after sending is
 * skipped or fails. A failed clear is logged and leaves the marker in place.
 */
@Slf4j
public class CompletionNotifier {

    public static final Duration CONNECTION_GRACE = Duration.ofSeconds(10);

    private final PendingRestartStore markers;
    private final PlatformConnections connections;
    private final MessageSender sender;
    private final MemoryProbe memoryProbe;
    private final ConfigStore configStore;
    private final Clock clock;
    private final Duration grace;

    public CompletionNotifier(PendingRestartStore markers, PlatformConnections connections, MessageSender sender,
            MemoryProbe memoryProbe, ConfigStore configStore, Clock clock) {
        this(markers, connections, sender, memoryProbe, configStore, clock, CONNECTION_GRACE);
    }

    public CompletionNotifier(PendingRestartStore markers, PlatformConnections connections, MessageSender sender,
            MemoryProbe memoryProbe, ConfigStore configStore, Clock clock, Duration grace) {
        this.markers = markers;
        this.connections = connections;
        this.sender = sender;
        this.memoryProbe = memoryProbe;
        this.configStore = configStore;
        this.clock = clock;
        this.grace = grace;
    }

    /**
     * Handle a platform (re)connection.
     *
     * @return true if a pending restart was consumed
     */
    public synchronized boolean onPlatformConnected(String platformId) {
        Optional<PendingRestartMarker> pending = markers.load();
        if (pending.isEmpty()) {
            return false;
        }
        PendingRestartMarker marker = pending.get();
        if (!marker.matches(platformId)) {
            log.debug("Platform '{}' connected, pending restart belongs to '{}'", platformId, marker.platformId());
            return false;
        }

        awaitConnection(platformId);
        Duration elapsed = Duration.between(marker.requestedAt(), clock.instant());
        log.info("Restart completed in {}", FormatDuration.formatSeconds(elapsed, 2));

        try {
            if (marker.hasOriginSession()) {
                sender.send(marker.originSession(), completionMessage(elapsed));
                log.info("Restart completion sent to '{}'", marker.originSession());
            }
        } catch (RuntimeException e) {
            log.error("Could not send restart completion to '{}': {}", marker.originSession(), e.getMessage(), e);
        } finally {
            clearMarker(marker);
        }
        return true;
    }

    private void clearMarker(PendingRestartMarker marker) {
        try {
            markers.clear();
        } catch (UncheckedIOException e) {
            log.error("Could not clear pending restart for session '{}'; the completion notice may be sent again"
                    + " on the next connection of '{}'", marker.originSession(), marker.platformId(), e);
        }
    }

    String completionMessage(Duration elapsed) {
        StringBuilder text = new StringBuilder("Restart complete (took ")
                .append(FormatDuration.formatSeconds(elapsed, 2))
                .append(")");
        if (configStore.load().isShowMemoryInfo()) {
            memoryProbe.describe().ifPresent(memory -> text.append("\nMemory: ").append(memory));
        }
        return text.toString();
    }

    private void awaitConnection(String platformId) {
        try {
            if (!connections.awaitLive(platformId, grace)) {
                log.warn("Platform '{}' connection not live after {}, notifying anyway", platformId, grace);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted waiting for platform '{}' connection, notifying anyway", platformId);
        }
    }
}
