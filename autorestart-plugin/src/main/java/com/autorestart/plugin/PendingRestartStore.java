package com.autorestart.plugin;

import com.autorestart.common.config.ConfigStore;
import com.autorestart.common.config.PluginConfig;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Keeps the pending-restart marker in the {@code restart_cache} section of the
 * plugin configuration, so it outlives the process that wrote it. Every write
 * is saved synchronously and touches no other key; a failed save leaves the
 * stored marker as it was.
 */
@Slf4j
public class PendingRestartStore {

    private final ConfigStore configStore;

    public PendingRestartStore(ConfigStore configStore) {
        this.configStore = configStore;
    }

    public synchronized Optional<PendingRestartMarker> load() {
        PluginConfig.RestartCache cache = configStore.load().getRestartCache();
        if (cache == null || cache.getStartTs() <= 0) {
            return Optional.empty();
        }
        Instant requestedAt = Instant.ofEpochMilli(Math.round(cache.getStartTs() * 1000));
        return Optional.of(new PendingRestartMarker(cache.getPlatformId(), cache.getUmo(), requestedAt));
    }

    /**
     * Persist {@code marker}, replacing any earlier one.
     *
     * @throws UncheckedIOException if the store could not be written
     */
    public synchronized void save(PendingRestartMarker marker) {
        PluginConfig.RestartCache cache = new PluginConfig.RestartCache();
        cache.setPlatformId(marker.platformId());
        cache.setUmo(marker.originSession());
        cache.setStartTs(marker.requestedAt().toEpochMilli() / 1000.0);
        write(cache);
        log.debug("Pending restart saved (platform '{}', requested at {})",
                marker.platformId(), marker.requestedAt());
    }

    /**
     * Reset the marker to its empty form.
     *
     * @throws UncheckedIOException if the store could not be written
     */
    public synchronized void clear() {
        write(new PluginConfig.RestartCache());
        log.debug("Pending restart cleared");
    }

    private void write(PluginConfig.RestartCache cache) {
        try {
            configStore.update(Map.of(PluginConfig.RESTART_CACHE, cache));
        } catch (IOException e) {
            throw new UncheckedIOException("Could not persist restart state: " + e.getMessage(), e);
        }
    }
}
