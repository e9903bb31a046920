package com.autorestart.common.config;

import java.io.IOException;
import java.util.Map;

/**
 * Key-value store holding the plugin configuration.
 */
public interface ConfigStore {

    /**
     * Current configuration. Treat the result as read-only; changes go
     * through {@link #update(Map)}.
     */
    PluginConfig load();

    /**
     * Write the given top-level keys and leave every other key in the stored
     * document alone. A {@code null} value removes its key. Values may be
     * plain JSON values or config objects such as {@link PluginConfig.RestartCache}.
     * Returns only once the data is on disk.
     *
     * @throws IOException if the document could not be read back or written;
     *                     the stored document is then unchanged
     */
    void update(Map<String, ?> changes) throws IOException;
}
