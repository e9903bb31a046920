package com.autorestart.plugin.host;

import com.autorestart.common.infra.MemoryInfo;

import java.util.Optional;

/**
 * Source of the optional memory line in completion messages.
 */
@FunctionalInterface
public interface MemoryProbe {

    /** e.g. {@code 8.5GB/16.0GB(53.2%)}, or empty when unavailable. */
    Optional<String> describe();

    static MemoryProbe system() {
        return () -> Optional.ofNullable(MemoryInfo.describeSystemMemory(1));
    }
}
