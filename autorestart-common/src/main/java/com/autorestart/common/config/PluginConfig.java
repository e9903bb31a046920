package com.autorestart.common.config;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * Root configuration for the restart plugin.
 * <p>
 * The same document carries the {@code restart_cache} section, which is how a
 * pending restart survives the process being replaced.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class PluginConfig {

    public static final String RESTART_SWITCH = "restart_switch";
    public static final String RESTART_INTERVAL = "restart_interval";
    public static final String RESTART_TIME = "restart_time";
    public static final String RESTART_CRON = "restart_cron";
    public static final String RESTART_CACHE = "restart_cache";

    /** Dashboard control-plane connection. */
    private DashboardConfig dashboard;

    /** Whether the recurring restart trigger is armed. */
    @JsonProperty(RESTART_SWITCH)
    private boolean restartSwitch;

    /** Fixed interval between restarts, in seconds. */
    @JsonProperty(RESTART_INTERVAL)
    private Long restartInterval;

    /** Daily restart time, "HH:MM". */
    @JsonProperty(RESTART_TIME)
    private String restartTime;

    /** Five-field cron expression (minute hour day month weekday). */
    @JsonProperty(RESTART_CRON)
    private String restartCron;

    /** IANA zone id; empty means the system zone. */
    private String timezone;

    @JsonProperty("show_memory_info")
    private boolean showMemoryInfo;

    @JsonProperty("request_timeout_seconds")
    private Integer requestTimeoutSeconds;

    @JsonProperty(RESTART_CACHE)
    private RestartCache restartCache;

    // --- Nested config types ---

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class DashboardConfig {
        private String host;
        private Integer port;
        private String username;
        private String password;
    }

    /**
     * Persisted record of a restart that has been requested but not yet
     * reported. Cleared values are empty strings and a zero timestamp.
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RestartCache {
        @JsonProperty("platform_id")
        private String platformId = "";

        /** Origin session the completion notice is routed to. */
        @JsonProperty("umo")
        @JsonAlias("restart_umo")
        private String umo = "";

        /** Epoch seconds at which the restart was requested. */
        @JsonProperty("start_ts")
        @JsonAlias("restart_start_ts")
        private double startTs;
    }
}
