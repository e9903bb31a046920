package com.autorestart.common.config;

/**
 * Default values for missing config fields.
 * <p>
 * Only structural defaults are applied here, so that saving a loaded config
 * never writes values that did not come from the file. Runtime overrides such
 * as {@code DASHBOARD_PORT} are resolved where they are consumed.
 */
public final class ConfigDefaults {

    private ConfigDefaults() {
    }

    public static final String DEFAULT_HOST = "127.0.0.1";
    public static final int DEFAULT_PORT = 6185;
    public static final int DEFAULT_REQUEST_TIMEOUT_SECONDS = 15;

    /** Environment variable that overrides {@code dashboard.port}. */
    public static final String PORT_ENV = "DASHBOARD_PORT";

    public static PluginConfig apply(PluginConfig config) {
        if (config.getDashboard() == null) {
            config.setDashboard(new PluginConfig.DashboardConfig());
        }
        if (config.getRestartCache() == null) {
            config.setRestartCache(new PluginConfig.RestartCache());
        }
        return config;
    }

    public static int requestTimeoutSeconds(PluginConfig config) {
        Integer configured = config.getRequestTimeoutSeconds();
        return configured == null || configured <= 0 ? DEFAULT_REQUEST_TIMEOUT_SECONDS : configured;
    }
}
