package com.autorestart.dashboard;

import com.autorestart.common.config.ConfigDefaults;
import com.autorestart.common.config.PluginConfig;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;

import java.util.Map;

/**
 * Where the dashboard listens, resolved from config and environment.
 */
@Slf4j
public record DashboardEndpoint(String host, int port) {

    /**
     * Resolve host and port. A wildcard bind address becomes loopback, and
     * {@code DASHBOARD_PORT} takes precedence over {@code dashboard.port}.
     */
    public static DashboardEndpoint resolve(PluginConfig.DashboardConfig config, Map<String, String> env) {
        String host = config == null ? null : config.getHost();
        if (host == null || host.isBlank() || "0.0.0.0".equals(host.trim())) {
            host = ConfigDefaults.DEFAULT_HOST;
        }

        int port = config == null || config.getPort() == null
                ? ConfigDefaults.DEFAULT_PORT
                : config.getPort();
        String envPort = env.get(ConfigDefaults.PORT_ENV);
        if (envPort != null && !envPort.isBlank()) {
            try {
                port = Integer.parseInt(envPort.trim());
            } catch (NumberFormatException e) {
                log.warn("Ignoring non-numeric {}={}, using port {}", ConfigDefaults.PORT_ENV, envPort, port);
            }
        }
        return new DashboardEndpoint(host.trim(), port);
    }

    public HttpUrl baseUrl() {
        return new HttpUrl.Builder()
                .scheme("http")
                .host(host)
                .port(port)
                .build();
    }
}
