package com.autorestart.dashboard;

import com.autorestart.common.config.PluginConfig;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DashboardEndpointTest {

    private static PluginConfig.DashboardConfig dashboard(String host, Integer port) {
        PluginConfig.DashboardConfig config = new PluginConfig.DashboardConfig();
        config.setHost(host);
        config.setPort(port);
        return config;
    }

    @Test
    void defaults_whenUnset() {
        DashboardEndpoint endpoint = DashboardEndpoint.resolve(dashboard(null, null), Map.of());
        assertEquals("127.0.0.1", endpoint.host());
        assertEquals(6185, endpoint.port());
    }

    @Test
    void wildcardHost_becomesLoopback() {
        DashboardEndpoint endpoint = DashboardEndpoint.resolve(dashboard("0.0.0.0", 7000), Map.of());
        assertEquals("127.0.0.1", endpoint.host());
        assertEquals(7000, endpoint.port());
    }

    @Test
    void envPort_overridesConfig() {
        DashboardEndpoint endpoint = DashboardEndpoint.resolve(dashboard("dash.local", 7000),
                Map.of("DASHBOARD_PORT", "8123"));
        assertEquals("dash.local", endpoint.host());
        assertEquals(8123, endpoint.port());
    }

    @Test
    void nonNumericEnvPort_isIgnored() {
        DashboardEndpoint endpoint = DashboardEndpoint.resolve(dashboard("dash.local", 7000),
                Map.of("DASHBOARD_PORT", "eighty"));
        assertEquals(7000, endpoint.port());
    }

    @Test
    void baseUrl() {
        assertEquals("http://dash.local:7000/",
                new DashboardEndpoint("dash.local", 7000).baseUrl().toString());
    }
}
