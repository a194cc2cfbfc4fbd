package com.cybershieldx.agent;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for AgentConfig
 */
class AgentConfigTest {

    @Test
    @DisplayName("Defaults apply when the environment is empty")
    void testDefaults() {
        AgentConfig config = AgentConfig.fromEnvironment(Map.of());

        assertEquals(AgentConfig.DEFAULT_SERVER_URL, config.getServerUrl());
        assertEquals(AgentConfig.DEFAULT_LOCAL_API_PORT, config.getLocalApiPort());
        assertEquals(AgentConfig.DEFAULT_SCAN_INTERVAL, config.getScanInterval());
        assertEquals(Duration.ofSeconds(30), config.getHeartbeatInterval());
        assertEquals(Duration.ofSeconds(10), config.getReconnectDelay());
        assertEquals(Duration.ofSeconds(60), config.getMaxReconnectDelay());
        assertTrue(config.isExponentialBackoff());
        assertTrue(config.isLocalApiEnabled());
    }

    @Test
    @DisplayName("Environment overrides paths, endpoints and port")
    void testEnvironment() {
        AgentConfig config = AgentConfig.fromEnvironment(Map.of(
                "CYBERSHIELDX_HOME", "/var/lib/cybershieldx",
                "CYBERSHIELDX_SERVER_URL", "wss://server.example.com",
                "CYBERSHIELDX_UPDATE_URL", "https://updates.example.com",
                "CYBERSHIELDX_INSTALL_DIR", "/opt/cybershieldx",
                "PORT", "9090"));

        assertEquals(Paths.get("/var/lib/cybershieldx"), config.getDataDir());
        assertEquals(Paths.get("/var/lib/cybershieldx", "reports"), config.getReportsDir());
        assertEquals(Paths.get("/var/lib/cybershieldx", "config.json"), config.getConfigFile());
        assertEquals("wss://server.example.com", config.getServerUrl());
        assertEquals("https://updates.example.com", config.getUpdateUrl());
        assertEquals(Paths.get("/opt/cybershieldx"), config.getInstallDir());
        assertEquals(9090, config.getLocalApiPort());
    }

    @Test
    @DisplayName("Invalid port is rejected")
    void testInvalidPort() {
        assertThrows(IllegalArgumentException.class, () -> AgentConfig.fromEnvironment(Map.of("PORT", "eighty")));
        assertThrows(IllegalArgumentException.class, () -> AgentConfig.fromEnvironment(Map.of("PORT", "70000")));
    }

    @Test
    @DisplayName("Builder rejects a reconnect cap below the base delay")
    void testBuilderValidation() {
        assertThrows(IllegalStateException.class, () -> AgentRuntime.builder()
                .reconnectDelay(Duration.ofSeconds(30), Duration.ofSeconds(5))
                .build());
    }
}
