package com.cybershieldx.agent;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Map;

/**
 * Configuration for the CyberShieldX agent process
 */
public class AgentConfig {
    /** Default server WebSocket endpoint */
    public static final String DEFAULT_SERVER_URL = "wss://api.cybershieldx.com";
    /** Default update server endpoint */
    public static final String DEFAULT_UPDATE_URL = "https://api.cybershieldx.com/agent/updates";
    /** Default scan schedule: every 6 hours */
    public static final String DEFAULT_SCAN_INTERVAL = "0 */6 * * *";
    /** Default loopback port of the local status API */
    public static final int DEFAULT_LOCAL_API_PORT = 8585;
    public static final Duration DEFAULT_HEARTBEAT_INTERVAL = Duration.ofSeconds(30);
    public static final Duration DEFAULT_RECONNECT_DELAY = Duration.ofSeconds(10);
    public static final Duration DEFAULT_MAX_RECONNECT_DELAY = Duration.ofSeconds(60);
    public static final Duration DEFAULT_UPDATE_CHECK_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_UPDATE_CHECK_INTERVAL = Duration.ofHours(12);
    public static final Duration DEFAULT_RESTART_GRACE = Duration.ofSeconds(2);
    public static final String DEFAULT_VERSION = "1.0.0";

    private Path dataDir = Paths.get(System.getProperty("user.home"), ".cybershieldx");
    private Path installDir = Paths.get(System.getProperty("user.dir"));
    private String serverUrl = DEFAULT_SERVER_URL;
    private String updateUrl = DEFAULT_UPDATE_URL;
    private String scanInterval = DEFAULT_SCAN_INTERVAL;
    private int localApiPort = DEFAULT_LOCAL_API_PORT;
    private boolean localApiEnabled = true;
    private Duration heartbeatInterval = DEFAULT_HEARTBEAT_INTERVAL;
    private Duration reconnectDelay = DEFAULT_RECONNECT_DELAY;
    private Duration maxReconnectDelay = DEFAULT_MAX_RECONNECT_DELAY;
    private boolean exponentialBackoff = true;
    private Duration updateCheckTimeout = DEFAULT_UPDATE_CHECK_TIMEOUT;
    private Duration updateCheckInterval = DEFAULT_UPDATE_CHECK_INTERVAL;
    private Duration restartGrace = DEFAULT_RESTART_GRACE;
    private String version = defaultVersion();

    /**
     * Build a config from process environment variables, falling back to defaults
     */
    public static AgentConfig fromEnvironment(Map<String, String> env) {
        AgentConfig config = new AgentConfig();
        String home = env.get("CYBERSHIELDX_HOME");
        if (home != null && !home.isBlank()) {
            config.setDataDir(Paths.get(home));
        }
        String serverUrl = env.get("CYBERSHIELDX_SERVER_URL");
        if (serverUrl != null && !serverUrl.isBlank()) {
            config.setServerUrl(serverUrl);
        }
        String updateUrl = env.get("CYBERSHIELDX_UPDATE_URL");
        if (updateUrl != null && !updateUrl.isBlank()) {
            config.setUpdateUrl(updateUrl);
        }
        String installDir = env.get("CYBERSHIELDX_INSTALL_DIR");
        if (installDir != null && !installDir.isBlank()) {
            config.setInstallDir(Paths.get(installDir));
        }
        String port = env.get("PORT");
        if (port != null && !port.isBlank()) {
            try {
                config.setLocalApiPort(Integer.parseInt(port.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("PORT must be a number: " + port, e);
            }
        }
        return config;
    }

    private static String defaultVersion() {
        String implementation = AgentConfig.class.getPackage().getImplementationVersion();
        return implementation != null ? implementation : DEFAULT_VERSION;
    }

    public Path getDataDir() {
        return dataDir;
    }

    public void setDataDir(Path dataDir) {
        this.dataDir = dataDir;
    }

    public Path getReportsDir() {
        return dataDir.resolve("reports");
    }

    public Path getBackupsDir() {
        return dataDir.resolve("backups");
    }

    public Path getDownloadsDir() {
        return dataDir.resolve("downloads");
    }

    public Path getLogsDir() {
        return dataDir.resolve("logs");
    }

    public Path getConfigFile() {
        return dataDir.resolve("config.json");
    }

    public Path getInstallDir() {
        return installDir;
    }

    public void setInstallDir(Path installDir) {
        this.installDir = installDir;
    }

    public String getServerUrl() {
        return serverUrl;
    }

    public void setServerUrl(String serverUrl) {
        this.serverUrl = serverUrl;
    }

    public String getUpdateUrl() {
        return updateUrl;
    }

    public void setUpdateUrl(String updateUrl) {
        this.updateUrl = updateUrl;
    }

    public String getScanInterval() {
        return scanInterval;
    }

    public void setScanInterval(String scanInterval) {
        this.scanInterval = scanInterval;
    }

    public int getLocalApiPort() {
        return localApiPort;
    }

    public void setLocalApiPort(int localApiPort) {
        if (localApiPort < 0 || localApiPort > 65535) {
            throw new IllegalArgumentException("Invalid local API port: " + localApiPort);
        }
        this.localApiPort = localApiPort;
    }

    public boolean isLocalApiEnabled() {
        return localApiEnabled;
    }

    public void setLocalApiEnabled(boolean localApiEnabled) {
        this.localApiEnabled = localApiEnabled;
    }

    public Duration getHeartbeatInterval() {
        return heartbeatInterval;
    }

    public void setHeartbeatInterval(Duration heartbeatInterval) {
        this.heartbeatInterval = requirePositive(heartbeatInterval, "heartbeatInterval");
    }

    public Duration getReconnectDelay() {
        return reconnectDelay;
    }

    public void setReconnectDelay(Duration reconnectDelay) {
        this.reconnectDelay = requirePositive(reconnectDelay, "reconnectDelay");
    }

    public Duration getMaxReconnectDelay() {
        return maxReconnectDelay;
    }

    public void setMaxReconnectDelay(Duration maxReconnectDelay) {
        this.maxReconnectDelay = requirePositive(maxReconnectDelay, "maxReconnectDelay");
    }

    public boolean isExponentialBackoff() {
        return exponentialBackoff;
    }

    public void setExponentialBackoff(boolean exponentialBackoff) {
        this.exponentialBackoff = exponentialBackoff;
    }

    public Duration getUpdateCheckTimeout() {
        return updateCheckTimeout;
    }

    public void setUpdateCheckTimeout(Duration updateCheckTimeout) {
        this.updateCheckTimeout = requirePositive(updateCheckTimeout, "updateCheckTimeout");
    }

    public Duration getUpdateCheckInterval() {
        return updateCheckInterval;
    }

    public void setUpdateCheckInterval(Duration updateCheckInterval) {
        this.updateCheckInterval = requirePositive(updateCheckInterval, "updateCheckInterval");
    }

    public Duration getRestartGrace() {
        return restartGrace;
    }

    public void setRestartGrace(Duration restartGrace) {
        if (restartGrace == null || restartGrace.isNegative()) {
            throw new IllegalArgumentException("restartGrace must not be negative");
        }
        this.restartGrace = restartGrace;
    }

    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    private static Duration requirePositive(Duration value, String name) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return value;
    }
}
