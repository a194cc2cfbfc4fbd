package com.cybershieldx.agent.auth;

import com.cybershieldx.agent.store.ConfigKeys;
import com.cybershieldx.agent.store.ConfigStore;
import com.cybershieldx.agent.util.Digests;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.NetworkInterface;
import java.net.SocketException;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Owns the agent credentials in the config store.
 * The server token and the temporary device token are never stored together.
 */
public class CredentialManager {
    private static final Logger log = LoggerFactory.getLogger(CredentialManager.class);

    private final ConfigStore store;

    public CredentialManager(ConfigStore store) {
        this.store = store;
    }

    /**
     * Token to authenticate with: the server-issued token if present, otherwise a freshly generated device token
     */
    public synchronized String authToken() {
        String serverToken = store.getString(ConfigKeys.SERVER_TOKEN);
        if (serverToken != null && !serverToken.isEmpty()) {
            return serverToken;
        }
        String deviceToken = generateDeviceToken();
        store.set(ConfigKeys.TEMP_DEVICE_TOKEN, deviceToken);
        log.info("Generated new device token");
        return deviceToken;
    }

    /**
     * Persist a server-issued token and drop the device token in the same write
     */
    public synchronized boolean saveServerToken(String token) {
        if (token == null || token.isEmpty()) {
            return false;
        }
        Map<String, String> changes = new HashMap<>();
        changes.put(ConfigKeys.SERVER_TOKEN, token);
        changes.put(ConfigKeys.TEMP_DEVICE_TOKEN, null);
        store.apply(changes);
        log.info("Server token saved");
        return true;
    }

    public synchronized void clearServerToken() {
        store.delete(ConfigKeys.SERVER_TOKEN);
        log.info("Server token cleared");
    }

    public synchronized boolean hasServerToken() {
        String token = store.getString(ConfigKeys.SERVER_TOKEN);
        return token != null && !token.isEmpty();
    }

    /**
     * Return the local API token, generating one on first use
     */
    public synchronized String ensureLocalApiToken() {
        String token = store.getString(ConfigKeys.LOCAL_API_TOKEN);
        if (token == null || token.isEmpty()) {
            token = UUID.randomUUID().toString();
            store.set(ConfigKeys.LOCAL_API_TOKEN, token);
            log.info("Generated local API token");
        }
        return token;
    }

    public boolean isValidLocalApiToken(String presented) {
        String expected = store.getString(ConfigKeys.LOCAL_API_TOKEN);
        if (expected == null || expected.isEmpty()) {
            return false;
        }
        return Digests.constantTimeEquals(expected, presented);
    }

    /**
     * SHA-256 over stable device characteristics plus the current time
     */
    String generateDeviceToken() {
        String agentId = store.getString(ConfigKeys.AGENT_ID, "unknown");
        try {
            String fingerprint = String.join("-",
                    agentId,
                    java.net.InetAddress.getLocalHost().getHostName(),
                    firstMacAddress(),
                    String.valueOf(Runtime.getRuntime().availableProcessors()),
                    String.valueOf(Runtime.getRuntime().maxMemory()),
                    String.valueOf(System.currentTimeMillis()));
            return Digests.sha256Hex(fingerprint);
        } catch (Exception e) {
            log.warn("Falling back to random device token: {}", e.getMessage());
            return Digests.sha256Hex(agentId + "-" + System.currentTimeMillis() + "-" + UUID.randomUUID());
        }
    }

    private static String firstMacAddress() throws SocketException {
        for (NetworkInterface nic : Collections.list(NetworkInterface.getNetworkInterfaces())) {
            byte[] mac = nic.getHardwareAddress();
            if (mac != null && mac.length > 0 && !nic.isLoopback()) {
                StringBuilder sb = new StringBuilder();
                for (byte b : mac) {
                    if (sb.length() > 0) {
                        sb.append(':');
                    }
                    sb.append(String.format("%02x", b));
                }
                return sb.toString();
            }
        }
        return "00:00:00:00:00:00";
    }
}
