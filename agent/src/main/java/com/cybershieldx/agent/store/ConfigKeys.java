package com.cybershieldx.agent.store;

import java.util.Set;

/**
 * Keys persisted in the agent configuration store
 */
public final class ConfigKeys {
    public static final String AGENT_ID = "agentId";
    public static final String CLIENT_ID = "clientId";
    public static final String SERVER_URL = "serverUrl";
    public static final String SERVER_TOKEN = "serverToken";
    public static final String TEMP_DEVICE_TOKEN = "tempDeviceToken";
    public static final String LOCAL_API_TOKEN = "localApiToken";
    public static final String SCAN_INTERVAL = "scanInterval";
    public static final String LAST_SCAN = "lastScan";
    public static final String SETUP_COMPLETE = "setupComplete";
    public static final String AUTO_UPDATE = "autoUpdate";
    public static final String INSTALL_DIR = "installDir";
    public static final String LAST_BACKUP_PATH = "lastBackupPath";
    public static final String LAST_UPDATE_CHECK = "lastUpdateCheck";

    /** Secrets never exposed through, or writable from, the local API */
    public static final Set<String> CREDENTIALS = Set.of(SERVER_TOKEN, TEMP_DEVICE_TOKEN, LOCAL_API_TOKEN);

    private ConfigKeys() {
    }
}
