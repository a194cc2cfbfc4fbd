package com.cybershieldx.agent.model;

import java.util.Locale;

/**
 * Agent status as reported in heartbeats and by the local API
 */
public enum AgentStatus {
    INITIALIZING,
    ONLINE,
    OFFLINE,
    SCANNING,
    UPDATING;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
