package com.cybershieldx.agent.session;

/**
 * Message types exchanged with the server
 */
public enum MessageType {
    // Agent -> server
    AUTH("auth"),
    HEARTBEAT("heartbeat"),
    SCAN_START("scan_start"),
    SCAN_COMPLETE("scan_complete"),
    CONFIG_UPDATE_ACK("config_update_ack"),
    UPDATE_COMPLETE("update_complete"),
    REBOOT_ACK("reboot_ack"),
    SHUTDOWN("shutdown"),
    ERROR("error"),

    // Server -> agent
    AUTH_RESPONSE("auth_response"),
    CONFIG_UPDATE("config_update"),
    RUN_SCAN("run_scan"),
    UPDATE_AGENT("update_agent"),
    REBOOT("reboot");

    private final String wireName;

    MessageType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Resolve a wire name, or null when the type is not known
     */
    public static MessageType fromWire(String wireName) {
        for (MessageType type : values()) {
            if (type.wireName.equals(wireName)) {
                return type;
            }
        }
        return null;
    }
}
