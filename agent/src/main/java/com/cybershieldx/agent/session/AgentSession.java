package com.cybershieldx.agent.session;

/**
 * Session operations available to command handlers
 */
public interface AgentSession extends MessageSender {

    /**
     * The server accepted our credentials
     */
    void authenticated(String token, String clientId);

    /**
     * The server rejected our credentials
     */
    void authenticationFailed(String reason);

    /**
     * Drop the current connection and connect again to the configured server URL
     */
    void reconnect();

    SessionState getState();
}
