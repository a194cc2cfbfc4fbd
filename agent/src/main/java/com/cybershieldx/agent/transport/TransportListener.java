package com.cybershieldx.agent.transport;

/**
 * Callbacks from a transport connection, invoked on transport threads
 */
public interface TransportListener {

    void onOpen(TransportConnection connection);

    void onMessage(String text);

    /**
     * Called once, whether the connection failed to open or closed later
     */
    void onClosed(String reason, Throwable cause);
}
