package com.cybershieldx.agent.session;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Sends messages to the server over the current session
 */
@FunctionalInterface
public interface MessageSender {

    /**
     * @return false when the session is not online; nothing is buffered
     */
    boolean send(MessageType type, ObjectNode data);
}
