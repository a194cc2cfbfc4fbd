package com.cybershieldx.agent.testing;

import com.cybershieldx.agent.session.AgentSession;
import com.cybershieldx.agent.session.MessageType;
import com.cybershieldx.agent.session.SessionState;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Session stand-in that records what components send and ask for
 */
public class RecordingSession implements AgentSession {

    public static final class Sent {
        public final MessageType type;
        public final ObjectNode data;

        Sent(MessageType type, ObjectNode data) {
            this.type = type;
            this.data = data;
        }
    }

    private final List<Sent> sent = new CopyOnWriteArrayList<>();
    private final List<String> events = new CopyOnWriteArrayList<>();
    private volatile boolean online = true;

    @Override
    public boolean send(MessageType type, ObjectNode data) {
        if (!online) {
            return false;
        }
        sent.add(new Sent(type, data.deepCopy()));
        return true;
    }

    @Override
    public void authenticated(String token, String clientId) {
        events.add("authenticated:" + token + ":" + clientId);
    }

    @Override
    public void authenticationFailed(String reason) {
        events.add("authenticationFailed:" + reason);
    }

    @Override
    public void reconnect() {
        events.add("reconnect");
    }

    @Override
    public SessionState getState() {
        return new SessionState(online ? SessionState.Phase.ONLINE : SessionState.Phase.RECONNECTING, 0, null);
    }

    public void setOnline(boolean online) {
        this.online = online;
    }

    public List<Sent> sent() {
        return sent;
    }

    public List<ObjectNode> sentOfType(MessageType type) {
        List<ObjectNode> matching = new ArrayList<>();
        for (Sent message : sent) {
            if (message.type == type) {
                matching.add(message.data);
            }
        }
        return matching;
    }

    public List<String> events() {
        return events;
    }
}
