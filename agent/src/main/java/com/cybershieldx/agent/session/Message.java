package com.cybershieldx.agent.session;

import com.cybershieldx.agent.util.Jsons;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;

/**
 * Wire envelope: {type, data, timestamp}
 */
public final class Message {
    private final String type;
    private final ObjectNode data;
    private final String timestamp;

    public Message(String type, ObjectNode data, String timestamp) {
        this.type = type;
        this.data = data == null ? Jsons.object() : data;
        this.timestamp = timestamp;
    }

    public static Message of(MessageType type, ObjectNode data) {
        return new Message(type.wireName(), data, Instant.now().toString());
    }

    public String getType() {
        return type;
    }

    public ObjectNode getData() {
        return data;
    }

    public String getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "Message{type=" + type + ", timestamp=" + timestamp + "}";
    }
}
