package com.cybershieldx.agent.session;

import com.cybershieldx.agent.util.Jsons;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * JSON encoding of session messages
 */
public final class MessageCodec {

    private MessageCodec() {
    }

    public static String encode(Message message) {
        ObjectNode node = Jsons.object();
        node.put("type", message.getType());
        node.set("data", message.getData());
        node.put("timestamp", message.getTimestamp());
        return Jsons.toJson(node);
    }

    public static Message decode(String text) throws ProtocolException {
        JsonNode node;
        try {
            node = Jsons.mapper().readTree(text);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Invalid JSON: " + e.getOriginalMessage(), e);
        }
        if (node == null || !node.isObject()) {
            throw new ProtocolException("Message is not a JSON object");
        }
        JsonNode type = node.get("type");
        if (type == null || !type.isTextual() || type.asText().isEmpty()) {
            throw new ProtocolException("Message has no type");
        }
        JsonNode data = node.get("data");
        if (data != null && !data.isNull() && !data.isObject()) {
            throw new ProtocolException("Message data for " + type.asText() + " is not an object");
        }
        JsonNode timestamp = node.get("timestamp");
        return new Message(type.asText(),
                data instanceof ObjectNode ? (ObjectNode) data : null,
                timestamp != null && timestamp.isTextual() ? timestamp.asText() : null);
    }
}
