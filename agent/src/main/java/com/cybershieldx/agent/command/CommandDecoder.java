package com.cybershieldx.agent.command;

import com.cybershieldx.agent.session.Message;
import com.cybershieldx.agent.session.MessageType;
import com.cybershieldx.agent.session.ProtocolException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns inbound messages into typed commands
 */
public final class CommandDecoder {

    private CommandDecoder() {
    }

    public static AgentCommand decode(Message message) throws ProtocolException {
        MessageType type = MessageType.fromWire(message.getType());
        if (type == null) {
            return new AgentCommand.Unknown(message.getType());
        }
        ObjectNode data = message.getData();
        switch (type) {
            case AUTH_RESPONSE:
                return decodeAuthResponse(data);
            case CONFIG_UPDATE:
                return decodeConfigUpdate(data);
            case RUN_SCAN:
                return new AgentCommand.RunScan(
                        optionalText(data, "type", "quick"),
                        optionalText(data, "scanId", null));
            case UPDATE_AGENT:
                return new AgentCommand.UpdateAgent(
                        optionalText(data, "version", null),
                        optionalBoolean(data, "restart"));
            case REBOOT:
                return new AgentCommand.Reboot();
            default:
                // Agent-to-server types are not commands
                return new AgentCommand.Unknown(message.getType());
        }
    }

    private static AgentCommand.AuthResponse decodeAuthResponse(ObjectNode data) throws ProtocolException {
        JsonNode success = data.get("success");
        if (success == null || !success.isBoolean()) {
            throw new ProtocolException("auth_response without a success flag");
        }
        return new AgentCommand.AuthResponse(
                success.asBoolean(),
                optionalText(data, "token", null),
                optionalText(data, "clientId", null),
                optionalText(data, "message", null),
                optionalText(data, "scanInterval", null),
                optionalBoolean(data, "runInitialScan"));
    }

    private static AgentCommand.ConfigUpdate decodeConfigUpdate(ObjectNode data) throws ProtocolException {
        if (data.isEmpty()) {
            throw new ProtocolException("config_update without configuration values");
        }
        Map<String, JsonNode> values = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = data.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            values.put(field.getKey(), field.getValue());
        }
        return new AgentCommand.ConfigUpdate(values);
    }

    private static String optionalText(ObjectNode data, String field, String defaultValue)
            throws ProtocolException {
        JsonNode value = data.get(field);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        if (!value.isTextual()) {
            throw new ProtocolException("Field " + field + " must be a string");
        }
        return value.asText().isEmpty() ? defaultValue : value.asText();
    }

    private static boolean optionalBoolean(ObjectNode data, String field) throws ProtocolException {
        JsonNode value = data.get(field);
        if (value == null || value.isNull()) {
            return false;
        }
        if (!value.isBoolean()) {
            throw new ProtocolException("Field " + field + " must be a boolean");
        }
        return value.asBoolean();
    }
}
