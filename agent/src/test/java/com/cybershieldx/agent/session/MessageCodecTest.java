package com.cybershieldx.agent.session;

import com.cybershieldx.agent.util.Jsons;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for MessageCodec
 */
class MessageCodecTest {

    @Test
    @DisplayName("Encoded messages carry type, data and an ISO-8601 timestamp")
    void testEncode() throws Exception {
        ObjectNode data = Jsons.object();
        data.put("status", "online");

        JsonNode encoded = Jsons.mapper().readTree(MessageCodec.encode(Message.of(MessageType.HEARTBEAT, data)));

        assertEquals("heartbeat", encoded.get("type").asText());
        assertEquals("online", encoded.get("data").get("status").asText());
        assertDoesNotThrow(() -> java.time.Instant.parse(encoded.get("timestamp").asText()));
    }

    @Test
    @DisplayName("Missing data decodes as an empty object")
    void testDecodeWithoutData() throws ProtocolException {
        Message message = MessageCodec.decode("{\"type\":\"reboot\"}");

        assertEquals("reboot", message.getType());
        assertTrue(message.getData().isEmpty());
    }

    @Test
    @DisplayName("Malformed messages are rejected")
    void testMalformed() {
        assertThrows(ProtocolException.class, () -> MessageCodec.decode("not json"));
        assertThrows(ProtocolException.class, () -> MessageCodec.decode("[1,2]"));
        assertThrows(ProtocolException.class, () -> MessageCodec.decode("{\"data\":{}}"));
        assertThrows(ProtocolException.class, () -> MessageCodec.decode("{\"type\":42}"));
        assertThrows(ProtocolException.class, () -> MessageCodec.decode("{\"type\":\"run_scan\",\"data\":\"quick\"}"));
    }
}
