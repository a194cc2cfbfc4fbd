package com.cybershieldx.agent.command;

import com.cybershieldx.agent.scan.ScanType;
import com.cybershieldx.agent.session.MessageCodec;
import com.cybershieldx.agent.session.ProtocolException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CommandDecoder
 */
class CommandDecoderTest {

    private static AgentCommand decode(String json) throws ProtocolException {
        return CommandDecoder.decode(MessageCodec.decode(json));
    }

    @Test
    @DisplayName("auth_response carries token, client id and optional settings")
    void testAuthResponse() throws ProtocolException {
        AgentCommand command = decode("{\"type\":\"auth_response\",\"data\":{\"success\":true,"
                + "\"token\":\"tok\",\"clientId\":\"c-1\",\"scanInterval\":\"0 1 * * *\",\"runInitialScan\":true}}");

        AgentCommand.AuthResponse auth = assertInstanceOf(AgentCommand.AuthResponse.class, command);
        assertTrue(auth.isSuccess());
        assertEquals("tok", auth.getToken());
        assertEquals("c-1", auth.getClientId());
        assertEquals("0 1 * * *", auth.getScanInterval());
        assertTrue(auth.isRunInitialScan());
    }

    @Test
    @DisplayName("auth_response without a success flag is malformed")
    void testAuthResponseWithoutSuccess() {
        assertThrows(ProtocolException.class, () -> decode("{\"type\":\"auth_response\",\"data\":{}}"));
        assertThrows(ProtocolException.class,
                () -> decode("{\"type\":\"auth_response\",\"data\":{\"success\":\"yes\"}}"));
    }

    @Test
    @DisplayName("run_scan defaults to a quick scan and resolves types case-insensitively")
    void testRunScan() throws ProtocolException {
        AgentCommand.RunScan defaults = assertInstanceOf(AgentCommand.RunScan.class,
                decode("{\"type\":\"run_scan\"}"));
        assertEquals(ScanType.QUICK, defaults.getScanType());
        assertNull(defaults.getScanId());

        AgentCommand.RunScan network = assertInstanceOf(AgentCommand.RunScan.class,
                decode("{\"type\":\"run_scan\",\"data\":{\"type\":\"NETWORK\",\"scanId\":\"s-9\"}}"));
        assertEquals(ScanType.NETWORK, network.getScanType());
        assertEquals("s-9", network.getScanId());

        AgentCommand.RunScan unknown = assertInstanceOf(AgentCommand.RunScan.class,
                decode("{\"type\":\"run_scan\",\"data\":{\"type\":\"deep\"}}"));
        assertNull(unknown.getScanType());
        assertEquals("deep", unknown.getRequestedType());
    }

    @Test
    @DisplayName("config_update without values is malformed")
    void testEmptyConfigUpdate() {
        assertThrows(ProtocolException.class, () -> decode("{\"type\":\"config_update\",\"data\":{}}"));
    }

    @Test
    @DisplayName("update_agent restart flag defaults to false")
    void testUpdateAgent() throws ProtocolException {
        AgentCommand.UpdateAgent update = assertInstanceOf(AgentCommand.UpdateAgent.class,
                decode("{\"type\":\"update_agent\",\"data\":{\"version\":\"1.2.0\"}}"));
        assertEquals("1.2.0", update.getVersion());
        assertFalse(update.isRestart());

        assertThrows(ProtocolException.class,
                () -> decode("{\"type\":\"update_agent\",\"data\":{\"restart\":\"true\"}}"));
    }

    @Test
    @DisplayName("Unknown and agent-to-server types decode as unknown commands")
    void testUnknown() throws ProtocolException {
        assertEquals("telemetry", assertInstanceOf(AgentCommand.Unknown.class,
                decode("{\"type\":\"telemetry\"}")).getType());
        assertInstanceOf(AgentCommand.Unknown.class, decode("{\"type\":\"heartbeat\"}"));
        assertInstanceOf(AgentCommand.Reboot.class, decode("{\"type\":\"reboot\"}"));
    }
}
