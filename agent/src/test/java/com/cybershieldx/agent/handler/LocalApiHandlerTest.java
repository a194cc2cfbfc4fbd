package com.cybershieldx.agent.handler;

import com.cybershieldx.agent.auth.CredentialManager;
import com.cybershieldx.agent.model.AgentIdentity;
import com.cybershieldx.agent.model.AgentState;
import com.cybershieldx.agent.model.AgentStatus;
import com.cybershieldx.agent.scan.ReportWriter;
import com.cybershieldx.agent.scan.TaskRunner;
import com.cybershieldx.agent.store.ConfigKeys;
import com.cybershieldx.agent.store.JsonFileConfigStore;
import com.cybershieldx.agent.testing.RecordingSession;
import com.cybershieldx.agent.testing.StubScanCollaborator;
import com.cybershieldx.agent.util.Jsons;
import com.fasterxml.jackson.databind.JsonNode;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.util.CharsetUtil;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for LocalApiHandler
 */
class LocalApiHandlerTest {

    @TempDir
    Path tempDir;

    private ExecutorService executor;
    private AgentState agentState;
    private JsonFileConfigStore store;
    private StubScanCollaborator collaborator;
    private TaskRunner taskRunner;
    private CredentialManager credentials;
    private String token;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        agentState = new AgentState(new AgentIdentity("agent-1", "client-1", "host-1", "linux", "x64", "1.0.0"));
        agentState.setStatus(AgentStatus.ONLINE);
        store = new JsonFileConfigStore(tempDir.resolve("config.json"));
        store.set(ConfigKeys.AGENT_ID, "agent-1");
        store.set(ConfigKeys.SERVER_TOKEN, "secret-server-token");
        collaborator = new StubScanCollaborator();
        taskRunner = new TaskRunner(agentState, collaborator, new ReportWriter(tempDir.resolve("reports")),
                store, new RecordingSession(), executor);
        credentials = new CredentialManager(store);
        token = credentials.ensureLocalApiToken();
    }

    @AfterEach
    void tearDown() {
        collaborator.release();
        executor.shutdownNow();
    }

    private FullHttpResponse call(HttpMethod method, String uri, String bearer, String body) {
        EmbeddedChannel channel = new EmbeddedChannel(new LocalApiHandler(agentState, store, credentials, taskRunner));
        FullHttpRequest request = new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, method, uri,
                Unpooled.copiedBuffer(body == null ? "" : body, CharsetUtil.UTF_8));
        if (bearer != null) {
            request.headers().set(HttpHeaderNames.AUTHORIZATION, "Bearer " + bearer);
        }
        channel.writeInbound(request);
        FullHttpResponse response = channel.readOutbound();
        assertNotNull(response, "no response for " + method + " " + uri);
        assertFalse(channel.isOpen());
        return response;
    }

    private static JsonNode json(FullHttpResponse response) throws Exception {
        try {
            return Jsons.mapper().readTree(response.content().toString(CharsetUtil.UTF_8));
        } finally {
            response.release();
        }
    }

    @Test
    @DisplayName("Health endpoint needs no token")
    void testHealth() throws Exception {
        FullHttpResponse response = call(HttpMethod.GET, "/health", null, null);

        assertEquals(HttpResponseStatus.OK, response.status());
        assertEquals("application/json", response.headers().get(HttpHeaderNames.CONTENT_TYPE));
        JsonNode body = json(response);
        assertEquals("ok", body.get("status").asText());
        assertEquals("1.0.0", body.get("version").asText());
    }

    @Test
    @DisplayName("API endpoints reject missing and wrong tokens")
    void testUnauthorized() throws Exception {
        FullHttpResponse missing = call(HttpMethod.GET, "/api/info", null, null);
        assertEquals(HttpResponseStatus.UNAUTHORIZED, missing.status());
        assertEquals("Authentication required", json(missing).get("message").asText());

        FullHttpResponse wrong = call(HttpMethod.GET, "/api/info", "not-the-token", null);
        assertEquals(HttpResponseStatus.UNAUTHORIZED, wrong.status());
        wrong.release();
    }

    @Test
    @DisplayName("Info reports identity and status")
    void testInfo() throws Exception {
        FullHttpResponse response = call(HttpMethod.GET, "/api/info", token, null);

        assertEquals(HttpResponseStatus.OK, response.status());
        JsonNode body = json(response);
        assertEquals("agent-1", body.get("id").asText());
        assertEquals("client-1", body.get("clientId").asText());
        assertEquals("linux", body.get("platform").asText());
        assertEquals("online", body.get("status").asText());
        assertFalse(body.has("currentScan"));
    }

    @Test
    @DisplayName("Scan request starts a scan and a second one conflicts")
    void testScan() throws Exception {
        collaborator.hold();

        FullHttpResponse started = call(HttpMethod.POST, "/api/scan", token, "{\"type\":\"system\"}");
        assertEquals(HttpResponseStatus.OK, started.status());
        JsonNode body = json(started);
        assertEquals("scanning", body.get("status").asText());
        String scanId = body.get("scanId").asText();
        assertFalse(scanId.isEmpty());

        FullHttpResponse conflict = call(HttpMethod.POST, "/api/scan", token, "{\"type\":\"quick\"}");
        assertEquals(HttpResponseStatus.CONFLICT, conflict.status());
        assertEquals("Agent is already scanning", json(conflict).get("message").asText());

        JsonNode info = json(call(HttpMethod.GET, "/api/info", token, null));
        assertEquals(scanId, info.get("currentScan").get("scanId").asText());
        assertEquals("system", info.get("currentScan").get("type").asText());
    }

    @Test
    @DisplayName("Unknown scan type and malformed body are bad requests")
    void testBadScanRequests() throws Exception {
        FullHttpResponse unknown = call(HttpMethod.POST, "/api/scan", token, "{\"type\":\"deep\"}");
        assertEquals(HttpResponseStatus.BAD_REQUEST, unknown.status());
        unknown.release();

        FullHttpResponse malformed = call(HttpMethod.POST, "/api/scan", token, "{oops");
        assertEquals(HttpResponseStatus.BAD_REQUEST, malformed.status());
        malformed.release();
        assertTrue(collaborator.calls().isEmpty());
    }

    @Test
    @DisplayName("Config read never exposes credentials")
    void testGetConfig() throws Exception {
        store.set(ConfigKeys.SCAN_INTERVAL, "0 1 * * *");

        JsonNode body = json(call(HttpMethod.GET, "/api/config", token, null));

        assertEquals("agent-1", body.get(ConfigKeys.AGENT_ID).asText());
        assertEquals("0 1 * * *", body.get(ConfigKeys.SCAN_INTERVAL).asText());
        assertFalse(body.has(ConfigKeys.SERVER_TOKEN));
        assertFalse(body.has(ConfigKeys.LOCAL_API_TOKEN));
        assertFalse(body.has(ConfigKeys.TEMP_DEVICE_TOKEN));
    }

    @Test
    @DisplayName("Config write applies ordinary keys")
    void testUpdateConfig() throws Exception {
        FullHttpResponse response = call(HttpMethod.POST, "/api/config", token, "{\"autoUpdate\":false}");

        assertEquals(HttpResponseStatus.OK, response.status());
        response.release();
        assertFalse(store.getBoolean(ConfigKeys.AUTO_UPDATE, true));
    }

    @Test
    @DisplayName("Config write with credential keys is rejected as a whole")
    void testUpdateConfigForbidden() throws Exception {
        FullHttpResponse response = call(HttpMethod.POST, "/api/config", token,
                "{\"serverToken\":\"forged\",\"autoUpdate\":false}");

        assertEquals(HttpResponseStatus.BAD_REQUEST, response.status());
        assertEquals("serverToken", json(response).get("keys").get(0).asText());
        assertEquals("secret-server-token", store.getString(ConfigKeys.SERVER_TOKEN));
        assertFalse(store.contains(ConfigKeys.AUTO_UPDATE));
    }

    @Test
    @DisplayName("Unknown paths and wrong methods")
    void testRouting() {
        FullHttpResponse notFound = call(HttpMethod.GET, "/api/nothing", token, null);
        assertEquals(HttpResponseStatus.NOT_FOUND, notFound.status());
        notFound.release();

        FullHttpResponse outside = call(HttpMethod.GET, "/index.html", null, null);
        assertEquals(HttpResponseStatus.NOT_FOUND, outside.status());
        outside.release();

        FullHttpResponse method = call(HttpMethod.DELETE, "/api/config", token, null);
        assertEquals(HttpResponseStatus.METHOD_NOT_ALLOWED, method.status());
        method.release();
    }
}
