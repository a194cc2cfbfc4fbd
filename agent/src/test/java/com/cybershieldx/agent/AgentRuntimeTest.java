package com.cybershieldx.agent;

import com.cybershieldx.agent.store.ConfigKeys;
import com.cybershieldx.agent.testing.Await;
import com.cybershieldx.agent.testing.FakeTransport;
import com.cybershieldx.agent.testing.FakeUpdateServerClient;
import com.cybershieldx.agent.testing.RecordingProcessControl;
import com.cybershieldx.agent.testing.StubScanCollaborator;
import com.cybershieldx.agent.util.Jsons;
import com.fasterxml.jackson.databind.JsonNode;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests for AgentRuntime against an in-memory server
 */
class AgentRuntimeTest {

    @TempDir
    Path tempDir;

    private FakeTransport transport;
    private StubScanCollaborator collaborator;
    private FakeUpdateServerClient updateClient;
    private RecordingProcessControl processControl;
    private AgentRuntime runtime;

    @BeforeEach
    void setUp() {
        transport = new FakeTransport().acceptAuth("issued-token");
        collaborator = new StubScanCollaborator();
        updateClient = new FakeUpdateServerClient();
        processControl = new RecordingProcessControl();
    }

    @AfterEach
    void tearDown() {
        if (runtime != null) {
            runtime.stop("test");
        }
    }

    private AgentRuntime newRuntime() throws Exception {
        AgentConfig config = new AgentConfig();
        config.setDataDir(tempDir.resolve("data"));
        config.setInstallDir(tempDir.resolve("install"));
        AgentRuntime.prepareDirectories(config);
        return AgentRuntime.builder()
                .config(config)
                .serverUrl("ws://127.0.0.1:1/agent")
                .localApiPort(0)
                .heartbeatInterval(Duration.ofHours(1))
                .reconnectDelay(Duration.ofMillis(50), Duration.ofMillis(100))
                .updateCheckInterval(Duration.ofHours(12))
                .transport(transport)
                .scanCollaborator(collaborator)
                .updateServerClient(updateClient)
                .processControl(processControl)
                .build();
    }

    @Test
    @DisplayName("Agent starts, authenticates and answers a scan request")
    void testStartAndScan() throws Exception {
        runtime = newRuntime();
        runtime.start();

        Await.until(() -> runtime.getSession().getState().isOnline(), "session online");
        FakeTransport.FakeConnection connection = transport.last();
        Await.until(() -> connection.sentOfType("heartbeat").size() == 1, "first heartbeat");

        assertEquals("issued-token", runtime.getStore().getString(ConfigKeys.SERVER_TOKEN));
        assertFalse(runtime.getStore().contains(ConfigKeys.TEMP_DEVICE_TOKEN));
        assertTrue(runtime.getStore().getBoolean(ConfigKeys.SETUP_COMPLETE, false));
        assertNotNull(runtime.getStore().getString(ConfigKeys.LOCAL_API_TOKEN));
        assertNotNull(runtime.getScheduler().nextFireTime());

        connection.receive("{\"type\":\"run_scan\",\"data\":{\"type\":\"quick\",\"scanId\":\"remote-1\"}}");

        Await.until(() -> connection.sentOfType("scan_complete").size() == 1, "scan_complete");
        JsonNode complete = connection.sentOfType("scan_complete").get(0).get("data");
        assertEquals("remote-1", complete.get("scanId").asText());
        assertTrue(complete.get("success").asBoolean());
        assertEquals("remote-1", connection.sentOfType("scan_start").get(0).get("data").get("scanId").asText());
        try (Stream<Path> reports = Files.list(runtime.getConfig().getReportsDir())) {
            assertEquals(1, reports.count());
        }
    }

    @Test
    @DisplayName("Local API serves health over loopback")
    void testLocalApi() throws Exception {
        runtime = newRuntime();
        runtime.start();
        int port = runtime.getLocalApiPort();
        assertTrue(port > 0);

        OkHttpClient http = new OkHttpClient.Builder().callTimeout(5, TimeUnit.SECONDS).build();
        Request health = new Request.Builder().url("http://127.0.0.1:" + port + "/health").build();
        try (Response response = http.newCall(health).execute()) {
            assertEquals(200, response.code());
            assertEquals("ok", Jsons.mapper().readTree(response.body().string()).get("status").asText());
        }

        String token = runtime.getStore().getString(ConfigKeys.LOCAL_API_TOKEN);
        Request info = new Request.Builder().url("http://127.0.0.1:" + port + "/api/info")
                .header("Authorization", "Bearer " + token).build();
        try (Response response = http.newCall(info).execute()) {
            assertEquals(200, response.code());
            JsonNode body = Jsons.mapper().readTree(response.body().string());
            assertEquals(runtime.getState().getIdentity().getAgentId(), body.get("id").asText());
        }
    }

    @Test
    @DisplayName("Agent id survives a restart and stop notifies the server")
    void testRestart() throws Exception {
        runtime = newRuntime();
        runtime.start();
        Await.until(() -> runtime.getSession().getState().isOnline(), "session online");
        String agentId = runtime.getState().getIdentity().getAgentId();
        FakeTransport.FakeConnection connection = transport.last();

        runtime.stop("service_stop");
        CompletableFuture<Void> terminated = CompletableFuture.runAsync(() -> {
            try {
                runtime.awaitTermination();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        terminated.get(5, TimeUnit.SECONDS);
        assertEquals("service_stop",
                connection.sentOfType("shutdown").get(0).get("data").get("reason").asText());

        transport = new FakeTransport().acceptAuth("issued-token");
        runtime = newRuntime();
        runtime.start();
        Await.until(() -> runtime.getSession().getState().isOnline(), "session online after restart");

        assertEquals(agentId, runtime.getState().getIdentity().getAgentId());
        JsonNode auth = transport.last().sentOfType("auth").get(0).get("data");
        assertEquals(agentId, auth.get("agentId").asText());
        assertEquals("issued-token", auth.get("token").asText());
    }

    @Test
    @DisplayName("First start lays out the install directory and later starts report the active version")
    void testInstalledVersion() throws Exception {
        runtime = newRuntime();
        runtime.start();
        Path install = tempDir.resolve("install");
        String running = runtime.getConfig().getVersion();
        assertEquals(running, Files.readString(install.resolve("current")).trim());
        assertTrue(Files.isRegularFile(install.resolve("versions").resolve(running).resolve("manifest.json")));
        runtime.stop("test");

        Path updated = Files.createDirectories(install.resolve("versions").resolve("1.1.0"));
        Jsons.writeAtomically(updated.resolve("manifest.json"), Jsons.object().put("version", "1.1.0"));
        Files.writeString(install.resolve("current"), "1.1.0");

        transport = new FakeTransport().acceptAuth("issued-token");
        runtime = newRuntime();
        runtime.start();
        Await.until(() -> runtime.getSession().getState().isOnline(), "session online after update");

        assertEquals("1.1.0", runtime.getState().getIdentity().getVersion());
        assertEquals("1.1.0", transport.last().sentOfType("auth").get(0).get("data").get("version").asText());
        assertEquals("1.1.0", Files.readString(install.resolve("current")).trim());
    }
}
