package com.cybershieldx.agent.handler;

import com.cybershieldx.agent.auth.CredentialManager;
import com.cybershieldx.agent.model.AgentIdentity;
import com.cybershieldx.agent.model.AgentState;
import com.cybershieldx.agent.model.PendingTask;
import com.cybershieldx.agent.scan.ScanResult;
import com.cybershieldx.agent.scan.ScanType;
import com.cybershieldx.agent.scan.TaskRunner;
import com.cybershieldx.agent.store.ConfigKeys;
import com.cybershieldx.agent.store.ConfigStore;
import com.cybershieldx.agent.util.Jsons;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.QueryStringDecoder;
import io.netty.util.CharsetUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * HTTP request handler for the loopback status API
 */
public class LocalApiHandler extends SimpleChannelInboundHandler<FullHttpRequest> {
    private static final Logger log = LoggerFactory.getLogger(LocalApiHandler.class);

    private static final String BEARER = "Bearer ";

    private final AgentState agentState;
    private final ConfigStore store;
    private final CredentialManager credentials;
    private final TaskRunner taskRunner;

    public LocalApiHandler(AgentState agentState, ConfigStore store, CredentialManager credentials,
            TaskRunner taskRunner) {
        this.agentState = agentState;
        this.store = store;
        this.credentials = credentials;
        this.taskRunner = taskRunner;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request) {
        String path = new QueryStringDecoder(request.uri()).path();
        HttpMethod method = request.method();

        if (path.equals("/health")) {
            if (!HttpMethod.GET.equals(method)) {
                sendError(ctx, HttpResponseStatus.METHOD_NOT_ALLOWED, "Method Not Allowed");
                return;
            }
            handleHealth(ctx);
            return;
        }

        // Handle API endpoints
        if (path.startsWith("/api/")) {
            if (!isAuthorized(request)) {
                log.warn("Rejected unauthenticated local API request to {}", path);
                sendError(ctx, HttpResponseStatus.UNAUTHORIZED, "Authentication required");
                return;
            }
            handleApiRequest(ctx, request, path, method);
            return;
        }

        sendError(ctx, HttpResponseStatus.NOT_FOUND, "Not Found");
    }

    private void handleApiRequest(ChannelHandlerContext ctx, FullHttpRequest request, String path, HttpMethod method) {
        if (path.equals("/api/info") && HttpMethod.GET.equals(method)) {
            handleInfo(ctx);
        } else if (path.equals("/api/scan") && HttpMethod.POST.equals(method)) {
            handleScan(ctx, request);
        } else if (path.equals("/api/config") && HttpMethod.GET.equals(method)) {
            handleGetConfig(ctx);
        } else if (path.equals("/api/config") && HttpMethod.POST.equals(method)) {
            handleUpdateConfig(ctx, request);
        } else if (path.equals("/api/info") || path.equals("/api/scan") || path.equals("/api/config")) {
            sendError(ctx, HttpResponseStatus.METHOD_NOT_ALLOWED, "Method Not Allowed");
        } else {
            sendError(ctx, HttpResponseStatus.NOT_FOUND, "Not Found");
        }
    }

    private boolean isAuthorized(FullHttpRequest request) {
        String header = request.headers().get(HttpHeaderNames.AUTHORIZATION);
        if (header == null || !header.startsWith(BEARER)) {
            return false;
        }
        return credentials.isValidLocalApiToken(header.substring(BEARER.length()).trim());
    }

    private void handleHealth(ChannelHandlerContext ctx) {
        ObjectNode body = Jsons.object();
        body.put("status", "ok");
        body.put("version", agentState.getIdentity().getVersion());
        body.put("agentStatus", agentState.getStatus().wireName());
        sendJson(ctx, HttpResponseStatus.OK, body);
    }

    private void handleInfo(ChannelHandlerContext ctx) {
        AgentIdentity identity = agentState.getIdentity();
        ObjectNode body = Jsons.object();
        body.put("id", identity.getAgentId());
        body.put("version", identity.getVersion());
        body.put("platform", identity.getPlatform());
        body.put("arch", identity.getArch());
        body.put("hostname", identity.getHostname());
        body.put("clientId", identity.getClientId());
        body.put("status", agentState.getStatus().wireName());
        Instant lastScan = agentState.getLastScan();
        body.put("lastScan", lastScan == null ? store.getString(ConfigKeys.LAST_SCAN) : lastScan.toString());
        PendingTask task = taskRunner.currentTask();
        if (task != null) {
            ObjectNode current = body.putObject("currentScan");
            current.put("scanId", task.getId());
            current.put("type", task.getType());
            current.put("status", task.getStatus().name().toLowerCase(Locale.ROOT));
        }
        sendJson(ctx, HttpResponseStatus.OK, body);
    }

    private void handleScan(ChannelHandlerContext ctx, FullHttpRequest request) {
        JsonNode body = readBody(request);
        if (body == null) {
            sendError(ctx, HttpResponseStatus.BAD_REQUEST, "Request body must be a JSON object");
            return;
        }
        String requested = body.path("type").asText("quick");
        ScanType type = ScanType.fromWire(requested);
        if (type == null) {
            sendError(ctx, HttpResponseStatus.BAD_REQUEST, "Unknown scan type: " + requested);
            return;
        }

        String scanId = UUID.randomUUID().toString();
        CompletableFuture<ScanResult> result = taskRunner.submit(type, scanId);
        ScanResult immediate = result.getNow(null);
        if (immediate != null && immediate.isRejected()) {
            sendError(ctx, HttpResponseStatus.CONFLICT, immediate.getError());
            return;
        }

        ObjectNode response = Jsons.object();
        response.put("message", type.wireName() + " scan started");
        response.put("status", "scanning");
        response.put("scanId", scanId);
        sendJson(ctx, HttpResponseStatus.OK, response);
    }

    private void handleGetConfig(ChannelHandlerContext ctx) {
        ObjectNode body = Jsons.object();
        for (Map.Entry<String, JsonNode> entry : store.snapshot().entrySet()) {
            if (!ConfigKeys.CREDENTIALS.contains(entry.getKey())) {
                body.set(entry.getKey(), entry.getValue());
            }
        }
        sendJson(ctx, HttpResponseStatus.OK, body);
    }

    private void handleUpdateConfig(ChannelHandlerContext ctx, FullHttpRequest request) {
        JsonNode body = readBody(request);
        if (body == null) {
            sendError(ctx, HttpResponseStatus.BAD_REQUEST, "Request body must be a JSON object");
            return;
        }

        ArrayNode forbidden = Jsons.mapper().createArrayNode();
        Map<String, Object> changes = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = body.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (ConfigKeys.CREDENTIALS.contains(field.getKey()) || ConfigKeys.AGENT_ID.equals(field.getKey())) {
                forbidden.add(field.getKey());
            } else {
                changes.put(field.getKey(), field.getValue());
            }
        }
        if (forbidden.size() > 0) {
            ObjectNode error = Jsons.object();
            error.put("error", "Forbidden configuration keys");
            error.set("keys", forbidden);
            sendJson(ctx, HttpResponseStatus.BAD_REQUEST, error);
            return;
        }

        store.apply(changes);
        log.info("Configuration updated through local API: {}", changes.keySet());
        ObjectNode response = Jsons.object();
        response.put("message", "Configuration updated");
        sendJson(ctx, HttpResponseStatus.OK, response);
    }

    private static JsonNode readBody(FullHttpRequest request) {
        String content = request.content().toString(CharsetUtil.UTF_8);
        if (content.isBlank()) {
            return Jsons.object();
        }
        try {
            JsonNode node = Jsons.mapper().readTree(content);
            return node != null && node.isObject() ? node : null;
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private void sendJson(ChannelHandlerContext ctx, HttpResponseStatus status, JsonNode body) {
        byte[] content = Jsons.toJson(body).getBytes(CharsetUtil.UTF_8);
        ByteBuf buffer = Unpooled.wrappedBuffer(content);
        FullHttpResponse response = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, status, buffer);

        response.headers().set(HttpHeaderNames.CONTENT_TYPE, "application/json");
        response.headers().set(HttpHeaderNames.CONTENT_LENGTH, content.length);
        response.headers().set(HttpHeaderNames.CACHE_CONTROL, "no-cache");

        ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
    }

    private void sendError(ChannelHandlerContext ctx, HttpResponseStatus status, String message) {
        ObjectNode body = Jsons.object();
        body.put("error", status.reasonPhrase());
        body.put("message", message);
        sendJson(ctx, status, body);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Local API error", cause);
        ctx.close();
    }
}
