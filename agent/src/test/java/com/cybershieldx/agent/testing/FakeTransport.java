package com.cybershieldx.agent.testing;

import com.cybershieldx.agent.transport.Transport;
import com.cybershieldx.agent.transport.TransportConnection;
import com.cybershieldx.agent.transport.TransportListener;
import com.cybershieldx.agent.util.Jsons;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory transport. Events are delivered on a separate thread, like a real network stack.
 */
public class FakeTransport implements Transport {

    private final List<FakeConnection> connections = new CopyOnWriteArrayList<>();
    private final ExecutorService events = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "fake-transport");
        t.setDaemon(true);
        return t;
    });
    private final AtomicInteger failuresRemaining = new AtomicInteger();
    private volatile boolean autoOpen = true;
    private volatile String autoAuthResponse;
    private volatile RuntimeException connectError;

    /**
     * The next {@code count} connection attempts are refused
     */
    public FakeTransport failNext(int count) {
        failuresRemaining.set(count);
        return this;
    }

    /**
     * The next connection attempt throws {@code error} instead of returning a connection
     */
    public FakeTransport throwOnNextConnect(RuntimeException error) {
        this.connectError = error;
        return this;
    }

    public FakeTransport autoOpen(boolean autoOpen) {
        this.autoOpen = autoOpen;
        return this;
    }

    /**
     * Answer every auth message with a successful auth_response carrying {@code token}
     */
    public FakeTransport acceptAuth(String token) {
        this.autoAuthResponse = "{\"type\":\"auth_response\",\"data\":{\"success\":true,\"token\":\""
                + token + "\"},\"timestamp\":\"2024-01-01T00:00:00Z\"}";
        return this;
    }

    @Override
    public TransportConnection connect(URI uri, TransportListener listener) {
        RuntimeException error = connectError;
        if (error != null) {
            connectError = null;
            throw error;
        }
        FakeConnection connection = new FakeConnection(uri, listener);
        connections.add(connection);
        if (failuresRemaining.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            events.execute(() -> connection.fail(new ConnectException("Connection refused")));
        } else if (autoOpen) {
            events.execute(connection::open);
        }
        return connection;
    }

    public List<FakeConnection> connections() {
        return connections;
    }

    public FakeConnection last() {
        return connections.get(connections.size() - 1);
    }

    @Override
    public void close() {
        events.shutdownNow();
    }

    static JsonNode parse(String text) {
        try {
            return Jsons.mapper().readTree(text);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Agent sent invalid JSON: " + text, e);
        }
    }

    public class FakeConnection implements TransportConnection {
        private final URI uri;
        private final TransportListener listener;
        private final List<String> sent = new CopyOnWriteArrayList<>();
        private volatile boolean closed;
        private volatile boolean failSends;

        FakeConnection(URI uri, TransportListener listener) {
            this.uri = uri;
            this.listener = listener;
        }

        public URI uri() {
            return uri;
        }

        @Override
        public CompletableFuture<Void> send(String text) {
            if (closed || failSends) {
                return CompletableFuture.failedFuture(new IOException("Broken pipe"));
            }
            sent.add(text);
            String response = autoAuthResponse;
            if (response != null && "auth".equals(parse(text).path("type").asText())) {
                events.execute(() -> listener.onMessage(response));
            }
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public void close() {
            if (!closed) {
                closed = true;
                events.execute(() -> listener.onClosed("closed by client", null));
            }
        }

        public void open() {
            listener.onOpen(this);
        }

        public void fail(Throwable cause) {
            closed = true;
            listener.onClosed("connect failed", cause);
        }

        /**
         * Deliver a frame from the server
         */
        public void receive(String text) {
            listener.onMessage(text);
        }

        /**
         * The server side went away
         */
        public void drop() {
            closed = true;
            listener.onClosed("connection reset", null);
        }

        public void failSends(boolean failSends) {
            this.failSends = failSends;
        }

        public boolean isClosed() {
            return closed;
        }

        public List<JsonNode> sentMessages() {
            List<JsonNode> messages = new ArrayList<>();
            for (String text : sent) {
                messages.add(parse(text));
            }
            return messages;
        }

        public List<JsonNode> sentOfType(String type) {
            List<JsonNode> matching = new ArrayList<>();
            for (JsonNode message : sentMessages()) {
                if (type.equals(message.path("type").asText())) {
                    matching.add(message);
                }
            }
            return matching;
        }
    }
}
