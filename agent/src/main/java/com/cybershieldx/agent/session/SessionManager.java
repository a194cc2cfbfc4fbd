package com.cybershieldx.agent.session;

import com.cybershieldx.agent.AgentConfig;
import com.cybershieldx.agent.auth.CredentialManager;
import com.cybershieldx.agent.model.AgentIdentity;
import com.cybershieldx.agent.model.AgentState;
import com.cybershieldx.agent.store.ConfigKeys;
import com.cybershieldx.agent.store.ConfigStore;
import com.cybershieldx.agent.transport.Transport;
import com.cybershieldx.agent.transport.TransportConnection;
import com.cybershieldx.agent.transport.TransportListener;
import com.cybershieldx.agent.util.Jsons;
import com.cybershieldx.agent.util.SanitizeUtils;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Owns the single long-lived connection to the server: connect, authenticate,
 * heartbeat, receive commands, reconnect with backoff.
 */
public class SessionManager implements AgentSession {
    private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

    private static final int MAX_BACKOFF_SHIFT = 16;

    private final AgentConfig config;
    private final AgentState agentState;
    private final ConfigStore store;
    private final CredentialManager credentials;
    private final Transport transport;
    private final ScheduledExecutorService timers;
    private final List<SessionListener> listeners = new CopyOnWriteArrayList<>();
    private volatile Consumer<Message> messageHandler = message -> { };

    private final Object lock = new Object();
    // Guarded by lock
    private SessionState state = new SessionState(SessionState.Phase.DISCONNECTED, 0, null);
    private ConnectionListener activeListener;
    private TransportConnection connection;
    private ScheduledFuture<?> heartbeatTask;
    private ScheduledFuture<?> retryTask;
    private boolean shutdown;

    public SessionManager(AgentConfig config, AgentState agentState, ConfigStore store,
            CredentialManager credentials, Transport transport) {
        this.config = config;
        this.agentState = agentState;
        this.store = store;
        this.credentials = credentials;
        this.transport = transport;
        this.timers = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "cybershieldx-session");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Set the handler for inbound messages. It is called on transport threads.
     */
    public void setMessageHandler(Consumer<Message> handler) {
        this.messageHandler = handler;
    }

    public void addListener(SessionListener listener) {
        listeners.add(listener);
    }

    public void removeListener(SessionListener listener) {
        listeners.remove(listener);
    }

    /**
     * Connect to the server. No-op while a connection is being established or online;
     * a pending retry is cancelled and the attempt made immediately.
     */
    public void connect() {
        synchronized (lock) {
            if (shutdown) {
                log.warn("Session is shut down, not connecting");
                return;
            }
            switch (state.getPhase()) {
                case CONNECTING:
                case AUTHENTICATING:
                case ONLINE:
                    log.debug("Already {}, connect() ignored", state);
                    return;
                default:
                    cancelRetry();
                    openConnection();
            }
        }
    }

    @Override
    public void reconnect() {
        TransportConnection previous;
        synchronized (lock) {
            if (shutdown) {
                return;
            }
            log.info("Reconnecting to {}", serverUrl());
            cancelRetry();
            stopHeartbeat();
            previous = connection;
            connection = null;
            activeListener = null;
            transition(SessionState.Phase.DISCONNECTED, 0, null);
            openConnection();
        }
        if (previous != null) {
            previous.close();
        }
    }

    @Override
    public boolean send(MessageType type, ObjectNode data) {
        synchronized (lock) {
            if (state.getPhase() != SessionState.Phase.ONLINE || connection == null) {
                log.warn("Cannot send {}: session is {}", type.wireName(), state);
                return false;
            }
            write(activeListener, connection, Message.of(type, data));
            return true;
        }
    }

    @Override
    public void authenticated(String token, String clientId) {
        synchronized (lock) {
            if (state.getPhase() != SessionState.Phase.AUTHENTICATING) {
                log.debug("Ignoring auth success while {}", state);
                return;
            }
            if (token != null && !token.isEmpty()) {
                credentials.saveServerToken(token);
            }
            if (clientId != null && !clientId.isEmpty()) {
                store.set(ConfigKeys.CLIENT_ID, clientId);
                agentState.updateClientId(clientId);
            }
            transition(SessionState.Phase.ONLINE, 0, null);
            agentState.setConnected(true);
            startHeartbeat();
        }
        log.info("Authenticated with server");
    }

    @Override
    public void authenticationFailed(String reason) {
        log.error("Authentication failed: {}", SanitizeUtils.sanitizeString(reason));
        if (reason != null && reason.toLowerCase(Locale.ROOT).contains("invalid token")) {
            credentials.clearServerToken();
        }
        TransportConnection previous;
        synchronized (lock) {
            if (shutdown || activeListener == null) {
                return;
            }
            previous = connection;
            dropConnection();
            scheduleReconnect();
        }
        if (previous != null) {
            previous.close();
        }
    }

    /**
     * Send a best-effort shutdown notice, close the connection and stop reconnecting
     */
    public void shutdown(String reason) {
        TransportConnection previous;
        synchronized (lock) {
            if (shutdown) {
                return;
            }
            if (state.getPhase() == SessionState.Phase.ONLINE && connection != null) {
                ObjectNode data = Jsons.object();
                data.put("reason", reason);
                write(activeListener, connection, Message.of(MessageType.SHUTDOWN, data));
            }
            shutdown = true;
            cancelRetry();
            previous = connection;
            dropConnection();
            transition(SessionState.Phase.DISCONNECTED, 0, null);
        }
        if (previous != null) {
            previous.close();
        }
        timers.shutdown();
        log.info("Session shut down ({})", reason);
    }

    /**
     * Report an unexpected error to the server when online
     */
    public void reportError(Throwable error) {
        ObjectNode data = Jsons.object();
        data.put("message", String.valueOf(error.getMessage()));
        StringWriter stack = new StringWriter();
        error.printStackTrace(new PrintWriter(stack));
        data.put("stack", stack.toString());
        send(MessageType.ERROR, data);
    }

    @Override
    public SessionState getState() {
        synchronized (lock) {
            return state;
        }
    }

    boolean isRetryScheduled() {
        synchronized (lock) {
            return retryTask != null && !retryTask.isDone();
        }
    }

    // Caller holds lock
    private void openConnection() {
        int attempt = state.getAttempt();
        transition(SessionState.Phase.CONNECTING, attempt, null);
        ConnectionListener listener = new ConnectionListener();
        activeListener = listener;
        URI uri;
        try {
            uri = URI.create(serverUrl());
        } catch (IllegalArgumentException e) {
            log.error("Invalid server URL {}: {}", serverUrl(), e.getMessage());
            activeListener = null;
            scheduleReconnect();
            return;
        }
        log.info("Connecting to server: {}", uri);
        TransportConnection opened;
        try {
            opened = transport.connect(uri, listener);
        } catch (RuntimeException e) {
            log.warn("Could not connect to {}: {}", uri, e.getMessage());
            if (activeListener == listener) {
                dropConnection();
                scheduleReconnect();
            }
            return;
        }
        if (activeListener == listener && connection == null) {
            connection = opened;
        }
    }

    private String serverUrl() {
        return store.getString(ConfigKeys.SERVER_URL, config.getServerUrl());
    }

    private void handleOpen(ConnectionListener listener, TransportConnection opened) {
        synchronized (lock) {
            if (listener != activeListener || shutdown) {
                opened.close();
                return;
            }
            connection = opened;
            log.info("Connected to server");
            transition(SessionState.Phase.AUTHENTICATING, state.getAttempt(), null);

            AgentIdentity identity = agentState.getIdentity();
            ObjectNode auth = identity.toJson();
            auth.put("token", credentials.authToken());
            write(listener, opened, Message.of(MessageType.AUTH, auth));
        }
    }

    private void handleMessage(ConnectionListener listener, String text) {
        synchronized (lock) {
            if (listener != activeListener) {
                return;
            }
        }
        Message message;
        try {
            message = MessageCodec.decode(text);
        } catch (ProtocolException e) {
            log.warn("Dropping malformed message: {}", e.getMessage());
            return;
        }
        try {
            messageHandler.accept(message);
        } catch (Exception e) {
            log.error("Error in message handler for {}", SanitizeUtils.sanitizeString(message.getType()), e);
        }
    }

    private void handleClosed(ConnectionListener listener, String reason, Throwable cause) {
        synchronized (lock) {
            if (listener != activeListener) {
                return;
            }
            dropConnection();
            if (shutdown) {
                transition(SessionState.Phase.DISCONNECTED, 0, null);
                return;
            }
            if (cause != null) {
                log.warn("Connection to server lost ({}): {}", reason, cause.getMessage());
            } else {
                log.warn("Connection to server lost: {}", reason);
            }
            scheduleReconnect();
        }
    }

    // Caller holds lock
    private void write(ConnectionListener listener, TransportConnection target, Message message) {
        target.send(MessageCodec.encode(message)).whenComplete((ignored, error) -> {
            if (error != null) {
                handleClosed(listener, "failed to send " + message.getType(), error);
                target.close();
            }
        });
    }

    // Caller holds lock
    private void dropConnection() {
        activeListener = null;
        connection = null;
        stopHeartbeat();
        agentState.setConnected(false);
    }

    // Caller holds lock
    private void scheduleReconnect() {
        cancelRetry();
        int attempt = state.getAttempt() + 1;
        Duration delay = backoff(attempt);
        Instant nextRetryAt = Instant.now().plus(delay);
        transition(SessionState.Phase.RECONNECTING, attempt, nextRetryAt);
        log.info("Reconnecting in {} ms (attempt {})", delay.toMillis(), attempt);
        retryTask = timers.schedule(this::retry, delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void retry() {
        synchronized (lock) {
            if (shutdown || state.getPhase() != SessionState.Phase.RECONNECTING) {
                return;
            }
            retryTask = null;
            openConnection();
        }
    }

    Duration backoff(int attempt) {
        Duration base = config.getReconnectDelay();
        if (!config.isExponentialBackoff()) {
            return base;
        }
        int shift = Math.min(Math.max(attempt - 1, 0), MAX_BACKOFF_SHIFT);
        Duration delay = base.multipliedBy(1L << shift);
        return delay.compareTo(config.getMaxReconnectDelay()) > 0 ? config.getMaxReconnectDelay() : delay;
    }

    // Caller holds lock
    private void cancelRetry() {
        if (retryTask != null) {
            retryTask.cancel(false);
            retryTask = null;
        }
    }

    // Caller holds lock. The first heartbeat goes out immediately so the server sees our status.
    private void startHeartbeat() {
        stopHeartbeat();
        long interval = config.getHeartbeatInterval().toMillis();
        heartbeatTask = timers.scheduleAtFixedRate(this::sendHeartbeat, 0, interval, TimeUnit.MILLISECONDS);
    }

    private void sendHeartbeat() {
        ObjectNode data = Jsons.object();
        data.put("status", agentState.getStatus().wireName());
        data.put("timestamp", Instant.now().toString());
        synchronized (lock) {
            if (state.getPhase() != SessionState.Phase.ONLINE || connection == null) {
                return;
            }
            try {
                write(activeListener, connection, Message.of(MessageType.HEARTBEAT, data));
            } catch (RuntimeException e) {
                // An escaping exception would cancel the periodic task
                log.error("Error sending heartbeat", e);
            }
        }
    }

    // Caller holds lock
    private void stopHeartbeat() {
        if (heartbeatTask != null) {
            heartbeatTask.cancel(false);
            heartbeatTask = null;
        }
    }

    // Caller holds lock
    private void transition(SessionState.Phase phase, int attempt, Instant nextRetryAt) {
        SessionState previous = state;
        state = new SessionState(phase, attempt, nextRetryAt);
        if (previous.getPhase() == phase && previous.getAttempt() == attempt) {
            return;
        }
        log.debug("Session {} -> {}", previous, state);
        for (SessionListener listener : listeners) {
            try {
                listener.onStateChanged(previous, state);
            } catch (Exception e) {
                log.error("Error in session listener callback", e);
            }
        }
    }

    private final class ConnectionListener implements TransportListener {
        @Override
        public void onOpen(TransportConnection opened) {
            handleOpen(this, opened);
        }

        @Override
        public void onMessage(String text) {
            handleMessage(this, text);
        }

        @Override
        public void onClosed(String reason, Throwable cause) {
            handleClosed(this, reason, cause);
        }
    }
}
