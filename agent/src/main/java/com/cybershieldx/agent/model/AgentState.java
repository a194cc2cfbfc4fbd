package com.cybershieldx.agent.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide agent state shared by the session, the task runner and the local API
 */
public class AgentState {
    private static final Logger log = LoggerFactory.getLogger(AgentState.class);

    private final AtomicReference<AgentIdentity> identity;
    private final AtomicReference<AgentStatus> status = new AtomicReference<>(AgentStatus.INITIALIZING);
    private volatile Instant lastScan;
    private boolean scanning;
    private boolean updating;

    public AgentState(AgentIdentity identity) {
        this.identity = new AtomicReference<>(Objects.requireNonNull(identity, "identity"));
    }

    public AgentIdentity getIdentity() {
        return identity.get();
    }

    public void updateClientId(String clientId) {
        identity.updateAndGet(current -> current.withClientId(clientId));
    }

    public AgentStatus getStatus() {
        return status.get();
    }

    public void setStatus(AgentStatus next) {
        AgentStatus previous = status.getAndSet(next);
        if (previous != next) {
            log.debug("Agent status {} -> {}", previous.wireName(), next.wireName());
        }
    }

    /**
     * Enter a scan or an update. While an update runs the status is updating,
     * otherwise scanning while a scan runs.
     */
    public synchronized void beginActivity(AgentStatus activity) {
        setActivity(activity, true);
    }

    /**
     * Leave a scan or an update. The status returns to online once neither is running.
     */
    public synchronized void endActivity(AgentStatus activity) {
        setActivity(activity, false);
    }

    // Caller holds this
    private void setActivity(AgentStatus activity, boolean active) {
        if (activity == AgentStatus.SCANNING) {
            scanning = active;
        } else if (activity == AgentStatus.UPDATING) {
            updating = active;
        } else {
            throw new IllegalArgumentException("Not an activity: " + activity);
        }
        setStatus(updating ? AgentStatus.UPDATING : scanning ? AgentStatus.SCANNING : AgentStatus.ONLINE);
    }

    /**
     * Reflect connectivity without overriding a scan or update in progress
     */
    public synchronized void setConnected(boolean connected) {
        if (!scanning && !updating) {
            setStatus(connected ? AgentStatus.ONLINE : AgentStatus.OFFLINE);
        }
    }

    public Instant getLastScan() {
        return lastScan;
    }

    public void setLastScan(Instant lastScan) {
        this.lastScan = lastScan;
    }
}
