package com.cybershieldx.agent.session;

import java.time.Instant;

/**
 * Snapshot of the session lifecycle. Never persisted.
 */
public final class SessionState {

    public enum Phase {
        DISCONNECTED,
        CONNECTING,
        AUTHENTICATING,
        ONLINE,
        RECONNECTING
    }

    private final Phase phase;
    private final int attempt;
    private final Instant nextRetryAt;

    public SessionState(Phase phase, int attempt, Instant nextRetryAt) {
        this.phase = phase;
        this.attempt = attempt;
        this.nextRetryAt = nextRetryAt;
    }

    public Phase getPhase() {
        return phase;
    }

    /** Consecutive failed attempts since the last time the session was online */
    public int getAttempt() {
        return attempt;
    }

    public Instant getNextRetryAt() {
        return nextRetryAt;
    }

    public boolean isOnline() {
        return phase == Phase.ONLINE;
    }

    @Override
    public String toString() {
        return phase == Phase.RECONNECTING
                ? phase + "(attempt=" + attempt + ", nextRetryAt=" + nextRetryAt + ")"
                : phase.toString();
    }
}
