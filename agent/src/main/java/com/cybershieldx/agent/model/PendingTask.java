package com.cybershieldx.agent.model;

import java.time.Instant;

/**
 * A scan request accepted by the task runner
 */
public class PendingTask {

    public enum Status {
        QUEUED,
        RUNNING,
        DONE,
        FAILED
    }

    private final String id;
    private final String type;
    private final Instant requestedAt;
    private volatile Status status = Status.QUEUED;

    public PendingTask(String id, String type, Instant requestedAt) {
        this.id = id;
        this.type = type;
        this.requestedAt = requestedAt;
    }

    public String getId() {
        return id;
    }

    public String getType() {
        return type;
    }

    public Instant getRequestedAt() {
        return requestedAt;
    }

    public Status getStatus() {
        return status;
    }

    public void setStatus(Status status) {
        this.status = status;
    }

    public boolean isTerminal() {
        return status == Status.DONE || status == Status.FAILED;
    }
}
