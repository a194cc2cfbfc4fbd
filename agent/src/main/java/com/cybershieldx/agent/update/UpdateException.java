package com.cybershieldx.agent.update;

/**
 * An update step failed
 */
public class UpdateException extends Exception {
    private final UpdatePhase phase;

    public UpdateException(UpdatePhase phase, String message) {
        super(message);
        this.phase = phase;
    }

    public UpdateException(UpdatePhase phase, String message, Throwable cause) {
        super(message, cause);
        this.phase = phase;
    }

    public UpdatePhase getPhase() {
        return phase;
    }
}
