package com.cybershieldx.agent.update;

/**
 * Phases of an update attempt
 */
public enum UpdatePhase {
    IDLE,
    CHECKING,
    NO_UPDATE,
    UPDATE_AVAILABLE,
    BACKING_UP,
    DOWNLOADING,
    INSTALLING,
    VERIFYING,
    DONE,
    ROLLED_BACK,
    FAILED
}
