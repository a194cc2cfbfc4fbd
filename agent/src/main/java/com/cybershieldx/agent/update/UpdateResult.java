package com.cybershieldx.agent.update;

import com.cybershieldx.agent.util.Jsons;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Result of an update run
 */
public final class UpdateResult {

    public enum Outcome {
        /** New version installed and verified */
        UPDATED,
        /** Nothing to install */
        NO_UPDATE,
        /** Failed before the installation was touched */
        NOT_STARTED,
        /** Failed, previous version restored */
        ROLLED_BACK,
        /** Failed and the previous version could not be restored */
        ROLLBACK_FAILED
    }

    private final Outcome outcome;
    private final String version;
    private final String error;
    private final String rollbackError;
    private final boolean mandatory;

    private UpdateResult(Outcome outcome, String version, String error, String rollbackError, boolean mandatory) {
        this.outcome = outcome;
        this.version = version;
        this.error = error;
        this.rollbackError = rollbackError;
        this.mandatory = mandatory;
    }

    private UpdateResult(Outcome outcome, String version, String error, String rollbackError) {
        this(outcome, version, error, rollbackError, false);
    }

    /**
     * Same result, flagged as a mandatory update announced by the server
     */
    public UpdateResult withMandatory(boolean mandatory) {
        return new UpdateResult(outcome, version, error, rollbackError, mandatory);
    }

    public static UpdateResult updated(String version) {
        return new UpdateResult(Outcome.UPDATED, version, null, null);
    }

    public static UpdateResult noUpdate(String message) {
        return new UpdateResult(Outcome.NO_UPDATE, null, message, null);
    }

    public static UpdateResult notStarted(String error) {
        return new UpdateResult(Outcome.NOT_STARTED, null, error, null);
    }

    public static UpdateResult rolledBack(String version, String error) {
        return new UpdateResult(Outcome.ROLLED_BACK, version, error, null);
    }

    public static UpdateResult rollbackFailed(String version, String error, String rollbackError) {
        return new UpdateResult(Outcome.ROLLBACK_FAILED, version, error, rollbackError);
    }

    public boolean isSuccess() {
        return outcome == Outcome.UPDATED;
    }

    public boolean isInstallationIntact() {
        return outcome != Outcome.ROLLBACK_FAILED;
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public String getVersion() {
        return version;
    }

    public String getError() {
        return error;
    }

    public String getRollbackError() {
        return rollbackError;
    }

    public boolean isMandatory() {
        return mandatory;
    }

    /**
     * Payload of the update_complete message
     */
    public ObjectNode toPayload() {
        ObjectNode data = Jsons.object();
        data.put("success", isSuccess());
        if (mandatory) {
            data.put("mandatory", true);
        }
        if (isSuccess()) {
            data.put("version", version);
            return data;
        }
        data.put("error", error);
        if (version != null) {
            data.put("version", version);
        }
        data.put("rolledBack", outcome == Outcome.ROLLED_BACK);
        if (rollbackError != null) {
            data.put("rollbackError", rollbackError);
        }
        return data;
    }

    @Override
    public String toString() {
        return isSuccess() ? outcome + "(" + version + ")" : outcome + "(" + error + ")";
    }
}
