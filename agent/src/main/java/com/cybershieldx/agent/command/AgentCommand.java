package com.cybershieldx.agent.command;

import com.cybershieldx.agent.scan.ScanType;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Commands the server can send to the agent. The set is closed: every command is
 * handled through {@link Visitor}, so adding one forces every handler to deal with it.
 */
public abstract class AgentCommand {

    private AgentCommand() {
    }

    public abstract <R> R accept(Visitor<R> visitor);

    public interface Visitor<R> {
        R visit(AuthResponse command);

        R visit(ConfigUpdate command);

        R visit(RunScan command);

        R visit(UpdateAgent command);

        R visit(Reboot command);

        R visit(Unknown command);
    }

    /**
     * Server verdict on our auth message
     */
    public static final class AuthResponse extends AgentCommand {
        private final boolean success;
        private final String token;
        private final String clientId;
        private final String message;
        private final String scanInterval;
        private final boolean runInitialScan;

        public AuthResponse(boolean success, String token, String clientId, String message,
                String scanInterval, boolean runInitialScan) {
            this.success = success;
            this.token = token;
            this.clientId = clientId;
            this.message = message;
            this.scanInterval = scanInterval;
            this.runInitialScan = runInitialScan;
        }

        public boolean isSuccess() {
            return success;
        }

        public String getToken() {
            return token;
        }

        public String getClientId() {
            return clientId;
        }

        public String getMessage() {
            return message;
        }

        public String getScanInterval() {
            return scanInterval;
        }

        public boolean isRunInitialScan() {
            return runInitialScan;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * Keys to merge into the agent configuration
     */
    public static final class ConfigUpdate extends AgentCommand {
        private final Map<String, JsonNode> values;

        public ConfigUpdate(Map<String, JsonNode> values) {
            this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        }

        public Map<String, JsonNode> getValues() {
            return values;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    public static final class RunScan extends AgentCommand {
        private final String requestedType;
        private final ScanType scanType;
        private final String scanId;

        public RunScan(String requestedType, String scanId) {
            this.requestedType = requestedType;
            this.scanType = ScanType.fromWire(requestedType);
            this.scanId = scanId;
        }

        public String getRequestedType() {
            return requestedType;
        }

        /** Resolved scan type, null when the server asked for an unknown one */
        public ScanType getScanType() {
            return scanType;
        }

        public String getScanId() {
            return scanId;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    public static final class UpdateAgent extends AgentCommand {
        private final String version;
        private final boolean restart;

        public UpdateAgent(String version, boolean restart) {
            this.version = version;
            this.restart = restart;
        }

        /** Requested version, null for the latest */
        public String getVersion() {
            return version;
        }

        public boolean isRestart() {
            return restart;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    public static final class Reboot extends AgentCommand {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    public static final class Unknown extends AgentCommand {
        private final String type;

        public Unknown(String type) {
            this.type = type;
        }

        public String getType() {
            return type;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }
}
