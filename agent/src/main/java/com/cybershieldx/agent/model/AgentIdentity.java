package com.cybershieldx.agent.model;

import com.cybershieldx.agent.util.Jsons;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * Who this agent is. The agentId never changes once generated; the server may reassign clientId.
 */
public final class AgentIdentity {
    private final String agentId;
    private final String clientId;
    private final String hostname;
    private final String platform;
    private final String arch;
    private final String version;

    public AgentIdentity(String agentId, String clientId, String hostname,
            String platform, String arch, String version) {
        this.agentId = Objects.requireNonNull(agentId, "agentId");
        this.clientId = clientId;
        this.hostname = hostname;
        this.platform = platform;
        this.arch = arch;
        this.version = version;
    }

    public AgentIdentity withClientId(String clientId) {
        return new AgentIdentity(agentId, clientId, hostname, platform, arch, version);
    }

    public String getAgentId() {
        return agentId;
    }

    public String getClientId() {
        return clientId;
    }

    public String getHostname() {
        return hostname;
    }

    public String getPlatform() {
        return platform;
    }

    public String getArch() {
        return arch;
    }

    public String getVersion() {
        return version;
    }

    /**
     * Identity fields as sent in the auth message and embedded in reports
     */
    public ObjectNode toJson() {
        ObjectNode node = Jsons.object();
        node.put("agentId", agentId);
        node.put("clientId", clientId);
        node.put("hostname", hostname);
        node.put("platform", platform);
        node.put("arch", arch);
        node.put("version", version);
        return node;
    }

    @Override
    public String toString() {
        return "AgentIdentity{agentId=" + agentId + ", clientId=" + clientId + ", hostname=" + hostname + "}";
    }
}
