package com.cybershieldx.agent.update;

/**
 * What the agent tells the update server about itself
 */
public final class UpdateQuery {
    private final String agentId;
    private final String serverToken;
    private final String currentVersion;
    private final String platform;
    private final String arch;
    private final String targetVersion;

    public UpdateQuery(String agentId, String serverToken, String currentVersion,
            String platform, String arch, String targetVersion) {
        this.agentId = agentId;
        this.serverToken = serverToken;
        this.currentVersion = currentVersion;
        this.platform = platform;
        this.arch = arch;
        this.targetVersion = targetVersion;
    }

    public String getAgentId() {
        return agentId;
    }

    public String getServerToken() {
        return serverToken;
    }

    public String getCurrentVersion() {
        return currentVersion;
    }

    public String getPlatform() {
        return platform;
    }

    public String getArch() {
        return arch;
    }

    public String getTargetVersion() {
        return targetVersion;
    }

    public String userAgent() {
        return "CyberShieldX-Agent/" + currentVersion + " (" + platform + "; " + arch + ")";
    }
}
