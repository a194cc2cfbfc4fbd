package com.cybershieldx.agent.update;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Progress of one update run
 */
public class UpdateAttempt {
    private static final Logger log = LoggerFactory.getLogger(UpdateAttempt.class);

    private volatile String targetVersion;
    private volatile String downloadUrl;
    private volatile Path backupPath;
    private volatile UpdatePhase phase = UpdatePhase.IDLE;

    public UpdateAttempt(String targetVersion) {
        this.targetVersion = targetVersion;
    }

    void enter(UpdatePhase next) {
        log.debug("Update {}: {} -> {}", targetVersion == null ? "(latest)" : targetVersion, phase, next);
        phase = next;
    }

    public String getTargetVersion() {
        return targetVersion;
    }

    void setTargetVersion(String targetVersion) {
        this.targetVersion = targetVersion;
    }

    public String getDownloadUrl() {
        return downloadUrl;
    }

    void setDownloadUrl(String downloadUrl) {
        this.downloadUrl = downloadUrl;
    }

    public Path getBackupPath() {
        return backupPath;
    }

    void setBackupPath(Path backupPath) {
        this.backupPath = backupPath;
    }

    public UpdatePhase getPhase() {
        return phase;
    }
}
