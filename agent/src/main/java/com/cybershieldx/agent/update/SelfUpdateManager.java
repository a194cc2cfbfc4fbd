package com.cybershieldx.agent.update;

import com.cybershieldx.agent.AgentConfig;
import com.cybershieldx.agent.model.AgentIdentity;
import com.cybershieldx.agent.model.AgentState;
import com.cybershieldx.agent.model.AgentStatus;
import com.cybershieldx.agent.store.ConfigKeys;
import com.cybershieldx.agent.store.ConfigStore;
import com.cybershieldx.agent.util.Digests;
import com.cybershieldx.agent.util.FileOps;
import com.cybershieldx.agent.util.SanitizeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Checks for, downloads and installs new agent versions, rolling back on failure.
 * It never restarts the process; callers decide what to do with a successful result.
 */
public class SelfUpdateManager {
    private static final Logger log = LoggerFactory.getLogger(SelfUpdateManager.class);

    /** Number of backups kept in the backups directory */
    public static final int MAX_BACKUPS = 3;

    private static final String BACKUP_PREFIX = "backup-";

    private final AgentConfig config;
    private final ConfigStore store;
    private final AgentState agentState;
    private final UpdateServerClient client;
    private final AtomicBoolean inProgress = new AtomicBoolean();
    private volatile UpdateAttempt lastAttempt;
    private ScheduledExecutorService checkTimer;

    public SelfUpdateManager(AgentConfig config, ConfigStore store, AgentState agentState,
            UpdateServerClient client) {
        this.config = config;
        this.store = store;
        this.agentState = agentState;
        this.client = client;
    }

    public boolean isAutoUpdateEnabled() {
        return store.getBoolean(ConfigKeys.AUTO_UPDATE, true);
    }

    /**
     * Ask the update server for a newer version. Returns "no update" without any
     * network call when auto-update is disabled, and when the server cannot be reached.
     */
    public UpdateInfo check() {
        String current = agentState.getIdentity().getVersion();
        if (!isAutoUpdateEnabled()) {
            log.debug("Auto-update disabled, skipping update check");
            return UpdateInfo.none(current);
        }
        return query(null);
    }

    /**
     * Install {@code targetVersion}, or the latest version when null.
     * Concurrent calls are rejected while an update is running.
     */
    public UpdateResult update(String targetVersion) {
        if (!inProgress.compareAndSet(false, true)) {
            log.warn("Update requested while another update is running");
            return UpdateResult.notStarted("Update already in progress");
        }
        UpdateAttempt attempt = new UpdateAttempt(targetVersion);
        lastAttempt = attempt;
        try {
            UpdateResult result = runUpdate(attempt);
            log.info("Update finished: {}", result);
            return result;
        } finally {
            inProgress.set(false);
        }
    }

    public boolean isUpdating() {
        return inProgress.get();
    }

    public UpdateAttempt getLastAttempt() {
        return lastAttempt;
    }

    /**
     * Check (and install when available) right away, then every {@code interval}
     */
    public synchronized void startPeriodicChecks(Duration interval, Consumer<UpdateResult> onInstalled) {
        if (checkTimer != null) {
            return;
        }
        checkTimer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "cybershieldx-update-check");
            t.setDaemon(true);
            return t;
        });
        checkTimer.scheduleWithFixedDelay(() -> runPeriodicCheck(onInstalled),
                0, interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Update checks scheduled every {} minutes", interval.toMinutes());
    }

    public synchronized void stopPeriodicChecks() {
        if (checkTimer != null) {
            checkTimer.shutdownNow();
            checkTimer = null;
        }
    }

    void runPeriodicCheck(Consumer<UpdateResult> onInstalled) {
        try {
            UpdateInfo info = check();
            if (!info.isUpdateAvailable()) {
                return;
            }
            log.info("Update available: {}", info.getLatestVersion());
            UpdateResult result = update(info.getLatestVersion());
            if (result.getOutcome() != UpdateResult.Outcome.NO_UPDATE) {
                onInstalled.accept(result);
            }
        } catch (Exception e) {
            log.error("Error in periodic update check", e);
        }
    }

    private UpdateInfo query(String targetVersion) {
        try {
            UpdateInfo info = client.fetchUpdateInfo(newQuery(targetVersion));
            store.set(ConfigKeys.LAST_UPDATE_CHECK, Instant.now().toString());
            return info;
        } catch (IOException | RuntimeException e) {
            log.warn("Update check failed: {}", e.getMessage());
            return UpdateInfo.none(agentState.getIdentity().getVersion());
        }
    }

    private UpdateResult runUpdate(UpdateAttempt attempt) {
        String current = agentState.getIdentity().getVersion();
        String target = attempt.getTargetVersion();

        attempt.enter(UpdatePhase.CHECKING);
        UpdateInfo info = query(target);
        if (!info.isUpdateAvailable() && target == null) {
            attempt.enter(UpdatePhase.NO_UPDATE);
            return UpdateResult.noUpdate("No updates available");
        }
        String version = target != null ? target : info.getLatestVersion();
        if (version == null || version.isEmpty() || version.equals(current)) {
            attempt.enter(UpdatePhase.NO_UPDATE);
            return UpdateResult.noUpdate("Already running version " + current);
        }
        if (info.getDownloadUrl() == null) {
            attempt.enter(UpdatePhase.FAILED);
            return UpdateResult.notStarted("No download URL provided for version " + version);
        }
        InstallationLayout layout = InstallationLayout.fromStore(store, config.getInstallDir());
        if (isActive(layout, version)) {
            attempt.enter(UpdatePhase.NO_UPDATE);
            return UpdateResult.noUpdate("Version " + version + " is already installed");
        }
        attempt.setTargetVersion(version);
        attempt.setDownloadUrl(info.getDownloadUrl());
        attempt.enter(UpdatePhase.UPDATE_AVAILABLE);
        if (info.isMandatory()) {
            log.info("Version {} is a mandatory update", version);
        }
        if (info.getChangelog() != null && !info.getChangelog().isEmpty()) {
            log.info("Changes in {}: {}", version, SanitizeUtils.sanitizeString(info.getChangelog()));
        }

        agentState.beginActivity(AgentStatus.UPDATING);
        try {
            attempt.enter(UpdatePhase.BACKING_UP);
            Path backup;
            try {
                backup = createBackup(layout, version);
            } catch (IOException e) {
                attempt.enter(UpdatePhase.FAILED);
                log.error("Backup failed, update aborted: {}", e.getMessage());
                return UpdateResult.notStarted("Backup failed: " + e.getMessage());
            }
            attempt.setBackupPath(backup);

            attempt.enter(UpdatePhase.DOWNLOADING);
            Path packageFile;
            try {
                packageFile = download(info, version, newQuery(version));
            } catch (IOException | UpdateException e) {
                attempt.enter(UpdatePhase.FAILED);
                log.error("Download of version {} failed: {}", version, e.getMessage());
                return UpdateResult.notStarted("Download failed: " + e.getMessage());
            }

            try {
                attempt.enter(UpdatePhase.INSTALLING);
                layout.install(packageFile, version);
                attempt.enter(UpdatePhase.VERIFYING);
                layout.verify(version);
            } catch (IOException | UpdateException | RuntimeException e) {
                return rollback(attempt, layout, backup, version, e).withMandatory(info.isMandatory());
            } finally {
                deleteQuietly(packageFile);
            }

            attempt.enter(UpdatePhase.DONE);
            log.info("Updated from {} to {}", current, version);
            return UpdateResult.updated(version).withMandatory(info.isMandatory());
        } finally {
            agentState.endActivity(AgentStatus.UPDATING);
        }
    }

    private UpdateResult rollback(UpdateAttempt attempt, InstallationLayout layout, Path backup,
            String version, Exception cause) {
        log.warn("Installing version {} failed, rolling back: {}", version, cause.getMessage());
        try {
            layout.restore(backup, version);
            attempt.enter(UpdatePhase.ROLLED_BACK);
            return UpdateResult.rolledBack(version, cause.getMessage());
        } catch (IOException | RuntimeException e) {
            attempt.enter(UpdatePhase.FAILED);
            log.error("Rollback from {} failed, installation at {} may be inconsistent; restore it from {}",
                    version, layout.getInstallDir(), backup, e);
            return UpdateResult.rollbackFailed(version, cause.getMessage(), e.getMessage());
        }
    }

    private static boolean isActive(InstallationLayout layout, String version) {
        try {
            return version.equals(layout.activeVersion());
        } catch (IOException e) {
            log.debug("No active version in {}: {}", layout.getInstallDir(), e.getMessage());
            return false;
        }
    }

    private UpdateQuery newQuery(String targetVersion) {
        AgentIdentity identity = agentState.getIdentity();
        return new UpdateQuery(identity.getAgentId(), store.getString(ConfigKeys.SERVER_TOKEN),
                identity.getVersion(), identity.getPlatform(), identity.getArch(), targetVersion);
    }

    Path createBackup(InstallationLayout layout, String targetVersion) throws IOException {
        Path backupsDir = config.getBackupsDir();
        Path backupDir = backupsDir.resolve(BACKUP_PREFIX + System.currentTimeMillis());
        String version = layout.backup(backupDir, targetVersion);
        store.set(ConfigKeys.LAST_BACKUP_PATH, backupDir.toString());
        log.info("Backed up version {} to {}", version, backupDir);
        pruneBackups(backupsDir);
        return backupDir;
    }

    private void pruneBackups(Path backupsDir) {
        List<Path> backups = new ArrayList<>();
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(backupsDir, BACKUP_PREFIX + "*")) {
            for (Path entry : entries) {
                backups.add(entry);
            }
        } catch (IOException e) {
            log.warn("Could not list backups in {}: {}", backupsDir, e.getMessage());
            return;
        }
        backups.sort(Comparator.comparingLong(SelfUpdateManager::backupTimestamp).reversed());
        for (int i = MAX_BACKUPS; i < backups.size(); i++) {
            try {
                FileOps.deleteRecursively(backups.get(i));
                log.debug("Removed old backup {}", backups.get(i));
            } catch (IOException e) {
                log.warn("Could not remove old backup {}: {}", backups.get(i), e.getMessage());
            }
        }
    }

    private static long backupTimestamp(Path backup) {
        try {
            return Long.parseLong(backup.getFileName().toString().substring(BACKUP_PREFIX.length()));
        } catch (NumberFormatException e) {
            return 0L;
        }
    }

    private Path download(UpdateInfo info, String version, UpdateQuery query) throws IOException, UpdateException {
        Path downloads = config.getDownloadsDir();
        Files.createDirectories(downloads);
        Path packageFile = downloads.resolve("update-" + SanitizeUtils.sanitizeForPath(version) + ".zip");
        client.download(info.getDownloadUrl(), packageFile, query);

        if (info.getChecksum() != null) {
            String actual = Digests.sha256Hex(packageFile);
            if (!actual.equalsIgnoreCase(info.getChecksum())) {
                deleteQuietly(packageFile);
                throw new UpdateException(UpdatePhase.DOWNLOADING,
                        "Checksum mismatch: expected " + info.getChecksum() + ", got " + actual);
            }
            log.info("Package checksum verified");
        }
        return packageFile;
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Could not delete {}: {}", file, e.getMessage());
        }
    }
}
