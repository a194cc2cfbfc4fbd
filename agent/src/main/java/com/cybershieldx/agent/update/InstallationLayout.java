package com.cybershieldx.agent.update;

import com.cybershieldx.agent.store.ConfigKeys;
import com.cybershieldx.agent.store.ConfigStore;
import com.cybershieldx.agent.util.FileOps;
import com.cybershieldx.agent.util.Jsons;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;

/**
 * Versioned install directory:
 * <pre>
 * installDir/current                      text file naming the active version
 * installDir/versions/&lt;v&gt;/manifest.json  {"version": "&lt;v&gt;"}
 * installDir/versions/&lt;v&gt;/lib/           jars started by bin/cybershieldx-agent
 * </pre>
 * A new version is staged next to the running one and activated by swapping the pointer,
 * so files of the running version are never modified.
 */
public class InstallationLayout {
    private static final Logger log = LoggerFactory.getLogger(InstallationLayout.class);

    static final String POINTER = "current";
    static final String VERSIONS = "versions";
    static final String MANIFEST = "manifest.json";
    static final String LIB = "lib";

    private final Path installDir;

    public InstallationLayout(Path installDir) {
        this.installDir = installDir.toAbsolutePath().normalize();
    }

    /**
     * Layout of the install directory persisted in {@code store}, or {@code defaultDir} when none is set
     */
    public static InstallationLayout fromStore(ConfigStore store, Path defaultDir) {
        String persisted = store.getString(ConfigKeys.INSTALL_DIR);
        return new InstallationLayout(persisted == null || persisted.isEmpty() ? defaultDir : Paths.get(persisted));
    }

    public Path getInstallDir() {
        return installDir;
    }

    public Path pointerFile() {
        return installDir.resolve(POINTER);
    }

    public Path versionDir(String version) {
        return installDir.resolve(VERSIONS).resolve(version);
    }

    Path stagingDir(String version) {
        return installDir.resolve(VERSIONS).resolve("." + version + ".staging");
    }

    /**
     * Version named by the pointer
     */
    public String activeVersion() throws IOException {
        Path pointer = pointerFile();
        if (!Files.isRegularFile(pointer)) {
            throw new NoSuchFileException(pointer.toString(), null, "installation pointer not found");
        }
        String version = Files.readString(pointer).trim();
        if (version.isEmpty()) {
            throw new IOException("Installation pointer " + pointer + " is empty");
        }
        return version;
    }

    /**
     * Version recorded in the manifest of the active version, or null when the
     * directory has no versioned layout yet
     */
    public String installedVersion() throws IOException {
        if (!Files.isRegularFile(pointerFile())) {
            return null;
        }
        String active = activeVersion();
        Path manifest = versionDir(active).resolve(MANIFEST);
        if (!Files.isRegularFile(manifest)) {
            return active;
        }
        String recorded = manifestVersion(versionDir(active));
        return recorded == null || recorded.isEmpty() ? active : recorded;
    }

    /**
     * Lay out {@code version} as the active version when the install directory has no pointer yet.
     * Jars of a flat install ({@code installDir/lib}) become the code of that version.
     *
     * @return true when the layout was created
     */
    public boolean initialize(String version) throws IOException {
        if (Files.exists(pointerFile())) {
            return false;
        }
        Path versionDir = versionDir(version);
        Files.createDirectories(versionDir);
        Path flatLib = installDir.resolve(LIB);
        if (Files.isDirectory(flatLib) && !Files.exists(versionDir.resolve(LIB))) {
            FileOps.copyTree(flatLib, versionDir.resolve(LIB));
        }
        Path manifest = versionDir.resolve(MANIFEST);
        if (!Files.exists(manifest)) {
            ObjectNode content = Jsons.object();
            content.put("version", version);
            Files.writeString(manifest, Jsons.mapper().writeValueAsString(content));
        }
        FileOps.writeStringAtomically(pointerFile(), version);
        log.info("Initialized installation layout in {} with version {}", installDir, version);
        return true;
    }

    public static String manifestVersion(Path versionDir) throws IOException {
        JsonNode manifest = Jsons.mapper().readTree(versionDir.resolve(MANIFEST).toFile());
        JsonNode version = manifest == null ? null : manifest.get("version");
        return version == null ? null : version.asText();
    }

    /**
     * Copy the pointer, the active version directory and any existing directory of
     * {@code targetVersion} into {@code backupDir}
     *
     * @return the backed-up active version
     */
    String backup(Path backupDir, String targetVersion) throws IOException {
        String active = activeVersion();
        Path activeDir = versionDir(active);
        if (!Files.isDirectory(activeDir)) {
            throw new NoSuchFileException(activeDir.toString(), null, "active version directory not found");
        }
        Files.createDirectories(backupDir);
        Files.copy(pointerFile(), backupDir.resolve(POINTER), StandardCopyOption.COPY_ATTRIBUTES);
        FileOps.copyTree(activeDir, backupDir.resolve(VERSIONS).resolve(active));
        if (targetVersion != null && !targetVersion.equals(active) && Files.isDirectory(versionDir(targetVersion))) {
            FileOps.copyTree(versionDir(targetVersion), backupDir.resolve(VERSIONS).resolve(targetVersion));
            log.info("Previously installed version {} included in backup", targetVersion);
        }
        return active;
    }

    /**
     * Stage {@code version} from the active version plus the package contents, then activate it
     */
    void install(Path packageFile, String version) throws IOException, UpdateException {
        String active = activeVersion();
        if (version.equals(active)) {
            throw new UpdateException(UpdatePhase.INSTALLING, "Version " + version + " is already active");
        }
        Path staging = stagingDir(version);
        FileOps.deleteRecursively(staging);
        FileOps.copyTree(versionDir(active), staging);
        int files = PackageExtractor.extract(packageFile, staging);
        log.info("Staged version {} ({} files from package)", version, files);

        Path target = versionDir(version);
        FileOps.deleteRecursively(target);
        try {
            Files.move(staging, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(staging, target);
        }
        FileOps.writeStringAtomically(pointerFile(), version);
        log.info("Activated version {}", version);
    }

    /**
     * Check the pointer and the manifest of the installed version
     */
    void verify(String version) throws IOException, UpdateException {
        String active = activeVersion();
        if (!version.equals(active)) {
            throw new UpdateException(UpdatePhase.VERIFYING,
                    "Installation pointer names " + active + ", expected " + version);
        }
        String installed = manifestVersion(versionDir(version));
        if (!version.equals(installed)) {
            throw new UpdateException(UpdatePhase.VERIFYING,
                    "Installed version metadata mismatch: expected " + version + ", found " + installed);
        }
    }

    /**
     * Remove whatever an attempt at {@code failedVersion} left behind and put the backup back in place
     */
    void restore(Path backupDir, String failedVersion) throws IOException {
        String backedUp = Files.readString(backupDir.resolve(POINTER)).trim();
        if (failedVersion != null) {
            FileOps.deleteRecursively(stagingDir(failedVersion));
            if (!failedVersion.equals(backedUp)) {
                FileOps.deleteRecursively(versionDir(failedVersion));
                Path previous = backupDir.resolve(VERSIONS).resolve(failedVersion);
                if (Files.isDirectory(previous)) {
                    FileOps.copyTree(previous, versionDir(failedVersion));
                }
            }
        }
        FileOps.copyTree(backupDir.resolve(VERSIONS).resolve(backedUp), versionDir(backedUp));

        Path temp = pointerFile().resolveSibling(POINTER + ".tmp");
        Files.copy(backupDir.resolve(POINTER), temp, StandardCopyOption.REPLACE_EXISTING,
                StandardCopyOption.COPY_ATTRIBUTES);
        FileOps.moveAtomically(temp, pointerFile());
        log.info("Restored version {} from {}", backedUp, backupDir);
    }
}
