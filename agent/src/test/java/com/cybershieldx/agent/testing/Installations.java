package com.cybershieldx.agent.testing;

import com.cybershieldx.agent.util.Digests;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Builds versioned install directories and update packages on disk
 */
public final class Installations {

    private Installations() {
    }

    /**
     * Lay out an installation with {@code version} active
     */
    public static void create(Path installDir, String version) throws IOException {
        Path versionDir = installDir.resolve("versions").resolve(version);
        Files.createDirectories(versionDir.resolve("bin"));
        Files.writeString(versionDir.resolve("manifest.json"), "{\"version\":\"" + version + "\"}");
        Files.writeString(versionDir.resolve("bin").resolve("agent.jar"), "agent " + version);
        Files.writeString(versionDir.resolve("settings.properties"), "level=info\n");
        Files.writeString(installDir.resolve("current"), version);
    }

    /**
     * Write a zip whose entries are the given names and UTF-8 contents
     */
    public static Path zip(Path file, Map<String, String> entries) throws IOException {
        try (OutputStream out = Files.newOutputStream(file);
             ZipOutputStream zip = new ZipOutputStream(out)) {
            for (Map.Entry<String, String> entry : entries.entrySet()) {
                zip.putNextEntry(new ZipEntry(entry.getKey()));
                zip.write(entry.getValue().getBytes(StandardCharsets.UTF_8));
                zip.closeEntry();
            }
        }
        return file;
    }

    public static Path updatePackage(Path file, String version) throws IOException {
        Map<String, String> entries = new TreeMap<>();
        entries.put("manifest.json", "{\"version\":\"" + version + "\"}");
        entries.put("bin/agent.jar", "agent " + version);
        return zip(file, entries);
    }

    /**
     * Every path under {@code root} mapped to a digest of its content, or "dir" for directories
     */
    public static Map<String, String> snapshot(Path root) throws IOException {
        Map<String, String> snapshot = new TreeMap<>();
        try (Stream<Path> paths = Files.walk(root)) {
            for (Path path : (Iterable<Path>) paths::iterator) {
                String key = root.relativize(path).toString().replace('\\', '/');
                snapshot.put(key, Files.isDirectory(path) ? "dir" : Digests.sha256Hex(path));
            }
        }
        return snapshot;
    }
}
