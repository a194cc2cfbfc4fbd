package com.cybershieldx.agent.update;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Extracts update packages (zip) over a directory
 */
final class PackageExtractor {

    private PackageExtractor() {
    }

    /**
     * @return number of files written
     */
    static int extract(Path zipFile, Path targetDir) throws IOException, UpdateException {
        Path root = targetDir.toAbsolutePath().normalize();
        int files = 0;
        try (InputStream in = Files.newInputStream(zipFile);
             ZipInputStream zip = new ZipInputStream(in)) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                Path resolved = root.resolve(entry.getName()).normalize();
                if (!resolved.startsWith(root) || resolved.equals(root)) {
                    throw new UpdateException(UpdatePhase.INSTALLING,
                            "Package entry escapes the install directory: " + entry.getName());
                }
                if (entry.isDirectory()) {
                    Files.createDirectories(resolved);
                } else {
                    Files.createDirectories(resolved.getParent());
                    Files.copy(zip, resolved, StandardCopyOption.REPLACE_EXISTING);
                    files++;
                }
                zip.closeEntry();
            }
        }
        if (files == 0) {
            throw new UpdateException(UpdatePhase.INSTALLING, "Update package contains no files");
        }
        return files;
    }
}
