package com.cybershieldx.agent.update;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Update server answer to a version check
 */
public final class UpdateInfo {
    private final boolean updateAvailable;
    private final String latestVersion;
    private final String downloadUrl;
    private final String changelog;
    private final boolean mandatory;
    private final String checksum;

    public UpdateInfo(boolean updateAvailable, String latestVersion, String downloadUrl,
            String changelog, boolean mandatory, String checksum) {
        this.updateAvailable = updateAvailable;
        this.latestVersion = latestVersion;
        this.downloadUrl = downloadUrl;
        this.changelog = changelog;
        this.mandatory = mandatory;
        this.checksum = checksum;
    }

    public static UpdateInfo none(String currentVersion) {
        return new UpdateInfo(false, currentVersion, null, null, false, null);
    }

    public static UpdateInfo fromJson(JsonNode node, String currentVersion) {
        return new UpdateInfo(
                node.path("updateAvailable").asBoolean(false),
                text(node, "latestVersion", currentVersion),
                text(node, "downloadUrl", null),
                text(node, "changelog", null),
                node.path("mandatory").asBoolean(false),
                text(node, "checksum", null));
    }

    private static String text(JsonNode node, String field, String defaultValue) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() || value.asText().isEmpty() ? defaultValue : value.asText();
    }

    public boolean isUpdateAvailable() {
        return updateAvailable;
    }

    public String getLatestVersion() {
        return latestVersion;
    }

    public String getDownloadUrl() {
        return downloadUrl;
    }

    public String getChangelog() {
        return changelog;
    }

    public boolean isMandatory() {
        return mandatory;
    }

    /** SHA-256 of the package in hex, when the server provides one */
    public String getChecksum() {
        return checksum;
    }
}
