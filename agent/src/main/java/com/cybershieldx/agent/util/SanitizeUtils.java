package com.cybershieldx.agent.util;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Utility class for sanitizing values received from the server before they reach logs or file names.
 */
public final class SanitizeUtils {

    private static final Pattern MAC_ADDRESS = Pattern.compile("^([0-9A-Fa-f]{2})[:-]([0-9A-Fa-f]{2})[:-]([0-9A-Fa-f]{2})([:-][0-9A-Fa-f]{2}){3}$");

    // Maximum lengths
    private static final int MAX_STRING_LENGTH = 1024;

    private SanitizeUtils() {
        // Utility class
    }

    /**
     * Sanitize a general string value for safe logging.
     * Removes control characters and truncates to max length.
     */
    public static String sanitizeString(String value) {
        if (value == null) {
            return "";
        }

        if (value.length() > MAX_STRING_LENGTH) {
            value = value.substring(0, MAX_STRING_LENGTH);
        }

        // Remove control characters including newlines for log safety
        return value
                .replace("\n", " ")
                .replace("\r", "")
                .replace("\t", " ")
                .replace("\0", "")
                .replaceAll("[\\p{Cntrl}]", "");
    }

    /**
     * Sanitize a string for use in file names.
     * Removes path traversal sequences and invalid characters.
     */
    public static String sanitizeForPath(String value) {
        if (value == null || value.isEmpty()) {
            return "unknown";
        }

        return value
                .replace("..", "")
                .replace("/", "_")
                .replace("\\", "_")
                .replace("\0", "")
                .replace(":", "_")
                .replaceAll("[^a-zA-Z0-9._-]", "_");
    }

    /**
     * Keep the vendor prefix of a MAC address and mask the device part.
     * Values that are not MAC addresses are returned unchanged.
     */
    public static String maskMacAddress(String mac) {
        if (mac == null) {
            return null;
        }
        Matcher matcher = MAC_ADDRESS.matcher(mac);
        if (!matcher.matches()) {
            return mac;
        }
        return matcher.group(1) + ":" + matcher.group(2) + ":" + matcher.group(3) + ":XX:XX:XX";
    }
}
