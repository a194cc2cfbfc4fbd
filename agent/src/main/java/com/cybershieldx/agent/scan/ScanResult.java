package com.cybershieldx.agent.scan;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Outcome of a probe or of a whole scan
 */
public final class ScanResult {
    private final boolean success;
    private final boolean rejected;
    private final String scanId;
    private final JsonNode data;
    private final String error;

    private ScanResult(boolean success, boolean rejected, String scanId, JsonNode data, String error) {
        this.success = success;
        this.rejected = rejected;
        this.scanId = scanId;
        this.data = data;
        this.error = error;
    }

    /**
     * Successful probe result
     */
    public static ScanResult ok(JsonNode data) {
        return new ScanResult(true, false, null, data, null);
    }

    /**
     * Failed probe result
     */
    public static ScanResult failure(String error) {
        return new ScanResult(false, false, null, null, error);
    }

    public static ScanResult completed(String scanId, JsonNode report) {
        return new ScanResult(true, false, scanId, report, null);
    }

    public static ScanResult failed(String scanId, String error) {
        return new ScanResult(false, false, scanId, null, error);
    }

    /**
     * The scan was not started because another one is running
     */
    public static ScanResult rejected(String scanId, String error) {
        return new ScanResult(false, true, scanId, null, error);
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isRejected() {
        return rejected;
    }

    public String getScanId() {
        return scanId;
    }

    public JsonNode getData() {
        return data;
    }

    public String getError() {
        return error;
    }
}
