package com.cybershieldx.agent.scan;

import java.util.concurrent.CompletableFuture;

/**
 * Scan engine contract. Probes run asynchronously and complete with a result;
 * a failed probe aborts the scan that requested it.
 */
public interface ScanCollaborator {

    CompletableFuture<ScanResult> probe(Probe probe, ScanDepth depth);
}
