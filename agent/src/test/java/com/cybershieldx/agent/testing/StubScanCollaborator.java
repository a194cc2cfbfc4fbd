package com.cybershieldx.agent.testing;

import com.cybershieldx.agent.scan.Probe;
import com.cybershieldx.agent.scan.ScanCollaborator;
import com.cybershieldx.agent.scan.ScanDepth;
import com.cybershieldx.agent.scan.ScanResult;
import com.cybershieldx.agent.util.Jsons;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Scan collaborator with scripted probe outcomes. Probes can be held until released.
 */
public class StubScanCollaborator implements ScanCollaborator {

    private final List<Probe> calls = new CopyOnWriteArrayList<>();
    private final Map<Probe, String> failures = new ConcurrentHashMap<>();
    private final Map<Probe, RuntimeException> throwing = new ConcurrentHashMap<>();
    private volatile CountDownLatch gate = new CountDownLatch(0);
    private final CountDownLatch firstCall = new CountDownLatch(1);

    public StubScanCollaborator failOn(Probe probe, String error) {
        failures.put(probe, error);
        return this;
    }

    public StubScanCollaborator throwOn(Probe probe, RuntimeException error) {
        throwing.put(probe, error);
        return this;
    }

    /**
     * Make probes wait until {@link #release()} is called
     */
    public StubScanCollaborator hold() {
        gate = new CountDownLatch(1);
        return this;
    }

    public void release() {
        gate.countDown();
    }

    public boolean awaitFirstCall() throws InterruptedException {
        return firstCall.await(5, TimeUnit.SECONDS);
    }

    @Override
    public CompletableFuture<ScanResult> probe(Probe probe, ScanDepth depth) {
        calls.add(probe);
        firstCall.countDown();
        RuntimeException error = throwing.get(probe);
        if (error != null) {
            throw error;
        }
        CountDownLatch waitFor = gate;
        return CompletableFuture.supplyAsync(() -> {
            try {
                waitFor.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            String failure = failures.get(probe);
            if (failure != null) {
                return ScanResult.failure(failure);
            }
            ObjectNode data = Jsons.object();
            data.put("probe", probe.name());
            data.put("depth", depth.name());
            return ScanResult.ok(data);
        });
    }

    public List<Probe> calls() {
        return calls;
    }
}
