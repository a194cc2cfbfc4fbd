package com.cybershieldx.agent.scan;

import com.cybershieldx.agent.model.AgentState;
import com.cybershieldx.agent.model.AgentStatus;
import com.cybershieldx.agent.model.PendingTask;
import com.cybershieldx.agent.session.MessageSender;
import com.cybershieldx.agent.session.MessageType;
import com.cybershieldx.agent.store.ConfigKeys;
import com.cybershieldx.agent.store.ConfigStore;
import com.cybershieldx.agent.util.Jsons;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs scans one at a time on a worker executor and reports them to the server
 */
public class TaskRunner {
    private static final Logger log = LoggerFactory.getLogger(TaskRunner.class);

    public static final String ALREADY_SCANNING = "Agent is already scanning";

    private final AgentState agentState;
    private final ScanCollaborator collaborator;
    private final ReportWriter reportWriter;
    private final ConfigStore store;
    private final MessageSender sender;
    private final Executor executor;
    private final AtomicReference<PendingTask> current = new AtomicReference<>();

    public TaskRunner(AgentState agentState, ScanCollaborator collaborator, ReportWriter reportWriter,
            ConfigStore store, MessageSender sender, Executor executor) {
        this.agentState = agentState;
        this.collaborator = collaborator;
        this.reportWriter = reportWriter;
        this.store = store;
        this.sender = sender;
        this.executor = executor;
    }

    /**
     * Submit a scan. A request made while another scan is running completes
     * immediately with a rejected result.
     */
    public CompletableFuture<ScanResult> submit(ScanType type, String scanId) {
        String id = scanId == null || scanId.isBlank() ? UUID.randomUUID().toString() : scanId;
        PendingTask task = new PendingTask(id, type.wireName(), Instant.now());
        if (!current.compareAndSet(null, task)) {
            PendingTask running = current.get();
            log.warn("Rejecting {} scan {}: scan {} is still running",
                    type.wireName(), id, running == null ? "?" : running.getId());
            return CompletableFuture.completedFuture(ScanResult.rejected(id, ALREADY_SCANNING));
        }

        CompletableFuture<ScanResult> result = new CompletableFuture<>();
        try {
            executor.execute(() -> run(task, type, result));
        } catch (RejectedExecutionException e) {
            log.error("Scan executor rejected scan {}", id, e);
            task.setStatus(PendingTask.Status.FAILED);
            current.compareAndSet(task, null);
            result.complete(ScanResult.failed(id, "Scan executor unavailable"));
        }
        return result;
    }

    public boolean isBusy() {
        return current.get() != null;
    }

    public PendingTask currentTask() {
        return current.get();
    }

    private void run(PendingTask task, ScanType type, CompletableFuture<ScanResult> result) {
        ScanResult outcome;
        task.setStatus(PendingTask.Status.RUNNING);
        agentState.beginActivity(AgentStatus.SCANNING);
        try {
            ObjectNode start = Jsons.object();
            start.put("scanId", task.getId());
            start.put("type", type.wireName());
            start.put("timestamp", Instant.now().toString());
            sender.send(MessageType.SCAN_START, start);

            log.info("Starting {} scan {}", type.wireName(), task.getId());
            outcome = runPipeline(task.getId(), type);
        } catch (RuntimeException e) {
            log.error("Scan {} failed unexpectedly", task.getId(), e);
            outcome = ScanResult.failed(task.getId(), String.valueOf(e.getMessage()));
        } finally {
            agentState.endActivity(AgentStatus.SCANNING);
        }

        task.setStatus(outcome.isSuccess() ? PendingTask.Status.DONE : PendingTask.Status.FAILED);
        current.compareAndSet(task, null);

        try {
            ObjectNode complete = Jsons.object();
            complete.put("scanId", task.getId());
            complete.put("success", outcome.isSuccess());
            if (outcome.isSuccess()) {
                complete.set("results", outcome.getData());
            } else {
                complete.put("error", outcome.getError());
            }
            sender.send(MessageType.SCAN_COMPLETE, complete);
        } catch (RuntimeException e) {
            log.error("Could not report completion of scan {}", task.getId(), e);
        } finally {
            result.complete(outcome);
        }
    }

    private ScanResult runPipeline(String scanId, ScanType type) {
        ObjectNode sections = Jsons.object();
        for (ScanStep step : type.steps()) {
            ScanResult probeResult = await(step);
            if (!probeResult.isSuccess()) {
                String error = step.getSection() + " probe failed: " + probeResult.getError();
                log.warn("Scan {} aborted: {}", scanId, error);
                return ScanResult.failed(scanId, error);
            }
            if (probeResult.getData() != null) {
                sections.set(step.getSection(), probeResult.getData());
            }
        }

        Instant finishedAt = Instant.now();
        ObjectNode report = reportWriter.build(scanId, type, agentState.getIdentity(), sections, finishedAt);
        try {
            reportWriter.save(report);
        } catch (IOException e) {
            // The server still gets the results
            log.warn("Could not save report for scan {}: {}", scanId, e.getMessage());
        }
        agentState.setLastScan(finishedAt);
        store.set(ConfigKeys.LAST_SCAN, finishedAt.toString());
        log.info("Scan {} completed", scanId);
        return ScanResult.completed(scanId, report);
    }

    private ScanResult await(ScanStep step) {
        try {
            ScanResult probeResult = collaborator.probe(step.getProbe(), step.getDepth()).get();
            return probeResult == null ? ScanResult.failure("no result") : probeResult;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            return ScanResult.failure(String.valueOf(cause.getMessage()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ScanResult.failure("interrupted");
        } catch (RuntimeException e) {
            return ScanResult.failure(String.valueOf(e.getMessage()));
        }
    }
}
