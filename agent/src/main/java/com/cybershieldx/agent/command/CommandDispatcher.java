package com.cybershieldx.agent.command;

import com.cybershieldx.agent.scan.ScanResult;
import com.cybershieldx.agent.scan.ScanType;
import com.cybershieldx.agent.scan.TaskRunner;
import com.cybershieldx.agent.schedule.CronSchedules;
import com.cybershieldx.agent.schedule.ScanScheduler;
import com.cybershieldx.agent.session.AgentSession;
import com.cybershieldx.agent.session.Message;
import com.cybershieldx.agent.session.MessageType;
import com.cybershieldx.agent.session.ProtocolException;
import com.cybershieldx.agent.store.ConfigKeys;
import com.cybershieldx.agent.store.ConfigStore;
import com.cybershieldx.agent.update.SelfUpdateManager;
import com.cybershieldx.agent.update.UpdateResult;
import com.cybershieldx.agent.util.Jsons;
import com.cybershieldx.agent.util.SanitizeUtils;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

/**
 * Routes server commands to the components that handle them and answers over the session.
 * No exception from a handler reaches the session.
 */
public class CommandDispatcher implements Consumer<Message>, AgentCommand.Visitor<Void> {
    private static final Logger log = LoggerFactory.getLogger(CommandDispatcher.class);

    /** Keys the server may not overwrite through config_update */
    static final Set<String> PROTECTED_KEYS = Set.of(
            ConfigKeys.AGENT_ID, ConfigKeys.SERVER_TOKEN, ConfigKeys.TEMP_DEVICE_TOKEN, ConfigKeys.LOCAL_API_TOKEN);

    private final AgentSession session;
    private final TaskRunner taskRunner;
    private final ScanScheduler scheduler;
    private final SelfUpdateManager updateManager;
    private final ConfigStore store;
    private final ProcessControl processControl;
    private final Executor worker;
    private final Duration restartGrace;

    public CommandDispatcher(AgentSession session, TaskRunner taskRunner, ScanScheduler scheduler,
            SelfUpdateManager updateManager, ConfigStore store, ProcessControl processControl,
            Executor worker, Duration restartGrace) {
        this.session = session;
        this.taskRunner = taskRunner;
        this.scheduler = scheduler;
        this.updateManager = updateManager;
        this.store = store;
        this.processControl = processControl;
        this.worker = worker;
        this.restartGrace = restartGrace;
    }

    @Override
    public void accept(Message message) {
        AgentCommand command;
        try {
            command = CommandDecoder.decode(message);
        } catch (ProtocolException e) {
            log.warn("Dropping malformed {} message: {}",
                    SanitizeUtils.sanitizeString(message.getType()), e.getMessage());
            return;
        }
        try {
            command.accept(this);
        } catch (Exception e) {
            log.error("Error handling {} command", SanitizeUtils.sanitizeString(message.getType()), e);
        }
    }

    @Override
    public Void visit(AgentCommand.AuthResponse command) {
        if (!command.isSuccess()) {
            session.authenticationFailed(command.getMessage());
            return null;
        }
        session.authenticated(command.getToken(), command.getClientId());
        if (command.getScanInterval() != null) {
            try {
                scheduler.reschedule(command.getScanInterval());
            } catch (IllegalArgumentException e) {
                log.warn("Ignoring invalid scan interval from server: {}", e.getMessage());
            }
        }
        if (command.isRunInitialScan()) {
            log.info("Server requested an initial scan");
            taskRunner.submit(ScanType.SYSTEM, null);
        }
        return null;
    }

    @Override
    public Void visit(AgentCommand.ConfigUpdate command) {
        ObjectNode ack = Jsons.object();
        boolean reconnect = false;
        try {
            Map<String, Object> changes = new LinkedHashMap<>();
            for (Map.Entry<String, JsonNode> entry : command.getValues().entrySet()) {
                if (PROTECTED_KEYS.contains(entry.getKey())) {
                    log.warn("Ignoring protected key {} in config_update", entry.getKey());
                    continue;
                }
                changes.put(entry.getKey(), entry.getValue());
            }

            JsonNode scanIntervalValue = command.getValues().get(ConfigKeys.SCAN_INTERVAL);
            String scanInterval = null;
            if (scanIntervalValue != null) {
                scanInterval = scanIntervalValue.asText().trim();
                CronSchedules.parse(scanInterval);
                changes.put(ConfigKeys.SCAN_INTERVAL, scanInterval);
            }

            JsonNode serverUrl = command.getValues().get(ConfigKeys.SERVER_URL);
            if (serverUrl != null && !serverUrl.asText().equals(store.getString(ConfigKeys.SERVER_URL))) {
                reconnect = true;
            }

            store.apply(changes);
            if (scanInterval != null) {
                scheduler.reschedule(scanInterval);
            }
            log.info("Configuration updated: {}", changes.keySet());
            ack.put("success", true);
            ack.put("message", "Configuration updated");
        } catch (RuntimeException e) {
            log.warn("Configuration update failed: {}", e.getMessage());
            reconnect = false;
            ack.put("success", false);
            ack.put("error", String.valueOf(e.getMessage()));
        }
        session.send(MessageType.CONFIG_UPDATE_ACK, ack);
        if (reconnect) {
            session.reconnect();
        }
        return null;
    }

    @Override
    public Void visit(AgentCommand.RunScan command) {
        if (command.getScanType() == null) {
            log.warn("Unknown scan type requested: {}", SanitizeUtils.sanitizeString(command.getRequestedType()));
            sendScanFailure(command.getScanId(), "Unknown scan type: " + command.getRequestedType());
            return null;
        }
        CompletableFuture<ScanResult> result = taskRunner.submit(command.getScanType(), command.getScanId());
        result.thenAccept(outcome -> {
            if (outcome.isRejected()) {
                sendScanFailure(outcome.getScanId(), outcome.getError());
            }
        });
        return null;
    }

    @Override
    public Void visit(AgentCommand.UpdateAgent command) {
        try {
            worker.execute(() -> runUpdate(command));
        } catch (RejectedExecutionException e) {
            log.error("Could not start update", e);
            session.send(MessageType.UPDATE_COMPLETE, UpdateResult.notStarted("Agent is shutting down").toPayload());
        }
        return null;
    }

    private void runUpdate(AgentCommand.UpdateAgent command) {
        UpdateResult result;
        try {
            result = updateManager.update(command.getVersion());
        } catch (RuntimeException e) {
            log.error("Update failed unexpectedly", e);
            result = UpdateResult.notStarted(String.valueOf(e.getMessage()));
        }
        session.send(MessageType.UPDATE_COMPLETE, result.toPayload());
        if (result.isSuccess() && command.isRestart()) {
            log.info("Restarting to run version {}", result.getVersion());
            processControl.exit(0, restartGrace);
        }
    }

    @Override
    public Void visit(AgentCommand.Reboot command) {
        ObjectNode ack = Jsons.object();
        ack.put("message", "Rebooting agent");
        session.send(MessageType.REBOOT_ACK, ack);
        processControl.exit(0, restartGrace);
        return null;
    }

    @Override
    public Void visit(AgentCommand.Unknown command) {
        log.warn("Unknown message type: {}", SanitizeUtils.sanitizeString(command.getType()));
        return null;
    }

    private void sendScanFailure(String scanId, String error) {
        ObjectNode data = Jsons.object();
        data.put("scanId", scanId);
        data.put("success", false);
        data.put("error", error);
        session.send(MessageType.SCAN_COMPLETE, data);
    }
}
