package com.cybershieldx.agent;

import com.cybershieldx.agent.api.LocalApiServer;
import com.cybershieldx.agent.auth.CredentialManager;
import com.cybershieldx.agent.command.CommandDispatcher;
import com.cybershieldx.agent.command.ProcessControl;
import com.cybershieldx.agent.command.SystemProcessControl;
import com.cybershieldx.agent.model.AgentIdentity;
import com.cybershieldx.agent.model.AgentState;
import com.cybershieldx.agent.scan.LocalProbes;
import com.cybershieldx.agent.scan.ReportWriter;
import com.cybershieldx.agent.scan.ScanCollaborator;
import com.cybershieldx.agent.scan.TaskRunner;
import com.cybershieldx.agent.schedule.ScanScheduler;
import com.cybershieldx.agent.session.MessageType;
import com.cybershieldx.agent.session.SessionManager;
import com.cybershieldx.agent.store.ConfigKeys;
import com.cybershieldx.agent.store.ConfigStore;
import com.cybershieldx.agent.store.JsonFileConfigStore;
import com.cybershieldx.agent.transport.Transport;
import com.cybershieldx.agent.transport.WebSocketTransport;
import com.cybershieldx.agent.update.InstallationLayout;
import com.cybershieldx.agent.update.OkHttpUpdateServerClient;
import com.cybershieldx.agent.update.SelfUpdateManager;
import com.cybershieldx.agent.update.UpdateResult;
import com.cybershieldx.agent.update.UpdateServerClient;
import com.cybershieldx.agent.util.Platforms;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * CyberShieldX agent - keeps a session with the server, runs scans and updates itself
 */
public class AgentRuntime {
    private static final Logger log = LoggerFactory.getLogger(AgentRuntime.class);

    private final AgentConfig config;
    private final ConfigStore store;
    private final AgentState state;
    private final CredentialManager credentials;
    private final Transport transport;
    private final ExecutorService worker;
    private final SessionManager session;
    private final TaskRunner taskRunner;
    private final ScanScheduler scheduler;
    private final SelfUpdateManager updateManager;
    private final ProcessControl processControl;
    private final LocalApiServer localApi;
    private final AtomicBoolean stopped = new AtomicBoolean();
    private final CountDownLatch terminated = new CountDownLatch(1);

    private AgentRuntime(Builder builder) {
        this.config = builder.config;
        this.store = builder.store != null ? builder.store : new JsonFileConfigStore(config.getConfigFile(), storeDefaults(config));
        this.credentials = new CredentialManager(store);
        this.state = new AgentState(loadIdentity(store, config));
        this.worker = Executors.newCachedThreadPool(namedDaemon("cybershieldx-worker"));
        this.transport = builder.transport != null ? builder.transport : new WebSocketTransport();
        this.processControl = builder.processControl != null ? builder.processControl : new SystemProcessControl();

        ScanCollaborator collaborator = builder.scanCollaborator != null ? builder.scanCollaborator : new LocalProbes(worker);
        UpdateServerClient updateClient = builder.updateServerClient != null
                ? builder.updateServerClient
                : new OkHttpUpdateServerClient(config.getUpdateUrl(), config.getUpdateCheckTimeout());

        this.session = new SessionManager(config, state, store, credentials, transport);
        this.taskRunner = new TaskRunner(state, collaborator, new ReportWriter(config.getReportsDir()), store, session, worker);
        this.scheduler = new ScanScheduler(taskRunner, store);
        this.updateManager = new SelfUpdateManager(config, store, state, updateClient);
        this.session.setMessageHandler(new CommandDispatcher(session, taskRunner, scheduler, updateManager,
                store, processControl, worker, config.getRestartGrace()));
        this.localApi = config.isLocalApiEnabled()
                ? new LocalApiServer(config.getLocalApiPort(), state, store, credentials, taskRunner)
                : null;
    }

    /**
     * Create a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Create the data directories. The agent cannot run without them.
     */
    public static void prepareDirectories(AgentConfig config) throws IOException {
        for (Path dir : new Path[] {config.getDataDir(), config.getReportsDir(), config.getBackupsDir(),
                config.getDownloadsDir(), config.getLogsDir()}) {
            Files.createDirectories(dir);
        }
    }

    /**
     * Start the agent
     */
    public void start() throws InterruptedException {
        credentials.ensureLocalApiToken();
        prepareInstallation();
        if (!store.getBoolean(ConfigKeys.SETUP_COMPLETE, false)) {
            store.set(ConfigKeys.SETUP_COMPLETE, true);
            log.info("First run setup complete");
        }
        restoreLastScan();

        AgentIdentity identity = state.getIdentity();
        log.info("CyberShieldX Agent v{} starting (agentId={}, platform={}/{})",
                identity.getVersion(), identity.getAgentId(), identity.getPlatform(), identity.getArch());

        if (localApi != null) {
            localApi.start();
        }
        scheduler.start();
        session.connect();
        updateManager.startPeriodicChecks(config.getUpdateCheckInterval(), this::onUpdateInstalled);
    }

    /**
     * Stop the agent, telling the server why
     */
    public void stop(String reason) {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        log.info("Stopping CyberShieldX Agent ({})", reason);
        updateManager.stopPeriodicChecks();
        scheduler.stop();
        session.shutdown(reason);
        if (localApi != null) {
            localApi.stop();
        }
        worker.shutdownNow();
        transport.close();
        terminated.countDown();
        log.info("CyberShieldX Agent stopped");
    }

    /**
     * Block until the agent is stopped
     */
    public void awaitTermination() throws InterruptedException {
        terminated.await();
    }

    /**
     * Send an unexpected error to the server, if a session is online
     */
    public void reportError(Throwable error) {
        session.reportError(error);
    }

    private void onUpdateInstalled(UpdateResult result) {
        session.send(MessageType.UPDATE_COMPLETE, result.toPayload());
        if (result.isSuccess()) {
            log.info("Version {} installed, restarting", result.getVersion());
            processControl.exit(0, config.getRestartGrace());
        }
    }

    private void prepareInstallation() {
        InstallationLayout layout = InstallationLayout.fromStore(store, config.getInstallDir());
        try {
            layout.initialize(state.getIdentity().getVersion());
        } catch (IOException e) {
            log.warn("Could not prepare installation layout in {}, updates will fail until it exists: {}",
                    layout.getInstallDir(), e.getMessage());
        }
    }

    private void restoreLastScan() {
        String lastScan = store.getString(ConfigKeys.LAST_SCAN);
        if (lastScan == null) {
            return;
        }
        try {
            state.setLastScan(Instant.parse(lastScan));
        } catch (DateTimeParseException e) {
            log.warn("Ignoring unreadable lastScan value: {}", lastScan);
        }
    }

    private static Map<String, Object> storeDefaults(AgentConfig config) {
        Map<String, Object> defaults = new HashMap<>();
        defaults.put(ConfigKeys.SERVER_URL, config.getServerUrl());
        defaults.put(ConfigKeys.SCAN_INTERVAL, config.getScanInterval());
        defaults.put(ConfigKeys.AUTO_UPDATE, true);
        defaults.put(ConfigKeys.INSTALL_DIR, config.getInstallDir().toString());
        return defaults;
    }

    private static AgentIdentity loadIdentity(ConfigStore store, AgentConfig config) {
        String agentId = store.getString(ConfigKeys.AGENT_ID);
        if (agentId == null || agentId.isEmpty()) {
            agentId = UUID.randomUUID().toString();
            store.set(ConfigKeys.AGENT_ID, agentId);
            log.info("Generated agent id {}", agentId);
        }
        return new AgentIdentity(agentId, store.getString(ConfigKeys.CLIENT_ID), Platforms.hostname(),
                Platforms.platform(), Platforms.arch(), installedVersion(store, config));
    }

    /**
     * Version of the active installation, falling back to the version of the running code
     */
    static String installedVersion(ConfigStore store, AgentConfig config) {
        InstallationLayout layout = InstallationLayout.fromStore(store, config.getInstallDir());
        try {
            String installed = layout.installedVersion();
            if (installed != null) {
                return installed;
            }
        } catch (IOException e) {
            log.warn("Could not read installed version from {}: {}", layout.getInstallDir(), e.getMessage());
        }
        return config.getVersion();
    }

    private static ThreadFactory namedDaemon(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    public AgentConfig getConfig() {
        return config;
    }

    public ConfigStore getStore() {
        return store;
    }

    public AgentState getState() {
        return state;
    }

    public SessionManager getSession() {
        return session;
    }

    public TaskRunner getTaskRunner() {
        return taskRunner;
    }

    public ScanScheduler getScheduler() {
        return scheduler;
    }

    /**
     * Port the local API is bound to, or -1 when it is disabled or not started
     */
    public int getLocalApiPort() {
        return localApi == null ? -1 : localApi.getBoundPort();
    }

    public SelfUpdateManager getUpdateManager() {
        return updateManager;
    }

    /**
     * Builder for AgentRuntime
     */
    public static class Builder {
        private AgentConfig config = new AgentConfig();
        private ConfigStore store;
        private Transport transport;
        private ScanCollaborator scanCollaborator;
        private UpdateServerClient updateServerClient;
        private ProcessControl processControl;

        public Builder config(AgentConfig config) {
            this.config = config;
            return this;
        }

        public Builder dataDir(Path dataDir) {
            config.setDataDir(dataDir);
            return this;
        }

        public Builder serverUrl(String serverUrl) {
            config.setServerUrl(serverUrl);
            return this;
        }

        public Builder localApiPort(int port) {
            config.setLocalApiPort(port);
            return this;
        }

        public Builder localApiEnabled(boolean enabled) {
            config.setLocalApiEnabled(enabled);
            return this;
        }

        public Builder heartbeatInterval(Duration interval) {
            config.setHeartbeatInterval(interval);
            return this;
        }

        public Builder reconnectDelay(Duration base, Duration max) {
            config.setReconnectDelay(base);
            config.setMaxReconnectDelay(max);
            return this;
        }

        public Builder updateCheckInterval(Duration interval) {
            config.setUpdateCheckInterval(interval);
            return this;
        }

        public Builder restartGrace(Duration grace) {
            config.setRestartGrace(grace);
            return this;
        }

        public Builder configStore(ConfigStore store) {
            this.store = store;
            return this;
        }

        public Builder transport(Transport transport) {
            this.transport = transport;
            return this;
        }

        public Builder scanCollaborator(ScanCollaborator collaborator) {
            this.scanCollaborator = collaborator;
            return this;
        }

        public Builder updateServerClient(UpdateServerClient client) {
            this.updateServerClient = client;
            return this;
        }

        public Builder processControl(ProcessControl processControl) {
            this.processControl = processControl;
            return this;
        }

        public AgentRuntime build() {
            if (config == null) {
                throw new IllegalStateException("config must not be null");
            }
            if (config.getMaxReconnectDelay().compareTo(config.getReconnectDelay()) < 0) {
                throw new IllegalStateException("maxReconnectDelay must not be shorter than reconnectDelay");
            }
            return new AgentRuntime(this);
        }
    }
}
