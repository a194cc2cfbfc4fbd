package com.cybershieldx.agent.launcher;

import ch.qos.logback.classic.LoggerContext;
import com.cybershieldx.agent.AgentConfig;
import com.cybershieldx.agent.AgentRuntime;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Map;

/**
 * Process entry point. Exit status 0 on shutdown or restart, 1 when the agent cannot start.
 */
public class AgentLauncher {
    private static final Logger log = LoggerFactory.getLogger(AgentLauncher.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FATAL = 1;
    /** Start script that runs the code of the active installed version */
    static final String START_SCRIPT = "bin/cybershieldx-agent";

    private final Map<String, String> env;
    private AgentRuntime runtime;

    AgentLauncher(Map<String, String> env) {
        this.env = env;
    }

    public static void main(String[] args) {
        AgentLauncher launcher = new AgentLauncher(System.getenv());
        int status = launcher.start();
        if (status != EXIT_OK) {
            System.exit(status);
        }
        launcher.installShutdownHandling();
        try {
            launcher.runtime.awaitTermination();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Configure and start the agent
     *
     * @return exit status to use when start-up failed, {@link #EXIT_OK} when the agent is running
     */
    int start() {
        AgentConfig config;
        try {
            config = AgentConfig.fromEnvironment(env);
        } catch (IllegalArgumentException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            return EXIT_FATAL;
        }

        try {
            AgentRuntime.prepareDirectories(config);
        } catch (IOException e) {
            log.error("Cannot create data directories under {}: {}", config.getDataDir(), e.toString());
            return EXIT_FATAL;
        }

        try {
            runtime = AgentRuntime.builder().config(config).build();
            String installed = runtime.getState().getIdentity().getVersion();
            if (!installed.equals(config.getVersion())) {
                log.warn("Running code of version {} but version {} is installed in {}; start the agent with {}",
                        config.getVersion(), installed, config.getInstallDir(), START_SCRIPT);
            }
            runtime.start();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted during start-up");
            return EXIT_FATAL;
        } catch (RuntimeException e) {
            log.error("Fatal error during start-up", e);
            if (runtime != null) {
                runtime.stop("startup_failed");
            }
            return EXIT_FATAL;
        }
        return EXIT_OK;
    }

    private void installShutdownHandling() {
        AgentRuntime agent = runtime;
        Thread.setDefaultUncaughtExceptionHandler((thread, error) -> {
            log.error("Uncaught exception in thread {}", thread.getName(), error);
            try {
                agent.reportError(error);
            } catch (RuntimeException e) {
                log.error("Could not report uncaught exception", e);
            }
        });

        // SIGTERM and SIGINT end here as well as System.exit() for restarts
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            agent.stop("service_stop");
            flushLogs();
            Runtime.getRuntime().halt(EXIT_OK);
        }, "cybershieldx-shutdown"));
    }

    private static void flushLogs() {
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (factory instanceof LoggerContext) {
            ((LoggerContext) factory).stop();
        }
    }
}
