package com.cybershieldx.agent.command;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Exits the JVM through {@link System#exit(int)}, which runs the shutdown hooks
 */
public class SystemProcessControl implements ProcessControl {
    private static final Logger log = LoggerFactory.getLogger(SystemProcessControl.class);

    private final ScheduledExecutorService exitTimer = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "cybershieldx-exit");
        t.setDaemon(true);
        return t;
    });

    @Override
    public void exit(int status, Duration delay) {
        log.info("Exiting with status {} in {} ms", status, delay.toMillis());
        exitTimer.schedule(() -> System.exit(status), delay.toMillis(), TimeUnit.MILLISECONDS);
    }
}
