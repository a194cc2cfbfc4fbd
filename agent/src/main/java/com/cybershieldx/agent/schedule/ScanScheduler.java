package com.cybershieldx.agent.schedule;

import com.cybershieldx.agent.AgentConfig;
import com.cybershieldx.agent.scan.ScanResult;
import com.cybershieldx.agent.scan.ScanType;
import com.cybershieldx.agent.scan.TaskRunner;
import com.cybershieldx.agent.store.ConfigKeys;
import com.cybershieldx.agent.store.ConfigStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.support.CronExpression;

import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Fires system scans on a cron schedule with at most one scheduled scan outstanding.
 * Missed fires are not caught up; the next fire is always computed from the current time.
 */
public class ScanScheduler {
    private static final Logger log = LoggerFactory.getLogger(ScanScheduler.class);

    private final TaskRunner taskRunner;
    private final ConfigStore store;
    private final Clock clock;
    private final ScheduledExecutorService timer;

    private final Object lock = new Object();
    // Guarded by lock
    private CronExpression cron;
    private String expression;
    private ScheduledFuture<?> nextFire;
    private long generation;
    private boolean running;
    private CompletableFuture<ScanResult> lastRun;

    public ScanScheduler(TaskRunner taskRunner, ConfigStore store) {
        this(taskRunner, store, Clock.systemDefaultZone());
    }

    public ScanScheduler(TaskRunner taskRunner, ConfigStore store, Clock clock) {
        this.taskRunner = taskRunner;
        this.store = store;
        this.clock = clock;
        this.timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "cybershieldx-scheduler");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Start with the persisted schedule, or the default one if the persisted value is invalid
     */
    public void start() {
        String persisted = store.getString(ConfigKeys.SCAN_INTERVAL, AgentConfig.DEFAULT_SCAN_INTERVAL);
        synchronized (lock) {
            running = true;
        }
        try {
            reschedule(persisted);
        } catch (IllegalArgumentException e) {
            log.error("Invalid scan schedule '{}', using default: {}", persisted, e.getMessage());
            reschedule(AgentConfig.DEFAULT_SCAN_INTERVAL);
        }
    }

    /**
     * Replace the schedule and persist the expression
     *
     * @throws IllegalArgumentException if the expression is invalid; the current schedule is kept
     * @throws java.io.UncheckedIOException if the expression cannot be persisted; the current schedule is kept
     */
    public void reschedule(String newExpression) {
        CronExpression parsed = CronSchedules.parse(newExpression);
        String trimmed = newExpression.trim();
        synchronized (lock) {
            store.set(ConfigKeys.SCAN_INTERVAL, trimmed);
            cancelNextFire();
            cron = parsed;
            expression = trimmed;
            generation++;
            if (running) {
                scheduleNext(generation);
            }
        }
        log.info("Scan schedule set to '{}'", newExpression);
    }

    public void stop() {
        synchronized (lock) {
            running = false;
            generation++;
            cancelNextFire();
        }
        timer.shutdownNow();
    }

    public String getExpression() {
        synchronized (lock) {
            return expression;
        }
    }

    /**
     * Time of the next scheduled fire, or null when nothing is scheduled
     */
    public ZonedDateTime nextFireTime() {
        synchronized (lock) {
            return cron == null || !running ? null : cron.next(ZonedDateTime.now(clock));
        }
    }

    // Caller holds lock
    private void scheduleNext(long forGeneration) {
        ZonedDateTime now = ZonedDateTime.now(clock);
        ZonedDateTime next = cron.next(now);
        if (next == null) {
            log.warn("Scan schedule '{}' has no future fire time", expression);
            return;
        }
        long delay = Math.max(0, Duration.between(now, next).toMillis());
        nextFire = timer.schedule(() -> fire(forGeneration), delay, TimeUnit.MILLISECONDS);
        log.debug("Next scheduled scan at {}", next);
    }

    private void fire(long forGeneration) {
        synchronized (lock) {
            if (!running || forGeneration != generation) {
                return;
            }
            scheduleNext(forGeneration);
        }
        runScheduledScan();
    }

    /**
     * Start a scheduled scan unless the previous scheduled scan is still running
     *
     * @return whether a scan was submitted
     */
    boolean runScheduledScan() {
        CompletableFuture<ScanResult> run;
        synchronized (lock) {
            if (lastRun != null && !lastRun.isDone()) {
                log.warn("Skipping scheduled scan: previous scheduled scan has not finished");
                return false;
            }
            log.info("Running scheduled scan");
            run = taskRunner.submit(ScanType.SYSTEM, null);
            lastRun = run;
        }
        run.thenAccept(result -> {
            if (result.isRejected()) {
                log.info("Scheduled scan skipped: {}", result.getError());
            }
        });
        return true;
    }

    // Caller holds lock
    private void cancelNextFire() {
        if (nextFire != null) {
            nextFire.cancel(false);
            nextFire = null;
        }
    }
}
