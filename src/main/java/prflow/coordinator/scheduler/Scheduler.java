package prflow.coordinator.scheduler;

import prflow.coordinator.config.CoordinatorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Coordinates background scheduled tasks:
 * - StaleClaimReclaimer: returns abandoned claims to PENDING
 * - HealthMonitor: records a queue health summary
 * - RetentionSweeper: purges old terminal requests
 *
 * Uses a single-threaded executor so sweeps never overlap.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final ScheduledExecutorService executor;
    private final StaleClaimReclaimer reclaimer;
    private final HealthMonitor healthMonitor;
    private final RetentionSweeper retentionSweeper;
    private final CoordinatorConfig config;

    private volatile boolean running = false;

    public Scheduler(StaleClaimReclaimer reclaimer, HealthMonitor healthMonitor,
            RetentionSweeper retentionSweeper, CoordinatorConfig config) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "prflow-scheduler");
            t.setDaemon(true);
            return t;
        });
        this.reclaimer = reclaimer;
        this.healthMonitor = healthMonitor;
        this.retentionSweeper = retentionSweeper;
        this.config = config;
    }

    /**
     * Start the scheduler.
     */
    public void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }

        running = true;

        schedule("stale-claim-reclaimer", reclaimer, config.reclaimInterval());
        schedule("health-monitor", healthMonitor, config.healthCheckInterval());
        schedule("retention-sweeper", retentionSweeper, config.retentionInterval());

        log.info("Scheduler started");
    }

    private void schedule(String name, Runnable task, Duration interval) {
        long intervalMs = interval.toMillis();
        executor.scheduleAtFixedRate(
                wrapRunnable(name, task),
                intervalMs, // initial delay
                intervalMs, // interval
                TimeUnit.MILLISECONDS);
        log.info("{} scheduled every {}ms", name, intervalMs);
    }

    /**
     * Stop the scheduler gracefully.
     */
    public void stop() {
        if (!running) {
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler forcefully stopped");
            } else {
                log.info("Scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Wrap a runnable so that nothing thrown cancels its future executions.
     */
    private Runnable wrapRunnable(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("{} error", name, e);
            }
        };
    }
}
