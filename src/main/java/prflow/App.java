package prflow;

import prflow.coordinator.config.CoordinatorConfig;
import prflow.coordinator.config.Dependencies;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Coordinator entry point.
 *
 * Reads configuration from PRFLOW_* environment variables, starts the HTTP
 * server and the background sweeps, and runs until the JVM is asked to stop.
 */
public class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) throws InterruptedException {
        CoordinatorConfig config = CoordinatorConfig.fromEnv();
        Dependencies deps = Dependencies.create(config);
        CountDownLatch stopped = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested, stopping coordinator...");
            deps.close();
            stopped.countDown();
        }, "prflow-shutdown"));

        try {
            deps.server().start();
            deps.startScheduler();
        } catch (RuntimeException e) {
            log.error("Failed to start coordinator", e);
            System.exit(1);
        }

        log.info("Coordinator started on port {}", deps.server().port());
        stopped.await();
    }
}
