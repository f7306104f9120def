package prflow.coordinator.config;

import prflow.coordinator.api.internal.v1.MaintenanceController;
import prflow.coordinator.api.internal.v1.WorkerController;
import prflow.coordinator.api.v1.HealthController;
import prflow.coordinator.api.v1.QueueController;
import prflow.coordinator.api.v1.RequestController;
import prflow.coordinator.repository.AuditLogRepository;
import prflow.coordinator.repository.RequestRepository;
import prflow.coordinator.scheduler.HealthMonitor;
import prflow.coordinator.scheduler.RetentionSweeper;
import prflow.coordinator.scheduler.Scheduler;
import prflow.coordinator.scheduler.StaleClaimReclaimer;
import prflow.coordinator.server.CoordinatorNettyServer;
import prflow.coordinator.server.RouterHandler;
import prflow.coordinator.service.AuditTrail;
import prflow.coordinator.service.QueueService;
import prflow.coordinator.store.Database;
import prflow.coordinator.store.JdbcAuditLogRepository;
import prflow.coordinator.store.JdbcRequestRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(CoordinatorConfig.fromEnv());
 * deps.server().start();
 * deps.startScheduler(); // start background sweeps
 * // ... serve ...
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final CoordinatorConfig config;
    private final Database database;
    private final RequestRepository requestRepository;
    private final AuditLogRepository auditLogRepository;
    private final AuditTrail auditTrail;
    private final QueueService queueService;

    // Periodic tasks
    private final StaleClaimReclaimer reclaimer;
    private final HealthMonitor healthMonitor;
    private final RetentionSweeper retentionSweeper;

    // Router (lazy-initialized)
    private RouterHandler routerHandler;

    // Server (lazy-initialized)
    private CoordinatorNettyServer server;

    // Scheduler (lazy-initialized)
    private Scheduler scheduler;

    private Dependencies(CoordinatorConfig config, Clock clock) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);

        // Repositories
        this.requestRepository = new JdbcRequestRepository(database);
        this.auditLogRepository = new JdbcAuditLogRepository(database);

        // Services
        this.auditTrail = new AuditTrail(auditLogRepository, clock);
        this.queueService = new QueueService(requestRepository, auditLogRepository, auditTrail, config);

        // Periodic tasks
        this.reclaimer = new StaleClaimReclaimer(requestRepository, auditTrail, config);
        this.healthMonitor = new HealthMonitor(requestRepository, auditLogRepository, auditTrail);
        this.retentionSweeper = new RetentionSweeper(requestRepository, auditLogRepository, auditTrail, config);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config and the UTC system clock.
     */
    public static Dependencies create(CoordinatorConfig config) {
        return new Dependencies(config, Clock.systemUTC());
    }

    // Getters
    public CoordinatorConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public RequestRepository requestRepository() {
        return requestRepository;
    }

    public AuditLogRepository auditLogRepository() {
        return auditLogRepository;
    }

    public AuditTrail auditTrail() {
        return auditTrail;
    }

    public QueueService queueService() {
        return queueService;
    }

    public StaleClaimReclaimer reclaimer() {
        return reclaimer;
    }

    public HealthMonitor healthMonitor() {
        return healthMonitor;
    }

    public RetentionSweeper retentionSweeper() {
        return retentionSweeper;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     * This is the main entry point for serving HTTP requests.
     */
    public synchronized RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler(config)
                    .registerController(new HealthController(database, queueService))
                    .registerController(new RequestController(queueService))
                    .registerController(new QueueController(queueService))
                    .registerController(new WorkerController(queueService))
                    .registerController(new MaintenanceController(reclaimer, healthMonitor, retentionSweeper,
                            config));
            log.info("RouterHandler created with {} controllers", routerHandler.controllerCount());
        }
        return routerHandler;
    }

    /**
     * Get the HTTP server (creates it if not yet created, does not start it).
     */
    public synchronized CoordinatorNettyServer server() {
        if (server == null) {
            server = new CoordinatorNettyServer(config, routerHandler());
        }
        return server;
    }

    /**
     * Get the scheduler (creates it if not yet created).
     */
    public synchronized Scheduler scheduler() {
        if (scheduler == null) {
            scheduler = new Scheduler(reclaimer, healthMonitor, retentionSweeper, config);
        }
        return scheduler;
    }

    /**
     * Start the background sweeps.
     * Should be called after server startup.
     */
    public void startScheduler() {
        scheduler().start();
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        // Stop accepting requests first
        if (server != null) {
            try {
                server.stop();
            } catch (Exception e) {
                log.warn("Error stopping server: {}", e.getMessage());
            }
        }

        if (scheduler != null) {
            try {
                scheduler.stop();
            } catch (Exception e) {
                log.warn("Error stopping scheduler: {}", e.getMessage());
            }
        }

        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
