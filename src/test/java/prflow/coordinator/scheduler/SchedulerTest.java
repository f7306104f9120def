package prflow.coordinator.scheduler;

import prflow.coordinator.config.CoordinatorConfig;
import prflow.coordinator.model.AuditLogEntry;
import prflow.coordinator.service.AuditTrail;
import prflow.coordinator.store.Database;
import prflow.coordinator.store.JdbcAuditLogRepository;
import prflow.coordinator.store.JdbcRequestRepository;
import org.junit.jupiter.api.*;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SchedulerTest {

    private static Database db;

    @BeforeAll
    static void setup() {
        db = new Database("jdbc:h2:mem:test-scheduler;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE", 4);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @Test
    void runsSweepsPeriodicallyUntilStopped() throws Exception {
        JdbcRequestRepository requests = new JdbcRequestRepository(db);
        JdbcAuditLogRepository auditLogs = new JdbcAuditLogRepository(db);
        AuditTrail audit = new AuditTrail(auditLogs, Clock.systemUTC());
        CoordinatorConfig config = CoordinatorConfig.defaults()
                .withReclaimInterval(Duration.ofMillis(50))
                .withHealthCheckInterval(Duration.ofMillis(50))
                .withRetentionInterval(Duration.ofHours(1));

        Scheduler scheduler = new Scheduler(
                new StaleClaimReclaimer(requests, audit, config),
                new HealthMonitor(requests, auditLogs, audit),
                new RetentionSweeper(requests, auditLogs, audit, config),
                config);

        scheduler.start();
        assertTrue(scheduler.isRunning());
        TimeUnit.MILLISECONDS.sleep(400);
        scheduler.stop();
        assertFalse(scheduler.isRunning());

        long sweeps = auditLogs.findRecent(500).stream()
                .map(AuditLogEntry::processorId)
                .filter(StaleClaimReclaimer.COMPONENT::equals)
                .count();
        long checks = auditLogs.findRecent(500).stream()
                .map(AuditLogEntry::processorId)
                .filter(HealthMonitor.COMPONENT::equals)
                .count();
        assertTrue(sweeps >= 2, "expected repeated reclaim sweeps, got " + sweeps);
        assertTrue(checks >= 2, "expected repeated health checks, got " + checks);

        // nothing runs after stop
        int before = auditLogs.findRecent(500).size();
        TimeUnit.MILLISECONDS.sleep(150);
        assertEquals(before, auditLogs.findRecent(500).size());
    }
}
