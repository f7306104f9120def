package prflow.coordinator.scheduler;

import prflow.coordinator.config.CoordinatorConfig;
import prflow.coordinator.model.AuditLogEntry;
import prflow.coordinator.model.LogLevel;
import prflow.coordinator.model.NewRequest;
import prflow.coordinator.model.ReclaimReport;
import prflow.coordinator.model.RequestStatus;
import prflow.coordinator.model.StatusUpdate;
import prflow.coordinator.model.WorkRequest;
import prflow.coordinator.service.AuditTrail;
import prflow.coordinator.service.QueueService;
import prflow.coordinator.store.Database;
import prflow.coordinator.store.JdbcAuditLogRepository;
import prflow.coordinator.store.JdbcRequestRepository;
import prflow.coordinator.support.MutableClock;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for StaleClaimReclaimer functionality.
 */
class StaleClaimReclaimerTest {

    private static Database db;
    private static JdbcRequestRepository requests;
    private static JdbcAuditLogRepository auditLogs;

    private MutableClock clock;
    private QueueService queue;
    private StaleClaimReclaimer reclaimer;

    @BeforeAll
    static void setup() {
        db = new Database("jdbc:h2:mem:test-reclaimer;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE", 4);
        requests = new JdbcRequestRepository(db);
        auditLogs = new JdbcAuditLogRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanTables() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM audit_log");
            st.execute("DELETE FROM work_requests");
            conn.commit();
        }
        clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
        // 5 minute sweep, 30 minute stale threshold
        CoordinatorConfig config = CoordinatorConfig.defaults().withReclaimInterval(Duration.ofMinutes(5));
        AuditTrail audit = new AuditTrail(auditLogs, clock);
        queue = new QueueService(requests, auditLogs, audit, config);
        reclaimer = new StaleClaimReclaimer(requests, audit, config);
    }

    private String submit(String branch) {
        return queue.submit(NewRequest.builder()
                .branchName(branch)
                .prTitle("Update " + branch)
                .fileName("config.yaml")
                .payload(new byte[] { 1 })
                .createdBy("alice")
                .build());
    }

    @Test
    void resetsClaimOlderThanThreshold() {
        String id = submit("feature/a");
        queue.claimNext("worker-1");

        clock.advance(Duration.ofMinutes(31));
        ReclaimReport report = reclaimer.reclaim();

        assertEquals(1, report.staleReset());
        assertEquals(30, report.maxProcessingMinutes());
        assertEquals(1, report.pending());
        assertEquals(0, report.processing());

        WorkRequest r = requests.findById(id).orElseThrow();
        assertEquals(RequestStatus.PENDING, r.status());
        assertNull(r.processorId());
        assertEquals(0, r.retryCount());
        assertTrue(r.errorMessage().contains("worker-1"));

        List<AuditLogEntry> logs = auditLogs.findByRequestId(id, 10);
        AuditLogEntry resetEntry = logs.get(logs.size() - 1);
        assertEquals(LogLevel.WARN, resetEntry.level());
        assertEquals("Stale claim reset to PENDING", resetEntry.message());
        assertEquals(StaleClaimReclaimer.COMPONENT, resetEntry.processorId());
    }

    @Test
    void leavesRecentClaimsAlone() {
        String id = submit("feature/a");
        queue.claimNext("worker-1");

        clock.advance(Duration.ofMinutes(29));
        ReclaimReport report = reclaimer.reclaim();

        assertEquals(0, report.staleReset());
        assertEquals(1, report.processing());
        assertEquals(RequestStatus.PROCESSING, requests.findById(id).orElseThrow().status());
    }

    @Test
    void reclaimedRequestCanBeClaimedAndReportedAgain() {
        String id = submit("feature/a");
        queue.claimNext("worker-1");
        clock.advance(Duration.ofHours(1));
        reclaimer.reclaim();

        WorkRequest again = queue.claimNext("worker-2").orElseThrow();
        assertEquals(id, again.id());
        assertEquals("worker-2", again.processorId());
        queue.updateStatus(id, StatusUpdate.completed("worker-2", null, "https://github.com/acme/repo/pull/3", 3));

        assertEquals(RequestStatus.COMPLETED, requests.findById(id).orElseThrow().status());
    }

    @Test
    void sweepAlwaysWritesSummary() {
        reclaimer.reclaim();

        AuditLogEntry summary = auditLogs.findRecent(1).get(0);
        assertTrue(summary.isQueueWide());
        assertEquals(LogLevel.INFO, summary.level());
        assertEquals("Stale claim sweep completed", summary.message());
        assertTrue(summary.details().contains("\"stale_reset\":0"));
    }

    @Test
    void runDoesNotThrow() {
        submit("feature/a");
        queue.claimNext("worker-1");
        clock.advance(Duration.ofHours(2));

        assertDoesNotThrow(reclaimer::run);
        assertEquals(0, requests.countByStatus(null).count(RequestStatus.PROCESSING));
    }
}
