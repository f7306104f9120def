package prflow.coordinator.store;

import prflow.coordinator.model.AuditLogEntry;
import prflow.coordinator.model.LogLevel;
import prflow.coordinator.model.WorkRequest;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JdbcAuditLogRepositoryTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    private static Database db;
    private static JdbcAuditLogRepository repo;
    private static JdbcRequestRepository requests;

    @BeforeAll
    static void setup() {
        db = new Database("jdbc:h2:mem:test-audit;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE", 4);
        repo = new JdbcAuditLogRepository(db);
        requests = new JdbcRequestRepository(db);
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
        requests.insert(WorkRequest.builder()
                .id("req-1")
                .createdAt(T0)
                .createdBy("alice")
                .branchName("feature/a")
                .prTitle("t")
                .targetBranch("main")
                .fileName("f.txt")
                .payload(new byte[] { 42 })
                .build());
    }

    @Test
    void appendAssignsIncreasingIds() {
        AuditLogEntry first = repo.append(AuditLogEntry.forRequest("req-1", LogLevel.INFO, "Request submitted",
                "{\"priority\":5}", "alice", T0));
        AuditLogEntry second = repo.append(AuditLogEntry.queueWide(LogLevel.WARN, "Queue performance degraded",
                null, "health-monitor", T0));

        assertNotNull(first.id());
        assertNotNull(second.id());
        assertTrue(second.id() > first.id());
        assertTrue(second.isQueueWide());
    }

    @Test
    void findByRequestIdOldestFirst() {
        repo.append(AuditLogEntry.forRequest("req-1", LogLevel.INFO, "Request submitted", null, "alice", T0));
        repo.append(AuditLogEntry.forRequest("req-1", LogLevel.INFO, "Request claimed", null, "worker-1",
                T0.plusSeconds(10)));
        repo.append(AuditLogEntry.queueWide(LogLevel.INFO, "Queue healthy", null, "health-monitor",
                T0.plusSeconds(5)));

        List<AuditLogEntry> entries = repo.findByRequestId("req-1", 100);
        assertEquals(2, entries.size());
        assertEquals("Request submitted", entries.get(0).message());
        assertEquals("Request claimed", entries.get(1).message());
        assertEquals("worker-1", entries.get(1).processorId());
        assertEquals(T0.plusSeconds(10), entries.get(1).timestamp());
    }

    @Test
    void findRecentNewestFirstAndLimited() {
        for (int i = 0; i < 5; i++) {
            repo.append(AuditLogEntry.queueWide(LogLevel.INFO, "entry-" + i, null, "test", T0.plusSeconds(i)));
        }

        List<AuditLogEntry> recent = repo.findRecent(3);
        assertEquals(3, recent.size());
        assertEquals("entry-4", recent.get(0).message());
        assertEquals("entry-2", recent.get(2).message());
    }

    @Test
    void detailsAreStoredVerbatim() {
        String details = "{\"branch_name\":\"feature/a\",\"priority\":5}";
        repo.append(AuditLogEntry.forRequest("req-1", LogLevel.INFO, "Request submitted", details, "alice", T0));

        assertEquals(details, repo.findByRequestId("req-1", 1).get(0).details());
    }

    @Test
    void countByLevelSince() {
        repo.append(AuditLogEntry.queueWide(LogLevel.ERROR, "old", null, "test", T0.minus(Duration.ofHours(2))));
        repo.append(AuditLogEntry.queueWide(LogLevel.ERROR, "recent", null, "test", T0));
        repo.append(AuditLogEntry.queueWide(LogLevel.WARN, "warn", null, "test", T0));

        assertEquals(1, repo.countByLevelSince(LogLevel.ERROR, T0.minus(Duration.ofHours(1))));
        assertEquals(2, repo.countByLevelSince(LogLevel.ERROR, T0.minus(Duration.ofHours(3))));
    }

    @Test
    void deleteQueueWideBeforeKeepsRequestEntries() {
        Instant old = T0.minus(Duration.ofDays(40));
        repo.append(AuditLogEntry.queueWide(LogLevel.INFO, "old sweep", null, "test", old));
        repo.append(AuditLogEntry.queueWide(LogLevel.INFO, "new sweep", null, "test", T0));
        repo.append(AuditLogEntry.forRequest("req-1", LogLevel.INFO, "Request submitted", null, "alice", old));

        assertEquals(1, repo.deleteQueueWideBefore(T0.minus(Duration.ofDays(30))));
        assertEquals(1, repo.findByRequestId("req-1", 10).size());
        assertEquals(2, repo.findRecent(10).size());
    }
}
