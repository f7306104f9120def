package prflow.coordinator.store;

import prflow.coordinator.model.AuditLogEntry;
import prflow.coordinator.model.LogLevel;
import prflow.coordinator.model.QueueStats;
import prflow.coordinator.model.RequestStatus;
import prflow.coordinator.model.WorkRequest;
import prflow.coordinator.repository.RequestRepository.PurgeResult;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class JdbcRequestRepositoryTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    private static Database db;
    private static JdbcRequestRepository repo;
    private static JdbcAuditLogRepository auditRepo;

    @BeforeAll
    static void setup() {
        // Use in-memory H2 for tests
        db = new Database("jdbc:h2:mem:test-requests;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE", 8);
        repo = new JdbcRequestRepository(db);
        auditRepo = new JdbcAuditLogRepository(db);
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
    }

    private static WorkRequest.Builder request(String id, String branch) {
        return WorkRequest.builder()
                .id(id)
                .createdAt(T0)
                .createdBy("alice")
                .branchName(branch)
                .prTitle("Update " + branch)
                .prDescription("generated")
                .targetBranch("main")
                .fileName("config.yaml")
                .payload("key: value\n".getBytes())
                .stagePath("pending/" + id + "/config.yaml")
                .priority(5)
                .maxRetries(3);
    }

    @Test
    void insertAndFindById() {
        assertTrue(repo.insert(request("req-1", "feature/a").priority(7).build()));

        Optional<WorkRequest> found = repo.findById("req-1");
        assertTrue(found.isPresent());
        WorkRequest r = found.get();
        assertEquals("feature/a", r.branchName());
        assertEquals(RequestStatus.PENDING, r.status());
        assertEquals(7, r.priority());
        assertEquals(T0, r.createdAt());
        assertEquals("pending/req-1/config.yaml", r.stagePath());
        assertTrue(r.samePayload("key: value\n".getBytes()));
        assertNull(r.processorId());
        assertNull(r.githubPrNumber());
    }

    @Test
    void findByIdMissing() {
        assertTrue(repo.findById("nope").isEmpty());
    }

    @Test
    void insertRejectsSecondActiveRequestForBranch() {
        assertTrue(repo.insert(request("req-1", "feature/a").build()));
        assertFalse(repo.insert(request("req-2", "feature/a").build()));
        assertTrue(repo.findById("req-2").isEmpty());
    }

    @Test
    void branchIsFreeAgainAfterTerminalTransition() {
        repo.insert(request("req-1", "feature/a").build());
        assertTrue(repo.tryClaim("req-1", "worker-1", T0.plusSeconds(1)));
        WorkRequest claimed = repo.findById("req-1").orElseThrow();
        WorkRequest done = claimed.toBuilder()
                .status(RequestStatus.COMPLETED)
                .processorId(null)
                .processedAt(T0.plusSeconds(2))
                .build();
        assertTrue(repo.applyTransition(claimed, done));

        assertTrue(repo.insert(request("req-2", "feature/a").createdAt(T0.plusSeconds(3)).build()));
        assertEquals("req-2", repo.findLatestByBranch("feature/a").orElseThrow().id());
    }

    @Test
    void claimCandidatesOrderedByPriorityThenAge() {
        repo.insert(request("a", "b-a").priority(3).createdAt(T0).build());
        repo.insert(request("b", "b-b").priority(7).createdAt(T0.plusSeconds(1)).build());
        repo.insert(request("c", "b-c").priority(7).createdAt(T0.plusSeconds(2)).build());
        repo.insert(request("d", "b-d").priority(1).createdAt(T0.plusSeconds(3)).build());

        List<String> ids = repo.findClaimCandidates(10).stream().map(WorkRequest::id).toList();
        assertEquals(List.of("b", "c", "a", "d"), ids);
    }

    @Test
    void claimCandidatesWithEqualPriorityAndAgeFollowInsertionOrder() {
        repo.insert(request("zz-first", "b-1").build());
        repo.insert(request("mm-second", "b-2").build());
        repo.insert(request("aa-third", "b-3").build());

        List<String> ids = repo.findClaimCandidates(10).stream().map(WorkRequest::id).toList();
        assertEquals(List.of("zz-first", "mm-second", "aa-third"), ids);
    }

    @Test
    void latestByBranchPrefersLaterInsertAtSameCreatedAt() {
        repo.insert(request("zz-first", "feature/a").build());
        assertTrue(repo.tryClaim("zz-first", "worker-1", T0));
        WorkRequest claimed = repo.findById("zz-first").orElseThrow();
        assertTrue(repo.applyTransition(claimed, claimed.toBuilder()
                .status(RequestStatus.CANCELLED)
                .processorId(null)
                .processedAt(T0)
                .build()));

        assertTrue(repo.insert(request("aa-second", "feature/a").build()));
        assertEquals("aa-second", repo.findLatestByBranch("feature/a").orElseThrow().id());
    }

    @Test
    void largePayloadIsStoredIntact() {
        byte[] payload = new byte[256 * 1024];
        for (int i = 0; i < payload.length; i++) {
            payload[i] = (byte) i;
        }
        assertTrue(repo.insert(request("req-1", "feature/a").payload(payload).build()));

        assertTrue(repo.findById("req-1").orElseThrow().samePayload(payload));
    }

    @Test
    void tryClaimOnlySucceedsOnce() {
        repo.insert(request("req-1", "feature/a").build());

        assertTrue(repo.tryClaim("req-1", "worker-1", T0.plusSeconds(5)));
        assertFalse(repo.tryClaim("req-1", "worker-2", T0.plusSeconds(6)));

        WorkRequest r = repo.findById("req-1").orElseThrow();
        assertEquals(RequestStatus.PROCESSING, r.status());
        assertEquals("worker-1", r.processorId());
        assertEquals(T0.plusSeconds(5), r.processedAt());
        assertTrue(repo.findClaimCandidates(10).isEmpty());
    }

    @Test
    void concurrentClaimsHandOutEachRequestOnce() throws Exception {
        for (int i = 0; i < 5; i++) {
            repo.insert(request("req-" + i, "branch-" + i).build());
        }

        int workers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(workers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<List<String>>> futures = new ArrayList<>();
        try {
            for (int w = 0; w < workers; w++) {
                String processor = "worker-" + w;
                Callable<List<String>> claimer = () -> {
                    start.await();
                    List<String> mine = new ArrayList<>();
                    for (WorkRequest candidate : repo.findClaimCandidates(10)) {
                        if (repo.tryClaim(candidate.id(), processor, T0.plusSeconds(1))) {
                            mine.add(candidate.id());
                        }
                    }
                    return mine;
                };
                futures.add(pool.submit(claimer));
            }
            start.countDown();

            List<String> all = new ArrayList<>();
            for (Future<List<String>> f : futures) {
                all.addAll(f.get(10, TimeUnit.SECONDS));
            }
            assertEquals(5, all.size());
            assertEquals(5, all.stream().distinct().count());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void applyTransitionFailsWhenSnapshotIsOutdated() {
        repo.insert(request("req-1", "feature/a").build());
        repo.tryClaim("req-1", "worker-1", T0.plusSeconds(1));
        WorkRequest claimed = repo.findById("req-1").orElseThrow();

        WorkRequest retry = claimed.toBuilder()
                .status(RequestStatus.PENDING)
                .processorId(null)
                .retryCount(1)
                .errorMessage("boom")
                .build();
        assertTrue(repo.applyTransition(claimed, retry));

        // second writer still holds the PROCESSING snapshot
        WorkRequest done = claimed.toBuilder().status(RequestStatus.COMPLETED).processorId(null).build();
        assertFalse(repo.applyTransition(claimed, done));

        WorkRequest stored = repo.findById("req-1").orElseThrow();
        assertEquals(RequestStatus.PENDING, stored.status());
        assertEquals(1, stored.retryCount());
        assertEquals("boom", stored.errorMessage());
    }

    @Test
    void applyTransitionStoresResultLinks() {
        repo.insert(request("req-1", "feature/a").build());
        repo.tryClaim("req-1", "worker-1", T0.plusSeconds(1));
        WorkRequest claimed = repo.findById("req-1").orElseThrow();

        WorkRequest done = claimed.toBuilder()
                .status(RequestStatus.COMPLETED)
                .processorId(null)
                .processedAt(T0.plusSeconds(30))
                .githubBranchUrl("https://github.com/acme/repo/tree/feature/a")
                .githubPrUrl("https://github.com/acme/repo/pull/7")
                .githubPrNumber(7)
                .build();
        assertTrue(repo.applyTransition(claimed, done));

        WorkRequest stored = repo.findById("req-1").orElseThrow();
        assertEquals(RequestStatus.COMPLETED, stored.status());
        assertEquals(7, stored.githubPrNumber());
        assertEquals("https://github.com/acme/repo/pull/7", stored.githubPrUrl());
        assertEquals(T0.plusSeconds(30), stored.processedAt());
    }

    @Test
    void staleProcessingIsResetWithoutConsumingRetry() {
        repo.insert(request("old", "b-old").build());
        repo.insert(request("fresh", "b-fresh").build());
        repo.tryClaim("old", "worker-1", T0);
        repo.tryClaim("fresh", "worker-2", T0.plus(Duration.ofMinutes(50)));

        Instant cutoff = T0.plus(Duration.ofMinutes(30));
        List<WorkRequest> stale = repo.findStaleProcessing(cutoff);
        assertEquals(1, stale.size());
        assertEquals("old", stale.get(0).id());

        assertTrue(repo.resetStale("old", cutoff, "reset"));
        assertFalse(repo.resetStale("fresh", cutoff, "reset"));

        WorkRequest reset = repo.findById("old").orElseThrow();
        assertEquals(RequestStatus.PENDING, reset.status());
        assertNull(reset.processorId());
        assertEquals(0, reset.retryCount());
        assertEquals("reset", reset.errorMessage());
    }

    @Test
    void countByStatusHonoursCreationWindow() {
        repo.insert(request("old", "b-old").createdAt(T0.minus(Duration.ofDays(2))).build());
        repo.insert(request("new", "b-new").createdAt(T0).build());
        repo.tryClaim("new", "worker-1", T0);

        QueueStats all = repo.countByStatus(null);
        assertEquals(1, all.count(RequestStatus.PENDING));
        assertEquals(1, all.count(RequestStatus.PROCESSING));
        assertEquals(2, all.total());

        QueueStats lastDay = repo.countByStatus(T0.minus(Duration.ofDays(1)));
        assertEquals(0, lastDay.count(RequestStatus.PENDING));
        assertEquals(1, lastDay.count(RequestStatus.PROCESSING));
        assertEquals(0, lastDay.count(RequestStatus.FAILED));
    }

    @Test
    void healthCounters() {
        repo.insert(request("stuck", "b-stuck").createdAt(T0.minus(Duration.ofHours(2))).build());
        repo.insert(request("retrying", "b-retry").createdAt(T0).retryCount(2).build());
        repo.insert(request("quiet", "b-quiet").createdAt(T0).retryCount(1).build());

        assertEquals(1, repo.countPendingCreatedBefore(T0.minus(Duration.ofHours(1))));
        assertEquals(1, repo.countActiveWithRetries(2, T0.minus(Duration.ofDays(1))));
    }

    @Test
    void purgeRemovesOnlyOldTerminalRequestsAndTheirLogs() {
        Instant old = T0.minus(Duration.ofDays(40));
        repo.insert(request("old-done", "b-1").createdAt(old).build());
        repo.insert(request("old-pending", "b-2").createdAt(old).build());
        repo.insert(request("new-done", "b-3").createdAt(T0).build());

        for (String id : List.of("old-done", "new-done")) {
            repo.tryClaim(id, "worker-1", T0);
            WorkRequest claimed = repo.findById(id).orElseThrow();
            repo.applyTransition(claimed, claimed.toBuilder()
                    .status(RequestStatus.COMPLETED).processorId(null).build());
        }
        auditRepo.append(AuditLogEntry.forRequest("old-done", LogLevel.INFO, "Request submitted", null,
                "alice", old));
        auditRepo.append(AuditLogEntry.forRequest("old-done", LogLevel.INFO, "Request completed", null,
                "worker-1", T0));
        auditRepo.append(AuditLogEntry.forRequest("old-pending", LogLevel.INFO, "Request submitted", null,
                "alice", old));

        PurgeResult result = repo.purgeTerminalCreatedBefore(T0.minus(Duration.ofDays(30)));

        assertEquals(1, result.deletedRequests());
        assertEquals(2, result.deletedLogs());
        assertTrue(repo.findById("old-done").isEmpty());
        assertTrue(repo.findById("old-pending").isPresent());
        assertTrue(repo.findById("new-done").isPresent());
        assertEquals(1, auditRepo.findByRequestId("old-pending", 10).size());

        PurgeResult again = repo.purgeTerminalCreatedBefore(T0.minus(Duration.ofDays(30)));
        assertEquals(0, again.deletedRequests());
        assertEquals(0, again.deletedLogs());
    }
}
