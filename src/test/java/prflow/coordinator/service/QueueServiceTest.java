package prflow.coordinator.service;

import prflow.coordinator.config.CoordinatorConfig;
import prflow.coordinator.error.DuplicateActiveRequestException;
import prflow.coordinator.error.ErrorCode;
import prflow.coordinator.error.InvalidParameterException;
import prflow.coordinator.error.InvalidTransitionException;
import prflow.coordinator.error.UnknownRequestException;
import prflow.coordinator.model.AuditLogEntry;
import prflow.coordinator.model.LogLevel;
import prflow.coordinator.model.NewRequest;
import prflow.coordinator.model.RequestStatus;
import prflow.coordinator.model.RequestTransitions;
import prflow.coordinator.model.StatusUpdate;
import prflow.coordinator.model.UpdateOutcome;
import prflow.coordinator.model.WorkRequest;
import prflow.coordinator.store.Database;
import prflow.coordinator.store.JdbcAuditLogRepository;
import prflow.coordinator.store.JdbcRequestRepository;
import prflow.coordinator.support.MutableClock;
import org.junit.jupiter.api.*;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class QueueServiceTest {

    private static Database db;
    private static JdbcRequestRepository requests;
    private static JdbcAuditLogRepository auditLogs;

    private MutableClock clock;
    private QueueService queue;

    @BeforeAll
    static void setup() {
        db = new Database("jdbc:h2:mem:test-queue;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE", 4);
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
        CoordinatorConfig config = CoordinatorConfig.defaults().withMaxRetries(3);
        queue = new QueueService(requests, auditLogs, new AuditTrail(auditLogs, clock), config);
    }

    private static NewRequest.Builder newRequest(String branch) {
        return NewRequest.builder()
                .branchName(branch)
                .prTitle("Update " + branch)
                .prDescription("Regenerated configuration")
                .fileName("config.yaml")
                .payload("replicas: 3\n".getBytes(StandardCharsets.UTF_8))
                .createdBy("alice");
    }

    @Test
    void submitCreatesPendingRequestWithDefaults() {
        String id = queue.submit(newRequest("feature/a").build());

        WorkRequest r = queue.getStatus(id).orElseThrow();
        assertEquals(RequestStatus.PENDING, r.status());
        assertEquals("main", r.targetBranch());
        assertEquals(NewRequest.DEFAULT_PRIORITY, r.priority());
        assertEquals(3, r.maxRetries());
        assertEquals(0, r.retryCount());
        assertEquals("pending/" + id + "/config.yaml", r.stagePath());
        assertEquals(clock.instant(), r.createdAt());
        assertEquals("replicas: 3\n", r.payloadAsString());
        assertEquals("feature/a", r.branchName());
        assertEquals("Update feature/a", r.prTitle());
        assertEquals("Regenerated configuration", r.prDescription());
        assertEquals("config.yaml", r.fileName());
        assertEquals("alice", r.createdBy());
        assertNull(r.processorId());
        assertNull(r.processedAt());
        assertNull(r.errorMessage());
        assertNull(r.githubBranchUrl());
        assertNull(r.githubPrUrl());
        assertNull(r.githubPrNumber());

        List<AuditLogEntry> logs = queue.findLogs(id, 10);
        assertEquals(1, logs.size());
        assertEquals("Request submitted", logs.get(0).message());
        assertEquals(LogLevel.INFO, logs.get(0).level());
        assertEquals("alice", logs.get(0).processorId());
        assertTrue(logs.get(0).details().contains("\"priority\":5"));
    }

    @Test
    void submitRejectsInvalidInputAndAuditsIt() {
        assertThrows(InvalidParameterException.class,
                () -> queue.submit(newRequest("feature/a").priority(11).build()));
        assertThrows(InvalidParameterException.class,
                () -> queue.submit(newRequest("feature/a").priority(0).build()));
        assertThrows(InvalidParameterException.class,
                () -> queue.submit(newRequest(" ").build()));
        assertThrows(InvalidParameterException.class,
                () -> queue.submit(newRequest("feature/a").payload(new byte[0]).build()));
        assertThrows(InvalidParameterException.class,
                () -> queue.submit(newRequest("feature/a").maxRetries(-1).build()));

        assertEquals(0, queue.stats().total());
        List<AuditLogEntry> recent = queue.recentLogs(10);
        assertEquals(5, recent.size());
        assertTrue(recent.stream().allMatch(e -> e.level() == LogLevel.WARN && e.isQueueWide()));
    }

    @Test
    void duplicateActiveBranchIsRejected() {
        String first = queue.submit(newRequest("feature/a").build());

        DuplicateActiveRequestException e = assertThrows(DuplicateActiveRequestException.class,
                () -> queue.submit(newRequest("feature/a").build()));
        assertEquals(ErrorCode.DUPLICATE_ACTIVE_REQUEST, e.code());

        // still a duplicate while PROCESSING
        queue.claimNext("worker-1");
        assertThrows(DuplicateActiveRequestException.class, () -> queue.submit(newRequest("feature/a").build()));

        queue.updateStatus(first, StatusUpdate.completed("worker-1", null, "https://github.com/acme/repo/pull/1", 1));
        String second = queue.submit(newRequest("feature/a").build());
        assertNotEquals(first, second);
        assertEquals(second, queue.getStatusByBranch("feature/a").orElseThrow().id());
    }

    @Test
    void claimsFollowPriorityThenSubmissionOrder() {
        String a = queue.submit(newRequest("branch-a").priority(3).build());
        clock.advance(Duration.ofSeconds(1));
        String b = queue.submit(newRequest("branch-b").priority(7).build());
        clock.advance(Duration.ofSeconds(1));
        String c = queue.submit(newRequest("branch-c").priority(7).build());
        clock.advance(Duration.ofSeconds(1));
        String d = queue.submit(newRequest("branch-d").priority(1).build());

        List<String> order = new ArrayList<>();
        Optional<WorkRequest> next;
        while ((next = queue.claimNext("worker-1")).isPresent()) {
            order.add(next.get().id());
        }

        assertEquals(List.of(b, c, a, d), order);
    }

    @Test
    void claimMarksRequestProcessing() {
        String id = queue.submit(newRequest("feature/a").build());
        clock.advance(Duration.ofMinutes(1));

        WorkRequest claimed = queue.claimNext("worker-1").orElseThrow();

        assertEquals(id, claimed.id());
        assertEquals(RequestStatus.PROCESSING, claimed.status());
        assertEquals("worker-1", claimed.processorId());
        assertEquals(clock.instant(), claimed.processedAt());
        assertTrue(queue.claimNext("worker-2").isEmpty());

        AuditLogEntry claimLog = queue.findLogs(id, 10).get(1);
        assertEquals("Request claimed", claimLog.message());
        assertTrue(claimLog.details().contains("\"attempt\":1"));
        assertTrue(claimLog.details().contains("\"max_attempts\":4"));
    }

    @Test
    void claimOnEmptyQueue() {
        assertTrue(queue.claimNext("worker-1").isEmpty());
        assertThrows(InvalidParameterException.class, () -> queue.claimNext(" "));
    }

    @Test
    void failuresAreRetriedUntilBudgetIsSpent() {
        String id = queue.submit(newRequest("feature/a").maxRetries(2).build());

        List<UpdateOutcome> outcomes = new ArrayList<>();
        for (int attempt = 1; attempt <= 3; attempt++) {
            WorkRequest claimed = queue.claimNext("worker-1").orElseThrow();
            assertEquals(id, claimed.id());
            outcomes.add(queue.updateStatus(id, StatusUpdate.failed("worker-1", "attempt " + attempt)));
        }

        assertEquals(List.of(UpdateOutcome.RETRY_SCHEDULED, UpdateOutcome.RETRY_SCHEDULED, UpdateOutcome.FAILED),
                outcomes);
        WorkRequest r = queue.getStatus(id).orElseThrow();
        assertEquals(RequestStatus.FAILED, r.status());
        assertEquals(2, r.retryCount());
        assertEquals("attempt 3", r.errorMessage());
        assertTrue(queue.claimNext("worker-1").isEmpty());

        List<LogLevel> levels = queue.findLogs(id, 100).stream()
                .filter(e -> e.message().startsWith("Request failed"))
                .map(AuditLogEntry::level)
                .toList();
        assertEquals(List.of(LogLevel.WARN, LogLevel.WARN, LogLevel.ERROR), levels);
    }

    @Test
    void oversizedFieldsAreRejectedAsInvalidParameter() {
        assertThrows(InvalidParameterException.class,
                () -> queue.submit(newRequest("feature/a").prTitle("t".repeat(2000)).build()));
        assertThrows(InvalidParameterException.class,
                () -> queue.submit(newRequest("b".repeat(NewRequest.MAX_BRANCH_LENGTH + 1)).build()));
        assertThrows(InvalidParameterException.class,
                () -> queue.submit(newRequest("feature/a").targetBranch("m".repeat(600)).build()));
        assertThrows(InvalidParameterException.class,
                () -> queue.submit(newRequest("feature/a").fileName("f".repeat(1500)).build()));
        assertThrows(InvalidParameterException.class,
                () -> queue.submit(newRequest("feature/a").createdBy("u".repeat(300)).build()));

        assertEquals(0, queue.stats().total());
        // every rejection was audited as a warning, none as an unexpected failure
        List<AuditLogEntry> recent = queue.recentLogs(10);
        assertEquals(5, recent.size());
        assertTrue(recent.stream().allMatch(e -> e.level() == LogLevel.WARN));
    }

    @Test
    void maximumLengthFieldsAreAccepted() {
        String branch = "b".repeat(NewRequest.MAX_BRANCH_LENGTH);
        String id = queue.submit(newRequest(branch)
                .prTitle("t".repeat(NewRequest.MAX_TITLE_LENGTH))
                .fileName("f".repeat(NewRequest.MAX_FILE_NAME_LENGTH))
                .createdBy("u".repeat(NewRequest.MAX_CREATED_BY_LENGTH))
                .build());

        assertEquals(branch, queue.getStatus(id).orElseThrow().branchName());
    }

    @Test
    void oversizedReportFieldsAreRejected() {
        String id = queue.submit(newRequest("feature/a").build());

        assertThrows(InvalidParameterException.class, () -> queue.claimNext("w".repeat(300)));
        queue.claimNext("worker-1");

        assertThrows(InvalidParameterException.class, () -> queue.updateStatus(id,
                StatusUpdate.completed("worker-1", null, "https://github.com/" + "x".repeat(3000), 1)));
        assertEquals(RequestStatus.PROCESSING, queue.getStatus(id).orElseThrow().status());
    }

    @Test
    void longFailureMessageStillExhaustsRetries() {
        String id = queue.submit(newRequest("feature/a").maxRetries(1).build());
        String longError = "stack trace line\n".repeat(400);

        queue.claimNext("worker-1");
        assertEquals(UpdateOutcome.RETRY_SCHEDULED,
                queue.updateStatus(id, StatusUpdate.failed("worker-1", longError)));
        queue.claimNext("worker-1");
        assertEquals(UpdateOutcome.FAILED, queue.updateStatus(id, StatusUpdate.failed("worker-1", longError)));

        WorkRequest r = queue.getStatus(id).orElseThrow();
        assertEquals(RequestStatus.FAILED, r.status());
        assertEquals(1, r.retryCount());
        assertEquals(RequestTransitions.MAX_ERROR_MESSAGE_LENGTH, r.errorMessage().length());
        assertTrue(longError.startsWith(r.errorMessage()));
    }

    @Test
    void latestSubmissionForBranchWinsAtSameInstant() {
        String first = queue.submit(newRequest("feature/a").build());
        queue.claimNext("worker-1");
        queue.updateStatus(first, StatusUpdate.cancelled("worker-1", "superseded"));
        // clock not advanced: both requests share createdAt
        String second = queue.submit(newRequest("feature/a").build());

        assertEquals(second, queue.getStatusByBranch("feature/a").orElseThrow().id());
    }

    @Test
    void zeroRetriesFailsImmediately() {
        String id = queue.submit(newRequest("feature/a").maxRetries(0).build());
        queue.claimNext("worker-1");

        assertEquals(UpdateOutcome.FAILED, queue.updateStatus(id, StatusUpdate.failed("worker-1", "boom")));
    }

    @Test
    void completionStoresPullRequestLinks() {
        String id = queue.submit(newRequest("feature/a").build());
        queue.claimNext("worker-1");
        clock.advance(Duration.ofMinutes(2));

        UpdateOutcome outcome = queue.updateStatus(id, StatusUpdate.completed("worker-1",
                "https://github.com/acme/repo/tree/feature/a", "https://github.com/acme/repo/pull/12", 12));

        assertEquals(UpdateOutcome.COMPLETED, outcome);
        WorkRequest r = queue.getStatus(id).orElseThrow();
        assertEquals(RequestStatus.COMPLETED, r.status());
        assertEquals(12, r.githubPrNumber());
        assertEquals("https://github.com/acme/repo/tree/feature/a", r.githubBranchUrl());
        assertNull(r.processorId());
        assertEquals(clock.instant(), r.processedAt());
    }

    @Test
    void cancellationIsTerminal() {
        String id = queue.submit(newRequest("feature/a").build());
        queue.claimNext("worker-1");

        assertEquals(UpdateOutcome.CANCELLED,
                queue.updateStatus(id, StatusUpdate.cancelled("worker-1", "target branch deleted")));
        assertEquals(RequestStatus.CANCELLED, queue.getStatus(id).orElseThrow().status());
        assertThrows(InvalidTransitionException.class,
                () -> queue.updateStatus(id, StatusUpdate.failed("worker-1", "late")));
    }

    @Test
    void updateOfUnknownRequest() {
        UnknownRequestException e = assertThrows(UnknownRequestException.class,
                () -> queue.updateStatus("missing", StatusUpdate.failed("worker-1", "x")));
        assertEquals(ErrorCode.UNKNOWN_REQUEST, e.code());

        AuditLogEntry entry = queue.recentLogs(1).get(0);
        assertEquals(LogLevel.WARN, entry.level());
        assertTrue(entry.isQueueWide());
        assertTrue(entry.details().contains("missing"));
    }

    @Test
    void updateOfPendingRequestIsInvalidTransition() {
        String id = queue.submit(newRequest("feature/a").build());

        assertThrows(InvalidTransitionException.class,
                () -> queue.updateStatus(id, StatusUpdate.completed("worker-1", null, null, null)));

        assertEquals(RequestStatus.PENDING, queue.getStatus(id).orElseThrow().status());
        AuditLogEntry last = queue.findLogs(id, 10).get(1);
        assertEquals("Status update rejected", last.message());
        assertEquals(LogLevel.WARN, last.level());
    }

    @Test
    void updateFromOtherProcessorIsRejected() {
        String id = queue.submit(newRequest("feature/a").build());
        queue.claimNext("worker-1");

        assertThrows(InvalidTransitionException.class,
                () -> queue.updateStatus(id, StatusUpdate.completed("worker-2", null, null, null)));
        assertEquals("worker-1", queue.getStatus(id).orElseThrow().processorId());
    }

    @Test
    void nonTerminalReportIsInvalidParameter() {
        String id = queue.submit(newRequest("feature/a").build());
        queue.claimNext("worker-1");

        assertThrows(InvalidParameterException.class, () -> queue.updateStatus(id,
                new StatusUpdate(RequestStatus.PENDING, null, null, null, null, "worker-1")));
        assertEquals(RequestStatus.PROCESSING, queue.getStatus(id).orElseThrow().status());
    }

    @Test
    void lookupValidation() {
        assertThrows(InvalidParameterException.class, () -> queue.getStatus(""));
        assertThrows(InvalidParameterException.class, () -> queue.getStatusByBranch(null));
        assertTrue(queue.getStatus("missing").isEmpty());
        assertThrows(UnknownRequestException.class, () -> queue.findLogs("missing", 10));
    }

    @Test
    void statsCountEveryStatus() {
        queue.submit(newRequest("b1").build());
        String b2 = queue.submit(newRequest("b2").build());
        queue.submit(newRequest("b3").priority(9).build());
        queue.claimNext("worker-1");

        assertEquals(2, queue.stats().count(RequestStatus.PENDING));
        assertEquals(1, queue.stats().count(RequestStatus.PROCESSING));
        assertEquals(0, queue.stats().count(RequestStatus.COMPLETED));
        assertEquals(3, queue.stats().total());
        assertEquals(RequestStatus.PENDING, queue.getStatus(b2).orElseThrow().status());
    }

    @Test
    void stagePathLayout() {
        assertEquals("pending/abc/values.yaml", QueueService.stagePath("abc", "values.yaml"));
    }
}
