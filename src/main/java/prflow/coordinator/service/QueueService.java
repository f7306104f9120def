package prflow.coordinator.service;

import prflow.coordinator.config.CoordinatorConfig;
import prflow.coordinator.error.DuplicateActiveRequestException;
import prflow.coordinator.error.InvalidParameterException;
import prflow.coordinator.error.InvalidTransitionException;
import prflow.coordinator.error.QueueException;
import prflow.coordinator.error.UnknownRequestException;
import prflow.coordinator.model.AuditLogEntry;
import prflow.coordinator.model.NewRequest;
import prflow.coordinator.model.QueueStats;
import prflow.coordinator.model.RequestTransitions;
import prflow.coordinator.model.StatusUpdate;
import prflow.coordinator.model.UpdateOutcome;
import prflow.coordinator.model.WorkRequest;
import prflow.coordinator.repository.AuditLogRepository;
import prflow.coordinator.repository.RequestRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static prflow.coordinator.util.Json.fields;

/**
 * Queue manager: submission, claiming and outcome reporting.
 *
 * Every state change goes through a conditional write in the repository, and
 * every change or rejection is written to the audit log before the call
 * returns or throws.
 */
public class QueueService {

    private static final Logger log = LoggerFactory.getLogger(QueueService.class);

    static final int CLAIM_BATCH = 10;
    static final int MAX_LOG_LIMIT = 500;
    static final int MAX_URL_LENGTH = 2048;
    static final int MAX_PROCESSOR_ID_LENGTH = 256;

    private final RequestRepository requests;
    private final AuditLogRepository auditLogs;
    private final AuditTrail audit;
    private final CoordinatorConfig config;

    public QueueService(RequestRepository requests, AuditLogRepository auditLogs, AuditTrail audit,
            CoordinatorConfig config) {
        this.requests = requests;
        this.auditLogs = auditLogs;
        this.audit = audit;
        this.config = config;
    }

    /**
     * Submit a new request.
     *
     * @return the id of the new PENDING request
     * @throws InvalidParameterException       if a required field is missing or a
     *                                         value is out of range
     * @throws DuplicateActiveRequestException if the branch already has an active
     *                                         request
     */
    public String submit(NewRequest newRequest) {
        if (newRequest == null) {
            throw new InvalidParameterException("request is required");
        }
        try {
            validate(newRequest);
        } catch (InvalidParameterException e) {
            audit.warn(null, "Submission rejected",
                    fields("branch_name", newRequest.branchName(), "reason", e.getMessage()),
                    newRequest.createdBy());
            throw e;
        }

        String id = UUID.randomUUID().toString();
        Instant now = audit.now();
        WorkRequest request = WorkRequest.builder()
                .id(id)
                .createdAt(now)
                .createdBy(newRequest.createdBy())
                .branchName(newRequest.branchName())
                .prTitle(newRequest.prTitle())
                .prDescription(newRequest.prDescription())
                .targetBranch(orDefault(newRequest.targetBranch(), NewRequest.DEFAULT_TARGET_BRANCH))
                .fileName(newRequest.fileName())
                .payload(newRequest.payload())
                .stagePath(stagePath(id, newRequest.fileName()))
                .priority(newRequest.priority() != null ? newRequest.priority() : NewRequest.DEFAULT_PRIORITY)
                .maxRetries(newRequest.maxRetries() != null ? newRequest.maxRetries() : config.defaultMaxRetries())
                .build();

        boolean inserted;
        try {
            inserted = requests.insert(request);
        } catch (RuntimeException e) {
            audit.recordFailure("Submit", e, fields("branch_name", request.branchName()), request.createdBy());
            throw e;
        }

        if (!inserted) {
            audit.warn(null, "Submission rejected: branch already active",
                    fields("branch_name", request.branchName()), request.createdBy());
            log.info("Rejected duplicate submission for branch {}", request.branchName());
            throw new DuplicateActiveRequestException(request.branchName());
        }

        audit.info(id, "Request submitted",
                fields("branch_name", request.branchName(),
                        "target_branch", request.targetBranch(),
                        "file_name", request.fileName(),
                        "payload_bytes", request.payload().length,
                        "priority", request.priority(),
                        "max_retries", request.maxRetries()),
                request.createdBy());

        log.info("Request {} submitted for branch {} (priority {})", id, request.branchName(), request.priority());
        return id;
    }

    /**
     * Claim the next request in priority order.
     *
     * @param processorId the claiming worker
     * @return the claimed request, or empty when no request is claimable
     */
    public Optional<WorkRequest> claimNext(String processorId) {
        if (processorId == null || processorId.isBlank()) {
            throw new InvalidParameterException("processorId is required");
        }
        requireMaxLength(processorId, MAX_PROCESSOR_ID_LENGTH, "processorId");

        try {
            while (true) {
                List<WorkRequest> candidates = requests.findClaimCandidates(CLAIM_BATCH);
                if (candidates.isEmpty()) {
                    return Optional.empty();
                }

                for (WorkRequest candidate : candidates) {
                    Instant now = audit.now();
                    if (!requests.tryClaim(candidate.id(), processorId, now)) {
                        continue; // taken by another worker
                    }

                    WorkRequest claimed = requests.findById(candidate.id())
                            .orElseThrow(() -> new IllegalStateException(
                                    "Claimed request disappeared: " + candidate.id()));

                    audit.info(claimed.id(), "Request claimed",
                            fields("attempt", claimed.retryCount() + 1,
                                    "max_attempts", claimed.maxRetries() + 1,
                                    "priority", claimed.priority()),
                            processorId);

                    log.info("Request {} claimed by {} (attempt {}/{})", claimed.id(), processorId,
                            claimed.retryCount() + 1, claimed.maxRetries() + 1);
                    return Optional.of(claimed);
                }
                // every candidate was taken concurrently; read the next batch
            }
        } catch (QueueException e) {
            throw e;
        } catch (RuntimeException e) {
            audit.recordFailure("Claim", e, null, processorId);
            throw e;
        }
    }

    /**
     * Apply a worker report to a PROCESSING request.
     *
     * A FAILED report with retries left is converted back to PENDING.
     *
     * @return the outcome that was applied
     * @throws UnknownRequestException    if the request does not exist
     * @throws InvalidTransitionException if the request is not PROCESSING or is
     *                                    held by another processor
     * @throws InvalidParameterException  if the reported status is not terminal
     */
    public UpdateOutcome updateStatus(String requestId, StatusUpdate update) {
        if (requestId == null || requestId.isBlank()) {
            throw new InvalidParameterException("requestId is required");
        }
        if (update == null) {
            throw new InvalidParameterException("status is required");
        }
        requireMaxLength(update.processorId(), MAX_PROCESSOR_ID_LENGTH, "processorId");
        requireMaxLength(update.branchUrl(), MAX_URL_LENGTH, "branchUrl");
        requireMaxLength(update.prUrl(), MAX_URL_LENGTH, "prUrl");
        String actor = update.processorId();

        try {
            Optional<WorkRequest> found = requests.findById(requestId);
            if (found.isEmpty()) {
                throw rejectUnknown(requestId, update);
            }
            WorkRequest current = found.get();

            UpdateOutcome outcome;
            try {
                outcome = RequestTransitions.resolve(current.status(), update.status(),
                        current.retryCount(), current.maxRetries());
                if (actor != null && current.processorId() != null && !actor.equals(current.processorId())) {
                    throw new InvalidTransitionException("Request " + requestId + " is held by "
                            + current.processorId() + ", not " + actor);
                }
            } catch (QueueException e) {
                audit.warn(requestId, "Status update rejected",
                        fields("current_status", current.status(),
                                "requested_status", update.status(),
                                "reason", e.getMessage()),
                        actor);
                log.warn("Rejected update of request {}: {}", requestId, e.getMessage());
                throw e;
            }

            WorkRequest next = RequestTransitions.apply(current, outcome, update, audit.now());
            if (!requests.applyTransition(current, next)) {
                throw rejectLostRace(current, update);
            }

            recordOutcome(next, outcome, actor);
            return outcome;
        } catch (QueueException e) {
            throw e;
        } catch (RuntimeException e) {
            audit.recordFailure("Status update", e, fields("request_id", requestId), actor);
            throw e;
        }
    }

    private UnknownRequestException rejectUnknown(String requestId, StatusUpdate update) {
        // queue-wide: the entry cannot reference a row that does not exist
        audit.warn(null, "Status update rejected: unknown request",
                fields("request_id", requestId, "requested_status", update.status()),
                update.processorId());
        log.warn("Update for unknown request {}", requestId);
        return new UnknownRequestException(requestId);
    }

    private QueueException rejectLostRace(WorkRequest expected, StatusUpdate update) {
        Optional<WorkRequest> latest = requests.findById(expected.id());
        if (latest.isEmpty()) {
            return rejectUnknown(expected.id(), update);
        }
        InvalidTransitionException e = new InvalidTransitionException("Request " + expected.id()
                + " changed concurrently and is now " + latest.get().status());
        audit.warn(expected.id(), "Status update rejected",
                fields("current_status", latest.get().status(),
                        "requested_status", update.status(),
                        "reason", e.getMessage()),
                update.processorId());
        log.warn("Lost update race on request {}: now {}", expected.id(), latest.get().status());
        return e;
    }

    private void recordOutcome(WorkRequest next, UpdateOutcome outcome, String actor) {
        switch (outcome) {
            case COMPLETED -> {
                audit.info(next.id(), "Request completed",
                        fields("branch_url", next.githubBranchUrl(),
                                "pr_url", next.githubPrUrl(),
                                "pr_number", next.githubPrNumber()),
                        actor);
                log.info("Request {} completed: {}", next.id(), next.githubPrUrl());
            }
            case CANCELLED -> {
                audit.info(next.id(), "Request cancelled", fields("reason", next.errorMessage()), actor);
                log.info("Request {} cancelled", next.id());
            }
            case RETRY_SCHEDULED -> {
                audit.warn(next.id(), "Request failed, retry scheduled",
                        fields("retry_count", next.retryCount(),
                                "max_retries", next.maxRetries(),
                                "error", next.errorMessage()),
                        actor);
                log.warn("Request {} failed, retry {}/{}: {}", next.id(), next.retryCount(), next.maxRetries(),
                        next.errorMessage());
            }
            case FAILED -> {
                audit.error(next.id(), "Request failed permanently",
                        fields("retry_count", next.retryCount(),
                                "max_retries", next.maxRetries(),
                                "error", next.errorMessage()),
                        actor);
                log.error("Request {} failed after {} retries: {}", next.id(), next.retryCount(),
                        next.errorMessage());
            }
        }
    }

    public Optional<WorkRequest> getStatus(String requestId) {
        if (requestId == null || requestId.isBlank()) {
            throw new InvalidParameterException("requestId is required");
        }
        return requests.findById(requestId);
    }

    /**
     * Latest request created for the branch.
     */
    public Optional<WorkRequest> getStatusByBranch(String branchName) {
        if (branchName == null || branchName.isBlank()) {
            throw new InvalidParameterException("branchName is required");
        }
        return requests.findLatestByBranch(branchName);
    }

    /**
     * Audit trail of one request, oldest first.
     *
     * @throws UnknownRequestException if the request does not exist
     */
    public List<AuditLogEntry> findLogs(String requestId, int limit) {
        if (getStatus(requestId).isEmpty()) {
            throw new UnknownRequestException(requestId);
        }
        return auditLogs.findByRequestId(requestId, clampLimit(limit));
    }

    /**
     * Latest audit entries across the queue, newest first.
     */
    public List<AuditLogEntry> recentLogs(int limit) {
        return auditLogs.findRecent(clampLimit(limit));
    }

    public QueueStats stats() {
        return requests.countByStatus(null);
    }

    private void validate(NewRequest r) {
        requireText(r.branchName(), "branchName");
        requireText(r.prTitle(), "prTitle");
        requireText(r.fileName(), "fileName");
        requireText(r.createdBy(), "createdBy");
        if (r.targetBranch() != null && r.targetBranch().isBlank()) {
            throw new InvalidParameterException("targetBranch must not be blank");
        }
        requireMaxLength(r.branchName(), NewRequest.MAX_BRANCH_LENGTH, "branchName");
        requireMaxLength(r.targetBranch(), NewRequest.MAX_BRANCH_LENGTH, "targetBranch");
        requireMaxLength(r.prTitle(), NewRequest.MAX_TITLE_LENGTH, "prTitle");
        requireMaxLength(r.fileName(), NewRequest.MAX_FILE_NAME_LENGTH, "fileName");
        requireMaxLength(r.createdBy(), NewRequest.MAX_CREATED_BY_LENGTH, "createdBy");
        if (r.payload() == null || r.payload().length == 0) {
            throw new InvalidParameterException("payload is required");
        }
        if (r.priority() != null
                && (r.priority() < NewRequest.MIN_PRIORITY || r.priority() > NewRequest.MAX_PRIORITY)) {
            throw new InvalidParameterException("priority must be between " + NewRequest.MIN_PRIORITY
                    + " and " + NewRequest.MAX_PRIORITY + ", got " + r.priority());
        }
        if (r.maxRetries() != null && r.maxRetries() < 0) {
            throw new InvalidParameterException("maxRetries must be >= 0, got " + r.maxRetries());
        }
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new InvalidParameterException(name + " is required");
        }
    }

    private static void requireMaxLength(String value, int max, String name) {
        if (value != null && value.length() > max) {
            throw new InvalidParameterException(name + " must be at most " + max + " characters, got "
                    + value.length());
        }
    }

    private static String orDefault(String value, String fallback) {
        return value != null ? value : fallback;
    }

    static String stagePath(String requestId, String fileName) {
        return "pending/" + requestId + "/" + fileName;
    }

    private static int clampLimit(int limit) {
        if (limit <= 0) {
            return 100;
        }
        return Math.min(limit, MAX_LOG_LIMIT);
    }
}
