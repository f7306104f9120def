package prflow.coordinator.repository;

import prflow.coordinator.model.QueueStats;
import prflow.coordinator.model.WorkRequest;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for work request persistence.
 *
 * Every state change is a conditional write: it only takes effect when the
 * row still holds the state the caller read, and reports whether it did.
 * Implementations must keep that contract for concurrent callers.
 */
public interface RequestRepository {

    /**
     * Insert a new PENDING request unless its branch already has an active one.
     *
     * @param request the request to insert
     * @return true if inserted, false if a PENDING/PROCESSING request exists for
     *         the same branch
     */
    boolean insert(WorkRequest request);

    /**
     * Find a request by ID.
     *
     * @param requestId the request ID
     * @return the request if found
     */
    Optional<WorkRequest> findById(String requestId);

    /**
     * Find the most recently created request for a branch.
     *
     * @param branchName the branch name
     * @return the latest request if any
     */
    Optional<WorkRequest> findLatestByBranch(String branchName);

    /**
     * Claimable requests in claim order: priority descending, then oldest
     * first, then by id.
     *
     * @param limit maximum number of candidates
     * @return candidates, possibly already taken by the time the caller acts
     */
    List<WorkRequest> findClaimCandidates(int limit);

    /**
     * Move a request from PENDING to PROCESSING.
     * Succeeds only if the row is still PENDING at write time.
     *
     * @param requestId   the request ID
     * @param processorId the claiming worker
     * @param now         claim timestamp
     * @return true if this caller won the claim
     */
    boolean tryClaim(String requestId, String processorId, Instant now);

    /**
     * Replace the lifecycle fields of a request.
     * Succeeds only if status, retry count and claim holder still match
     * {@code expected}.
     *
     * @param expected the snapshot the transition was decided on
     * @param next     the state to store
     * @return true if the row was updated
     */
    boolean applyTransition(WorkRequest expected, WorkRequest next);

    /**
     * Find PROCESSING requests claimed before the cutoff.
     *
     * @param claimedBefore cutoff timestamp
     * @return stale claims, oldest first
     */
    List<WorkRequest> findStaleProcessing(Instant claimedBefore);

    /**
     * Return a stale claim to PENDING without consuming a retry.
     * Succeeds only if the row is still PROCESSING and still older than the cutoff.
     *
     * @param requestId     the request ID
     * @param claimedBefore cutoff timestamp
     * @param note          error message recorded on the request
     * @return true if reset
     */
    boolean resetStale(String requestId, Instant claimedBefore, String note);

    /**
     * Count requests per status.
     *
     * @param createdSince only count requests created at or after this instant;
     *                     null counts everything
     * @return counts per status
     */
    QueueStats countByStatus(Instant createdSince);

    /**
     * Count PENDING requests created before the given instant.
     */
    int countPendingCreatedBefore(Instant createdBefore);

    /**
     * Count PENDING/PROCESSING requests created since the given instant with at
     * least {@code minRetries} retries consumed.
     */
    int countActiveWithRetries(int minRetries, Instant createdSince);

    /**
     * Delete terminal requests created before the cutoff together with their
     * audit entries, logs first, in one transaction.
     *
     * @param createdBefore cutoff timestamp
     * @return counts of deleted rows
     */
    PurgeResult purgeTerminalCreatedBefore(Instant createdBefore);

    /**
     * Rows removed by a purge.
     */
    record PurgeResult(int deletedRequests, int deletedLogs) {
    }
}
