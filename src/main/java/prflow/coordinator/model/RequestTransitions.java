package prflow.coordinator.model;

import prflow.coordinator.error.InvalidParameterException;
import prflow.coordinator.error.InvalidTransitionException;

import java.time.Instant;

/**
 * Transition table of the request lifecycle.
 *
 * <pre>
 * PENDING    --claim-->                PROCESSING
 * PROCESSING --COMPLETED-->            COMPLETED
 * PROCESSING --CANCELLED-->            CANCELLED
 * PROCESSING --FAILED, retries left--> PENDING (retryCount + 1)
 * PROCESSING --FAILED, exhausted-->    FAILED
 * PROCESSING --stale reclaim-->        PENDING (retryCount unchanged)
 * </pre>
 *
 * Pure functions only; storage applies the decision with a conditional write.
 */
public final class RequestTransitions {

    /** Width of the stored error message; longer reports are truncated. */
    public static final int MAX_ERROR_MESSAGE_LENGTH = 4096;

    private RequestTransitions() {
    }

    /**
     * Whether a failed attempt is converted back to PENDING.
     */
    public static boolean shouldRetry(int retryCount, int maxRetries) {
        return retryCount < maxRetries;
    }

    /**
     * Whether a request may be handed to a worker.
     * A request whose last retry was granted (retryCount == maxRetries) is still
     * owed that attempt, so the bound is {@code <=} rather than the strict
     * {@code <} a plain "retries left" check would use. With a strict bound the
     * final retry would stay PENDING forever and never reach FAILED.
     */
    public static boolean isClaimable(RequestStatus status, int retryCount, int maxRetries) {
        return status == RequestStatus.PENDING && retryCount <= maxRetries;
    }

    /**
     * Decide the outcome of a worker report.
     *
     * @param current    status currently stored
     * @param requested  status reported by the worker
     * @param retryCount retries already consumed
     * @param maxRetries retry budget
     * @return the outcome to apply
     * @throws InvalidParameterException  if {@code requested} is not a report a
     *                                    worker can make
     * @throws InvalidTransitionException if the request is not PROCESSING
     */
    public static UpdateOutcome resolve(RequestStatus current, RequestStatus requested,
            int retryCount, int maxRetries) {
        if (requested == null) {
            throw new InvalidParameterException("status is required");
        }
        if (requested.isActive()) {
            throw new InvalidParameterException(
                    "Status " + requested + " cannot be reported; expected COMPLETED, FAILED or CANCELLED");
        }
        if (current != RequestStatus.PROCESSING) {
            throw new InvalidTransitionException(
                    "Cannot move request from " + current + " to " + requested + "; it is not PROCESSING");
        }
        return switch (requested) {
            case COMPLETED -> UpdateOutcome.COMPLETED;
            case CANCELLED -> UpdateOutcome.CANCELLED;
            case FAILED -> shouldRetry(retryCount, maxRetries)
                    ? UpdateOutcome.RETRY_SCHEDULED
                    : UpdateOutcome.FAILED;
            default -> throw new IllegalStateException("Unhandled status: " + requested);
        };
    }

    /**
     * Build the state a PROCESSING request moves to for the given outcome.
     * The claim holder is always released. Result links are merged: a reported
     * value replaces the stored one, a missing value keeps it.
     *
     * @param current the PROCESSING snapshot the outcome was decided on
     * @param outcome outcome from {@link #resolve}
     * @param update  the worker report
     * @param now     transition timestamp
     * @return the next state of the request
     */
    public static WorkRequest apply(WorkRequest current, UpdateOutcome outcome, StatusUpdate update, Instant now) {
        WorkRequest.Builder next = current.toBuilder()
                .status(outcome.resultingStatus())
                .processorId(null);

        switch (outcome) {
            case COMPLETED -> next
                    .processedAt(now)
                    .errorMessage(null)
                    .githubBranchUrl(firstNonNull(update.branchUrl(), current.githubBranchUrl()))
                    .githubPrUrl(firstNonNull(update.prUrl(), current.githubPrUrl()))
                    .githubPrNumber(firstNonNull(update.prNumber(), current.githubPrNumber()));
            case FAILED -> next
                    .processedAt(now)
                    .errorMessage(firstNonNull(boundedError(update.errorMessage()), current.errorMessage()))
                    .githubBranchUrl(firstNonNull(update.branchUrl(), current.githubBranchUrl()))
                    .githubPrUrl(firstNonNull(update.prUrl(), current.githubPrUrl()))
                    .githubPrNumber(firstNonNull(update.prNumber(), current.githubPrNumber()));
            case CANCELLED -> next
                    .processedAt(now)
                    .errorMessage(firstNonNull(boundedError(update.errorMessage()), current.errorMessage()));
            case RETRY_SCHEDULED -> next
                    .retryCount(current.retryCount() + 1)
                    .errorMessage(firstNonNull(boundedError(update.errorMessage()), current.errorMessage()));
        }
        return next.build();
    }

    /**
     * Truncate an error message to what the store keeps. Null stays null.
     */
    public static String boundedError(String message) {
        if (message == null || message.length() <= MAX_ERROR_MESSAGE_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_ERROR_MESSAGE_LENGTH);
    }

    private static <T> T firstNonNull(T preferred, T fallback) {
        return preferred != null ? preferred : fallback;
    }
}
