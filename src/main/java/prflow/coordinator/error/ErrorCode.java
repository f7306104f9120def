package prflow.coordinator.error;

/**
 * Stable error identifiers surfaced to callers.
 */
public enum ErrorCode {
    /** Caller input violates a documented constraint */
    INVALID_PARAMETER,
    /** A PENDING or PROCESSING request already exists for the branch */
    DUPLICATE_ACTIVE_REQUEST,
    /** No request with the given id */
    UNKNOWN_REQUEST,
    /** The request is not in a state that accepts the report */
    INVALID_TRANSITION
}
