package prflow.coordinator.model;

/**
 * Result of reporting the outcome of a claimed request.
 */
public enum UpdateOutcome {
    /** Request moved to COMPLETED */
    COMPLETED,

    /** Request moved to CANCELLED */
    CANCELLED,

    /** Failure reported with retries left; request is PENDING again */
    RETRY_SCHEDULED,

    /** Failure reported with retries exhausted; request is FAILED */
    FAILED;

    /** Status the request holds after this outcome. */
    public RequestStatus resultingStatus() {
        return switch (this) {
            case COMPLETED -> RequestStatus.COMPLETED;
            case CANCELLED -> RequestStatus.CANCELLED;
            case RETRY_SCHEDULED -> RequestStatus.PENDING;
            case FAILED -> RequestStatus.FAILED;
        };
    }
}
