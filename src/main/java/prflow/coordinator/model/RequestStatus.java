package prflow.coordinator.model;

/**
 * Lifecycle status of a work request.
 */
public enum RequestStatus {
    /** Submitted, waiting to be claimed */
    PENDING,
    /** Claimed by a worker; the external side effect is in flight */
    PROCESSING,
    /** Branch and pull request created */
    COMPLETED,
    /** Retries exhausted */
    FAILED,
    /** Abandoned by the worker, never retried */
    CANCELLED;

    /** Pending or Processing: the states guarded by the one-per-branch rule. */
    public boolean isActive() {
        return this == PENDING || this == PROCESSING;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * Parse a status name case-insensitively.
     *
     * @throws IllegalArgumentException if the name is unknown
     */
    public static RequestStatus parse(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("status is required");
        }
        try {
            return valueOf(name.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid status \"" + name + "\"", e);
        }
    }
}
