package prflow.coordinator.model;

/**
 * Result of one retention sweep.
 */
public record RetentionReport(
        int deletedRequests,
        int deletedLogs,
        int deletedQueueLogs,
        int daysKept) {

    public int totalDeleted() {
        return deletedRequests + deletedLogs + deletedQueueLogs;
    }
}
