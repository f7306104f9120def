package prflow.coordinator.model;

/**
 * Outcome reported by a worker for a claimed request.
 * All fields but {@code status} are optional.
 */
public record StatusUpdate(
        RequestStatus status,
        String branchUrl,
        String prUrl,
        Integer prNumber,
        String errorMessage,
        String processorId) {

    public static StatusUpdate completed(String processorId, String branchUrl, String prUrl, Integer prNumber) {
        return new StatusUpdate(RequestStatus.COMPLETED, branchUrl, prUrl, prNumber, null, processorId);
    }

    public static StatusUpdate failed(String processorId, String errorMessage) {
        return new StatusUpdate(RequestStatus.FAILED, null, null, null, errorMessage, processorId);
    }

    public static StatusUpdate cancelled(String processorId, String reason) {
        return new StatusUpdate(RequestStatus.CANCELLED, null, null, null, reason, processorId);
    }
}
