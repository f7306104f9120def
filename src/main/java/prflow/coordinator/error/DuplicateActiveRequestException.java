package prflow.coordinator.error;

/**
 * Raised when a branch already has a PENDING or PROCESSING request.
 * The caller may resubmit once that request reaches a terminal state.
 */
public class DuplicateActiveRequestException extends QueueException {

    private final String branchName;

    public DuplicateActiveRequestException(String branchName) {
        super(ErrorCode.DUPLICATE_ACTIVE_REQUEST,
                "A request for branch \"" + branchName + "\" is already pending or processing");
        this.branchName = branchName;
    }

    public String branchName() {
        return branchName;
    }
}
