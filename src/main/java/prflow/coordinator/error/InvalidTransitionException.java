package prflow.coordinator.error;

/**
 * Raised when a report targets a request that is not PROCESSING, or that is
 * held by another processor. Usually a duplicate or late completion.
 */
public class InvalidTransitionException extends QueueException {

    public InvalidTransitionException(String message) {
        super(ErrorCode.INVALID_TRANSITION, message);
    }
}
