package prflow.coordinator.error;

/**
 * Base class for rejections raised by the queue.
 * These are expected outcomes of caller input or races, not infrastructure
 * failures, and are never retried by the queue itself.
 */
public abstract class QueueException extends RuntimeException {

    private final ErrorCode code;

    protected QueueException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public ErrorCode code() {
        return code;
    }
}
