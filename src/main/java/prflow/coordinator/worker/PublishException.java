package prflow.coordinator.worker;

/**
 * Failure of the external side effect: branch, commit or pull request could
 * not be created.
 */
public class PublishException extends Exception {

    public PublishException(String message) {
        super(message);
    }

    public PublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
