package prflow.coordinator.error;

public class InvalidParameterException extends QueueException {

    public InvalidParameterException(String message) {
        super(ErrorCode.INVALID_PARAMETER, message);
    }
}
