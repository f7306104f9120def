package prflow.coordinator.error;

public class UnknownRequestException extends QueueException {

    private final String requestId;

    public UnknownRequestException(String requestId) {
        super(ErrorCode.UNKNOWN_REQUEST, "Request not found: " + requestId);
        this.requestId = requestId;
    }

    public String requestId() {
        return requestId;
    }
}
