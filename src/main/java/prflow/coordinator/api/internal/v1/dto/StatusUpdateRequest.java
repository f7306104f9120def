package prflow.coordinator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import prflow.coordinator.model.RequestStatus;
import prflow.coordinator.model.StatusUpdate;

/**
 * Request DTO for reporting the outcome of a claimed request.
 * POST /internal/v1/requests/{requestId}/status
 */
public record StatusUpdateRequest(
        @JsonProperty("status") String status,
        @JsonProperty("branchUrl") String branchUrl,
        @JsonProperty("prUrl") String prUrl,
        @JsonProperty("prNumber") Integer prNumber,
        @JsonProperty("errorMessage") String errorMessage,
        @JsonProperty("processorId") String processorId) {

    public void validate() {
        RequestStatus.parse(status);
        if (prNumber != null && prNumber <= 0) {
            throw new IllegalArgumentException("prNumber must be positive");
        }
    }

    public StatusUpdate toStatusUpdate() {
        return new StatusUpdate(RequestStatus.parse(status), branchUrl, prUrl, prNumber, errorMessage,
                processorId);
    }
}
