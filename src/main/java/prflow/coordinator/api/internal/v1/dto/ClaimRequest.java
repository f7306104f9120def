package prflow.coordinator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for claiming the next request.
 * POST /internal/v1/requests/claim
 */
public record ClaimRequest(
        @JsonProperty("processorId") String processorId) {

    public void validate() {
        if (processorId == null || processorId.isBlank()) {
            throw new IllegalArgumentException("processorId is required");
        }
    }
}
