package prflow.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import prflow.coordinator.model.WorkRequest;

import java.time.Instant;
import java.util.Base64;

/**
 * Response DTO for a work request.
 * GET /api/v1/requests/{requestId}
 *
 * The payload is only included for the worker that claimed the request.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RequestResponse(
        @JsonProperty("requestId") String requestId,
        @JsonProperty("requestType") String requestType,
        @JsonProperty("status") String status,
        @JsonProperty("branchName") String branchName,
        @JsonProperty("prTitle") String prTitle,
        @JsonProperty("prDescription") String prDescription,
        @JsonProperty("targetBranch") String targetBranch,
        @JsonProperty("fileName") String fileName,
        @JsonProperty("stagePath") String stagePath,
        @JsonProperty("payloadBytes") int payloadBytes,
        @JsonProperty("payload") String payload,
        @JsonProperty("priority") int priority,
        @JsonProperty("retryCount") int retryCount,
        @JsonProperty("maxRetries") int maxRetries,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("createdBy") String createdBy,
        @JsonProperty("processorId") String processorId,
        @JsonProperty("processedAt") Instant processedAt,
        @JsonProperty("errorMessage") String errorMessage,
        @JsonProperty("githubBranchUrl") String githubBranchUrl,
        @JsonProperty("githubPrUrl") String githubPrUrl,
        @JsonProperty("githubPrNumber") Integer githubPrNumber) {

    /** Create response from domain model, without the payload */
    public static RequestResponse from(WorkRequest r) {
        return from(r, null);
    }

    /** Create response including the base64 payload (claim responses) */
    public static RequestResponse withPayload(WorkRequest r) {
        return from(r, Base64.getEncoder().encodeToString(r.payload()));
    }

    private static RequestResponse from(WorkRequest r, String payload) {
        return new RequestResponse(
                r.id(),
                r.requestType().name(),
                r.status().name(),
                r.branchName(),
                r.prTitle(),
                r.prDescription(),
                r.targetBranch(),
                r.fileName(),
                r.stagePath(),
                r.payload().length,
                payload,
                r.priority(),
                r.retryCount(),
                r.maxRetries(),
                r.createdAt(),
                r.createdBy(),
                r.processorId(),
                r.processedAt(),
                r.errorMessage(),
                r.githubBranchUrl(),
                r.githubPrUrl(),
                r.githubPrNumber());
    }
}
