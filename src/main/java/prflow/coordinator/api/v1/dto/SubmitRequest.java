package prflow.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import prflow.coordinator.model.NewRequest;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Request DTO for submitting a work request.
 * POST /api/v1/requests
 *
 * The file travels either base64-encoded in {@code payload} or as UTF-8 text
 * in {@code content}, never both.
 */
public record SubmitRequest(
        @JsonProperty("branchName") String branchName,
        @JsonProperty("prTitle") String prTitle,
        @JsonProperty("prDescription") String prDescription,
        @JsonProperty("targetBranch") String targetBranch,
        @JsonProperty("fileName") String fileName,
        @JsonProperty("payload") String payload,
        @JsonProperty("content") String content,
        @JsonProperty("createdBy") String createdBy,
        @JsonProperty("priority") Integer priority,
        @JsonProperty("maxRetries") Integer maxRetries) {

    public void validate() {
        if (payload != null && content != null) {
            throw new IllegalArgumentException("Provide either payload or content, not both");
        }
        if (payload == null && content == null) {
            throw new IllegalArgumentException("payload or content is required");
        }
    }

    /** Decoded file bytes */
    public byte[] payloadBytes() {
        if (content != null) {
            return content.getBytes(StandardCharsets.UTF_8);
        }
        try {
            return Base64.getDecoder().decode(payload);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("payload is not valid base64", e);
        }
    }

    public NewRequest toNewRequest() {
        return new NewRequest(branchName, prTitle, prDescription, targetBranch, fileName, payloadBytes(),
                createdBy, priority, maxRetries);
    }
}
