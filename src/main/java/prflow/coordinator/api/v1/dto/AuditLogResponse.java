package prflow.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonRawValue;
import prflow.coordinator.model.AuditLogEntry;

import java.time.Instant;

/**
 * Response DTO for one audit entry.
 * Details are stored as a JSON object and embedded as-is.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuditLogResponse(
        @JsonProperty("id") Long id,
        @JsonProperty("requestId") String requestId,
        @JsonProperty("level") String level,
        @JsonProperty("message") String message,
        @JsonProperty("details") @JsonRawValue String details,
        @JsonProperty("processorId") String processorId,
        @JsonProperty("timestamp") Instant timestamp) {

    public static AuditLogResponse from(AuditLogEntry entry) {
        return new AuditLogResponse(
                entry.id(),
                entry.requestId(),
                entry.level().name(),
                entry.message(),
                entry.details(),
                entry.processorId(),
                entry.timestamp());
    }
}
