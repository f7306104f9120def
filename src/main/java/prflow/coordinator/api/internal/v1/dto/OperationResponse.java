package prflow.coordinator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import prflow.coordinator.model.UpdateOutcome;

/**
 * Response for a status report.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OperationResponse(
        @JsonProperty("ok") boolean ok,
        @JsonProperty("outcome") String outcome,
        @JsonProperty("status") String status,
        @JsonProperty("willRetry") Boolean willRetry) {

    public static OperationResponse of(UpdateOutcome outcome) {
        return new OperationResponse(true, outcome.name(), outcome.resultingStatus().name(),
                outcome == UpdateOutcome.RETRY_SCHEDULED);
    }
}
