package prflow.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import prflow.coordinator.model.QueueStats;
import prflow.coordinator.model.RequestStatus;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Response DTO for queue statistics.
 * GET /api/v1/queue/stats
 */
public record StatsResponse(
        @JsonProperty("counts") Map<String, Integer> counts,
        @JsonProperty("total") int total) {

    public static StatsResponse from(QueueStats stats) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (RequestStatus status : RequestStatus.values()) {
            counts.put(status.name(), stats.count(status));
        }
        return new StatsResponse(counts, stats.total());
    }
}
