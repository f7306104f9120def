package prflow.coordinator.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Request counts per status.
 */
public record QueueStats(Map<RequestStatus, Integer> counts) {

    public QueueStats {
        EnumMap<RequestStatus, Integer> copy = new EnumMap<>(RequestStatus.class);
        for (RequestStatus status : RequestStatus.values()) {
            copy.put(status, 0);
        }
        if (counts != null) {
            copy.putAll(counts);
        }
        counts = Collections.unmodifiableMap(copy);
    }

    public int count(RequestStatus status) {
        return counts.get(status);
    }

    public int total() {
        return counts.values().stream().mapToInt(Integer::intValue).sum();
    }
}
