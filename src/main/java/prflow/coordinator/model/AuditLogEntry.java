package prflow.coordinator.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One append-only audit record.
 *
 * @param id          store-assigned sequence, null before the entry is persisted
 * @param requestId   owning request, null for queue-wide events
 * @param level       severity
 * @param message     human readable summary
 * @param details     structured details as a JSON object, may be null
 * @param processorId component or worker that produced the entry
 * @param timestamp   when the entry was written
 */
public record AuditLogEntry(
        Long id,
        String requestId,
        LogLevel level,
        String message,
        String details,
        String processorId,
        Instant timestamp) {

    public AuditLogEntry {
        Objects.requireNonNull(level, "level is required");
        Objects.requireNonNull(message, "message is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
    }

    public static AuditLogEntry forRequest(String requestId, LogLevel level, String message, String details,
            String processorId, Instant timestamp) {
        return new AuditLogEntry(null, requestId, level, message, details, processorId, timestamp);
    }

    public static AuditLogEntry queueWide(LogLevel level, String message, String details, String processorId,
            Instant timestamp) {
        return new AuditLogEntry(null, null, level, message, details, processorId, timestamp);
    }

    public boolean isQueueWide() {
        return requestId == null;
    }
}
