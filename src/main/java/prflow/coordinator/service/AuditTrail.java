package prflow.coordinator.service;

import prflow.coordinator.model.AuditLogEntry;
import prflow.coordinator.model.LogLevel;
import prflow.coordinator.repository.AuditLogRepository;
import prflow.coordinator.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Map;

/**
 * Writes audit entries with timestamps from the injected clock and details
 * rendered as a JSON object.
 */
public class AuditTrail {

    private static final Logger log = LoggerFactory.getLogger(AuditTrail.class);

    /** Processor id used for entries the queue writes on its own behalf. */
    public static final String QUEUE_SERVICE = "queue-service";

    static final int MAX_PROCESSOR_ID_LENGTH = 256;

    private final AuditLogRepository repository;
    private final Clock clock;

    public AuditTrail(AuditLogRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    /**
     * Current time, truncated to what the store keeps.
     */
    public Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    public AuditLogEntry info(String requestId, String message, Map<String, Object> details, String processorId) {
        return record(requestId, LogLevel.INFO, message, details, processorId);
    }

    public AuditLogEntry warn(String requestId, String message, Map<String, Object> details, String processorId) {
        return record(requestId, LogLevel.WARN, message, details, processorId);
    }

    public AuditLogEntry error(String requestId, String message, Map<String, Object> details, String processorId) {
        return record(requestId, LogLevel.ERROR, message, details, processorId);
    }

    public AuditLogEntry record(String requestId, LogLevel level, String message, Map<String, Object> details,
            String processorId) {
        String json = details == null || details.isEmpty() ? null : Json.write(details);
        String actor = processorId != null ? processorId : QUEUE_SERVICE;
        if (actor.length() > MAX_PROCESSOR_ID_LENGTH) {
            // rejected submissions carry the caller's unchecked createdBy
            actor = actor.substring(0, MAX_PROCESSOR_ID_LENGTH);
        }
        return repository.append(new AuditLogEntry(null, requestId, level, message, json, actor, now()));
    }

    /**
     * Record an unexpected failure as a queue-wide ERROR entry.
     * If the entry itself cannot be written, the write failure is attached to
     * {@code failure} as suppressed and the original failure stays the one
     * callers see.
     */
    public void recordFailure(String operation, RuntimeException failure, Map<String, Object> details,
            String processorId) {
        Map<String, Object> fields = Json.fields("operation", operation, "error", String.valueOf(failure.getMessage()),
                "exception", failure.getClass().getName());
        if (details != null) {
            fields.putAll(details);
        }
        try {
            error(null, operation + " failed", fields, processorId);
        } catch (RuntimeException auditFailure) {
            log.error("Could not record failure of {} in audit log", operation, auditFailure);
            failure.addSuppressed(auditFailure);
        }
    }
}
