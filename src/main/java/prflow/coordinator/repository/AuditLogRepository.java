package prflow.coordinator.repository;

import prflow.coordinator.model.AuditLogEntry;
import prflow.coordinator.model.LogLevel;

import java.time.Instant;
import java.util.List;

/**
 * Append-only store of audit entries.
 * Entries are never updated; they are removed only by retention.
 */
public interface AuditLogRepository {

    /**
     * Append an entry.
     *
     * @param entry the entry, without id
     * @return the stored entry with its id
     */
    AuditLogEntry append(AuditLogEntry entry);

    /**
     * Entries of one request, oldest first.
     */
    List<AuditLogEntry> findByRequestId(String requestId, int limit);

    /**
     * Latest entries across the queue, newest first.
     */
    List<AuditLogEntry> findRecent(int limit);

    /**
     * Count entries of a level written at or after the given instant.
     */
    int countByLevelSince(LogLevel level, Instant since);

    /**
     * Delete queue-wide entries (no request id) written before the cutoff.
     *
     * @return number of deleted entries
     */
    int deleteQueueWideBefore(Instant cutoff);
}
