package prflow.coordinator.scheduler;

import prflow.coordinator.config.CoordinatorConfig;
import prflow.coordinator.error.InvalidParameterException;
import prflow.coordinator.model.RetentionReport;
import prflow.coordinator.repository.AuditLogRepository;
import prflow.coordinator.repository.RequestRepository;
import prflow.coordinator.repository.RequestRepository.PurgeResult;
import prflow.coordinator.service.AuditTrail;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

import static prflow.coordinator.util.Json.fields;

/**
 * Deletes terminal requests, their audit entries and old queue-wide entries
 * once they fall outside the retention window. Active requests are never
 * touched, whatever their age.
 */
public class RetentionSweeper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(RetentionSweeper.class);

    static final String COMPONENT = "retention-sweeper";

    private final RequestRepository requests;
    private final AuditLogRepository auditLogs;
    private final AuditTrail audit;
    private final CoordinatorConfig config;

    public RetentionSweeper(RequestRepository requests, AuditLogRepository auditLogs, AuditTrail audit,
            CoordinatorConfig config) {
        this.requests = requests;
        this.auditLogs = auditLogs;
        this.audit = audit;
        this.config = config;
    }

    @Override
    public void run() {
        try {
            purge(config.retentionDays());
        } catch (RuntimeException e) {
            log.error("Retention sweeper error", e);
            audit.recordFailure("Retention sweep", e, fields("days_to_keep", config.retentionDays()), COMPONENT);
        }
    }

    /**
     * Purge everything terminal created more than {@code daysToKeep} days ago.
     *
     * @param daysToKeep retention window in days, at least 1
     * @return counts of deleted rows
     */
    public RetentionReport purge(int daysToKeep) {
        if (daysToKeep < 1) {
            throw new InvalidParameterException("daysToKeep must be >= 1, got " + daysToKeep);
        }

        Instant cutoff = audit.now().minus(Duration.ofDays(daysToKeep));

        PurgeResult purged = requests.purgeTerminalCreatedBefore(cutoff);
        int queueLogs = auditLogs.deleteQueueWideBefore(cutoff);

        RetentionReport report = new RetentionReport(purged.deletedRequests(), purged.deletedLogs(), queueLogs,
                daysToKeep);

        audit.info(null, "Retention sweep completed",
                fields("deleted_requests", report.deletedRequests(),
                        "deleted_logs", report.deletedLogs(),
                        "deleted_queue_logs", report.deletedQueueLogs(),
                        "days_kept", daysToKeep),
                COMPONENT);

        log.info("Retention sweep: {} requests, {} request logs, {} queue logs deleted (kept {} days)",
                report.deletedRequests(), report.deletedLogs(), report.deletedQueueLogs(), daysToKeep);
        return report;
    }
}
