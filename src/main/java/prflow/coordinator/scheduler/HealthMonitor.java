package prflow.coordinator.scheduler;

import prflow.coordinator.model.HealthReport;
import prflow.coordinator.model.LogLevel;
import prflow.coordinator.repository.AuditLogRepository;
import prflow.coordinator.repository.RequestRepository;
import prflow.coordinator.service.AuditTrail;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

import static prflow.coordinator.util.Json.fields;

/**
 * Periodic queue health check.
 * Its only side effect is one summary entry in the audit log; alerting is left
 * to whatever reads the log.
 */
public class HealthMonitor implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(HealthMonitor.class);

    static final String COMPONENT = "health-monitor";

    static final int HIGH_RETRY_THRESHOLD = 2;
    static final int MAX_HIGH_RETRY = 3;
    static final int MAX_RECENT_ERRORS = 5;

    private final RequestRepository requests;
    private final AuditLogRepository auditLogs;
    private final AuditTrail audit;

    public HealthMonitor(RequestRepository requests, AuditLogRepository auditLogs, AuditTrail audit) {
        this.requests = requests;
        this.auditLogs = auditLogs;
        this.audit = audit;
    }

    @Override
    public void run() {
        try {
            check();
        } catch (RuntimeException e) {
            log.error("Health monitor error", e);
            audit.recordFailure("Health check", e, null, COMPONENT);
        }
    }

    /**
     * Compute the counters, classify them and record the result.
     */
    public HealthReport check() {
        Instant now = audit.now();
        Instant hourAgo = now.minus(Duration.ofHours(1));
        Instant dayAgo = now.minus(Duration.ofDays(1));

        int oldPending = requests.countPendingCreatedBefore(hourAgo);
        int highRetry = requests.countActiveWithRetries(HIGH_RETRY_THRESHOLD, dayAgo);
        int recentErrors = auditLogs.countByLevelSince(LogLevel.ERROR, hourAgo);

        LogLevel level = classify(oldPending, highRetry, recentErrors);
        HealthReport report = new HealthReport(level, messageFor(level), oldPending, highRetry, recentErrors);

        audit.record(null, level, report.message(),
                fields("old_pending", oldPending,
                        "high_retry", highRetry,
                        "recent_errors", recentErrors,
                        "health_status", level),
                COMPONENT);

        switch (level) {
            case ERROR -> log.error("{}: old_pending={}, high_retry={}, recent_errors={}",
                    report.message(), oldPending, highRetry, recentErrors);
            case WARN -> log.warn("{}: high_retry={}, recent_errors={}", report.message(), highRetry, recentErrors);
            case INFO -> log.info(report.message());
        }
        return report;
    }

    /**
     * ERROR if anything is stuck or failing heavily, WARN on any retry pressure
     * or recent error, INFO otherwise.
     */
    public static LogLevel classify(int oldPending, int highRetry, int recentErrors) {
        if (oldPending > 0 || highRetry > MAX_HIGH_RETRY || recentErrors > MAX_RECENT_ERRORS) {
            return LogLevel.ERROR;
        }
        if (highRetry > 0 || recentErrors > 0) {
            return LogLevel.WARN;
        }
        return LogLevel.INFO;
    }

    static String messageFor(LogLevel level) {
        return switch (level) {
            case ERROR -> "Queue health issues detected";
            case WARN -> "Queue performance degraded";
            case INFO -> "Queue healthy";
        };
    }
}
