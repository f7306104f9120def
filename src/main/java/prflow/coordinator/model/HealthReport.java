package prflow.coordinator.model;

/**
 * Result of one health check.
 *
 * @param level        classification written to the audit log
 * @param message      summary message
 * @param oldPending   PENDING requests older than one hour
 * @param highRetry    active requests from the last day with two or more retries
 * @param recentErrors ERROR audit entries from the last hour
 */
public record HealthReport(
        LogLevel level,
        String message,
        int oldPending,
        int highRetry,
        int recentErrors) {
}
