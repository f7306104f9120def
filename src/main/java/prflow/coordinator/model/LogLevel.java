package prflow.coordinator.model;

/**
 * Severity of an audit log entry.
 */
public enum LogLevel {
    INFO,
    WARN,
    ERROR
}
