package prflow.coordinator.model;

/**
 * Summary of one stale-claim sweep.
 *
 * @param staleReset            claims returned to PENDING
 * @param maxProcessingMinutes  age after which a claim is considered stale
 * @param pending               PENDING requests created in the last day
 * @param processing            PROCESSING requests created in the last day
 * @param failed                FAILED requests created in the last day
 */
public record ReclaimReport(
        int staleReset,
        long maxProcessingMinutes,
        int pending,
        int processing,
        int failed) {
}
