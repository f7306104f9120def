package prflow.coordinator.worker;

/**
 * Counters of one {@link QueueWorker#runOnce()} pass.
 */
public record WorkerStats(int processed, int succeeded, int failed) {
}
