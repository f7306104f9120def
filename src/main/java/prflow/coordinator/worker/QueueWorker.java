package prflow.coordinator.worker;

import prflow.coordinator.error.InvalidParameterException;
import prflow.coordinator.error.QueueException;
import prflow.coordinator.model.StatusUpdate;
import prflow.coordinator.model.UpdateOutcome;
import prflow.coordinator.model.WorkRequest;
import prflow.coordinator.service.QueueService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * In-process worker.
 * Loops: claim → publish → report COMPLETED or FAILED, until the queue is
 * empty, then idles. Stops cleanly on Thread.interrupt().
 */
public final class QueueWorker implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(QueueWorker.class);

    private final QueueService queue;
    private final PullRequestPublisher publisher;
    private final String processorId;
    private final Duration idleInterval;

    public QueueWorker(QueueService queue, PullRequestPublisher publisher, String processorId,
            Duration idleInterval) {
        this.queue = queue;
        this.publisher = publisher;
        this.processorId = processorId;
        this.idleInterval = idleInterval;
    }

    public QueueWorker(QueueService queue, PullRequestPublisher publisher) {
        this(queue, publisher, defaultProcessorId(), Duration.ofMinutes(5));
    }

    /**
     * Process id and start time, unique per worker process.
     */
    public static String defaultProcessorId() {
        return "worker-" + ProcessHandle.current().pid() + "-" + Instant.now().getEpochSecond();
    }

    public String processorId() {
        return processorId;
    }

    /**
     * Process requests until none is claimable.
     */
    public WorkerStats runOnce() {
        int processed = 0;
        int succeeded = 0;
        int failed = 0;

        while (!Thread.currentThread().isInterrupted()) {
            Optional<WorkRequest> claimed = queue.claimNext(processorId);
            if (claimed.isEmpty()) {
                log.debug("No more pending requests");
                break;
            }

            WorkRequest request = claimed.get();
            processed++;
            log.info("Processing request {}: {}", request.id(), request.prTitle());

            if (process(request)) {
                succeeded++;
            } else {
                failed++;
            }
        }

        return new WorkerStats(processed, succeeded, failed);
    }

    private boolean process(WorkRequest request) {
        PublishedPullRequest published;
        try {
            published = publisher.publish(request, PullRequestDescriptions.build(request));
        } catch (PublishException | RuntimeException e) {
            log.error("Failed to process request {}: {}", request.id(), e.getMessage(), e);
            reportFailure(request, e);
            return false;
        }

        try {
            queue.updateStatus(request.id(), StatusUpdate.completed(processorId,
                    published.branchUrl(), published.prUrl(), published.prNumber()));
            log.info("Successfully processed request {}", request.id());
            return true;
        } catch (InvalidParameterException e) {
            // the publisher's result cannot be stored; count it as a failed attempt
            log.warn("Completion of request {} invalid: {}", request.id(), e.getMessage());
            reportFailure(request, e);
            return false;
        } catch (QueueException e) {
            // reclaimed while we were publishing; the pull request exists but
            // another attempt now owns the request
            log.warn("Completion of request {} rejected: {}", request.id(), e.getMessage());
            return false;
        }
    }

    private void reportFailure(WorkRequest request, Exception cause) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        try {
            UpdateOutcome outcome = queue.updateStatus(request.id(), StatusUpdate.failed(processorId, message));
            log.info("Request {} reported failed: {}", request.id(), outcome);
        } catch (QueueException e) {
            log.warn("Failure report for request {} rejected: {}", request.id(), e.getMessage());
        }
    }

    @Override
    public void run() {
        log.info("Queue worker {} started", processorId);

        while (!Thread.currentThread().isInterrupted()) {
            try {
                WorkerStats stats = runOnce();
                if (stats.processed() > 0) {
                    log.info("Batch completed: {} succeeded, {} failed", stats.succeeded(), stats.failed());
                } else {
                    log.debug("No requests processed this cycle");
                }
                Thread.sleep(idleInterval.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                log.error("Queue worker {} error", processorId, e);
                try {
                    Thread.sleep(idleInterval.toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }

        log.info("Queue worker {} stopped", processorId);
    }
}
