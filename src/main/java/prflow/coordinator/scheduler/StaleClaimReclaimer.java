package prflow.coordinator.scheduler;

import prflow.coordinator.config.CoordinatorConfig;
import prflow.coordinator.model.QueueStats;
import prflow.coordinator.model.ReclaimReport;
import prflow.coordinator.model.RequestStatus;
import prflow.coordinator.model.RequestTransitions;
import prflow.coordinator.model.WorkRequest;
import prflow.coordinator.repository.RequestRepository;
import prflow.coordinator.service.AuditTrail;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static prflow.coordinator.util.Json.fields;

/**
 * Background task that returns abandoned claims to the pending pool.
 *
 * A claim goes stale when its worker crashes, loses the network or is killed
 * before it reports an outcome. The reclaimer:
 * 1. Finds PROCESSING requests claimed longer ago than maxProcessingTime
 * 2. Resets each to PENDING without consuming a retry
 * 3. Writes one WARN entry per reset and one INFO summary per sweep
 */
public class StaleClaimReclaimer implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(StaleClaimReclaimer.class);

    static final String COMPONENT = "stale-claim-reclaimer";

    private final RequestRepository requests;
    private final AuditTrail audit;
    private final CoordinatorConfig config;

    public StaleClaimReclaimer(RequestRepository requests, AuditTrail audit, CoordinatorConfig config) {
        this.requests = requests;
        this.audit = audit;
        this.config = config;
    }

    @Override
    public void run() {
        try {
            reclaim();
        } catch (RuntimeException e) {
            log.error("Stale claim reclaimer error", e);
            audit.recordFailure("Stale claim sweep", e, null, COMPONENT);
        }
    }

    /**
     * Reset stale PROCESSING requests.
     *
     * @return sweep summary
     */
    public ReclaimReport reclaim() {
        Instant now = audit.now();
        Duration maxProcessing = config.maxProcessingTime();
        Instant cutoff = now.minus(maxProcessing);

        List<WorkRequest> stale = requests.findStaleProcessing(cutoff);

        int reset = 0;
        for (WorkRequest request : stale) {
            try {
                String note = RequestTransitions.boundedError("Reset from stale PROCESSING state: claimed by "
                        + request.processorId() + " at " + request.processedAt() + ", no report within "
                        + maxProcessing.toMinutes() + " minutes");
                if (!requests.resetStale(request.id(), cutoff, note)) {
                    log.debug("Request {} reported before it could be reset", request.id());
                    continue;
                }
                reset++;
                audit.warn(request.id(), "Stale claim reset to PENDING",
                        fields("processor_id", request.processorId(),
                                "claimed_at", request.processedAt(),
                                "retry_count", request.retryCount(),
                                "max_processing_minutes", maxProcessing.toMinutes()),
                        COMPONENT);
                log.warn("Reset stale request {} claimed by {} at {}",
                        request.id(), request.processorId(), request.processedAt());
            } catch (RuntimeException e) {
                log.error("Failed to reset stale request {}", request.id(), e);
                audit.recordFailure("Stale claim reset", e, fields("request_id", request.id()), COMPONENT);
            }
        }

        QueueStats lastDay = requests.countByStatus(now.minus(Duration.ofDays(1)));
        ReclaimReport report = new ReclaimReport(reset, maxProcessing.toMinutes(),
                lastDay.count(RequestStatus.PENDING),
                lastDay.count(RequestStatus.PROCESSING),
                lastDay.count(RequestStatus.FAILED));

        audit.info(null, "Stale claim sweep completed",
                fields("stale_reset", report.staleReset(),
                        "max_processing_minutes", report.maxProcessingMinutes(),
                        "pending", report.pending(),
                        "processing", report.processing(),
                        "failed", report.failed()),
                COMPONENT);

        if (reset > 0) {
            log.info("Stale claim reclaimer: {} reset, {} stale found", reset, stale.size());
        } else {
            log.debug("No stale claims found");
        }
        return report;
    }
}
