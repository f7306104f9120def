package prflow.coordinator.api.internal.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import prflow.coordinator.api.Controller;
import prflow.coordinator.api.internal.v1.dto.ClaimRequest;
import prflow.coordinator.api.internal.v1.dto.OperationResponse;
import prflow.coordinator.api.internal.v1.dto.StatusUpdateRequest;
import prflow.coordinator.api.v1.dto.RequestResponse;
import prflow.coordinator.error.QueueException;
import prflow.coordinator.model.UpdateOutcome;
import prflow.coordinator.model.WorkRequest;
import prflow.coordinator.server.RouterHandler;
import prflow.coordinator.service.QueueService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for worker operations (internal API).
 * POST /internal/v1/requests/claim - Claim the next request (204 when idle)
 * POST /internal/v1/requests/{requestId}/status - Report an outcome
 */
public class WorkerController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(WorkerController.class);

    private static final Pattern CLAIM_PATTERN = Pattern.compile("^/internal/v1/requests/claim$");
    private static final Pattern STATUS_PATTERN = Pattern.compile("^/internal/v1/requests/([^/]+)/status$");

    private final QueueService queueService;

    public WorkerController(QueueService queueService) {
        this.queueService = queueService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (!method.equals(HttpMethod.POST)) {
            return false;
        }
        return CLAIM_PATTERN.matcher(path).matches()
                || STATUS_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (CLAIM_PATTERN.matcher(path).matches()) {
                return handleClaim(req);
            }

            Matcher statusMatcher = STATUS_PATTERN.matcher(path);
            if (statusMatcher.matches()) {
                return handleStatus(req, statusMatcher.group(1));
            }

            return ControllerResponse.notFound("unknown worker endpoint");

        } catch (QueueException e) {
            return ControllerResponse.rejected(e);
        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("malformed JSON: " + e.getOriginalMessage());
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Worker controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    /**
     * POST /internal/v1/requests/claim
     */
    private ControllerResponse handleClaim(FullHttpRequest req) throws JsonProcessingException {
        String body = req.content().toString(StandardCharsets.UTF_8);
        ClaimRequest request = RouterHandler.mapper().readValue(body, ClaimRequest.class);

        request.validate();

        Optional<WorkRequest> claimed = queueService.claimNext(request.processorId());
        if (claimed.isEmpty()) {
            return ControllerResponse.noContent();
        }
        return ControllerResponse.json(HttpResponseStatus.OK, RequestResponse.withPayload(claimed.get()));
    }

    /**
     * POST /internal/v1/requests/{requestId}/status
     */
    private ControllerResponse handleStatus(FullHttpRequest req, String requestId) throws JsonProcessingException {
        String body = req.content().toString(StandardCharsets.UTF_8);
        StatusUpdateRequest request = RouterHandler.mapper().readValue(body, StatusUpdateRequest.class);

        request.validate();

        UpdateOutcome outcome = queueService.updateStatus(requestId, request.toStatusUpdate());
        return ControllerResponse.json(HttpResponseStatus.OK, OperationResponse.of(outcome));
    }
}
