package prflow.coordinator.api.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import prflow.coordinator.api.Controller;
import prflow.coordinator.api.v1.dto.AuditLogResponse;
import prflow.coordinator.api.v1.dto.RequestResponse;
import prflow.coordinator.api.v1.dto.SubmitRequest;
import prflow.coordinator.error.QueueException;
import prflow.coordinator.model.AuditLogEntry;
import prflow.coordinator.model.WorkRequest;
import prflow.coordinator.server.RouterHandler;
import prflow.coordinator.service.QueueService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for work requests (public API).
 *
 * POST /api/v1/requests - Submit a request
 * GET /api/v1/requests?branch={branchName} - Latest request for a branch
 * GET /api/v1/requests/{requestId} - Request status
 * GET /api/v1/requests/{requestId}/logs - Audit trail of a request
 */
public class RequestController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(RequestController.class);

    private static final Pattern REQUESTS_PATTERN = Pattern.compile("^/api/v1/requests$");
    private static final Pattern REQUEST_BY_ID_PATTERN = Pattern.compile("^/api/v1/requests/([^/]+)$");
    private static final Pattern REQUEST_LOGS_PATTERN = Pattern.compile("^/api/v1/requests/([^/]+)/logs$");

    private final QueueService queueService;

    public RequestController(QueueService queueService) {
        this.queueService = queueService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (REQUESTS_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.POST) || method.equals(HttpMethod.GET);
        }
        if (method.equals(HttpMethod.GET)) {
            return REQUEST_BY_ID_PATTERN.matcher(path).matches()
                    || REQUEST_LOGS_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (REQUESTS_PATTERN.matcher(path).matches()) {
                return req.method().equals(HttpMethod.POST)
                        ? handleSubmit(req)
                        : handleFindByBranch(req);
            }

            Matcher logsMatcher = REQUEST_LOGS_PATTERN.matcher(path);
            if (logsMatcher.matches()) {
                return handleLogs(req, logsMatcher.group(1));
            }

            Matcher idMatcher = REQUEST_BY_ID_PATTERN.matcher(path);
            if (idMatcher.matches()) {
                return handleGet(idMatcher.group(1));
            }

            return ControllerResponse.notFound("unknown request endpoint");

        } catch (QueueException e) {
            return ControllerResponse.rejected(e);
        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("malformed JSON: " + e.getOriginalMessage());
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Request controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    /**
     * POST /api/v1/requests - Submit a request
     */
    private ControllerResponse handleSubmit(FullHttpRequest req) throws JsonProcessingException {
        String body = req.content().toString(StandardCharsets.UTF_8);
        SubmitRequest request = RouterHandler.mapper().readValue(body, SubmitRequest.class);

        request.validate();

        String requestId = queueService.submit(request.toNewRequest());

        return ControllerResponse.json(HttpResponseStatus.CREATED,
                Map.of("success", true, "requestId", requestId, "status", "PENDING"));
    }

    /**
     * GET /api/v1/requests?branch={branchName}
     */
    private ControllerResponse handleFindByBranch(FullHttpRequest req) {
        String branch = queryParam(req, "branch");
        if (branch == null) {
            return ControllerResponse.badRequest("branch query parameter is required");
        }
        return respond(queueService.getStatusByBranch(branch), "no request for branch " + branch);
    }

    /**
     * GET /api/v1/requests/{requestId}
     */
    private ControllerResponse handleGet(String requestId) {
        return respond(queueService.getStatus(requestId), "request not found");
    }

    /**
     * GET /api/v1/requests/{requestId}/logs?limit=N
     */
    private ControllerResponse handleLogs(FullHttpRequest req, String requestId) {
        int limit = intParam(req, "limit", 100);
        List<AuditLogEntry> entries = queueService.findLogs(requestId, limit);

        List<AuditLogResponse> logs = entries.stream()
                .map(AuditLogResponse::from)
                .toList();

        return ControllerResponse.json(HttpResponseStatus.OK,
                Map.of("requestId", requestId, "count", logs.size(), "logs", logs));
    }

    private static ControllerResponse respond(Optional<WorkRequest> request, String notFoundMessage) {
        if (request.isEmpty()) {
            return ControllerResponse.notFound(notFoundMessage);
        }
        return ControllerResponse.json(HttpResponseStatus.OK, RequestResponse.from(request.get()));
    }

    static String queryParam(FullHttpRequest req, String name) {
        List<String> values = new QueryStringDecoder(req.uri()).parameters().get(name);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            return null;
        }
        return values.get(0);
    }

    static int intParam(FullHttpRequest req, String name, int fallback) {
        String value = queryParam(req, name);
        if (value == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer", e);
        }
    }
}
