package prflow.coordinator.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import prflow.coordinator.api.Controller;
import prflow.coordinator.api.v1.dto.AuditLogResponse;
import prflow.coordinator.api.v1.dto.StatsResponse;
import prflow.coordinator.service.QueueService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Queue-wide views (public API).
 * GET /api/v1/queue/stats - Request counts per status
 * GET /api/v1/queue/logs - Latest audit entries
 */
public class QueueController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(QueueController.class);

    private final QueueService queueService;

    public QueueController(QueueService queueService) {
        this.queueService = queueService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET)
                && ("/api/v1/queue/stats".equals(path) || "/api/v1/queue/logs".equals(path));
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if ("/api/v1/queue/stats".equals(path)) {
                return ControllerResponse.json(HttpResponseStatus.OK, StatsResponse.from(queueService.stats()));
            }

            int limit = RequestController.intParam(req, "limit", 50);
            List<AuditLogResponse> logs = queueService.recentLogs(limit).stream()
                    .map(AuditLogResponse::from)
                    .toList();
            return ControllerResponse.json(HttpResponseStatus.OK, Map.of("count", logs.size(), "logs", logs));

        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Queue controller error", e);
            return ControllerResponse.error("internal error");
        }
    }
}
