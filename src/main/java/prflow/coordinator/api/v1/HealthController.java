package prflow.coordinator.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import prflow.coordinator.api.Controller;
import prflow.coordinator.api.v1.dto.HealthResponse;
import prflow.coordinator.model.QueueStats;
import prflow.coordinator.model.RequestStatus;
import prflow.coordinator.service.QueueService;
import prflow.coordinator.store.Database;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.time.Duration;

/**
 * Health check controller.
 * GET /api/v1/health
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);
    private static final String VERSION = "1.0.0";

    private final Database database;
    private final QueueService queueService;

    public HealthController(Database database, QueueService queueService) {
        this.database = database;
        this.queueService = queueService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (!database.isHealthy()) {
                return ControllerResponse.json(HttpResponseStatus.SERVICE_UNAVAILABLE,
                        HealthResponse.unhealthy("connection failed"));
            }

            QueueStats stats = queueService.stats();
            HealthResponse response = HealthResponse.healthy(formatUptime(), VERSION,
                    stats.count(RequestStatus.PENDING), stats.count(RequestStatus.PROCESSING));

            return ControllerResponse.json(HttpResponseStatus.OK, response);

        } catch (Exception e) {
            log.error("Health check failed", e);
            return ControllerResponse.json(HttpResponseStatus.SERVICE_UNAVAILABLE,
                    HealthResponse.unhealthy(e.getMessage()));
        }
    }

    private String formatUptime() {
        long uptimeMs = ManagementFactory.getRuntimeMXBean().getUptime();
        Duration duration = Duration.ofMillis(uptimeMs);
        long hours = duration.toHours();
        long minutes = duration.toMinutesPart();
        return hours + "h " + minutes + "m";
    }
}
