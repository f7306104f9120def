package prflow.coordinator.api.internal.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import prflow.coordinator.api.Controller;
import prflow.coordinator.config.CoordinatorConfig;
import prflow.coordinator.error.QueueException;
import prflow.coordinator.scheduler.HealthMonitor;
import prflow.coordinator.scheduler.RetentionSweeper;
import prflow.coordinator.scheduler.StaleClaimReclaimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * On-demand sweeps (internal API).
 * POST /internal/v1/maintenance/reclaim
 * POST /internal/v1/maintenance/health-check
 * POST /internal/v1/maintenance/retention?days=N
 */
public class MaintenanceController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(MaintenanceController.class);

    private static final String PREFIX = "/internal/v1/maintenance/";

    private final StaleClaimReclaimer reclaimer;
    private final HealthMonitor healthMonitor;
    private final RetentionSweeper retentionSweeper;
    private final CoordinatorConfig config;

    public MaintenanceController(StaleClaimReclaimer reclaimer, HealthMonitor healthMonitor,
            RetentionSweeper retentionSweeper, CoordinatorConfig config) {
        this.reclaimer = reclaimer;
        this.healthMonitor = healthMonitor;
        this.retentionSweeper = retentionSweeper;
        this.config = config;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.POST) && path.startsWith(PREFIX);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            Object report = switch (path.substring(PREFIX.length())) {
                case "reclaim" -> reclaimer.reclaim();
                case "health-check" -> healthMonitor.check();
                case "retention" -> retentionSweeper.purge(days(req));
                default -> null;
            };
            if (report == null) {
                return ControllerResponse.notFound("unknown maintenance task");
            }
            log.info("Maintenance {} run on demand", path);
            return ControllerResponse.json(HttpResponseStatus.OK, Map.of("ok", true, "report", report));

        } catch (QueueException e) {
            return ControllerResponse.rejected(e);
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Maintenance controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    private int days(FullHttpRequest req) {
        List<String> values = new QueryStringDecoder(req.uri()).parameters().get("days");
        if (values == null || values.isEmpty()) {
            return config.retentionDays();
        }
        try {
            return Integer.parseInt(values.get(0));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("days must be an integer", e);
        }
    }
}
