package autowarm.engine.api.v1;

import autowarm.engine.api.Controller;
import autowarm.engine.api.v1.dto.HealthResponse;
import autowarm.engine.scheduler.Scheduler;
import autowarm.engine.scheduler.SchedulerStats;
import autowarm.engine.store.DurableStore;
import autowarm.engine.store.EndpointHealth;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.time.Duration;
import java.util.List;

/**
 * Health check controller.
 * GET /api/v1/health
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);
    private static final String VERSION = "1.0.0";

    private final DurableStore store;
    private final Scheduler scheduler;

    public HealthController(DurableStore store, Scheduler scheduler) {
        this.store = store;
        this.scheduler = scheduler;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            store.healthCheck();
            List<EndpointHealth> endpoints = store.health();
            boolean writable = store.isWritable();
            boolean degraded = endpoints.stream().anyMatch(e -> !e.healthy());
            SchedulerStats stats = scheduler.stats();

            HealthResponse response = HealthResponse.of(writable, degraded, formatUptime(), VERSION, endpoints,
                    stats.queued(), stats.inFlight());

            return ControllerResponse.json(writable ? HttpResponseStatus.OK : HttpResponseStatus.SERVICE_UNAVAILABLE,
                    response);
        } catch (Exception e) {
            log.error("Health check failed", e);
            return ControllerResponse.unavailable("health check failed: " + e.getMessage());
        }
    }

    private String formatUptime() {
        long uptimeMs = ManagementFactory.getRuntimeMXBean().getUptime();
        Duration duration = Duration.ofMillis(uptimeMs);
        return duration.toHours() + "h " + duration.toMinutesPart() + "m";
    }
}
