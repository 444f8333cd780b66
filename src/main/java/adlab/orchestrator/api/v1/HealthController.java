package adlab.orchestrator.api.v1;

import adlab.orchestrator.api.Controller;
import adlab.orchestrator.api.v1.dto.HealthResponse;
import adlab.orchestrator.model.TaskStatus;
import adlab.orchestrator.repository.TaskRecordStore;
import adlab.orchestrator.repository.WorkQueue;
import adlab.orchestrator.server.RouterHandler;
import adlab.orchestrator.store.Database;
import adlab.orchestrator.stream.TaskStreamService;
import adlab.orchestrator.worker.WorkerPool;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
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
    private final TaskRecordStore store;
    private final WorkQueue queue;
    private final WorkerPool workerPool;
    private final TaskStreamService streamService;

    public HealthController(Database database, TaskRecordStore store, WorkQueue queue, WorkerPool workerPool,
            TaskStreamService streamService) {
        this.database = database;
        this.store = store;
        this.queue = queue;
        this.workerPool = workerPool;
        this.streamService = streamService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (!database.isHealthy()) {
                HealthResponse response = HealthResponse.unhealthy("connection failed");
                return ControllerResponse.json(
                        HttpResponseStatus.SERVICE_UNAVAILABLE,
                        RouterHandler.mapper().writeValueAsString(response));
            }

            HealthResponse response = HealthResponse.healthy(
                    formatUptime(),
                    VERSION,
                    store.countByStatus(TaskStatus.PENDING),
                    store.countByStatus(TaskStatus.RUNNING),
                    queue.depth(),
                    queue.inFlight(),
                    workerPool.workerCount(),
                    streamService.activeCount());

            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));

        } catch (Exception e) {
            log.error("Health check failed", e);
            try {
                HealthResponse response = HealthResponse.unhealthy(e.getMessage());
                return ControllerResponse.json(
                        HttpResponseStatus.SERVICE_UNAVAILABLE,
                        RouterHandler.mapper().writeValueAsString(response));
            } catch (Exception ex) {
                return ControllerResponse.error("health check failed");
            }
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
