package adlab.orchestrator.api.v1;

import adlab.orchestrator.api.StreamingController;
import adlab.orchestrator.server.RouterHandler;
import adlab.orchestrator.server.SseEventSink;
import adlab.orchestrator.service.TaskNotFoundException;
import adlab.orchestrator.service.TaskQueryService;
import adlab.orchestrator.stream.Subscription;
import adlab.orchestrator.stream.TaskStreamService;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * GET /api/v1/tasks/{taskId}/stream - Server-sent status events
 *
 * Events: {@code update} with the task snapshot and {@code timeout} when the
 * stream's maximum duration runs out. The response ends after a terminal
 * update or the timeout. Disconnecting does not affect the task.
 */
public class TaskStreamController implements StreamingController {

    private static final Logger log = LoggerFactory.getLogger(TaskStreamController.class);

    private static final Pattern STREAM_PATTERN = Pattern.compile("^/api/v1/tasks/([^/]+)/stream$");

    private final TaskQueryService queryService;
    private final TaskStreamService streamService;

    public TaskStreamController(TaskQueryService queryService, TaskStreamService streamService) {
        this.queryService = queryService;
        this.streamService = streamService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && STREAM_PATTERN.matcher(path).matches();
    }

    @Override
    public void open(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        Matcher matcher = STREAM_PATTERN.matcher(path);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("unknown stream endpoint");
        }
        String taskId = matcher.group(1);

        // Unknown ids get a plain 404 before any stream headers go out
        queryService.get(taskId);

        SseEventSink sink = new SseEventSink(ctx, RouterHandler.mapper());
        sink.start();

        Subscription subscription;
        try {
            subscription = streamService.subscribe(taskId, sink);
        } catch (TaskNotFoundException e) {
            log.info("Task {} disappeared before its stream started", taskId);
            sink.onComplete();
            return;
        } catch (RuntimeException e) {
            // Headers are already out, so end the stream instead of answering 500
            log.error("Failed to open stream for task {}", taskId, e);
            sink.onComplete();
            return;
        }

        ctx.channel().closeFuture().addListener(future -> subscription.cancel());
        log.debug("Streaming task {} to {}", taskId, ctx.channel().remoteAddress());
    }
}
