package adlab.orchestrator.api.v1;

import adlab.orchestrator.api.Controller;
import adlab.orchestrator.api.v1.dto.TaskRecordResponse;
import adlab.orchestrator.model.TaskRecord;
import adlab.orchestrator.server.RouterHandler;
import adlab.orchestrator.service.TaskNotFoundException;
import adlab.orchestrator.service.TaskQueryService;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * GET /api/v1/tasks/{taskId} - Current task status
 */
public class TaskQueryController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(TaskQueryController.class);

    private static final Pattern TASK_BY_ID_PATTERN = Pattern.compile("^/api/v1/tasks/([^/]+)$");

    private final TaskQueryService queryService;

    public TaskQueryController(TaskQueryService queryService) {
        this.queryService = queryService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && TASK_BY_ID_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        Matcher matcher = TASK_BY_ID_PATTERN.matcher(path);
        if (!matcher.matches()) {
            return ControllerResponse.notFound("unknown task endpoint");
        }
        String taskId = matcher.group(1);

        try {
            TaskRecord record = queryService.get(taskId);
            TaskRecordResponse response = TaskRecordResponse.from(record, RouterHandler.mapper());
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
        } catch (TaskNotFoundException e) {
            return ControllerResponse.notFound("Task not found");
        } catch (Exception e) {
            log.error("Failed to read task {}", taskId, e);
            return ControllerResponse.error("internal error");
        }
    }
}
