package adlab.orchestrator.api.v1;

import adlab.orchestrator.api.Controller;
import adlab.orchestrator.api.v1.dto.SubmitTaskRequest;
import adlab.orchestrator.api.v1.dto.TaskAcceptedResponse;
import adlab.orchestrator.model.TaskType;
import adlab.orchestrator.server.RouterHandler;
import adlab.orchestrator.service.TaskSubmissionService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for task submission (public API).
 *
 * POST /api/v1/tasks - Submit any task type: {"task_type": ..., "payload": {...}}
 * POST /api/v1/{task-type} - Submit with the body as payload, e.g. /api/v1/extract-ad-concept
 */
public class TaskSubmissionController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(TaskSubmissionController.class);

    private static final Pattern TASKS_PATTERN = Pattern.compile("^/api/v1/tasks$");
    private static final Pattern TYPED_PATTERN = Pattern.compile("^/api/v1/([a-z-]+)$");

    private final TaskSubmissionService submissionService;

    public TaskSubmissionController(TaskSubmissionService submissionService) {
        this.submissionService = submissionService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (!method.equals(HttpMethod.POST)) {
            return false;
        }
        return TASKS_PATTERN.matcher(path).matches() || typeFromPath(path).isPresent();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            String body = req.content().toString(StandardCharsets.UTF_8);

            if (TASKS_PATTERN.matcher(path).matches()) {
                return handleSubmit(body);
            }

            Optional<TaskType> type = typeFromPath(path);
            if (type.isPresent()) {
                return handleTypedSubmit(type.get(), body);
            }

            return ControllerResponse.notFound("unknown submission endpoint");

        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("Malformed JSON body");
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Task submission error", e);
            return ControllerResponse.error("internal error");
        }
    }

    /**
     * POST /api/v1/tasks
     */
    private ControllerResponse handleSubmit(String body) throws JsonProcessingException {
        SubmitTaskRequest request = RouterHandler.mapper().readValue(body, SubmitTaskRequest.class);
        request.validate();

        String taskId = submissionService.submit(request.taskType(), request.payload());
        String message = TaskType.fromWireName(request.taskType())
                .map(TaskType::acceptedMessage)
                .orElse("Task started. Use the task_id to check the status.");
        return accepted(taskId, message);
    }

    /**
     * POST /api/v1/{task-type}
     */
    private ControllerResponse handleTypedSubmit(TaskType type, String body) throws JsonProcessingException {
        JsonNode payload = RouterHandler.mapper().readTree(body);
        String taskId = submissionService.submit(type, payload);
        return accepted(taskId, type.acceptedMessage());
    }

    private ControllerResponse accepted(String taskId, String message) throws JsonProcessingException {
        TaskAcceptedResponse response = new TaskAcceptedResponse(taskId, message);
        return ControllerResponse.json(
                HttpResponseStatus.ACCEPTED,
                RouterHandler.mapper().writeValueAsString(response));
    }

    private static Optional<TaskType> typeFromPath(String path) {
        Matcher matcher = TYPED_PATTERN.matcher(path);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return TaskType.fromWireName(matcher.group(1));
    }
}
