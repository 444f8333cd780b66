package adlab.orchestrator.api.v1.dto;

import adlab.orchestrator.model.TaskError;
import adlab.orchestrator.model.TaskRecord;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;

import java.time.Instant;

/**
 * Response DTO for a task status snapshot.
 * GET /api/v1/tasks/{id} and the {@code update} stream event.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskRecordResponse(
        @JsonProperty("task_id") String taskId,
        @JsonProperty("task_type") String taskType,
        @JsonProperty("status") String status,
        @JsonProperty("progress") String progress,
        @JsonProperty("result") JsonNode result,
        @JsonProperty("error") ErrorBody error,
        @JsonProperty("attempts") int attempts,
        @JsonProperty("version") long version,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("updated_at") Instant updatedAt) {

    /**
     * Failure details of a FAILED task.
     */
    public record ErrorBody(
            @JsonProperty("code") String code,
            @JsonProperty("message") String message,
            @JsonProperty("attempt") int attempt) {
        static ErrorBody from(TaskError error) {
            return error != null ? new ErrorBody(error.code(), error.message(), error.attempt()) : null;
        }
    }

    /** Create from domain model */
    public static TaskRecordResponse from(TaskRecord record, ObjectMapper mapper) {
        return new TaskRecordResponse(
                record.id(),
                record.type().wireName(),
                record.status().wireName(),
                record.progress(),
                parseResult(record.result(), mapper),
                ErrorBody.from(record.error()),
                record.attempts(),
                record.version(),
                record.createdAt(),
                record.updatedAt());
    }

    private static JsonNode parseResult(String result, ObjectMapper mapper) {
        if (result == null) {
            return null;
        }
        try {
            return mapper.readTree(result);
        } catch (JsonProcessingException e) {
            return TextNode.valueOf(result);
        }
    }
}
