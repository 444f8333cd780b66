package adlab.orchestrator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Request DTO for the generic submission endpoint.
 * POST /api/v1/tasks
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SubmitTaskRequest(
        @JsonProperty("task_type") String taskType,
        @JsonProperty("payload") JsonNode payload) {

    /** Validate the request */
    public void validate() {
        if (taskType == null || taskType.isBlank()) {
            throw new IllegalArgumentException("task_type is required");
        }
        if (payload == null || payload.isNull()) {
            throw new IllegalArgumentException("payload is required");
        }
    }
}
