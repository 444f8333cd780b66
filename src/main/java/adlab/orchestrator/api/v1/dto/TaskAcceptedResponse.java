package adlab.orchestrator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for an accepted submission (HTTP 202).
 */
public record TaskAcceptedResponse(
        @JsonProperty("task_id") String taskId,
        @JsonProperty("message") String message) {
}
