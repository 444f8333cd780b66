package adlab.orchestrator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for health check.
 * GET /api/v1/health
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("database") String database,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("version") String version,
        @JsonProperty("pending") Integer pending,
        @JsonProperty("running") Integer running,
        @JsonProperty("queue_depth") Integer queueDepth,
        @JsonProperty("in_flight") Integer inFlight,
        @JsonProperty("workers") Integer workers,
        @JsonProperty("active_streams") Integer activeStreams) {

    public static HealthResponse healthy(String uptime, String version, int pending, int running,
            int queueDepth, int inFlight, int workers, int activeStreams) {
        return new HealthResponse("healthy", "ok", uptime, version, pending, running,
                queueDepth, inFlight, workers, activeStreams);
    }

    public static HealthResponse unhealthy(String database) {
        return new HealthResponse("unhealthy", database, null, null, null, null, null, null, null, null);
    }
}
