package adlab.orchestrator.worker;

import adlab.orchestrator.model.TaskType;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Task logic for one {@link TaskType}.
 *
 * Delivery is at-least-once, so the same payload may be executed more than
 * once for one task id. Implementations must be idempotent: any external
 * write has to be an upsert keyed by something stable (the task id, or a
 * natural key from the payload).
 */
public interface TaskHandler {

    /**
     * The task type this handler serves.
     */
    TaskType type();

    /**
     * Run the task.
     *
     * @param payload the submitted payload, already validated for required fields
     * @param context progress reporting and attempt information
     * @return the result object stored on the record
     * @throws AnalysisException    if this attempt failed
     * @throws InterruptedException if the worker is shutting down
     */
    JsonNode execute(JsonNode payload, TaskContext context) throws AnalysisException, InterruptedException;
}
