package adlab.orchestrator.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One unit of queued work. Carries identity and input only, never status.
 *
 * @param taskId    id of the matching {@link TaskRecord}
 * @param taskType  operation to run
 * @param payload   task-type specific input as JSON text
 * @param createdAt submission time
 */
public record TaskDescriptor(String taskId, TaskType taskType, String payload, Instant createdAt) {

    public TaskDescriptor {
        Objects.requireNonNull(taskId, "taskId is required");
        Objects.requireNonNull(taskType, "taskType is required");
        Objects.requireNonNull(payload, "payload is required");
        Objects.requireNonNull(createdAt, "createdAt is required");
    }

    public static TaskDescriptor of(TaskRecord record) {
        return new TaskDescriptor(record.id(), record.type(), record.payload(), record.createdAt());
    }
}
