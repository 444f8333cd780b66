package adlab.orchestrator.service;

import adlab.orchestrator.model.TaskDescriptor;
import adlab.orchestrator.model.TaskError;
import adlab.orchestrator.model.TaskRecord;
import adlab.orchestrator.model.TaskType;
import adlab.orchestrator.repository.QueueUnavailableException;
import adlab.orchestrator.repository.TaskRecordStore;
import adlab.orchestrator.repository.WorkQueue;
import adlab.orchestrator.worker.TaskHandlerRegistry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.UUID;

/**
 * Accepts task submissions: validates, records and enqueues.
 * Never runs task logic; returns as soon as the descriptor is queued.
 */
public class TaskSubmissionService {

    private static final Logger log = LoggerFactory.getLogger(TaskSubmissionService.class);

    private final TaskRecordStore store;
    private final WorkQueue queue;
    private final TaskHandlerRegistry registry;
    private final ObjectMapper mapper;

    public TaskSubmissionService(TaskRecordStore store, WorkQueue queue, TaskHandlerRegistry registry,
            ObjectMapper mapper) {
        this.store = store;
        this.queue = queue;
        this.registry = registry;
        this.mapper = mapper;
    }

    /**
     * Submit a task by its wire name (e.g. {@code extract-ad-concept}).
     *
     * @return the new task id
     * @throws InvalidTaskTypeException if the type is unknown or not handled
     * @throws InvalidPayloadException  if the payload lacks required fields
     */
    public String submit(String taskType, JsonNode payload) {
        TaskType type = TaskType.fromWireName(taskType)
                .orElseThrow(() -> new InvalidTaskTypeException(taskType));
        return submit(type, payload);
    }

    /**
     * Submit a task.
     *
     * The record is created before the descriptor is enqueued. If the queue
     * rejects the descriptor the record is failed with
     * {@link TaskError#QUEUE_UNAVAILABLE} and the id is still returned.
     *
     * @return the new task id
     */
    public String submit(TaskType type, JsonNode payload) {
        if (!registry.supports(type)) {
            throw new InvalidTaskTypeException(type.wireName());
        }
        validatePayload(type, payload);

        String payloadJson;
        try {
            payloadJson = mapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new InvalidPayloadException("Payload is not serializable: " + e.getOriginalMessage());
        }

        String taskId = UUID.randomUUID().toString();
        TaskRecord record = TaskRecord.pending(taskId, type, payloadJson, Instant.now());
        store.create(record);

        try {
            queue.enqueue(TaskDescriptor.of(record));
        } catch (QueueUnavailableException e) {
            log.error("Failed to enqueue task {} ({})", taskId, type.wireName(), e);
            store.fail(taskId, TaskError.queueUnavailable(e.getMessage()));
            return taskId;
        }

        log.info("Accepted task {} ({})", taskId, type.wireName());
        return taskId;
    }

    /**
     * Check the payload is an object carrying every required field as non-blank text.
     */
    static void validatePayload(TaskType type, JsonNode payload) {
        if (payload == null || !payload.isObject()) {
            throw new InvalidPayloadException("Payload must be a JSON object");
        }
        for (String field : type.requiredFields()) {
            JsonNode value = payload.get(field);
            if (value == null || value.isNull()) {
                throw new InvalidPayloadException(field + " is required");
            }
            if (!value.isTextual() || value.asText().isBlank()) {
                throw new InvalidPayloadException(field + " must be a non-empty string");
            }
        }
    }
}
