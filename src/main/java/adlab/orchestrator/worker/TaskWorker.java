package adlab.orchestrator.worker;

import adlab.orchestrator.model.QueueMessage;
import adlab.orchestrator.model.TaskError;
import adlab.orchestrator.model.TaskRecord;
import adlab.orchestrator.model.TaskType;
import adlab.orchestrator.model.TransitionResult;
import adlab.orchestrator.repository.TaskRecordStore;
import adlab.orchestrator.repository.WorkQueue;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * Runs one leased queue message through its handler and records the outcome.
 *
 * The record is always written before the queue entry is acked. A failed
 * attempt is retried by handing the entry back to the queue with a backoff
 * delay; the record stays RUNNING in between.
 */
public class TaskWorker {

    private static final Logger log = LoggerFactory.getLogger(TaskWorker.class);

    private final TaskRecordStore store;
    private final WorkQueue queue;
    private final TaskHandlerRegistry registry;
    private final RetryPolicy retryPolicy;
    private final ObjectMapper mapper;
    private final Duration leaseDuration;

    public TaskWorker(TaskRecordStore store, WorkQueue queue, TaskHandlerRegistry registry,
            RetryPolicy retryPolicy, ObjectMapper mapper, Duration leaseDuration) {
        this.store = store;
        this.queue = queue;
        this.registry = registry;
        this.retryPolicy = retryPolicy;
        this.mapper = mapper;
        this.leaseDuration = leaseDuration;
    }

    /**
     * Process one delivery.
     *
     * @throws InterruptedException if interrupted while the handler ran; the
     *                              attempt is not counted and the message has
     *                              been handed back to the queue
     */
    public void process(QueueMessage message) throws InterruptedException {
        String taskId = message.taskId();
        int maxAttempts = retryPolicy.maxAttempts();

        Optional<TaskRecord> current = store.findById(taskId);
        if (current.isEmpty()) {
            log.warn("Dropping queue entry for unknown task {}", taskId);
            queue.ack(message);
            return;
        }

        TaskRecord record = current.get();
        if (record.isTerminal()) {
            log.info("Task {} already {}, dropping duplicate delivery #{}",
                    taskId, record.status(), message.deliveries());
            queue.ack(message);
            return;
        }

        // The last attempt was started but never reported back
        if (record.attempts() >= maxAttempts) {
            log.warn("Task {} redelivered after {} attempts, giving up", taskId, record.attempts());
            store.fail(taskId, TaskError.attemptsExhausted(record.attempts()));
            queue.ack(message);
            return;
        }

        Optional<TaskRecord> running = store.markRunning(taskId,
                "starting attempt " + (record.attempts() + 1) + "/" + maxAttempts);
        if (running.isEmpty()) {
            log.info("Task {} finished concurrently, dropping delivery", taskId);
            queue.ack(message);
            return;
        }

        int attempt = running.get().attempts();
        TaskType type = message.descriptor().taskType();
        log.info("Task {} ({}) attempt {}/{} started", taskId, type.wireName(), attempt, maxAttempts);

        String resultJson;
        try {
            resultJson = execute(message, attempt);
        } catch (InterruptedException e) {
            log.info("Task {} interrupted on attempt {}, returning it to the queue", taskId, attempt);
            store.releaseAttempt(taskId, "attempt " + attempt + "/" + maxAttempts + " interrupted, waiting to resume");
            queue.requeue(message, Duration.ZERO);
            throw e;
        } catch (Throwable e) {
            // Errors from handler code count as a failed attempt too
            onAttemptFailed(message, attempt, e);
            return;
        }

        TransitionResult outcome = store.complete(taskId, resultJson);
        switch (outcome) {
            case APPLIED -> log.info("Task {} completed on attempt {}", taskId, attempt);
            case ALREADY_TERMINAL -> log.info("Task {} was already terminal, result discarded", taskId);
            default -> log.warn("Task {} result not recorded: {}", taskId, outcome);
        }
        queue.ack(message);
    }

    private String execute(QueueMessage message, int attempt) throws AnalysisException, InterruptedException {
        TaskType type = message.descriptor().taskType();
        TaskHandler handler = registry.lookup(type)
                .orElseThrow(() -> new AnalysisException("No handler registered for task type " + type.wireName()));

        JsonNode payload;
        try {
            payload = mapper.readTree(message.descriptor().payload());
        } catch (JsonProcessingException e) {
            throw new AnalysisException("Malformed payload: " + e.getOriginalMessage(), e);
        }

        WorkerTaskContext context = new WorkerTaskContext(
                message, attempt, retryPolicy.maxAttempts(), store, queue, leaseDuration);
        JsonNode result = handler.execute(payload, context);

        try {
            return mapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new AnalysisException("Result is not serializable: " + e.getOriginalMessage(), e);
        }
    }

    private void onAttemptFailed(QueueMessage message, int attempt, Throwable error) {
        String taskId = message.taskId();
        int maxAttempts = retryPolicy.maxAttempts();
        String reason = describe(error);

        if (!retryPolicy.shouldRetry(attempt)) {
            log.error("Task {} failed on final attempt {}/{}: {}", taskId, attempt, maxAttempts, reason, error);
            store.fail(taskId, TaskError.analysis(reason, attempt));
            queue.ack(message);
            return;
        }

        Duration delay = retryPolicy.backoff(attempt);
        log.warn("Task {} attempt {}/{} failed, retrying in {}ms: {}",
                taskId, attempt, maxAttempts, delay.toMillis(), reason);
        store.updateProgress(taskId, "attempt " + attempt + "/" + maxAttempts + " failed: " + reason
                + "; retrying in " + delay.toMillis() + "ms");
        queue.requeue(message, delay);
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message != null && !message.isBlank() ? message : error.getClass().getSimpleName();
    }
}
