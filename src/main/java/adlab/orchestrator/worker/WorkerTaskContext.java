package adlab.orchestrator.worker;

import adlab.orchestrator.model.QueueMessage;
import adlab.orchestrator.model.TaskType;
import adlab.orchestrator.model.TransitionResult;
import adlab.orchestrator.repository.TaskRecordStore;
import adlab.orchestrator.repository.WorkQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * TaskContext bound to one leased queue message.
 */
class WorkerTaskContext implements TaskContext {

    private static final Logger log = LoggerFactory.getLogger(WorkerTaskContext.class);

    private final QueueMessage message;
    private final int attempt;
    private final int maxAttempts;
    private final TaskRecordStore store;
    private final WorkQueue queue;
    private final Duration leaseDuration;

    WorkerTaskContext(QueueMessage message, int attempt, int maxAttempts,
            TaskRecordStore store, WorkQueue queue, Duration leaseDuration) {
        this.message = message;
        this.attempt = attempt;
        this.maxAttempts = maxAttempts;
        this.store = store;
        this.queue = queue;
        this.leaseDuration = leaseDuration;
    }

    @Override
    public String taskId() {
        return message.taskId();
    }

    @Override
    public TaskType taskType() {
        return message.descriptor().taskType();
    }

    @Override
    public int attempt() {
        return attempt;
    }

    @Override
    public int maxAttempts() {
        return maxAttempts;
    }

    @Override
    public void reportProgress(String progress) {
        TransitionResult result = store.updateProgress(taskId(), progress);
        if (result != TransitionResult.APPLIED) {
            log.debug("Progress for task {} not recorded: {}", taskId(), result);
        }
        if (!queue.extendVisibility(message, leaseDuration)) {
            log.warn("Lease on task {} was lost while running attempt {}", taskId(), attempt);
        }
    }
}
