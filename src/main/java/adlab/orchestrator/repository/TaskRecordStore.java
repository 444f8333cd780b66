package adlab.orchestrator.repository;

import adlab.orchestrator.model.TaskError;
import adlab.orchestrator.model.TaskRecord;
import adlab.orchestrator.model.TaskStatus;
import adlab.orchestrator.model.TransitionResult;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Single source of truth for task status.
 * Every write is one atomic, conditional update: a record never moves
 * backwards and readers never observe a partially written record.
 */
public interface TaskRecordStore {

    /**
     * Insert a new record (normally PENDING).
     *
     * @param record the record to save
     */
    void create(TaskRecord record);

    /**
     * Find a record by task id.
     *
     * @param taskId the task id
     * @return the current snapshot if found
     */
    Optional<TaskRecord> findById(String taskId);

    /**
     * Start an execution attempt: PENDING or RUNNING → RUNNING, attempts + 1.
     *
     * @param taskId   the task id
     * @param progress progress text to publish with the transition
     * @return the updated snapshot, or empty if the record is missing or terminal
     */
    Optional<TaskRecord> markRunning(String taskId, String progress);

    /**
     * Hand back an attempt that was interrupted before its handler finished,
     * so shutdowns never count against the retry budget. Only allowed while RUNNING.
     */
    TransitionResult releaseAttempt(String taskId, String progress);

    /**
     * Publish a progress milestone. Only allowed while RUNNING.
     */
    TransitionResult updateProgress(String taskId, String progress);

    /**
     * RUNNING → COMPLETED with the given result JSON.
     */
    TransitionResult complete(String taskId, String result);

    /**
     * PENDING or RUNNING → FAILED with the given error.
     */
    TransitionResult fail(String taskId, TaskError error);

    /**
     * PENDING records created before the cutoff, oldest first.
     * Used by the reaper to find submissions that never reached the queue.
     */
    List<TaskRecord> findPendingBefore(Instant cutoff, int limit);

    /**
     * Delete COMPLETED/FAILED records last updated before the cutoff.
     *
     * @return number of records purged
     */
    int deleteTerminalBefore(Instant cutoff);

    /**
     * Count records in the given status.
     */
    int countByStatus(TaskStatus status);
}
