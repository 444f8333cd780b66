package adlab.orchestrator.service;

import adlab.orchestrator.model.TaskRecord;
import adlab.orchestrator.repository.TaskRecordStore;

/**
 * Read-only view of task records.
 */
public class TaskQueryService {

    private final TaskRecordStore store;

    public TaskQueryService(TaskRecordStore store) {
        this.store = store;
    }

    /**
     * Current snapshot of a task.
     *
     * @throws TaskNotFoundException if no record exists
     */
    public TaskRecord get(String taskId) {
        return store.findById(taskId)
                .orElseThrow(() -> new TaskNotFoundException(taskId));
    }
}
