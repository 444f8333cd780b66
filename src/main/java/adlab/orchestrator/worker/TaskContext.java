package adlab.orchestrator.worker;

import adlab.orchestrator.model.TaskType;

/**
 * What a running handler can see of, and report about, its task.
 */
public interface TaskContext {

    String taskId();

    TaskType taskType();

    /** 1-based number of the current attempt. */
    int attempt();

    int maxAttempts();

    /**
     * Publish a human-readable milestone on the task record.
     * Also renews the queue lease, so long-running handlers should report regularly.
     */
    void reportProgress(String progress);
}
