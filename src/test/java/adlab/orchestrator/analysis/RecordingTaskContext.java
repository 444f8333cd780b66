package adlab.orchestrator.analysis;

import adlab.orchestrator.model.TaskType;
import adlab.orchestrator.worker.TaskContext;

import java.util.ArrayList;
import java.util.List;

class RecordingTaskContext implements TaskContext {

    final List<String> progress = new ArrayList<>();
    private final String taskId;
    private final TaskType type;

    RecordingTaskContext(String taskId, TaskType type) {
        this.taskId = taskId;
        this.type = type;
    }

    @Override
    public String taskId() {
        return taskId;
    }

    @Override
    public TaskType taskType() {
        return type;
    }

    @Override
    public int attempt() {
        return 1;
    }

    @Override
    public int maxAttempts() {
        return 3;
    }

    @Override
    public void reportProgress(String progress) {
        this.progress.add(progress);
    }
}
