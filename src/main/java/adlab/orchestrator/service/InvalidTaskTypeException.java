package adlab.orchestrator.service;

/**
 * Submitted task type is unknown or has no registered handler.
 */
public class InvalidTaskTypeException extends IllegalArgumentException {

    private final String taskType;

    public InvalidTaskTypeException(String taskType) {
        super("Unsupported task type: " + taskType);
        this.taskType = taskType;
    }

    public String taskType() {
        return taskType;
    }
}
