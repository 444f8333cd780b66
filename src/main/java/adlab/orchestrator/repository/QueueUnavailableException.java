package adlab.orchestrator.repository;

/**
 * The work queue could not accept or hand out entries.
 */
public class QueueUnavailableException extends RuntimeException {

    public QueueUnavailableException(String message) {
        super(message);
    }

    public QueueUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
