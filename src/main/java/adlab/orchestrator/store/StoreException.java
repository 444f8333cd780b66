package adlab.orchestrator.store;

/**
 * A JDBC operation against the task database failed.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
