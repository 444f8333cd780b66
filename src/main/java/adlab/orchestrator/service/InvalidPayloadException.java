package adlab.orchestrator.service;

/**
 * Submitted payload is not valid for its task type.
 */
public class InvalidPayloadException extends IllegalArgumentException {

    public InvalidPayloadException(String message) {
        super(message);
    }
}
