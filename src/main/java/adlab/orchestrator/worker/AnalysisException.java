package adlab.orchestrator.worker;

/**
 * Task logic failed. The worker treats it as a failed attempt and retries
 * while attempts remain.
 */
public class AnalysisException extends Exception {

    public AnalysisException(String message) {
        super(message);
    }

    public AnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
