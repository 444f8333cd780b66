package adlab.orchestrator.model;

import java.util.Objects;

/**
 * Structured failure description stored on a FAILED record.
 *
 * @param code    machine-readable reason, see the constants below
 * @param message human-readable detail (last error seen)
 * @param attempt attempt number that produced the error, 0 when no attempt ran
 */
public record TaskError(String code, String message, int attempt) {

    /** Task logic threw on the final attempt */
    public static final String ANALYSIS_ERROR = "ANALYSIS_ERROR";
    /** The descriptor could not be enqueued after the record was created */
    public static final String QUEUE_UNAVAILABLE = "QUEUE_UNAVAILABLE";
    /** Redelivered after the last attempt was lost (worker crash) */
    public static final String ATTEMPTS_EXHAUSTED = "ATTEMPTS_EXHAUSTED";

    public TaskError {
        Objects.requireNonNull(code, "code is required");
        message = message != null ? message : "";
    }

    public static TaskError analysis(String message, int attempt) {
        return new TaskError(ANALYSIS_ERROR, message, attempt);
    }

    public static TaskError queueUnavailable(String message) {
        return new TaskError(QUEUE_UNAVAILABLE, message, 0);
    }

    public static TaskError attemptsExhausted(int attempts) {
        return new TaskError(ATTEMPTS_EXHAUSTED,
                "Task lost its worker on the last attempt (" + attempts + " attempts made)", attempts);
    }
}
