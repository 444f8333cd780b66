package adlab.orchestrator.worker;

import java.time.Duration;

/**
 * Decides whether a failed attempt gets another try, and when.
 */
public interface RetryPolicy {

    /**
     * Total number of attempts a task may use, the first one included.
     */
    int maxAttempts();

    /**
     * @param attemptsMade attempts made so far, the failed one included
     */
    default boolean shouldRetry(int attemptsMade) {
        return attemptsMade < maxAttempts();
    }

    /**
     * Delay before the next attempt.
     *
     * @param attemptsMade attempts made so far, the failed one included (1 for the first retry)
     */
    Duration backoff(int attemptsMade);
}
