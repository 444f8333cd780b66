package adlab.orchestrator.worker;

import adlab.orchestrator.config.OrchestratorConfig;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ExponentialBackoffRetryPolicyTest {

    @Test
    void delaysGrowExponentially() {
        RetryPolicy policy = new ExponentialBackoffRetryPolicy(5, Duration.ofSeconds(2), 2.0, null, false);

        assertEquals(Duration.ofSeconds(2), policy.backoff(1));
        assertEquals(Duration.ofSeconds(4), policy.backoff(2));
        assertEquals(Duration.ofSeconds(8), policy.backoff(3));
    }

    @Test
    void delayIsCapped() {
        RetryPolicy policy = new ExponentialBackoffRetryPolicy(10, Duration.ofSeconds(2), 2.0,
                Duration.ofSeconds(60), false);

        assertEquals(Duration.ofSeconds(60), policy.backoff(8));
    }

    @Test
    void jitterStaysWithinTenPercent() {
        RetryPolicy policy = new ExponentialBackoffRetryPolicy(3, Duration.ofSeconds(10), 2.0, null, true);

        for (int i = 0; i < 200; i++) {
            long millis = policy.backoff(1).toMillis();
            assertTrue(millis >= 9_000 && millis <= 11_000, "delay out of range: " + millis);
        }
    }

    @Test
    void retriesUntilMaxAttempts() {
        RetryPolicy policy = new ExponentialBackoffRetryPolicy();

        assertEquals(3, policy.maxAttempts());
        assertTrue(policy.shouldRetry(1));
        assertTrue(policy.shouldRetry(2));
        assertFalse(policy.shouldRetry(3));
    }

    @Test
    void rejectsInvalidSettings() {
        assertThrows(IllegalArgumentException.class,
                () -> new ExponentialBackoffRetryPolicy(0, Duration.ofSeconds(1), 2.0, null, false));
        assertThrows(IllegalArgumentException.class,
                () -> new ExponentialBackoffRetryPolicy(3, Duration.ofSeconds(1), 0.5, null, false));
    }

    @Test
    void builtFromConfig() {
        OrchestratorConfig config = OrchestratorConfig.defaults()
                .withMaxAttempts(5)
                .withRetryBackoff(Duration.ofMillis(100), Duration.ofSeconds(1))
                .withRetryJitter(false);

        ExponentialBackoffRetryPolicy policy = ExponentialBackoffRetryPolicy.from(config);

        assertEquals(5, policy.maxAttempts());
        assertEquals(Duration.ofMillis(100), policy.initialDelay());
        assertEquals(Duration.ofSeconds(1), policy.maxDelay());
        assertFalse(policy.addJitter());
    }
}
