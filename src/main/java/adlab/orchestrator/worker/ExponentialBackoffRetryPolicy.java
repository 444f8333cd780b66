package adlab.orchestrator.worker;

import adlab.orchestrator.config.OrchestratorConfig;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with an optional cap and jitter.
 * The n-th retry waits {@code initialDelay * multiplier^(n-1)}, capped at
 * {@code maxDelay}, then shifted by up to +/-10% when jitter is on.
 */
public class ExponentialBackoffRetryPolicy implements RetryPolicy {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_INITIAL_DELAY = Duration.ofSeconds(2);
    public static final double DEFAULT_MULTIPLIER = 2.0;
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(60);

    private final int maxAttempts;
    private final Duration initialDelay;
    private final double multiplier;
    private final Duration maxDelay; // null disables the cap
    private final boolean addJitter;

    public ExponentialBackoffRetryPolicy() {
        this(DEFAULT_MAX_ATTEMPTS, DEFAULT_INITIAL_DELAY, DEFAULT_MULTIPLIER, DEFAULT_MAX_DELAY, true);
    }

    /**
     * @param maxAttempts  total attempts, at least 1
     * @param initialDelay delay before the first retry
     * @param multiplier   growth factor per retry, at least 1.0
     * @param maxDelay     optional cap, null or zero to disable
     * @param addJitter    spread retries by +/-10%
     */
    public ExponentialBackoffRetryPolicy(int maxAttempts, Duration initialDelay, double multiplier,
            Duration maxDelay, boolean addJitter) {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be at least 1");
        if (initialDelay == null || initialDelay.isNegative()) throw new IllegalArgumentException("initialDelay must not be negative");
        if (multiplier < 1.0) throw new IllegalArgumentException("multiplier must be at least 1.0");

        this.maxAttempts = maxAttempts;
        this.initialDelay = initialDelay;
        this.multiplier = multiplier;
        this.maxDelay = (maxDelay != null && !maxDelay.isNegative() && !maxDelay.isZero()) ? maxDelay : null;
        this.addJitter = addJitter;
    }

    public static ExponentialBackoffRetryPolicy from(OrchestratorConfig config) {
        return new ExponentialBackoffRetryPolicy(
                config.maxAttempts(),
                config.retryInitialBackoff(),
                config.retryMultiplier(),
                config.retryMaxBackoff(),
                config.retryJitter());
    }

    @Override
    public int maxAttempts() {
        return maxAttempts;
    }

    @Override
    public Duration backoff(int attemptsMade) {
        int exponent = Math.max(0, attemptsMade - 1);
        double delayMillis = initialDelay.toMillis() * Math.pow(multiplier, exponent);

        if (maxDelay != null && delayMillis > maxDelay.toMillis()) {
            delayMillis = maxDelay.toMillis();
        }

        long millis = (long) delayMillis;
        if (addJitter && millis > 0) {
            long jitter = (long) (millis * 0.1 * (ThreadLocalRandom.current().nextDouble() * 2 - 1));
            millis = Math.max(1, millis + jitter);
        }
        return Duration.ofMillis(millis);
    }

    public Duration initialDelay() {
        return initialDelay;
    }

    public double multiplier() {
        return multiplier;
    }

    public Duration maxDelay() {
        return maxDelay;
    }

    public boolean addJitter() {
        return addJitter;
    }
}
