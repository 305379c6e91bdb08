package com.ryuqq.governor.adapter.runner;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Delay between attempts of one coordinated execution.
 *
 * <p>The coordinator asks for a delay after each failed or timed-out attempt, passing the
 * number of attempts made so far, and schedules the next attempt once it elapses.</p>
 *
 * <p><strong>Algorithm:</strong></p>
 * <pre>
 * delay = min(backoffBaseMs * 2^(failedAttempts-1) + jitter, backoffMaxMs)
 * jitter = random(0, exponential * backoffJitter)
 * </pre>
 *
 * <p><strong>With {@code new CoordinatorConfig()} (maxAttempts=2):</strong> the single
 * retry waits 1000ms plus up to 100ms of jitter. Raising {@code maxAttempts} to 4 adds
 * retries after about 2000ms and 4000ms.</p>
 *
 * <pre>
 * BackoffCalculator backoff = BackoffCalculator.from(new CoordinatorConfig().withMaxAttempts(4));
 * long firstRetryDelay = backoff.calculate(1);   // 1000 ~ 1100
 * long thirdRetryDelay = backoff.calculate(3);   // 4000 ~ 4400
 * </pre>
 *
 * @author Governor Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;
    private final DoubleSupplier random;

    /**
     * Default settings: baseDelay=1000ms, maxDelay=30000ms, jitterFactor=0.1.
     */
    public BackoffCalculator() {
        this(1000, 30000, 0.1);
    }

    /**
     * @param baseDelayMs delay before the first retry (positive)
     * @param maxDelayMs upper bound (at least baseDelayMs)
     * @param jitterFactor jitter ratio (0.0 ~ 1.0)
     * @throws IllegalArgumentException if a parameter is out of range
     */
    public BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor) {
        this(baseDelayMs, maxDelayMs, jitterFactor, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param baseDelayMs delay before the first retry (positive)
     * @param maxDelayMs upper bound (at least baseDelayMs)
     * @param jitterFactor jitter ratio (0.0 ~ 1.0)
     * @param random source of values in [0, 1)
     * @throws IllegalArgumentException if a parameter is out of range
     */
    public BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor, DoubleSupplier random) {
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException(
                "baseDelayMs must be positive (current: " + baseDelayMs + ")"
            );
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }

        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitterFactor = jitterFactor;
        this.random = random;
    }

    /**
     * Backoff for a coordinator configuration.
     *
     * @param config coordinator configuration
     * @return BackoffCalculator
     */
    public static BackoffCalculator from(CoordinatorConfig config) {
        return new BackoffCalculator(config.backoffBaseMs(), config.backoffMaxMs(), config.backoffJitter());
    }

    /**
     * Delay before the next attempt.
     *
     * @param failedAttempts attempts that failed so far (starting at 1)
     * @return delay in milliseconds
     * @throws IllegalArgumentException if failedAttempts is not positive
     */
    public long calculate(int failedAttempts) {
        if (failedAttempts <= 0) {
            throw new IllegalArgumentException(
                "failedAttempts must be positive (current: " + failedAttempts + ")"
            );
        }

        // shift capped to keep the product from overflowing
        int shift = Math.min(failedAttempts - 1, 62);
        long exponential = baseDelayMs > (maxDelayMs >> shift)
            ? maxDelayMs
            : Math.min(baseDelayMs << shift, maxDelayMs);

        long jitter = (long) (exponential * jitterFactor * random.getAsDouble());

        return Math.min(exponential + jitter, maxDelayMs);
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    public double getJitterFactor() {
        return jitterFactor;
    }
}
