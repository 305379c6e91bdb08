package com.ryuqq.governor.adapter.runner;

/**
 * Request coordinator configuration (immutable record).
 *
 * <p><strong>Settings:</strong></p>
 * <ul>
 *   <li>attemptTimeoutMs: timeout of a single attempt (default 15000ms)</li>
 *   <li>maxAttempts: attempts per execution when retry is requested (default 2)</li>
 *   <li>backoffBaseMs: delay before the first retry (default 1000ms)</li>
 *   <li>backoffMaxMs: upper bound of the retry delay (default 30000ms)</li>
 *   <li>backoffJitter: jitter ratio (default 0.1)</li>
 *   <li>maxConcurrent: batch window size (default 3)</li>
 * </ul>
 *
 * @author Governor Team
 * @since 1.0.0
 * @param attemptTimeoutMs per-attempt timeout (milliseconds, positive)
 * @param maxAttempts attempts per execution (at least 1)
 * @param backoffBaseMs base backoff delay (milliseconds, positive)
 * @param backoffMaxMs maximum backoff delay (milliseconds, at least backoffBaseMs)
 * @param backoffJitter jitter ratio (0.0 ~ 1.0)
 * @param maxConcurrent batch concurrency (at least 1)
 */
public record CoordinatorConfig(
    long attemptTimeoutMs,
    int maxAttempts,
    long backoffBaseMs,
    long backoffMaxMs,
    double backoffJitter,
    int maxConcurrent
) {

    /**
     * Default configuration.
     *
     * <p>attemptTimeoutMs=15000, maxAttempts=2, backoffBaseMs=1000, backoffMaxMs=30000,
     * backoffJitter=0.1, maxConcurrent=3</p>
     */
    public CoordinatorConfig() {
        this(15000, 2, 1000, 30000, 0.1, 3);
    }

    /**
     * Compact constructor (validation).
     *
     * @throws IllegalArgumentException if a value is out of range
     */
    public CoordinatorConfig {
        if (attemptTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "attemptTimeoutMs must be positive (current: " + attemptTimeoutMs + ")"
            );
        }
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException(
                "maxAttempts must be positive (current: " + maxAttempts + ")"
            );
        }
        if (backoffBaseMs <= 0) {
            throw new IllegalArgumentException(
                "backoffBaseMs must be positive (current: " + backoffBaseMs + ")"
            );
        }
        if (backoffMaxMs < backoffBaseMs) {
            throw new IllegalArgumentException(
                "backoffMaxMs must be >= backoffBaseMs (base: " + backoffBaseMs + ", max: " + backoffMaxMs + ")"
            );
        }
        if (backoffJitter < 0.0 || backoffJitter > 1.0) {
            throw new IllegalArgumentException(
                "backoffJitter must be between 0.0 and 1.0 (current: " + backoffJitter + ")"
            );
        }
        if (maxConcurrent <= 0) {
            throw new IllegalArgumentException(
                "maxConcurrent must be positive (current: " + maxConcurrent + ")"
            );
        }
    }

    public CoordinatorConfig withAttemptTimeoutMs(long attemptTimeoutMs) {
        return new CoordinatorConfig(attemptTimeoutMs, maxAttempts, backoffBaseMs, backoffMaxMs, backoffJitter, maxConcurrent);
    }

    public CoordinatorConfig withMaxAttempts(int maxAttempts) {
        return new CoordinatorConfig(attemptTimeoutMs, maxAttempts, backoffBaseMs, backoffMaxMs, backoffJitter, maxConcurrent);
    }

    /**
     * Copy with new backoff bounds.
     */
    public CoordinatorConfig withBackoff(long backoffBaseMs, long backoffMaxMs) {
        return new CoordinatorConfig(attemptTimeoutMs, maxAttempts, backoffBaseMs, backoffMaxMs, backoffJitter, maxConcurrent);
    }

    public CoordinatorConfig withBackoffJitter(double backoffJitter) {
        return new CoordinatorConfig(attemptTimeoutMs, maxAttempts, backoffBaseMs, backoffMaxMs, backoffJitter, maxConcurrent);
    }

    public CoordinatorConfig withMaxConcurrent(int maxConcurrent) {
        return new CoordinatorConfig(attemptTimeoutMs, maxAttempts, backoffBaseMs, backoffMaxMs, backoffJitter, maxConcurrent);
    }
}
