package com.ryuqq.governor.adapter.runner;

/**
 * Cache janitor configuration (immutable record).
 *
 * <p><strong>Settings:</strong></p>
 * <ul>
 *   <li>intervalMs: base interval of the expiry sweep (default 600000ms = 10 min)</li>
 *   <li>shrinkFactor: capacity fraction kept under CRITICAL pressure (default 0.7)</li>
 *   <li>minCapacityBytes: floor of the shrunk capacity (default 20 MB)</li>
 *   <li>purgeMaxIdleMs: idle time after which an entry is purged on entering the background
 *       (default 3600000ms = 1 h)</li>
 *   <li>purgeMinAccessCount: reads an entry needs to survive that purge (default 3)</li>
 * </ul>
 *
 * @author Governor Team
 * @since 1.0.0
 * @param intervalMs sweep interval (milliseconds, positive)
 * @param shrinkFactor shrink ratio (0.0 exclusive ~ 1.0)
 * @param minCapacityBytes shrink floor (bytes, positive)
 * @param purgeMaxIdleMs purge idle threshold (milliseconds, not negative)
 * @param purgeMinAccessCount purge access threshold (not negative)
 */
public record JanitorConfig(
    long intervalMs,
    double shrinkFactor,
    long minCapacityBytes,
    long purgeMaxIdleMs,
    long purgeMinAccessCount
) {

    private static final long DEFAULT_MIN_CAPACITY_BYTES = 20L * 1024 * 1024;

    public JanitorConfig() {
        this(600000, 0.7, DEFAULT_MIN_CAPACITY_BYTES, 3600000, 3);
    }

    public JanitorConfig {
        if (intervalMs <= 0) {
            throw new IllegalArgumentException(
                "intervalMs must be positive (current: " + intervalMs + ")"
            );
        }
        if (!(shrinkFactor > 0.0) || shrinkFactor > 1.0) {
            throw new IllegalArgumentException(
                "shrinkFactor must be in (0.0, 1.0] (current: " + shrinkFactor + ")"
            );
        }
        if (minCapacityBytes <= 0) {
            throw new IllegalArgumentException(
                "minCapacityBytes must be positive (current: " + minCapacityBytes + ")"
            );
        }
        if (purgeMaxIdleMs < 0) {
            throw new IllegalArgumentException(
                "purgeMaxIdleMs must not be negative (current: " + purgeMaxIdleMs + ")"
            );
        }
        if (purgeMinAccessCount < 0) {
            throw new IllegalArgumentException(
                "purgeMinAccessCount must not be negative (current: " + purgeMinAccessCount + ")"
            );
        }
    }

    public JanitorConfig withIntervalMs(long intervalMs) {
        return new JanitorConfig(intervalMs, shrinkFactor, minCapacityBytes, purgeMaxIdleMs, purgeMinAccessCount);
    }

    public JanitorConfig withShrink(double shrinkFactor, long minCapacityBytes) {
        return new JanitorConfig(intervalMs, shrinkFactor, minCapacityBytes, purgeMaxIdleMs, purgeMinAccessCount);
    }

    public JanitorConfig withPurge(long purgeMaxIdleMs, long purgeMinAccessCount) {
        return new JanitorConfig(intervalMs, shrinkFactor, minCapacityBytes, purgeMaxIdleMs, purgeMinAccessCount);
    }
}
