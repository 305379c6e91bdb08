package com.ryuqq.governor.core.protection;

/**
 * Fixed-window rate limiter configuration.
 *
 * <p><strong>Settings:</strong></p>
 * <ul>
 *   <li>maxRequests: requests allowed per action class and window (default 10)</li>
 *   <li>windowMs: window length (default 1000ms)</li>
 *   <li>purgeThreshold: tracked windows above which stale ones are dropped (default 100)</li>
 * </ul>
 *
 * @param maxRequests requests per window (positive)
 * @param windowMs window length in milliseconds (positive)
 * @param purgeThreshold tracked window count that triggers purging (positive)
 * @author Governor Team
 * @since 1.0.0
 */
public record RateLimiterConfig(int maxRequests, long windowMs, int purgeThreshold) {

    /**
     * Default configuration.
     *
     * <p>Defaults: maxRequests=10, windowMs=1000, purgeThreshold=100</p>
     */
    public RateLimiterConfig() {
        this(10, 1000, 100);
    }

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException if a parameter is not positive
     */
    public RateLimiterConfig {
        if (maxRequests <= 0) {
            throw new IllegalArgumentException("maxRequests must be positive (current: " + maxRequests + ")");
        }
        if (windowMs <= 0) {
            throw new IllegalArgumentException("windowMs must be positive (current: " + windowMs + ")");
        }
        if (purgeThreshold <= 0) {
            throw new IllegalArgumentException("purgeThreshold must be positive (current: " + purgeThreshold + ")");
        }
    }

    /**
     * New instance with only maxRequests changed.
     */
    public RateLimiterConfig withMaxRequests(int maxRequests) {
        return new RateLimiterConfig(maxRequests, windowMs, purgeThreshold);
    }

    /**
     * New instance with only windowMs changed.
     */
    public RateLimiterConfig withWindowMs(long windowMs) {
        return new RateLimiterConfig(maxRequests, windowMs, purgeThreshold);
    }

    /**
     * New instance with only purgeThreshold changed.
     */
    public RateLimiterConfig withPurgeThreshold(int purgeThreshold) {
        return new RateLimiterConfig(maxRequests, windowMs, purgeThreshold);
    }
}
