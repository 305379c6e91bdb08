package com.ryuqq.governor.core.contract;

import com.ryuqq.governor.core.model.Priority;

import java.time.Duration;

/**
 * Per-call options for {@code RequestCoordinator.execute}.
 *
 * <p><strong>Options:</strong></p>
 * <ul>
 *   <li>useCache: read-through/write-through caching (default true)</li>
 *   <li>cacheTtl: TTL of the cached result, {@link Duration#ZERO} for no expiry (default 5 minutes)</li>
 *   <li>priority: request importance (default MEDIUM)</li>
 *   <li>retry: retry with exponential backoff on failure (default true)</li>
 * </ul>
 *
 * @param useCache whether to consult and populate the cache
 * @param cacheTtl TTL of the cached result (not null, not negative)
 * @param priority request priority (not null)
 * @param retry whether failed attempts are retried
 * @author Governor Team
 * @since 1.0.0
 */
public record RequestOptions(
    boolean useCache,
    Duration cacheTtl,
    Priority priority,
    boolean retry
) {

    private static final Duration DEFAULT_CACHE_TTL = Duration.ofMinutes(5);

    /**
     * Default options.
     *
     * <p>Defaults: useCache=true, cacheTtl=5 minutes, priority=MEDIUM, retry=true</p>
     */
    public RequestOptions() {
        this(true, DEFAULT_CACHE_TTL, Priority.MEDIUM, true);
    }

    /**
     * Compact constructor (validation).
     *
     * @throws IllegalArgumentException if a parameter is invalid
     */
    public RequestOptions {
        if (cacheTtl == null) {
            throw new IllegalArgumentException("cacheTtl cannot be null");
        }
        if (cacheTtl.isNegative()) {
            throw new IllegalArgumentException("cacheTtl must not be negative (current: " + cacheTtl + ")");
        }
        if (priority == null) {
            throw new IllegalArgumentException("priority cannot be null");
        }
    }

    /**
     * Default options.
     *
     * @return default RequestOptions
     */
    public static RequestOptions defaults() {
        return new RequestOptions();
    }

    /**
     * Options that bypass the cache entirely.
     *
     * @return RequestOptions with useCache=false
     */
    public static RequestOptions uncached() {
        return new RequestOptions().withUseCache(false);
    }

    /**
     * New instance with only useCache changed.
     */
    public RequestOptions withUseCache(boolean useCache) {
        return new RequestOptions(useCache, cacheTtl, priority, retry);
    }

    /**
     * New instance with only cacheTtl changed.
     */
    public RequestOptions withCacheTtl(Duration cacheTtl) {
        return new RequestOptions(useCache, cacheTtl, priority, retry);
    }

    /**
     * New instance with only priority changed.
     */
    public RequestOptions withPriority(Priority priority) {
        return new RequestOptions(useCache, cacheTtl, priority, retry);
    }

    /**
     * New instance with only retry changed.
     */
    public RequestOptions withRetry(boolean retry) {
        return new RequestOptions(useCache, cacheTtl, priority, retry);
    }
}
