package com.ryuqq.governor.application.coordinator;

/**
 * Request coordinator counters.
 *
 * @param inFlight executions currently in flight
 * @param cacheHits calls answered from the cache
 * @param cacheMisses cache lookups that missed
 * @param rateLimited calls rejected by the rate limiter
 * @param joined calls that joined an existing execution
 * @param executions executions started
 * @param retries attempts beyond the first
 * @param failures executions that settled with a failure
 * @author Governor Team
 * @since 1.0.0
 */
public record CoordinatorMetrics(
    int inFlight,
    long cacheHits,
    long cacheMisses,
    long rateLimited,
    long joined,
    long executions,
    long retries,
    long failures
) {
}
