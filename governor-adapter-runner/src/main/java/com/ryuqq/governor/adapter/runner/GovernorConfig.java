package com.ryuqq.governor.adapter.runner;

import com.ryuqq.governor.adapter.inmemory.cache.CacheStoreConfig;
import com.ryuqq.governor.application.scheduler.IntervalPolicy;
import com.ryuqq.governor.core.protection.RateLimiterConfig;

/**
 * Aggregate configuration for {@link Governor}.
 *
 * @param cache cache store settings
 * @param rateLimiter rate limiter settings
 * @param coordinator coordinator settings
 * @param scheduler scheduler settings
 * @param janitor cache janitor settings
 * @param intervalPolicy interval multipliers per lifecycle state
 * @author Governor Team
 * @since 1.0.0
 */
public record GovernorConfig(
    CacheStoreConfig cache,
    RateLimiterConfig rateLimiter,
    CoordinatorConfig coordinator,
    SchedulerConfig scheduler,
    JanitorConfig janitor,
    IntervalPolicy intervalPolicy
) {

    /**
     * All defaults.
     */
    public GovernorConfig() {
        this(
            new CacheStoreConfig(),
            new RateLimiterConfig(),
            new CoordinatorConfig(),
            new SchedulerConfig(),
            new JanitorConfig(),
            IntervalPolicy.defaults()
        );
    }

    public GovernorConfig {
        if (cache == null) {
            throw new IllegalArgumentException("cache cannot be null");
        }
        if (rateLimiter == null) {
            throw new IllegalArgumentException("rateLimiter cannot be null");
        }
        if (coordinator == null) {
            throw new IllegalArgumentException("coordinator cannot be null");
        }
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler cannot be null");
        }
        if (janitor == null) {
            throw new IllegalArgumentException("janitor cannot be null");
        }
        if (intervalPolicy == null) {
            throw new IllegalArgumentException("intervalPolicy cannot be null");
        }
        if (janitor.minCapacityBytes() > cache.capacityBytes()) {
            throw new IllegalArgumentException(
                "janitor.minCapacityBytes must not exceed cache.capacityBytes (min: "
                    + janitor.minCapacityBytes() + ", capacity: " + cache.capacityBytes() + ")"
            );
        }
    }

    public GovernorConfig withCache(CacheStoreConfig cache) {
        return new GovernorConfig(cache, rateLimiter, coordinator, scheduler, janitor, intervalPolicy);
    }

    public GovernorConfig withRateLimiter(RateLimiterConfig rateLimiter) {
        return new GovernorConfig(cache, rateLimiter, coordinator, scheduler, janitor, intervalPolicy);
    }

    public GovernorConfig withCoordinator(CoordinatorConfig coordinator) {
        return new GovernorConfig(cache, rateLimiter, coordinator, scheduler, janitor, intervalPolicy);
    }

    public GovernorConfig withScheduler(SchedulerConfig scheduler) {
        return new GovernorConfig(cache, rateLimiter, coordinator, scheduler, janitor, intervalPolicy);
    }

    public GovernorConfig withJanitor(JanitorConfig janitor) {
        return new GovernorConfig(cache, rateLimiter, coordinator, scheduler, janitor, intervalPolicy);
    }

    public GovernorConfig withIntervalPolicy(IntervalPolicy intervalPolicy) {
        return new GovernorConfig(cache, rateLimiter, coordinator, scheduler, janitor, intervalPolicy);
    }
}
