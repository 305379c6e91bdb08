package com.ryuqq.governor.core.protection.noop;

import com.ryuqq.governor.core.model.ActionKey;
import com.ryuqq.governor.core.protection.RateLimiter;
import com.ryuqq.governor.core.protection.RateLimiterConfig;

/**
 * Rate Limiter NoOp implementation.
 *
 * <p>Always allows every request. Used in tests or when a host wants caching and
 * single-flight without rate limiting.</p>
 *
 * @author Governor Team
 * @since 1.0.0
 */
public final class NoOpRateLimiter implements RateLimiter {

    private static final RateLimiterConfig UNLIMITED_CONFIG =
        new RateLimiterConfig(Integer.MAX_VALUE, Long.MAX_VALUE, Integer.MAX_VALUE);

    @Override
    public boolean tryAcquire(ActionKey actionKey) {
        return true;
    }

    @Override
    public RateLimiterConfig getConfig() {
        return UNLIMITED_CONFIG;
    }
}
