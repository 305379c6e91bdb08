package com.ryuqq.governor.core.protection;

import com.ryuqq.governor.core.model.ActionKey;

/**
 * Rate Limiter SPI.
 *
 * <p>Caps the number of requests an action class may start within a window, protecting the
 * remote backend from bursts of identical calls.</p>
 *
 * <p>The check is non-blocking: an exhausted window is reported immediately and never
 * queued. Callers that need the call later retry on their own.</p>
 *
 * <p><strong>Usage example:</strong></p>
 * <pre>{@code
 * RateLimiter limiter = ...;
 * ActionKey action = ActionKey.of("video");
 *
 * if (!limiter.tryAcquire(action)) {
 *     throw new RateLimitExceededException(action);
 * }
 * }</pre>
 *
 * @author Governor Team
 * @since 1.0.0
 */
public interface RateLimiter {

    /**
     * Consumes one permit of the current window if available.
     *
     * @param actionKey action class
     * @return true: request allowed, false: window exhausted
     */
    boolean tryAcquire(ActionKey actionKey);

    /**
     * Rate limiter configuration.
     *
     * @return configuration (window size and maximum requests)
     */
    RateLimiterConfig getConfig();
}
