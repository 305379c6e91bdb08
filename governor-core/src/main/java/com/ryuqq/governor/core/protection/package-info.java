/**
 * Protection SPI.
 *
 * <p>Outbound-request protection applied by the request coordinator after a cache miss:</p>
 * <pre>
 * 1. Cache lookup        → hits are free, no protection applied
 * 2. RateLimiter         → fixed window per action class, immediate rejection
 * 3. Single-flight join  → concurrent callers share one execution
 * 4. Work                → per-attempt timeout, retry with backoff
 * </pre>
 *
 * <p>{@link com.ryuqq.governor.core.protection.ActionKeyResolver} maps cache keys to the
 * action classes the limiter counts. The {@code noop} subpackage holds an always-allow
 * limiter for development and tests.</p>
 *
 * @author Governor Team
 * @since 1.0.0
 * @see com.ryuqq.governor.core.protection.RateLimiter
 * @see com.ryuqq.governor.core.protection.noop.NoOpRateLimiter
 */
package com.ryuqq.governor.core.protection;
