/**
 * Request coordination contract.
 *
 * <p>{@link com.ryuqq.governor.application.coordinator.RequestCoordinator} combines the cache
 * store, a rate limiter and single-flight de-duplication into one execution entry point.</p>
 *
 * @author Governor Team
 * @since 1.0.0
 */
package com.ryuqq.governor.application.coordinator;
