/**
 * Lifecycle scheduling contract.
 *
 * <p>{@link com.ryuqq.governor.application.scheduler.LifecycleScheduler} owns the lifecycle
 * state; {@link com.ryuqq.governor.application.scheduler.IntervalPolicy} maps each state to an
 * interval multiplier.</p>
 *
 * @author Governor Team
 * @since 1.0.0
 */
package com.ryuqq.governor.application.scheduler;
