package com.ryuqq.governor.core.spi;

import com.ryuqq.governor.core.statemachine.LifecycleState;

/**
 * Receives lifecycle state transitions from the scheduler.
 *
 * @author Governor Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface LifecycleListener {

    /**
     * Called after the state changed.
     *
     * @param previous state before the transition
     * @param current state after the transition
     */
    void onStateChanged(LifecycleState previous, LifecycleState current);
}
