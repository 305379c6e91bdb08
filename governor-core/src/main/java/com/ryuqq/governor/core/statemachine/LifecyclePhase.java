package com.ryuqq.governor.core.statemachine;

/**
 * Process visibility phase, driven by OS lifecycle events.
 *
 * @author Governor Team
 * @since 1.0.0
 */
public enum LifecyclePhase {

    /**
     * Visible and interactive.
     */
    FOREGROUND,

    /**
     * Not visible; periodic work should slow down.
     */
    BACKGROUND
}
