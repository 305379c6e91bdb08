package com.ryuqq.governor.core.model;

import com.ryuqq.governor.core.statemachine.LifecyclePhase;
import com.ryuqq.governor.core.statemachine.LifecycleState;
import com.ryuqq.governor.core.statemachine.PressureLevel;

/**
 * Importance of a request or periodic task.
 *
 * <p><strong>Shedding rules for periodic tasks:</strong></p>
 * <ul>
 *   <li>HIGH: always runs</li>
 *   <li>MEDIUM: skipped under CRITICAL pressure</li>
 *   <li>LOW: skipped under CRITICAL pressure and while the process is in the background</li>
 * </ul>
 *
 * @author Governor Team
 * @since 1.0.0
 */
public enum Priority {

    HIGH,

    MEDIUM,

    LOW;

    /**
     * Whether work of this priority should be skipped in the given state.
     *
     * @param state current lifecycle state
     * @return true if the work should be shed
     */
    public boolean isShedIn(LifecycleState state) {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        return switch (this) {
            case HIGH -> false;
            case MEDIUM -> state.pressureLevel() == PressureLevel.CRITICAL;
            case LOW -> state.pressureLevel() == PressureLevel.CRITICAL
                || state.phase() == LifecyclePhase.BACKGROUND;
        };
    }
}
