package com.ryuqq.governor.core.statemachine;

/**
 * Immutable snapshot of the governor's lifecycle state: phase × pressure (6 states).
 *
 * <p><strong>Transitions:</strong></p>
 * <ul>
 *   <li>phase: FOREGROUND ↔ BACKGROUND on OS lifecycle events</li>
 *   <li>pressure: NORMAL / ELEVATED / CRITICAL on periodic sampling</li>
 *   <li>every state is reachable from every other; there is no terminal state</li>
 * </ul>
 *
 * <p>Owned by the lifecycle scheduler, which publishes a new snapshot per transition.
 * Other components only read it.</p>
 *
 * @param phase lifecycle phase (not null)
 * @param pressureLevel pressure level (not null)
 * @author Governor Team
 * @since 1.0.0
 */
public record LifecycleState(LifecyclePhase phase, PressureLevel pressureLevel) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException if phase or pressureLevel is null
     */
    public LifecycleState {
        if (phase == null) {
            throw new IllegalArgumentException("phase cannot be null");
        }
        if (pressureLevel == null) {
            throw new IllegalArgumentException("pressureLevel cannot be null");
        }
    }

    /**
     * Initial state: FOREGROUND / NORMAL.
     *
     * @return initial state
     */
    public static LifecycleState initial() {
        return new LifecycleState(LifecyclePhase.FOREGROUND, PressureLevel.NORMAL);
    }

    /**
     * New snapshot with only the phase changed.
     */
    public LifecycleState withPhase(LifecyclePhase phase) {
        return new LifecycleState(phase, pressureLevel);
    }

    /**
     * New snapshot with only the pressure level changed.
     */
    public LifecycleState withPressureLevel(PressureLevel pressureLevel) {
        return new LifecycleState(phase, pressureLevel);
    }

    public boolean isBackground() {
        return phase == LifecyclePhase.BACKGROUND;
    }

    public boolean isCritical() {
        return pressureLevel == PressureLevel.CRITICAL;
    }

    @Override
    public String toString() {
        return phase + "/" + pressureLevel;
    }
}
