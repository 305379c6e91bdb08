package com.ryuqq.governor.application.scheduler;

import com.ryuqq.governor.core.model.Priority;
import com.ryuqq.governor.core.statemachine.LifecyclePhase;
import com.ryuqq.governor.core.statemachine.LifecycleState;
import com.ryuqq.governor.core.statemachine.PressureLevel;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

/**
 * Interval multiplier table keyed by {@code (phase, pressure)}.
 *
 * <p>The multiplier is a pure function of the state. The default table is the product of a
 * phase factor and a pressure factor:</p>
 *
 * <table>
 *   <caption>Default factors</caption>
 *   <tr><th>Phase</th><th>Factor</th><th>Pressure</th><th>Factor</th></tr>
 *   <tr><td>FOREGROUND</td><td>1.0</td><td>NORMAL</td><td>1.0</td></tr>
 *   <tr><td>BACKGROUND</td><td>3.0</td><td>ELEVATED</td><td>1.5</td></tr>
 *   <tr><td></td><td></td><td>CRITICAL</td><td>1.5</td></tr>
 * </table>
 *
 * <p>Shedding follows {@link Priority#isShedIn(LifecycleState)}.</p>
 *
 * @author Governor Team
 * @since 1.0.0
 */
public final class IntervalPolicy {

    private static final IntervalPolicy DEFAULT = fromFactors(
        Map.of(LifecyclePhase.FOREGROUND, 1.0, LifecyclePhase.BACKGROUND, 3.0),
        Map.of(PressureLevel.NORMAL, 1.0, PressureLevel.ELEVATED, 1.5, PressureLevel.CRITICAL, 1.5)
    );

    private final Map<LifecycleState, Double> multipliers;

    private IntervalPolicy(Map<LifecycleState, Double> multipliers) {
        for (LifecyclePhase phase : LifecyclePhase.values()) {
            for (PressureLevel level : PressureLevel.values()) {
                LifecycleState state = new LifecycleState(phase, level);
                Double multiplier = multipliers.get(state);
                if (multiplier == null) {
                    throw new IllegalArgumentException("multiplier missing for state " + state);
                }
                validateMultiplier(state, multiplier);
            }
        }
        this.multipliers = Map.copyOf(multipliers);
    }

    /**
     * Default policy.
     *
     * @return phase factor × pressure factor table
     */
    public static IntervalPolicy defaults() {
        return DEFAULT;
    }

    /**
     * Builds a table as the product of per-phase and per-pressure factors.
     *
     * @param phaseFactors factor per phase (every phase required)
     * @param pressureFactors factor per pressure level (every level required)
     * @return IntervalPolicy
     * @throws IllegalArgumentException if a factor is missing or not positive
     */
    public static IntervalPolicy fromFactors(
            Map<LifecyclePhase, Double> phaseFactors,
            Map<PressureLevel, Double> pressureFactors) {
        if (phaseFactors == null || pressureFactors == null) {
            throw new IllegalArgumentException("factors cannot be null");
        }
        Map<LifecycleState, Double> table = new HashMap<>();
        for (LifecyclePhase phase : LifecyclePhase.values()) {
            Double phaseFactor = phaseFactors.get(phase);
            if (phaseFactor == null) {
                throw new IllegalArgumentException("factor missing for phase " + phase);
            }
            for (PressureLevel level : PressureLevel.values()) {
                Double pressureFactor = pressureFactors.get(level);
                if (pressureFactor == null) {
                    throw new IllegalArgumentException("factor missing for pressure level " + level);
                }
                table.put(new LifecycleState(phase, level), phaseFactor * pressureFactor);
            }
        }
        return new IntervalPolicy(table);
    }

    /**
     * Copy with one cell of the table replaced.
     *
     * @param state state to override
     * @param multiplier new multiplier (positive, finite)
     * @return new IntervalPolicy
     */
    public IntervalPolicy withMultiplier(LifecycleState state, double multiplier) {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        validateMultiplier(state, multiplier);
        Map<LifecycleState, Double> table = new HashMap<>(multipliers);
        table.put(state, multiplier);
        return new IntervalPolicy(table);
    }

    /**
     * Multiplier for a state.
     *
     * @param state lifecycle state
     * @return multiplier
     */
    public double multiplierFor(LifecycleState state) {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        return multipliers.get(state);
    }

    /**
     * Whether a task of the given priority skips its cycle in the given state.
     *
     * @param priority task priority
     * @param state lifecycle state
     * @return true if the cycle is skipped
     */
    public boolean shouldShed(Priority priority, LifecycleState state) {
        if (priority == null) {
            throw new IllegalArgumentException("priority cannot be null");
        }
        return priority.isShedIn(state);
    }

    /**
     * Table snapshot, ordered by phase then pressure level.
     *
     * @return multiplier per phase, per pressure level
     */
    public Map<LifecyclePhase, Map<PressureLevel, Double>> asTable() {
        Map<LifecyclePhase, Map<PressureLevel, Double>> table = new EnumMap<>(LifecyclePhase.class);
        for (LifecyclePhase phase : LifecyclePhase.values()) {
            Map<PressureLevel, Double> row = new EnumMap<>(PressureLevel.class);
            for (PressureLevel level : PressureLevel.values()) {
                row.put(level, multipliers.get(new LifecycleState(phase, level)));
            }
            table.put(phase, row);
        }
        return table;
    }

    private static void validateMultiplier(LifecycleState state, double multiplier) {
        if (!(multiplier > 0) || Double.isInfinite(multiplier)) {
            throw new IllegalArgumentException(
                "multiplier for " + state + " must be positive and finite (current: " + multiplier + ")"
            );
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return multipliers.equals(((IntervalPolicy) o).multipliers);
    }

    @Override
    public int hashCode() {
        return multipliers.hashCode();
    }

    @Override
    public String toString() {
        return "IntervalPolicy" + asTable();
    }
}
