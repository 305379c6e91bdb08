package com.ryuqq.governor.core.statemachine;

import com.ryuqq.governor.core.spi.PressureSample;

/**
 * Coarse classification of resource scarcity.
 *
 * <p><strong>Classification:</strong></p>
 * <pre>
 * heapUtilization &lt; elevatedThreshold                      → NORMAL
 * elevatedThreshold &lt;= heapUtilization &lt; criticalThreshold → ELEVATED
 * heapUtilization &gt;= criticalThreshold                     → CRITICAL
 * batterySaver                                             → at least ELEVATED
 * </pre>
 *
 * @author Governor Team
 * @since 1.0.0
 */
public enum PressureLevel {

    NORMAL,

    ELEVATED,

    /**
     * Only essential work should keep running.
     */
    CRITICAL;

    /**
     * Classifies a pressure sample.
     *
     * @param sample pressure sample
     * @param elevatedThreshold utilization at which ELEVATED starts
     * @param criticalThreshold utilization at which CRITICAL starts
     * @return pressure level
     * @throws IllegalArgumentException if sample is null or thresholds are out of order
     */
    public static PressureLevel classify(PressureSample sample, double elevatedThreshold, double criticalThreshold) {
        if (sample == null) {
            throw new IllegalArgumentException("sample cannot be null");
        }
        if (elevatedThreshold > criticalThreshold) {
            throw new IllegalArgumentException(
                "elevatedThreshold must be <= criticalThreshold (elevated: " + elevatedThreshold
                    + ", critical: " + criticalThreshold + ")"
            );
        }

        double utilization = sample.heapUtilization();
        if (utilization >= criticalThreshold) {
            return CRITICAL;
        }
        if (utilization >= elevatedThreshold || sample.batterySaver()) {
            return ELEVATED;
        }
        return NORMAL;
    }
}
