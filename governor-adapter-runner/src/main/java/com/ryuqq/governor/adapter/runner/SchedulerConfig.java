package com.ryuqq.governor.adapter.runner;

/**
 * Lifecycle scheduler configuration (immutable record).
 *
 * <p><strong>Settings:</strong></p>
 * <ul>
 *   <li>samplingIntervalMs: pressure sampling period (default 30000ms)</li>
 *   <li>elevatedThreshold: utilization at which pressure becomes ELEVATED (default 0.70)</li>
 *   <li>criticalThreshold: utilization at which pressure becomes CRITICAL (default 0.85)</li>
 * </ul>
 *
 * @author Governor Team
 * @since 1.0.0
 * @param samplingIntervalMs sampling period (milliseconds, positive)
 * @param elevatedThreshold low threshold (0.0 ~ 1.0)
 * @param criticalThreshold high threshold (elevatedThreshold ~ 1.0)
 */
public record SchedulerConfig(
    long samplingIntervalMs,
    double elevatedThreshold,
    double criticalThreshold
) {

    public SchedulerConfig() {
        this(30000, 0.70, 0.85);
    }

    public SchedulerConfig {
        if (samplingIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "samplingIntervalMs must be positive (current: " + samplingIntervalMs + ")"
            );
        }
        if (elevatedThreshold < 0.0 || elevatedThreshold > 1.0) {
            throw new IllegalArgumentException(
                "elevatedThreshold must be between 0.0 and 1.0 (current: " + elevatedThreshold + ")"
            );
        }
        if (criticalThreshold < elevatedThreshold || criticalThreshold > 1.0) {
            throw new IllegalArgumentException(
                "criticalThreshold must be between elevatedThreshold and 1.0 (elevated: "
                    + elevatedThreshold + ", critical: " + criticalThreshold + ")"
            );
        }
    }

    public SchedulerConfig withSamplingIntervalMs(long samplingIntervalMs) {
        return new SchedulerConfig(samplingIntervalMs, elevatedThreshold, criticalThreshold);
    }

    public SchedulerConfig withThresholds(double elevatedThreshold, double criticalThreshold) {
        return new SchedulerConfig(samplingIntervalMs, elevatedThreshold, criticalThreshold);
    }
}
