package com.ryuqq.governor.core.spi;

/**
 * One reading of the resource-pressure signal.
 *
 * @param heapUtilization used / available memory ratio (0.0 ~ 1.0)
 * @param batterySaver whether the device reports a battery saver mode
 * @author Governor Team
 * @since 1.0.0
 */
public record PressureSample(double heapUtilization, boolean batterySaver) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException if heapUtilization is outside 0.0 ~ 1.0
     */
    public PressureSample {
        if (Double.isNaN(heapUtilization) || heapUtilization < 0.0 || heapUtilization > 1.0) {
            throw new IllegalArgumentException(
                "heapUtilization must be between 0.0 and 1.0 (current: " + heapUtilization + ")"
            );
        }
    }

    /**
     * Sample without a battery saver signal.
     *
     * @param heapUtilization used / available memory ratio
     * @return PressureSample instance
     */
    public static PressureSample ofUtilization(double heapUtilization) {
        return new PressureSample(heapUtilization, false);
    }
}
