package com.ryuqq.governor.core.spi;

/**
 * Source of periodic resource-pressure readings.
 *
 * @author Governor Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface PressureSampler {

    /**
     * Takes a reading.
     *
     * @return current pressure sample
     * @throws Exception if the signal is unavailable
     */
    PressureSample sample() throws Exception;
}
