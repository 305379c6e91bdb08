package com.ryuqq.governor.core.statemachine;

import com.ryuqq.governor.core.spi.PressureSample;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PressureLevel classification")
class PressureLevelTest {

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
        "0.0,  NORMAL",
        "0.69, NORMAL",
        "0.70, ELEVATED",
        "0.84, ELEVATED",
        "0.85, CRITICAL",
        "1.0,  CRITICAL"
    })
    void classify_ByThresholds(double utilization, PressureLevel expected) {
        assertEquals(expected, PressureLevel.classify(PressureSample.ofUtilization(utilization), 0.70, 0.85));
    }

    @Test
    @DisplayName("Battery saver raises NORMAL to ELEVATED but not past it")
    void classify_BatterySaver() {
        assertEquals(PressureLevel.ELEVATED, PressureLevel.classify(new PressureSample(0.1, true), 0.70, 0.85));
        assertEquals(PressureLevel.CRITICAL, PressureLevel.classify(new PressureSample(0.9, true), 0.70, 0.85));
    }

    @Test
    void classify_InvertedThresholds_ThrowsException() {
        assertThrows(
            IllegalArgumentException.class,
            () -> PressureLevel.classify(PressureSample.ofUtilization(0.5), 0.9, 0.8)
        );
    }
}
