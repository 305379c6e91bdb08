package com.ryuqq.governor.adapter.runner;

import com.ryuqq.governor.core.spi.PressureSample;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class JvmHeapPressureSamplerTest {

    @Test
    void sample_ReportsUtilizationWithinBounds() {
        PressureSample sample = new JvmHeapPressureSampler().sample();

        assertThat(sample.heapUtilization()).isBetween(0.0, 1.0);
        assertThat(sample.batterySaver()).isFalse();
    }

    @Test
    void sample_ReportsBatterySaverFromSupplier() {
        PressureSample sample = new JvmHeapPressureSampler(() -> true).sample();

        assertThat(sample.batterySaver()).isTrue();
    }

    @Test
    void utilization_IsClampedAndSafeForEmptyLimit() {
        assertThat(JvmHeapPressureSampler.utilization(50, 100)).isEqualTo(0.5);
        assertThat(JvmHeapPressureSampler.utilization(150, 100)).isEqualTo(1.0);
        assertThat(JvmHeapPressureSampler.utilization(-1, 100)).isEqualTo(0.0);
        assertThat(JvmHeapPressureSampler.utilization(10, 0)).isEqualTo(0.0);
    }
}
