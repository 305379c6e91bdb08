package com.ryuqq.governor.adapter.runner;

import com.ryuqq.governor.adapter.inmemory.cache.CacheStoreConfig;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Defaults and validation of the runner configuration records.
 *
 * @author Governor Team
 * @since 1.0.0
 */
class RunnerConfigTest {

    // ============================================================
    // CoordinatorConfig
    // ============================================================

    @Test
    void coordinatorConfig_Defaults() {
        CoordinatorConfig config = new CoordinatorConfig();

        assertThat(config.attemptTimeoutMs()).isEqualTo(15000);
        assertThat(config.maxAttempts()).isEqualTo(2);
        assertThat(config.backoffBaseMs()).isEqualTo(1000);
        assertThat(config.backoffMaxMs()).isEqualTo(30000);
        assertThat(config.backoffJitter()).isEqualTo(0.1);
        assertThat(config.maxConcurrent()).isEqualTo(3);
    }

    @Test
    void coordinatorConfig_InvalidValues_Throw() {
        CoordinatorConfig config = new CoordinatorConfig();

        assertThatThrownBy(() -> config.withAttemptTimeoutMs(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("current: 0");
        assertThatThrownBy(() -> config.withMaxAttempts(0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> config.withBackoff(500, 100))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> config.withMaxConcurrent(0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    // ============================================================
    // SchedulerConfig
    // ============================================================

    @Test
    void schedulerConfig_Defaults() {
        SchedulerConfig config = new SchedulerConfig();

        assertThat(config.samplingIntervalMs()).isEqualTo(30000);
        assertThat(config.elevatedThreshold()).isEqualTo(0.70);
        assertThat(config.criticalThreshold()).isEqualTo(0.85);
    }

    @Test
    void schedulerConfig_ThresholdsOutOfOrder_Throw() {
        assertThatThrownBy(() -> new SchedulerConfig().withThresholds(0.9, 0.8))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("criticalThreshold");
    }

    // ============================================================
    // JanitorConfig
    // ============================================================

    @Test
    void janitorConfig_Defaults() {
        JanitorConfig config = new JanitorConfig();

        assertThat(config.intervalMs()).isEqualTo(600000);
        assertThat(config.shrinkFactor()).isEqualTo(0.7);
        assertThat(config.minCapacityBytes()).isEqualTo(20L * 1024 * 1024);
        assertThat(config.purgeMaxIdleMs()).isEqualTo(3600000);
        assertThat(config.purgeMinAccessCount()).isEqualTo(3);
    }

    @Test
    void janitorConfig_InvalidShrinkFactor_Throws() {
        assertThatThrownBy(() -> new JanitorConfig().withShrink(0.0, 1024))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new JanitorConfig().withShrink(1.5, 1024))
            .isInstanceOf(IllegalArgumentException.class);
    }

    // ============================================================
    // GovernorConfig
    // ============================================================

    @Test
    void governorConfig_Defaults_AreConsistent() {
        GovernorConfig config = new GovernorConfig();

        assertThat(config.cache().capacityBytes()).isGreaterThanOrEqualTo(config.janitor().minCapacityBytes());
    }

    @Test
    void governorConfig_MinCapacityAboveCacheCapacity_Throws() {
        GovernorConfig config = new GovernorConfig();

        assertThatThrownBy(() -> config.withCache(CacheStoreConfig.ofCapacity(1024)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("minCapacityBytes");
    }

    @Test
    void governorConfig_NullPart_Throws() {
        assertThatThrownBy(() -> new GovernorConfig().withScheduler(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("scheduler");
    }
}
