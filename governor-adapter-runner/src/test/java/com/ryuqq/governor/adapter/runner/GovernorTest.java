package com.ryuqq.governor.adapter.runner;

import com.ryuqq.governor.adapter.inmemory.cache.CacheStoreConfig;
import com.ryuqq.governor.adapter.inmemory.persistence.InMemoryPersistenceBackend;
import com.ryuqq.governor.core.spi.PressureSample;
import com.ryuqq.governor.core.statemachine.LifecyclePhase;
import com.ryuqq.governor.core.statemachine.PressureLevel;
import com.ryuqq.governor.testkit.fake.ManualClock;
import com.ryuqq.governor.testkit.fake.ManualLifecycleEventSource;
import com.ryuqq.governor.testkit.fake.ScriptedPressureSampler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end wiring of cache, coordinator, scheduler and janitor.
 *
 * @author Governor Team
 * @since 1.0.0
 */
class GovernorTest {

    private ManualClock clock;
    private ManualLifecycleEventSource eventSource;
    private ScriptedPressureSampler sampler;
    private InMemoryPersistenceBackend backend;
    private Governor governor;

    @BeforeEach
    void setUp() {
        clock = new ManualClock();
        eventSource = new ManualLifecycleEventSource();
        sampler = new ScriptedPressureSampler();
        backend = new InMemoryPersistenceBackend();
        GovernorConfig config = new GovernorConfig()
            .withJanitor(new JanitorConfig().withShrink(0.5, 1024).withPurge(60_000, 2))
            .withCache(CacheStoreConfig.ofCapacity(4096))
            .withScheduler(new SchedulerConfig().withSamplingIntervalMs(3_600_000));
        governor = new Governor(config, eventSource, sampler, backend, clock);
    }

    @AfterEach
    void tearDown() {
        governor.close();
    }

    private static void awaitCondition(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("condition not met within 5s");
            }
            Thread.sleep(5);
        }
    }

    @Test
    void execute_CachesResultAndMirrorsItToPersistence() throws Exception {
        // given
        governor.start();

        // when
        String result = governor.coordinator()
            .execute("profile:7", () -> CompletableFuture.completedFuture("alice"))
            .get(2, TimeUnit.SECONDS);

        // then
        assertThat(result).isEqualTo("alice");
        assertThat(governor.cacheStore().get("profile:7")).contains("alice");
        awaitCondition(() -> backend.read("profile:7").isPresent());
        assertThat(new String(backend.read("profile:7").orElseThrow(), StandardCharsets.UTF_8))
            .isEqualTo("\"alice\"");
    }

    @Test
    void criticalPressure_ShrinksCache() throws Exception {
        // given
        sampler.thenReturn(PressureSample.ofUtilization(0.95));

        // when
        governor.start();

        // then
        awaitCondition(() -> governor.scheduler().currentState().pressureLevel() == PressureLevel.CRITICAL);
        awaitCondition(() -> governor.cacheStore().stats().capacityBytes() == 2048);
    }

    @Test
    void enteringBackground_PurgesRarelyUsedEntries() throws Exception {
        // given
        governor.start();
        awaitCondition(() -> sampler.callCount() >= 1);
        governor.cacheStore().put("cold", "c");
        governor.cacheStore().put("warm", "w");
        governor.cacheStore().get("warm");

        // when
        eventSource.emit(LifecyclePhase.BACKGROUND);

        // then
        assertThat(governor.cacheStore().contains("cold")).isFalse();
        assertThat(governor.cacheStore().contains("warm")).isTrue();
        assertThat(governor.scheduler().intervalMultiplier()).isEqualTo(3.0);
    }

    @Test
    void start_RegistersJanitorTask() {
        // when
        governor.start();

        // then
        assertThat(((AdaptiveLifecycleScheduler) governor.scheduler()).registeredTaskIds())
            .contains(CacheJanitor.TASK_ID);
    }

    @Test
    void janitorPass_RemovesExpiredEntries() {
        // given
        governor.cacheStore().put("short", "s", Duration.ofSeconds(1));
        clock.advance(Duration.ofSeconds(5));

        // when
        int removed = governor.janitor().runPass().removedEntries();

        // then
        assertThat(removed).isEqualTo(1);
    }

    @Test
    void close_StopsScheduler() {
        // given
        governor.start();

        // when
        governor.close();

        // then
        assertThat(eventSource.subscriberCount()).isZero();
        assertThatThrownBy(() -> governor.scheduler().registerTask("late", Duration.ofSeconds(1), () -> { }))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void constructor_NullArguments_Throw() {
        assertThatThrownBy(() -> new Governor(null, eventSource))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("config");
        assertThatThrownBy(() -> new Governor(new GovernorConfig(), null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("eventSource");
    }
}
