package com.ryuqq.governor.adapter.runner;

import com.ryuqq.governor.adapter.inmemory.cache.CacheStoreConfig;
import com.ryuqq.governor.adapter.inmemory.cache.InMemoryCacheStore;
import com.ryuqq.governor.adapter.inmemory.ratelimit.FixedWindowRateLimiter;
import com.ryuqq.governor.adapter.inmemory.ratelimit.PrefixActionKeyResolver;
import com.ryuqq.governor.application.coordinator.CoordinatorMetrics;
import com.ryuqq.governor.core.contract.RequestOptions;
import com.ryuqq.governor.core.contract.Work;
import com.ryuqq.governor.core.error.GovernorError;
import com.ryuqq.governor.core.error.OperationTimeoutException;
import com.ryuqq.governor.core.error.RateLimitExceededException;
import com.ryuqq.governor.core.error.WorkFailedException;
import com.ryuqq.governor.core.protection.RateLimiterConfig;
import com.ryuqq.governor.core.protection.noop.NoOpRateLimiter;
import com.ryuqq.governor.core.spi.CacheStore;
import com.ryuqq.governor.testkit.fake.ManualClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * DefaultRequestCoordinator unit test.
 *
 * <ul>
 *   <li>Cache lookup and write-back</li>
 *   <li>Rate limiting per action class</li>
 *   <li>Single-flight joining</li>
 *   <li>Timeout and retry with backoff</li>
 * </ul>
 *
 * @author Governor Team
 * @since 1.0.0
 */
class DefaultRequestCoordinatorTest {

    private static final CoordinatorConfig CONFIG = new CoordinatorConfig()
        .withAttemptTimeoutMs(200)
        .withMaxAttempts(3)
        .withBackoff(1, 5)
        .withBackoffJitter(0.0);

    private ManualClock clock;
    private InMemoryCacheStore cacheStore;
    private DefaultRequestCoordinator coordinator;

    @BeforeEach
    void setUp() {
        clock = new ManualClock();
        cacheStore = new InMemoryCacheStore(CacheStoreConfig.ofCapacity(1024 * 1024), clock);
        coordinator = newCoordinator(new RateLimiterConfig(), CONFIG);
    }

    private DefaultRequestCoordinator newCoordinator(RateLimiterConfig limits, CoordinatorConfig config) {
        return new DefaultRequestCoordinator(
            cacheStore,
            new FixedWindowRateLimiter(limits, clock),
            new PrefixActionKeyResolver(),
            config
        );
    }

    private static Work<String> counting(AtomicInteger calls, String value) {
        return () -> {
            calls.incrementAndGet();
            return CompletableFuture.completedFuture(value);
        };
    }

    private static Throwable failureOf(CompletableFuture<?> future) throws Exception {
        try {
            future.get(2, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            return e.getCause();
        }
        return fail("expected the future to fail");
    }

    // ============================================================
    // 1. Cache
    // ============================================================

    @Test
    void execute_CacheHit_ReturnsCachedValueWithoutRunningWork() throws Exception {
        // given
        cacheStore.put("user:1", "cached");
        AtomicInteger calls = new AtomicInteger();

        // when
        String result = coordinator.execute("user:1", counting(calls, "fresh")).get(2, TimeUnit.SECONDS);

        // then
        assertThat(result).isEqualTo("cached");
        assertThat(calls).hasValue(0);
        assertThat(coordinator.metrics().cacheHits()).isEqualTo(1);
    }

    @Test
    void execute_CacheMiss_RunsWorkAndCachesResult() throws Exception {
        // given
        AtomicInteger calls = new AtomicInteger();

        // when
        String result = coordinator.execute("user:1", counting(calls, "fresh")).get(2, TimeUnit.SECONDS);

        // then
        assertThat(result).isEqualTo("fresh");
        assertThat(calls).hasValue(1);
        assertThat(cacheStore.get("user:1")).contains("fresh");
        assertThat(coordinator.metrics().cacheMisses()).isEqualTo(1);
    }

    @Test
    void execute_CachedResultHonoursTtl() throws Exception {
        // given
        AtomicInteger calls = new AtomicInteger();
        RequestOptions options = RequestOptions.defaults().withCacheTtl(Duration.ofSeconds(10));
        coordinator.execute("user:1", counting(calls, "v"), options).get(2, TimeUnit.SECONDS);

        // when
        clock.advance(Duration.ofSeconds(11));
        coordinator.execute("user:1", counting(calls, "v"), options).get(2, TimeUnit.SECONDS);

        // then
        assertThat(calls).hasValue(2);
    }

    @Test
    void execute_UseCacheFalse_NeitherReadsNorWritesCache() throws Exception {
        // given
        cacheStore.put("user:1", "cached");
        AtomicInteger calls = new AtomicInteger();

        // when
        String result = coordinator.execute("user:1", counting(calls, "fresh"), RequestOptions.uncached())
            .get(2, TimeUnit.SECONDS);

        // then
        assertThat(result).isEqualTo("fresh");
        assertThat(calls).hasValue(1);
        assertThat(cacheStore.get("user:1")).contains("cached");
    }

    @Test
    void execute_NullResult_IsReturnedButNotCached() throws Exception {
        // given
        Work<String> work = () -> CompletableFuture.completedFuture(null);

        // when
        String result = coordinator.execute("user:1", work).get(2, TimeUnit.SECONDS);

        // then
        assertThat(result).isNull();
        assertThat(cacheStore.contains("user:1")).isFalse();
    }

    @Test
    void execute_CacheWriteFailure_StillDeliversResult() throws Exception {
        // given
        CacheStore failingStore = mock(CacheStore.class);
        when(failingStore.get("user:1")).thenReturn(Optional.empty());
        doThrow(new IllegalStateException("store broken")).when(failingStore).put(eq("user:1"), any(), any());
        DefaultRequestCoordinator withFailingStore = new DefaultRequestCoordinator(
            failingStore, new NoOpRateLimiter(), new PrefixActionKeyResolver(), CONFIG);

        // when
        String result = withFailingStore.execute("user:1", () -> CompletableFuture.completedFuture("v"))
            .get(2, TimeUnit.SECONDS);

        // then
        assertThat(result).isEqualTo("v");
        assertThat(withFailingStore.metrics().inFlight()).isZero();
    }

    // ============================================================
    // 2. Rate limit
    // ============================================================

    @Test
    void execute_RateLimitExceeded_FailsWithoutRunningWork() throws Exception {
        // given
        coordinator = newCoordinator(new RateLimiterConfig(2, 1000, 100), CONFIG);
        AtomicInteger calls = new AtomicInteger();
        coordinator.execute("search:a", counting(calls, "a"), RequestOptions.uncached()).get(2, TimeUnit.SECONDS);
        coordinator.execute("search:b", counting(calls, "b"), RequestOptions.uncached()).get(2, TimeUnit.SECONDS);

        // when
        CompletableFuture<String> limited =
            coordinator.execute("search:c", counting(calls, "c"), RequestOptions.uncached());

        // then
        assertThat(failureOf(limited))
            .isInstanceOfSatisfying(RateLimitExceededException.class, e -> {
                assertThat(e.getActionKey().getValue()).isEqualTo("search");
                assertThat(e.getError()).isEqualTo(GovernorError.RATE_LIMIT_EXCEEDED);
            });
        assertThat(calls).hasValue(2);
        assertThat(coordinator.metrics().rateLimited()).isEqualTo(1);
    }

    @Test
    void execute_RateLimit_IsTrackedPerActionClass() throws Exception {
        // given
        coordinator = newCoordinator(new RateLimiterConfig(1, 1000, 100), CONFIG);
        AtomicInteger calls = new AtomicInteger();
        coordinator.execute("search:a", counting(calls, "a"), RequestOptions.uncached()).get(2, TimeUnit.SECONDS);

        // when
        String other = coordinator.execute("profile:a", counting(calls, "p"), RequestOptions.uncached())
            .get(2, TimeUnit.SECONDS);

        // then
        assertThat(other).isEqualTo("p");
    }

    @Test
    void execute_CacheHit_DoesNotConsumeRateLimit() throws Exception {
        // given
        coordinator = newCoordinator(new RateLimiterConfig(1, 1000, 100), CONFIG);
        cacheStore.put("search:cached", "hit");
        coordinator.execute("search:cached", counting(new AtomicInteger(), "x")).get(2, TimeUnit.SECONDS);

        // when
        String result = coordinator.execute("search:miss", counting(new AtomicInteger(), "miss"))
            .get(2, TimeUnit.SECONDS);

        // then
        assertThat(result).isEqualTo("miss");
    }

    @Test
    void execute_WindowRollover_AllowsRequestsAgain() throws Exception {
        // given
        coordinator = newCoordinator(new RateLimiterConfig(1, 1000, 100), CONFIG);
        AtomicInteger calls = new AtomicInteger();
        coordinator.execute("search:a", counting(calls, "a"), RequestOptions.uncached()).get(2, TimeUnit.SECONDS);

        // when
        clock.advanceMillis(1000);
        String result = coordinator.execute("search:b", counting(calls, "b"), RequestOptions.uncached())
            .get(2, TimeUnit.SECONDS);

        // then
        assertThat(result).isEqualTo("b");
    }

    // ============================================================
    // 3. Single-flight
    // ============================================================

    @Test
    void execute_SameKeyWhileInFlight_JoinsSingleExecution() throws Exception {
        // given
        AtomicInteger calls = new AtomicInteger();
        CompletableFuture<String> gate = new CompletableFuture<>();
        Work<String> work = () -> {
            calls.incrementAndGet();
            return gate;
        };

        // when
        List<CompletableFuture<String>> callers = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            callers.add(coordinator.execute("user:1", work, RequestOptions.uncached()));
        }
        assertThat(coordinator.metrics().inFlight()).isEqualTo(1);
        gate.complete("shared");

        // then
        for (CompletableFuture<String> caller : callers) {
            assertThat(caller.get(2, TimeUnit.SECONDS)).isEqualTo("shared");
        }
        assertThat(calls).hasValue(1);
        CoordinatorMetrics metrics = coordinator.metrics();
        assertThat(metrics.joined()).isEqualTo(4);
        assertThat(metrics.executions()).isEqualTo(1);
        assertThat(metrics.inFlight()).isZero();
    }

    @Test
    void execute_JoinedFailure_PropagatesToEveryCaller() throws Exception {
        // given
        CompletableFuture<String> gate = new CompletableFuture<>();
        RequestOptions noRetry = RequestOptions.uncached().withRetry(false);
        CompletableFuture<String> first = coordinator.execute("user:1", () -> gate, noRetry);
        CompletableFuture<String> second = coordinator.execute("user:1", () -> gate, noRetry);

        // when
        gate.completeExceptionally(new IllegalStateException("upstream down"));

        // then
        assertThat(failureOf(first)).isInstanceOf(WorkFailedException.class);
        assertThat(failureOf(second)).isInstanceOf(WorkFailedException.class);
    }

    @Test
    void execute_CancellingOneCaller_DoesNotAffectOthers() throws Exception {
        // given
        CompletableFuture<String> gate = new CompletableFuture<>();
        CompletableFuture<String> first = coordinator.execute("user:1", () -> gate, RequestOptions.uncached());
        CompletableFuture<String> second = coordinator.execute("user:1", () -> gate, RequestOptions.uncached());

        // when
        first.cancel(true);
        gate.complete("value");

        // then
        assertThat(first).isCancelled();
        assertThat(second.get(2, TimeUnit.SECONDS)).isEqualTo("value");
    }

    @Test
    void execute_AfterSettlement_StartsNewExecution() throws Exception {
        // given
        AtomicInteger calls = new AtomicInteger();
        coordinator.execute("user:1", counting(calls, "a"), RequestOptions.uncached()).get(2, TimeUnit.SECONDS);

        // when
        coordinator.execute("user:1", counting(calls, "b"), RequestOptions.uncached()).get(2, TimeUnit.SECONDS);

        // then
        assertThat(calls).hasValue(2);
    }

    @Test
    void execute_JoinerSeesCachedValueAfterSettlement() throws Exception {
        // given
        CompletableFuture<String> gate = new CompletableFuture<>();
        CompletableFuture<String> owner = coordinator.execute("user:1", () -> gate);

        // when
        gate.complete("fresh");
        owner.get(2, TimeUnit.SECONDS);

        // then
        assertThat(cacheStore.get("user:1")).contains("fresh");
        assertThat(coordinator.metrics().inFlight()).isZero();
    }

    // ============================================================
    // 4. Timeout and retry
    // ============================================================

    @Test
    void execute_FailingThenSucceeding_Retries() throws Exception {
        // given
        AtomicInteger calls = new AtomicInteger();
        Work<String> work = () -> calls.incrementAndGet() == 1
            ? CompletableFuture.failedFuture(new IllegalStateException("flaky"))
            : CompletableFuture.completedFuture("ok");

        // when
        String result = coordinator.execute("user:1", work).get(2, TimeUnit.SECONDS);

        // then
        assertThat(result).isEqualTo("ok");
        assertThat(calls).hasValue(2);
        assertThat(coordinator.metrics().retries()).isEqualTo(1);
    }

    @Test
    void execute_AlwaysFailing_SurfacesWorkFailedAfterMaxAttempts() throws Exception {
        // given
        AtomicInteger calls = new AtomicInteger();
        IllegalStateException cause = new IllegalStateException("upstream down");
        Work<String> work = () -> {
            calls.incrementAndGet();
            return CompletableFuture.failedFuture(cause);
        };

        // when
        Throwable failure = failureOf(coordinator.execute("user:1", work));

        // then
        assertThat(failure).isInstanceOfSatisfying(WorkFailedException.class, e -> {
            assertThat(e.getAttempts()).isEqualTo(3);
            assertThat(e.getCause()).isSameAs(cause);
            assertThat(e.getError()).isEqualTo(GovernorError.WORK_FAILED);
        });
        assertThat(calls).hasValue(3);
        assertThat(coordinator.metrics().failures()).isEqualTo(1);
        assertThat(cacheStore.contains("user:1")).isFalse();
    }

    @Test
    void execute_RetryDisabled_RunsOnce() throws Exception {
        // given
        AtomicInteger calls = new AtomicInteger();
        Work<String> work = () -> {
            calls.incrementAndGet();
            throw new IllegalStateException("thrown at start");
        };

        // when
        Throwable failure = failureOf(coordinator.execute("user:1", work, RequestOptions.defaults().withRetry(false)));

        // then
        assertThat(failure).isInstanceOf(WorkFailedException.class);
        assertThat(calls).hasValue(1);
    }

    @Test
    void execute_WorkNeverCompletes_TimesOut() throws Exception {
        // given
        coordinator = newCoordinator(new RateLimiterConfig(), CONFIG.withAttemptTimeoutMs(50).withMaxAttempts(1));
        Work<String> work = CompletableFuture::new;

        // when
        Throwable failure = failureOf(coordinator.execute("user:1", work));

        // then
        assertThat(failure).isInstanceOfSatisfying(OperationTimeoutException.class, e -> {
            assertThat(e.getTimeoutMs()).isEqualTo(50);
            assertThat(e.getError()).isEqualTo(GovernorError.TIMEOUT);
        });
        assertThat(coordinator.metrics().inFlight()).isZero();
    }

    @Test
    void execute_TimeoutThenSuccess_RetriesAfterTimeout() throws Exception {
        // given
        coordinator = newCoordinator(new RateLimiterConfig(), CONFIG.withAttemptTimeoutMs(50));
        AtomicInteger calls = new AtomicInteger();
        Work<String> work = () -> calls.incrementAndGet() == 1
            ? new CompletableFuture<>()
            : CompletableFuture.completedFuture("second");

        // when
        String result = coordinator.execute("user:1", work).get(2, TimeUnit.SECONDS);

        // then
        assertThat(result).isEqualTo("second");
        assertThat(calls).hasValue(2);
    }

    @Test
    void execute_WorkReturningNoStage_FailsAsWorkFailure() throws Exception {
        // given
        Work<String> work = () -> null;

        // when
        Throwable failure = failureOf(coordinator.execute("user:1", work, RequestOptions.defaults().withRetry(false)));

        // then
        assertThat(failure).isInstanceOf(WorkFailedException.class)
            .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void execute_WorkThrowingError_SettlesKeyAndAllowsNextExecution() throws Exception {
        // given
        AtomicInteger calls = new AtomicInteger();
        Work<String> work = () -> {
            calls.incrementAndGet();
            throw new AssertionError("boom");
        };

        // when
        Throwable failure = failureOf(coordinator.execute("user:1", work));

        // then
        assertThat(failure).isInstanceOf(WorkFailedException.class)
            .hasCauseInstanceOf(AssertionError.class);
        assertThat(calls).hasValue(CONFIG.maxAttempts());
        assertThat(coordinator.metrics().inFlight()).isZero();

        String next = coordinator.execute("user:1", () -> CompletableFuture.completedFuture("recovered"))
            .get(2, TimeUnit.SECONDS);
        assertThat(next).isEqualTo("recovered");
    }

    // ============================================================
    // 5. Validation
    // ============================================================

    @Test
    void execute_InvalidArguments_ThrowIllegalArgument() {
        Work<String> work = () -> CompletableFuture.completedFuture("v");

        assertThatThrownBy(() -> coordinator.execute(" ", work))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("key");
        assertThatThrownBy(() -> coordinator.execute("k", null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("work");
        assertThatThrownBy(() -> coordinator.execute("k", work, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("options");
    }

    @Test
    void constructor_NullDependency_ThrowsIllegalArgument() {
        assertThatThrownBy(() -> new DefaultRequestCoordinator(
            null, new NoOpRateLimiter(), new PrefixActionKeyResolver(), CONFIG))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("cacheStore");
        assertThatThrownBy(() -> new DefaultRequestCoordinator(
            cacheStore, new NoOpRateLimiter(), new PrefixActionKeyResolver(), null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("config");
    }
}
