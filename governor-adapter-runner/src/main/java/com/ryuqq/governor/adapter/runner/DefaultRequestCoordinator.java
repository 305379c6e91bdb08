package com.ryuqq.governor.adapter.runner;

import com.ryuqq.governor.application.coordinator.CoordinatorMetrics;
import com.ryuqq.governor.application.coordinator.RequestCoordinator;
import com.ryuqq.governor.core.contract.RequestOptions;
import com.ryuqq.governor.core.contract.Work;
import com.ryuqq.governor.core.error.CacheWriteFailedException;
import com.ryuqq.governor.core.error.GovernorException;
import com.ryuqq.governor.core.error.OperationTimeoutException;
import com.ryuqq.governor.core.error.RateLimitExceededException;
import com.ryuqq.governor.core.error.WorkFailedException;
import com.ryuqq.governor.core.model.ActionKey;
import com.ryuqq.governor.core.outcome.Fail;
import com.ryuqq.governor.core.outcome.Ok;
import com.ryuqq.governor.core.outcome.Outcome;
import com.ryuqq.governor.core.protection.ActionKeyResolver;
import com.ryuqq.governor.core.protection.RateLimiter;
import com.ryuqq.governor.core.spi.CacheStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReferenceArray;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Default {@link RequestCoordinator}.
 *
 * <p><strong>Single-flight:</strong> the first caller for a key registers a shared future in
 * the in-flight registry and runs the work; later callers receive a copy of that future. The
 * registry is guarded by its own lock, held for one map operation at a time.</p>
 *
 * <p><strong>Settlement order:</strong></p>
 * <ol>
 *   <li>Remove the key from the in-flight registry</li>
 *   <li>On success with {@code useCache}, write the result to the cache (failures are logged)</li>
 *   <li>Complete the shared future, releasing every waiter</li>
 * </ol>
 *
 * <p><strong>Retry:</strong> each attempt is bounded by {@code attemptTimeoutMs}. A failed or
 * timed-out attempt is retried after a {@link BackoffCalculator} delay, scheduled on a
 * delayed executor, until {@code maxAttempts} is reached. The surfaced failure is
 * {@link OperationTimeoutException} if the last attempt timed out, otherwise
 * {@link WorkFailedException}.</p>
 *
 * <p>Work is never cancelled; an attempt that times out may still complete in the
 * background and its result is ignored.</p>
 *
 * @author Governor Team
 * @since 1.0.0
 */
public final class DefaultRequestCoordinator implements RequestCoordinator {

    private static final Logger log = LoggerFactory.getLogger(DefaultRequestCoordinator.class);

    private final CacheStore cacheStore;
    private final RateLimiter rateLimiter;
    private final ActionKeyResolver actionKeyResolver;
    private final CoordinatorConfig config;
    private final BackoffCalculator backoffCalculator;

    private final ReentrantLock inFlightLock = new ReentrantLock();
    private final Map<String, CompletableFuture<Object>> inFlight = new HashMap<>();

    private final AtomicLong cacheHits = new AtomicLong();
    private final AtomicLong cacheMisses = new AtomicLong();
    private final AtomicLong rateLimited = new AtomicLong();
    private final AtomicLong joined = new AtomicLong();
    private final AtomicLong executions = new AtomicLong();
    private final AtomicLong retries = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();

    /**
     * Coordinator with a backoff derived from the configuration.
     *
     * @param cacheStore cache store
     * @param rateLimiter rate limiter
     * @param actionKeyResolver maps a key to its action class
     * @param config coordinator configuration
     */
    public DefaultRequestCoordinator(
            CacheStore cacheStore,
            RateLimiter rateLimiter,
            ActionKeyResolver actionKeyResolver,
            CoordinatorConfig config) {
        this(cacheStore, rateLimiter, actionKeyResolver, config,
            config == null ? null : BackoffCalculator.from(config));
    }

    /**
     * Coordinator with an explicit backoff.
     *
     * @param cacheStore cache store
     * @param rateLimiter rate limiter
     * @param actionKeyResolver maps a key to its action class
     * @param config coordinator configuration
     * @param backoffCalculator retry delay calculator
     * @throws IllegalArgumentException if a dependency is null
     */
    public DefaultRequestCoordinator(
            CacheStore cacheStore,
            RateLimiter rateLimiter,
            ActionKeyResolver actionKeyResolver,
            CoordinatorConfig config,
            BackoffCalculator backoffCalculator) {
        if (cacheStore == null) {
            throw new IllegalArgumentException("cacheStore cannot be null");
        }
        if (rateLimiter == null) {
            throw new IllegalArgumentException("rateLimiter cannot be null");
        }
        if (actionKeyResolver == null) {
            throw new IllegalArgumentException("actionKeyResolver cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (backoffCalculator == null) {
            throw new IllegalArgumentException("backoffCalculator cannot be null");
        }
        this.cacheStore = cacheStore;
        this.rateLimiter = rateLimiter;
        this.actionKeyResolver = actionKeyResolver;
        this.config = config;
        this.backoffCalculator = backoffCalculator;
    }

    @Override
    public <T> CompletableFuture<T> execute(String key, Work<T> work, RequestOptions options) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key cannot be null or blank");
        }
        if (work == null) {
            throw new IllegalArgumentException("work cannot be null");
        }
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }

        // 1. cache
        if (options.useCache()) {
            Optional<Object> cached = cacheStore.get(key);
            if (cached.isPresent()) {
                cacheHits.incrementAndGet();
                log.debug("Cache hit for key {}", key);
                return typed(CompletableFuture.completedFuture(cached.get()));
            }
            cacheMisses.incrementAndGet();
        }

        // 2. rate limit
        ActionKey actionKey = actionKeyResolver.resolve(key);
        if (!rateLimiter.tryAcquire(actionKey)) {
            rateLimited.incrementAndGet();
            log.debug("Rate limit exceeded for key {} ({})", key, actionKey.getValue());
            return CompletableFuture.failedFuture(new RateLimitExceededException(actionKey));
        }

        // 3. join or register
        CompletableFuture<Object> shared;
        boolean owner = false;
        inFlightLock.lock();
        try {
            shared = inFlight.get(key);
            if (shared == null) {
                shared = new CompletableFuture<>();
                inFlight.put(key, shared);
                owner = true;
            }
        } finally {
            inFlightLock.unlock();
        }

        if (!owner) {
            joined.incrementAndGet();
            log.debug("Joined in-flight execution for key {}", key);
            return typed(shared.copy());
        }

        // 4. execute
        executions.incrementAndGet();
        log.debug("Executing work for key {} (priority {})", key, options.priority());
        runAttempt(key, work, options, 1, shared);
        return typed(shared.copy());
    }

    @Override
    public <T> CompletableFuture<List<Outcome<T>>> executeBatch(List<? extends Work<T>> works) {
        if (works == null) {
            throw new IllegalArgumentException("works cannot be null");
        }
        int size = works.size();
        if (size == 0) {
            return CompletableFuture.completedFuture(List.of());
        }

        for (int i = 0; i < size; i++) {
            if (works.get(i) == null) {
                throw new IllegalArgumentException("works[" + i + "] cannot be null");
            }
        }

        BatchRun<T> run = new BatchRun<>(List.copyOf(works), Math.min(config.maxConcurrent(), size));
        run.drain();
        return run.result;
    }

    @Override
    public CoordinatorMetrics metrics() {
        int inFlightCount;
        inFlightLock.lock();
        try {
            inFlightCount = inFlight.size();
        } finally {
            inFlightLock.unlock();
        }
        return new CoordinatorMetrics(
            inFlightCount,
            cacheHits.get(),
            cacheMisses.get(),
            rateLimited.get(),
            joined.get(),
            executions.get(),
            retries.get(),
            failures.get()
        );
    }

    private <T> void runAttempt(
            String key,
            Work<T> work,
            RequestOptions options,
            int attempt,
            CompletableFuture<Object> shared) {
        startAttempt(work).whenComplete((value, error) -> {
            if (error == null) {
                settleSuccess(key, value, options, shared);
                return;
            }
            Throwable cause = unwrap(error);
            if (options.retry() && attempt < config.maxAttempts()) {
                long delayMs = backoffCalculator.calculate(attempt);
                retries.incrementAndGet();
                log.debug("Attempt {} for key {} failed ({}), retrying in {}ms",
                    attempt, key, cause.toString(), delayMs);
                CompletableFuture.delayedExecutor(delayMs, TimeUnit.MILLISECONDS)
                    .execute(() -> runAttempt(key, work, options, attempt + 1, shared));
                return;
            }
            settleFailure(key, toFailure(key, attempt, cause), shared);
        });
    }

    /**
     * Starts one attempt bounded by the attempt timeout. Never throws; anything thrown while
     * starting, errors included, completes the returned future exceptionally.
     */
    private <T> CompletableFuture<T> startAttempt(Work<T> work) {
        CompletableFuture<T> attempt = new CompletableFuture<>();
        try {
            CompletionStage<T> stage = work.start();
            if (stage == null) {
                attempt.completeExceptionally(new IllegalStateException("work returned no completion stage"));
            } else {
                stage.whenComplete((value, error) -> {
                    if (error != null) {
                        attempt.completeExceptionally(error);
                    } else {
                        attempt.complete(value);
                    }
                });
            }
        } catch (Throwable t) {
            attempt.completeExceptionally(t);
        }
        return attempt.orTimeout(config.attemptTimeoutMs(), TimeUnit.MILLISECONDS);
    }

    private void settleSuccess(String key, Object value, RequestOptions options, CompletableFuture<Object> shared) {
        unregister(key, shared);
        if (options.useCache()) {
            writeToCache(key, value, options);
        }
        shared.complete(value);
    }

    private void settleFailure(String key, GovernorException failure, CompletableFuture<Object> shared) {
        unregister(key, shared);
        failures.incrementAndGet();
        log.debug("Execution for key {} failed: {}", key, failure.getMessage());
        shared.completeExceptionally(failure);
    }

    private void writeToCache(String key, Object value, RequestOptions options) {
        if (value == null) {
            log.debug("Result for key {} is null, not cached", key);
            return;
        }
        try {
            cacheStore.put(key, value, options.cacheTtl());
        } catch (RuntimeException e) {
            CacheWriteFailedException failure = new CacheWriteFailedException(key, e);
            log.warn("{}: {}", failure.getMessage(), e.getMessage());
        }
    }

    private void unregister(String key, CompletableFuture<Object> shared) {
        inFlightLock.lock();
        try {
            inFlight.remove(key, shared);
        } finally {
            inFlightLock.unlock();
        }
    }

    private GovernorException toFailure(String key, int attempts, Throwable cause) {
        if (cause instanceof TimeoutException) {
            return new OperationTimeoutException(key, config.attemptTimeoutMs(), cause);
        }
        return new WorkFailedException(key, attempts, cause);
    }

    /**
     * Every future under one key carries the result of work typed by its caller.
     */
    @SuppressWarnings("unchecked")
    private static <T> CompletableFuture<T> typed(CompletableFuture<?> future) {
        return (CompletableFuture<T>) future;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * One executeBatch call: a sliding window over the work list.
     *
     * <p>Only one thread at a time runs {@link #drain()}; a completion that arrives while
     * another thread is draining frees its slot and leaves the start to that thread. Work
     * that completes synchronously therefore never nests one start inside another, however
     * long the list.</p>
     */
    private final class BatchRun<T> {

        private final List<? extends Work<T>> works;
        private final AtomicReferenceArray<Outcome<T>> outcomes;
        private final AtomicInteger freeSlots;
        private final AtomicInteger drainRequests = new AtomicInteger();
        private final AtomicInteger remaining;
        private final CompletableFuture<List<Outcome<T>>> result = new CompletableFuture<>();

        // guarded by drainRequests
        private int nextIndex;

        private BatchRun(List<? extends Work<T>> works, int maxConcurrent) {
            this.works = works;
            this.outcomes = new AtomicReferenceArray<>(works.size());
            this.freeSlots = new AtomicInteger(maxConcurrent);
            this.remaining = new AtomicInteger(works.size());
        }

        private void drain() {
            if (drainRequests.getAndIncrement() != 0) {
                return;
            }
            int missed = 1;
            do {
                while (nextIndex < works.size() && freeSlots.get() > 0) {
                    freeSlots.decrementAndGet();
                    start(nextIndex++);
                }
                missed = drainRequests.addAndGet(-missed);
            } while (missed != 0);
        }

        private void start(int index) {
            String slotKey = "batch[" + index + "]";
            startAttempt(works.get(index)).whenComplete((value, error) -> {
                Outcome<T> outcome = error == null
                    ? Ok.of(value)
                    : Fail.of(toFailure(slotKey, 1, unwrap(error)));
                outcomes.set(index, outcome);
                if (remaining.decrementAndGet() == 0) {
                    result.complete(collect());
                    return;
                }
                freeSlots.incrementAndGet();
                drain();
            });
        }

        private List<Outcome<T>> collect() {
            List<Outcome<T>> ordered = new ArrayList<>(outcomes.length());
            for (int i = 0; i < outcomes.length(); i++) {
                ordered.add(outcomes.get(i));
            }
            return ordered;
        }
    }
}
