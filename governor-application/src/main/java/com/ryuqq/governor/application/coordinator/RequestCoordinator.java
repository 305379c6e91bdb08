package com.ryuqq.governor.application.coordinator;

import com.ryuqq.governor.core.contract.RequestOptions;
import com.ryuqq.governor.core.contract.Work;
import com.ryuqq.governor.core.outcome.Outcome;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Coordinates outbound asynchronous work.
 *
 * <p>Cached, single-flight, rate-limited, timed-out and retried execution keyed by an opaque
 * cache key.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * CompletableFuture&lt;Profile&gt; profile = coordinator.execute(
 *     "profile:42",
 *     () -&gt; client.fetchProfile(42),
 *     RequestOptions.defaults().withCacheTtl(Duration.ofMinutes(1))
 * );
 * </pre>
 *
 * <p><strong>Execution order:</strong></p>
 * <ol>
 *   <li>Cache lookup when {@code useCache}; a hit completes immediately</li>
 *   <li>Rate limit of the key's action class; over the limit fails without queuing</li>
 *   <li>Join an in-flight execution for the same key</li>
 *   <li>Otherwise execute with a per-attempt timeout, retrying with backoff</li>
 *   <li>On settlement unregister the key, then cache a success</li>
 * </ol>
 *
 * <p>All callers of one execution observe the same outcome. Each gets its own future, so
 * cancelling one caller's future does not affect the others.</p>
 *
 * @author Governor Team
 * @since 1.0.0
 */
public interface RequestCoordinator {

    /**
     * Executes work for a key.
     *
     * <p>The returned future completes exceptionally with
     * {@link com.ryuqq.governor.core.error.RateLimitExceededException},
     * {@link com.ryuqq.governor.core.error.OperationTimeoutException} or
     * {@link com.ryuqq.governor.core.error.WorkFailedException}. A failed cache write is
     * logged and never fails the call.</p>
     *
     * @param key cache and single-flight key
     * @param work work to run on a miss
     * @param options request options
     * @param <T> result type
     * @return future of the result
     * @throws IllegalArgumentException if key is blank or work/options is null
     */
    <T> CompletableFuture<T> execute(String key, Work<T> work, RequestOptions options);

    /**
     * Executes work for a key with {@link RequestOptions#defaults()}.
     *
     * @param key cache and single-flight key
     * @param work work to run on a miss
     * @param <T> result type
     * @return future of the result
     */
    default <T> CompletableFuture<T> execute(String key, Work<T> work) {
        return execute(key, work, RequestOptions.defaults());
    }

    /**
     * Runs a batch of work with bounded concurrency.
     *
     * <p>At most {@code maxConcurrent} items run at once; a new one starts as soon as a slot
     * frees up. The result list has the same order as the input. Each slot is an
     * {@link com.ryuqq.governor.core.outcome.Ok} or a {@link com.ryuqq.governor.core.outcome.Fail};
     * the returned future itself never fails.</p>
     *
     * <p>Batch items bypass the cache, the rate limiter and single-flight.</p>
     *
     * @param works work items
     * @param <T> result type
     * @return future of per-item outcomes in input order
     */
    <T> CompletableFuture<List<Outcome<T>>> executeBatch(List<? extends Work<T>> works);

    /**
     * Current metrics snapshot.
     *
     * @return metrics
     */
    CoordinatorMetrics metrics();
}
