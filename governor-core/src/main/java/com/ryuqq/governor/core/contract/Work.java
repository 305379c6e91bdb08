package com.ryuqq.governor.core.contract;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;

/**
 * Asynchronous unit of work submitted to the request coordinator.
 *
 * <p>The coordinator treats the returned stage as opaque: it never inspects how the work
 * schedules itself and cannot cancel it. Abandoning a timed-out attempt leaves the
 * underlying operation running until it finishes on its own.</p>
 *
 * <p><strong>Example:</strong></p>
 * <pre>{@code
 * Work<Profile> work = () -> apiClient.fetchProfileAsync(userId);
 *
 * // blocking call adapted onto an executor
 * Work<Profile> blocking = Work.fromCallable(() -> apiClient.fetchProfile(userId), ioExecutor);
 * }</pre>
 *
 * @param <T> result type
 * @author Governor Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Work<T> {

    /**
     * Starts the work.
     *
     * <p>Each call starts a new attempt. Implementations may throw instead of returning a
     * failed stage; the coordinator treats both the same way.</p>
     *
     * @return stage completing with the result
     * @throws Exception if the attempt cannot be started
     */
    CompletionStage<T> start() throws Exception;

    /**
     * Adapts a blocking call onto an executor.
     *
     * @param callable blocking call
     * @param executor executor running the call
     * @param <T> result type
     * @return asynchronous work
     */
    static <T> Work<T> fromCallable(Callable<T> callable, Executor executor) {
        if (callable == null) {
            throw new IllegalArgumentException("callable cannot be null");
        }
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        return () -> {
            CompletableFuture<T> future = new CompletableFuture<>();
            executor.execute(() -> {
                try {
                    future.complete(callable.call());
                } catch (Exception e) {
                    future.completeExceptionally(e);
                }
            });
            return future;
        };
    }
}
