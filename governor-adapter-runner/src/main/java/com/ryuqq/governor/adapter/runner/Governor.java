package com.ryuqq.governor.adapter.runner;

import com.ryuqq.governor.adapter.inmemory.cache.AsyncPersistenceMirror;
import com.ryuqq.governor.adapter.inmemory.cache.FrequencyRecencyEvictionPolicy;
import com.ryuqq.governor.adapter.inmemory.cache.InMemoryCacheStore;
import com.ryuqq.governor.adapter.inmemory.cache.JacksonValueCodec;
import com.ryuqq.governor.adapter.inmemory.ratelimit.FixedWindowRateLimiter;
import com.ryuqq.governor.adapter.inmemory.ratelimit.PrefixActionKeyResolver;
import com.ryuqq.governor.application.coordinator.RequestCoordinator;
import com.ryuqq.governor.application.scheduler.LifecycleScheduler;
import com.ryuqq.governor.core.spi.CacheStore;
import com.ryuqq.governor.core.spi.LifecycleEventSource;
import com.ryuqq.governor.core.spi.PersistenceBackend;
import com.ryuqq.governor.core.spi.PressureSampler;
import com.ryuqq.governor.core.spi.noop.NoOpPersistenceBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Wires the cache store, request coordinator, lifecycle scheduler and cache janitor into one
 * unit with a start/close lifecycle.
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * try (Governor governor = new Governor(new GovernorConfig(), hostEvents)) {
 *     governor.start();
 *     governor.coordinator().execute("user:42", () -&gt; api.fetchUserAsync(42));
 * }
 * </pre>
 *
 * @author Governor Team
 * @since 1.0.0
 */
public final class Governor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Governor.class);

    private final ExecutorService persistenceExecutor;
    private final InMemoryCacheStore cacheStore;
    private final DefaultRequestCoordinator coordinator;
    private final AdaptiveLifecycleScheduler scheduler;
    private final CacheJanitor janitor;

    /**
     * Governor with no persistence mirror, sampling JVM heap usage.
     *
     * @param config configuration
     * @param eventSource host lifecycle events
     */
    public Governor(GovernorConfig config, LifecycleEventSource eventSource) {
        this(config, eventSource, new JvmHeapPressureSampler(), new NoOpPersistenceBackend(), Clock.systemUTC());
    }

    /**
     * Fully specified governor.
     *
     * @param config configuration
     * @param eventSource host lifecycle events
     * @param pressureSampler pressure readings
     * @param persistenceBackend receives mirrored cache writes
     * @param clock clock for cache and rate limiter timing
     */
    public Governor(
            GovernorConfig config,
            LifecycleEventSource eventSource,
            PressureSampler pressureSampler,
            PersistenceBackend persistenceBackend,
            Clock clock) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (eventSource == null) {
            throw new IllegalArgumentException("eventSource cannot be null");
        }
        if (pressureSampler == null) {
            throw new IllegalArgumentException("pressureSampler cannot be null");
        }
        if (persistenceBackend == null) {
            throw new IllegalArgumentException("persistenceBackend cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.persistenceExecutor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "governor-persistence");
            thread.setDaemon(true);
            return thread;
        });
        this.cacheStore = new InMemoryCacheStore(
            config.cache(),
            new JacksonValueCodec(),
            new FrequencyRecencyEvictionPolicy(),
            new AsyncPersistenceMirror(persistenceBackend, persistenceExecutor),
            clock
        );
        this.coordinator = new DefaultRequestCoordinator(
            cacheStore,
            new FixedWindowRateLimiter(config.rateLimiter(), clock),
            new PrefixActionKeyResolver(),
            config.coordinator()
        );
        this.scheduler = new AdaptiveLifecycleScheduler(
            config.scheduler(), config.intervalPolicy(), eventSource, pressureSampler);
        this.janitor = new CacheJanitor(cacheStore, scheduler, config.janitor());
    }

    /**
     * Starts the cache janitor, then pressure sampling and the lifecycle subscription.
     */
    public void start() {
        janitor.start();
        scheduler.start();
        log.info("Governor started");
    }

    public CacheStore cacheStore() {
        return cacheStore;
    }

    public RequestCoordinator coordinator() {
        return coordinator;
    }

    public LifecycleScheduler scheduler() {
        return scheduler;
    }

    CacheJanitor janitor() {
        return janitor;
    }

    /**
     * Stops the janitor and scheduler, then drains pending persistence writes.
     */
    @Override
    public void close() {
        janitor.stop();
        scheduler.close();
        persistenceExecutor.shutdown();
        try {
            if (!persistenceExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Persistence mirror did not drain within 5s");
                persistenceExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            persistenceExecutor.shutdownNow();
        }
        log.info("Governor closed");
    }
}
