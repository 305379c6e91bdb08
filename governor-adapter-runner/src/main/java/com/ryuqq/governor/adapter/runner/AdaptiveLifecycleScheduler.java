package com.ryuqq.governor.adapter.runner;

import com.ryuqq.governor.application.scheduler.IntervalPolicy;
import com.ryuqq.governor.application.scheduler.LifecycleScheduler;
import com.ryuqq.governor.core.model.Priority;
import com.ryuqq.governor.core.spi.LifecycleEventSource;
import com.ryuqq.governor.core.spi.LifecycleListener;
import com.ryuqq.governor.core.spi.PressureSample;
import com.ryuqq.governor.core.spi.PressureSampler;
import com.ryuqq.governor.core.statemachine.LifecyclePhase;
import com.ryuqq.governor.core.statemachine.LifecycleState;
import com.ryuqq.governor.core.statemachine.PressureLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.UnaryOperator;

/**
 * {@link LifecycleScheduler} driven by a lifecycle event source and a pressure sampler.
 *
 * <p><strong>State:</strong> a volatile immutable {@link LifecycleState}. Transitions are
 * serialized; readers never lock.</p>
 *
 * <p><strong>Task loop:</strong> every task schedules its next cycle itself after the current
 * one finishes, using the multiplier of the state at that moment. A cycle whose priority is
 * shed in the current state is skipped and rescheduled. After a state change, pending cycles
 * that would come due sooner under the new multiplier are moved forward; cycles that would
 * come due later keep their time and pick up the new multiplier on the next cycle.</p>
 *
 * <p><strong>Sampling:</strong> {@link #samplePressure()} runs every
 * {@code samplingIntervalMs} once started. A failed sample keeps the last level and logs a
 * warning.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * AdaptiveLifecycleScheduler scheduler = new AdaptiveLifecycleScheduler(
 *     new SchedulerConfig(), IntervalPolicy.defaults(), eventSource, new JvmHeapPressureSampler());
 * scheduler.start();
 * scheduler.registerTask("feed-refresh", Duration.ofMinutes(1), feed::refresh, Priority.LOW);
 * </pre>
 *
 * @author Governor Team
 * @since 1.0.0
 */
public final class AdaptiveLifecycleScheduler implements LifecycleScheduler {

    private static final Logger log = LoggerFactory.getLogger(AdaptiveLifecycleScheduler.class);

    private final SchedulerConfig config;
    private final IntervalPolicy policy;
    private final LifecycleEventSource eventSource;
    private final PressureSampler pressureSampler;
    private final ScheduledExecutorService executor;
    private final boolean ownsExecutor;

    private final Object transitionLock = new Object();
    private volatile LifecycleState state = LifecycleState.initial();

    private final ConcurrentHashMap<String, ScheduledTask> tasks = new ConcurrentHashMap<>();
    private final List<LifecycleListener> listeners = new CopyOnWriteArrayList<>();

    private final Object lifecycleLock = new Object();
    private boolean started;
    private volatile boolean closed;
    private AutoCloseable subscription;
    private ScheduledFuture<?> samplingFuture;

    /**
     * Scheduler with its own single-threaded executor.
     *
     * @param config scheduler configuration
     * @param policy interval policy
     * @param eventSource host lifecycle events
     * @param pressureSampler pressure readings
     */
    public AdaptiveLifecycleScheduler(
            SchedulerConfig config,
            IntervalPolicy policy,
            LifecycleEventSource eventSource,
            PressureSampler pressureSampler) {
        this(config, policy, eventSource, pressureSampler, newExecutor(), true);
    }

    /**
     * Scheduler on a caller-provided executor. The executor is not shut down on close.
     *
     * @param config scheduler configuration
     * @param policy interval policy
     * @param eventSource host lifecycle events
     * @param pressureSampler pressure readings
     * @param executor executor running tasks and sampling
     */
    public AdaptiveLifecycleScheduler(
            SchedulerConfig config,
            IntervalPolicy policy,
            LifecycleEventSource eventSource,
            PressureSampler pressureSampler,
            ScheduledExecutorService executor) {
        this(config, policy, eventSource, pressureSampler, executor, false);
    }

    private AdaptiveLifecycleScheduler(
            SchedulerConfig config,
            IntervalPolicy policy,
            LifecycleEventSource eventSource,
            PressureSampler pressureSampler,
            ScheduledExecutorService executor,
            boolean ownsExecutor) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        if (eventSource == null) {
            throw new IllegalArgumentException("eventSource cannot be null");
        }
        if (pressureSampler == null) {
            throw new IllegalArgumentException("pressureSampler cannot be null");
        }
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        this.config = config;
        this.policy = policy;
        this.eventSource = eventSource;
        this.pressureSampler = pressureSampler;
        this.executor = executor;
        this.ownsExecutor = ownsExecutor;
    }

    private static ScheduledExecutorService newExecutor() {
        return Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "governor-scheduler");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Subscribes to lifecycle events and starts periodic sampling. Idempotent.
     *
     * @throws IllegalStateException if the scheduler is closed
     */
    public void start() {
        synchronized (lifecycleLock) {
            ensureOpen();
            if (started) {
                return;
            }
            subscription = eventSource.subscribe(this::onPhaseChanged);
            samplingFuture = executor.scheduleWithFixedDelay(
                this::samplePressure, 0, config.samplingIntervalMs(), TimeUnit.MILLISECONDS);
            started = true;
        }
        log.info("Lifecycle scheduler started (sampling every {}ms)", config.samplingIntervalMs());
    }

    @Override
    public LifecycleState currentState() {
        return state;
    }

    @Override
    public double intervalMultiplier() {
        return policy.multiplierFor(state);
    }

    /**
     * Applies a phase change reported by the host.
     *
     * @param phase new phase
     */
    public void onPhaseChanged(LifecyclePhase phase) {
        if (phase == null) {
            throw new IllegalArgumentException("phase cannot be null");
        }
        transition(current -> current.withPhase(phase));
    }

    /**
     * Takes one pressure reading and applies the resulting level. Never throws.
     *
     * @return pressure level after the reading
     */
    public PressureLevel samplePressure() {
        PressureLevel level;
        try {
            PressureSample sample = pressureSampler.sample();
            level = PressureLevel.classify(sample, config.elevatedThreshold(), config.criticalThreshold());
        } catch (Exception e) {
            PressureLevel held = state.pressureLevel();
            log.warn("Pressure sampling failed, holding level {}: {}", held, e.getMessage());
            return held;
        }
        transition(current -> current.withPressureLevel(level));
        return level;
    }

    @Override
    public void registerTask(String id, Duration baseInterval, Runnable task, Priority priority) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (baseInterval == null || baseInterval.isZero() || baseInterval.isNegative()) {
            throw new IllegalArgumentException("baseInterval must be positive (current: " + baseInterval + ")");
        }
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        if (priority == null) {
            throw new IllegalArgumentException("priority cannot be null");
        }
        ensureOpen();

        ScheduledTask scheduled = new ScheduledTask(id, baseInterval, task, priority);
        ScheduledTask previous = tasks.put(id, scheduled);
        if (previous != null) {
            previous.cancel();
            log.debug("Task {} replaced", id);
        }
        scheduled.scheduleNext(System.nanoTime());
        log.debug("Task {} registered (base {}ms, priority {})", id, baseInterval.toMillis(), priority);
    }

    @Override
    public boolean cancelTask(String id) {
        if (id == null) {
            return false;
        }
        ScheduledTask removed = tasks.remove(id);
        if (removed == null) {
            return false;
        }
        removed.cancel();
        log.debug("Task {} cancelled", id);
        return true;
    }

    @Override
    public void addListener(LifecycleListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        listeners.add(listener);
    }

    /**
     * Ids of the registered tasks.
     *
     * @return snapshot of task ids
     */
    public Set<String> registeredTaskIds() {
        return Set.copyOf(tasks.keySet());
    }

    @Override
    public void close() {
        synchronized (lifecycleLock) {
            if (closed) {
                return;
            }
            closed = true;
            if (samplingFuture != null) {
                samplingFuture.cancel(false);
            }
            if (subscription != null) {
                try {
                    subscription.close();
                } catch (Exception e) {
                    log.warn("Failed to unsubscribe from lifecycle events: {}", e.getMessage());
                }
            }
        }
        tasks.values().forEach(ScheduledTask::cancel);
        tasks.clear();
        if (ownsExecutor) {
            executor.shutdownNow();
        }
        log.info("Lifecycle scheduler closed");
    }

    private void transition(UnaryOperator<LifecycleState> change) {
        LifecycleState previous;
        LifecycleState next;
        synchronized (transitionLock) {
            previous = state;
            next = change.apply(previous);
            if (next.equals(previous)) {
                return;
            }
            state = next;
        }
        log.info("Lifecycle state changed: {} -> {} (multiplier {})", previous, next, policy.multiplierFor(next));

        for (ScheduledTask task : tasks.values()) {
            task.rescheduleIfSooner();
        }
        for (LifecycleListener listener : listeners) {
            try {
                listener.onStateChanged(previous, next);
            } catch (RuntimeException e) {
                log.warn("Lifecycle listener failed on {} -> {}: {}", previous, next, e.getMessage(), e);
            }
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Lifecycle scheduler is closed");
        }
    }

    private long currentDelayNanos(Duration baseInterval) {
        double delay = baseInterval.toNanos() * intervalMultiplier();
        return delay >= Long.MAX_VALUE ? Long.MAX_VALUE : Math.round(delay);
    }

    /**
     * One registered task and its pending cycle.
     */
    private final class ScheduledTask {

        private final String id;
        private final Duration baseInterval;
        private final Runnable body;
        private final Priority priority;

        private ScheduledFuture<?> pending;
        private long scheduledAtNanos;
        private long dueAtNanos;
        private boolean running;
        private boolean cancelled;

        private ScheduledTask(String id, Duration baseInterval, Runnable body, Priority priority) {
            this.id = id;
            this.baseInterval = baseInterval;
            this.body = body;
            this.priority = priority;
        }

        synchronized void scheduleNext(long fromNanos) {
            if (cancelled) {
                return;
            }
            long delay = currentDelayNanos(baseInterval);
            scheduledAtNanos = fromNanos;
            dueAtNanos = saturatedAdd(fromNanos, delay);
            schedule(delay);
        }

        synchronized void rescheduleIfSooner() {
            if (cancelled || running || pending == null) {
                return;
            }
            long newDue = saturatedAdd(scheduledAtNanos, currentDelayNanos(baseInterval));
            if (newDue - dueAtNanos >= 0) {
                return;
            }
            if (pending.cancel(false)) {
                dueAtNanos = newDue;
                schedule(Math.max(0, newDue - System.nanoTime()));
                log.debug("Task {} moved forward after state change", id);
            }
        }

        synchronized void cancel() {
            cancelled = true;
            if (pending != null) {
                pending.cancel(false);
            }
        }

        private void schedule(long delayNanos) {
            try {
                pending = executor.schedule(this::runCycle, delayNanos, TimeUnit.NANOSECONDS);
            } catch (RejectedExecutionException e) {
                cancelled = true;
                log.warn("Task {} could not be scheduled: executor unavailable", id);
            }
        }

        private void runCycle() {
            synchronized (this) {
                if (cancelled) {
                    return;
                }
                running = true;
            }
            try {
                LifecycleState current = state;
                if (policy.shouldShed(priority, current)) {
                    log.debug("Task {} ({}) skipped in state {}", id, priority, current);
                } else {
                    body.run();
                }
            } catch (RuntimeException e) {
                log.warn("Task {} failed: {}", id, e.getMessage(), e);
            } finally {
                synchronized (this) {
                    running = false;
                    scheduleNext(System.nanoTime());
                }
            }
        }

        private long saturatedAdd(long base, long delta) {
            long sum = base + delta;
            return ((base ^ sum) & (delta ^ sum)) < 0 ? Long.MAX_VALUE : sum;
        }
    }
}
