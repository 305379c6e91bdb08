package com.ryuqq.governor.application.scheduler;

import com.ryuqq.governor.core.model.Priority;
import com.ryuqq.governor.core.spi.LifecycleListener;
import com.ryuqq.governor.core.statemachine.LifecycleState;

import java.time.Duration;

/**
 * Tracks lifecycle phase and resource pressure and paces periodic tasks.
 *
 * <p><strong>State machine:</strong> phase (FOREGROUND, BACKGROUND) × pressure (NORMAL,
 * ELEVATED, CRITICAL). The phase changes on host lifecycle events, the pressure level on
 * periodic sampling.</p>
 *
 * <p><strong>Task pacing:</strong> each registered task runs every
 * {@code baseInterval × intervalMultiplier()}. The multiplier is re-read for every cycle, so a
 * state change takes effect on the next scheduling decision.</p>
 *
 * @author Governor Team
 * @since 1.0.0
 */
public interface LifecycleScheduler extends AutoCloseable {

    /**
     * Current state snapshot.
     *
     * @return immutable state
     */
    LifecycleState currentState();

    /**
     * Interval multiplier of the current state.
     *
     * @return multiplier (≥ 1.0 with the default policy)
     */
    double intervalMultiplier();

    /**
     * Registers a periodic task that is never shed.
     *
     * <p>Registering an existing id replaces the previous task.</p>
     *
     * @param id task id
     * @param baseInterval interval at multiplier 1.0
     * @param task task body
     */
    default void registerTask(String id, Duration baseInterval, Runnable task) {
        registerTask(id, baseInterval, task, Priority.HIGH);
    }

    /**
     * Registers a periodic task with a priority.
     *
     * <p>A cycle that falls in a state where the policy sheds this priority is skipped and
     * the task is rescheduled.</p>
     *
     * @param id task id
     * @param baseInterval interval at multiplier 1.0 (positive)
     * @param task task body
     * @param priority shedding priority
     * @throws IllegalArgumentException if any argument is invalid
     * @throws IllegalStateException if the scheduler is closed
     */
    void registerTask(String id, Duration baseInterval, Runnable task, Priority priority);

    /**
     * Cancels a task. Idempotent.
     *
     * @param id task id
     * @return true if a task was registered under the id
     */
    boolean cancelTask(String id);

    /**
     * Adds a state change listener.
     *
     * @param listener listener
     */
    void addListener(LifecycleListener listener);

    /**
     * Stops sampling and cancels every task.
     */
    @Override
    void close();
}
