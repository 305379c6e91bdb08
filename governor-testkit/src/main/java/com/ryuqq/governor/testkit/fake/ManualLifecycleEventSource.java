package com.ryuqq.governor.testkit.fake;

import com.ryuqq.governor.core.spi.LifecycleEventSource;
import com.ryuqq.governor.core.statemachine.LifecyclePhase;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * LifecycleEventSource driven by the test.
 *
 * <p>{@link #emit(LifecyclePhase)} delivers the phase synchronously to every subscriber on
 * the calling thread.</p>
 *
 * @author Governor Team
 * @since 1.0.0
 */
public final class ManualLifecycleEventSource implements LifecycleEventSource {

    private final List<Consumer<LifecyclePhase>> listeners = new CopyOnWriteArrayList<>();

    @Override
    public AutoCloseable subscribe(Consumer<LifecyclePhase> listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    /**
     * Delivers a phase change to every subscriber.
     *
     * @param phase new phase
     */
    public void emit(LifecyclePhase phase) {
        if (phase == null) {
            throw new IllegalArgumentException("phase cannot be null");
        }
        for (Consumer<LifecyclePhase> listener : listeners) {
            listener.accept(phase);
        }
    }

    public int subscriberCount() {
        return listeners.size();
    }
}
