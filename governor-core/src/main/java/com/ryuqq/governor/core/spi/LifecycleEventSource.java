package com.ryuqq.governor.core.spi;

import com.ryuqq.governor.core.statemachine.LifecyclePhase;

import java.util.function.Consumer;

/**
 * Source of foreground/background notifications delivered by the host platform.
 *
 * @author Governor Team
 * @since 1.0.0
 */
public interface LifecycleEventSource {

    /**
     * Registers a listener for phase changes.
     *
     * @param listener receives the new phase
     * @return handle that unregisters the listener when closed
     */
    AutoCloseable subscribe(Consumer<LifecyclePhase> listener);
}
