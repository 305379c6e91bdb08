package com.ryuqq.governor.testkit.fake;

import com.ryuqq.governor.core.spi.PressureSample;
import com.ryuqq.governor.core.spi.PressureSampler;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * PressureSampler that replays a script.
 *
 * <p>Queued readings and failures are returned in order. Once the script is exhausted the
 * last successful reading repeats.</p>
 *
 * <pre>
 * ScriptedPressureSampler sampler = new ScriptedPressureSampler()
 *     .thenReturn(PressureSample.ofUtilization(0.9))
 *     .thenFail(new IllegalStateException("signal lost"));
 * </pre>
 *
 * @author Governor Team
 * @since 1.0.0
 */
public final class ScriptedPressureSampler implements PressureSampler {

    private final Deque<Object> script = new ArrayDeque<>();
    private final AtomicInteger calls = new AtomicInteger();
    private PressureSample last = PressureSample.ofUtilization(0.0);

    /**
     * Queues readings.
     *
     * @param samples readings in order
     * @return this sampler
     */
    public synchronized ScriptedPressureSampler thenReturn(PressureSample... samples) {
        for (PressureSample sample : samples) {
            if (sample == null) {
                throw new IllegalArgumentException("sample cannot be null");
            }
            script.addLast(sample);
        }
        return this;
    }

    /**
     * Queues a failure.
     *
     * @param failure exception thrown by the matching {@link #sample()} call
     * @return this sampler
     */
    public synchronized ScriptedPressureSampler thenFail(Exception failure) {
        if (failure == null) {
            throw new IllegalArgumentException("failure cannot be null");
        }
        script.addLast(failure);
        return this;
    }

    @Override
    public synchronized PressureSample sample() throws Exception {
        calls.incrementAndGet();
        Object next = script.pollFirst();
        if (next instanceof Exception failure) {
            throw failure;
        }
        if (next instanceof PressureSample sample) {
            last = sample;
        }
        return last;
    }

    public int callCount() {
        return calls.get();
    }
}
