package com.ryuqq.governor.adapter.runner;

import com.ryuqq.governor.core.spi.PressureSample;
import com.ryuqq.governor.core.spi.PressureSampler;

import java.util.function.BooleanSupplier;

/**
 * {@link PressureSampler} reading JVM heap usage from {@link Runtime}.
 *
 * <p>Utilization is {@code (total - free) / max}. When the heap has no declared maximum the
 * currently committed size is used instead.</p>
 *
 * @author Governor Team
 * @since 1.0.0
 */
public final class JvmHeapPressureSampler implements PressureSampler {

    private final Runtime runtime;
    private final BooleanSupplier batterySaver;

    /**
     * Sampler for the current JVM with battery saver always off.
     */
    public JvmHeapPressureSampler() {
        this(Runtime.getRuntime(), () -> false);
    }

    /**
     * Sampler for the current JVM with a host-provided battery saver flag.
     *
     * @param batterySaver reports whether the host is in battery saver mode
     */
    public JvmHeapPressureSampler(BooleanSupplier batterySaver) {
        this(Runtime.getRuntime(), batterySaver);
    }

    JvmHeapPressureSampler(Runtime runtime, BooleanSupplier batterySaver) {
        if (runtime == null) {
            throw new IllegalArgumentException("runtime cannot be null");
        }
        if (batterySaver == null) {
            throw new IllegalArgumentException("batterySaver cannot be null");
        }
        this.runtime = runtime;
        this.batterySaver = batterySaver;
    }

    @Override
    public PressureSample sample() {
        long total = runtime.totalMemory();
        long used = total - runtime.freeMemory();
        long max = runtime.maxMemory();
        long limit = max == Long.MAX_VALUE ? total : max;
        return new PressureSample(utilization(used, limit), batterySaver.getAsBoolean());
    }

    static double utilization(long usedBytes, long limitBytes) {
        if (limitBytes <= 0) {
            return 0.0;
        }
        double ratio = (double) usedBytes / limitBytes;
        return Math.max(0.0, Math.min(1.0, ratio));
    }
}
