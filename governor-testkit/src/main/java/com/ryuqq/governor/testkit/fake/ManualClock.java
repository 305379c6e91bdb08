package com.ryuqq.governor.testkit.fake;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Clock that only moves when told to.
 *
 * <p>Thread-safe. Used to drive TTL expiry and eviction scores deterministically.</p>
 *
 * @author Governor Team
 * @since 1.0.0
 */
public final class ManualClock extends Clock {

    private final AtomicReference<Instant> now;
    private final ZoneId zone;

    public ManualClock() {
        this(Instant.parse("2024-01-01T00:00:00Z"));
    }

    public ManualClock(Instant start) {
        this(new AtomicReference<>(requireInstant(start)), ZoneOffset.UTC);
    }

    private ManualClock(AtomicReference<Instant> now, ZoneId zone) {
        this.now = now;
        this.zone = zone;
    }

    /**
     * Moves the clock forward.
     *
     * @param duration amount to advance (not negative)
     * @return the new instant
     */
    public Instant advance(Duration duration) {
        if (duration == null || duration.isNegative()) {
            throw new IllegalArgumentException("duration must not be null or negative (current: " + duration + ")");
        }
        return now.updateAndGet(current -> current.plus(duration));
    }

    /**
     * Moves the clock forward by milliseconds.
     *
     * @param millis amount to advance
     * @return the new instant
     */
    public Instant advanceMillis(long millis) {
        return advance(Duration.ofMillis(millis));
    }

    /**
     * Jumps to an instant. The clock may move backwards.
     *
     * @param instant new instant
     */
    public void setInstant(Instant instant) {
        now.set(requireInstant(instant));
    }

    @Override
    public Instant instant() {
        return now.get();
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    /**
     * Clock sharing this clock's time in another zone.
     */
    @Override
    public Clock withZone(ZoneId zone) {
        return new ManualClock(now, zone);
    }

    private static Instant requireInstant(Instant instant) {
        if (instant == null) {
            throw new IllegalArgumentException("instant cannot be null");
        }
        return instant;
    }
}
