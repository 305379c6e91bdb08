package com.ryuqq.governor.adapter.inmemory.ratelimit;

import com.ryuqq.governor.core.model.ActionKey;
import com.ryuqq.governor.core.protection.RateLimiter;
import com.ryuqq.governor.core.protection.RateLimiterConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fixed-window rate limiter keyed by action class.
 *
 * <p>Each action class gets a window of {@code windowMs}. The first call after a window ends
 * opens a new one with a count of 1; within a window at most {@code maxRequests} calls are
 * admitted. The window start and count are replaced together under the lock.</p>
 *
 * <p>Once more than {@code purgeThreshold} windows are tracked, windows that already ended
 * are dropped on the next call.</p>
 *
 * @author Governor Team
 * @since 1.0.0
 */
public class FixedWindowRateLimiter implements RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(FixedWindowRateLimiter.class);

    private final RateLimiterConfig config;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<ActionKey, Window> windows = new HashMap<>();

    public FixedWindowRateLimiter(RateLimiterConfig config) {
        this(config, Clock.systemUTC());
    }

    public FixedWindowRateLimiter(RateLimiterConfig config, Clock clock) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.config = config;
        this.clock = clock;
    }

    @Override
    public boolean tryAcquire(ActionKey actionKey) {
        if (actionKey == null) {
            throw new IllegalArgumentException("actionKey cannot be null");
        }
        long now = clock.millis();
        lock.lock();
        try {
            if (windows.size() > config.purgeThreshold()) {
                purgeEnded(now);
            }
            Window window = windows.get(actionKey);
            if (window == null || window.hasEnded(now, config.windowMs())) {
                windows.put(actionKey, new Window(now, 1));
                return true;
            }
            if (window.count() >= config.maxRequests()) {
                return false;
            }
            windows.put(actionKey, new Window(window.start(), window.count() + 1));
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public RateLimiterConfig getConfig() {
        return config;
    }

    /**
     * Number of windows currently tracked.
     *
     * @return window count
     */
    public int trackedWindows() {
        lock.lock();
        try {
            return windows.size();
        } finally {
            lock.unlock();
        }
    }

    private void purgeEnded(long now) {
        int before = windows.size();
        windows.values().removeIf(window -> window.hasEnded(now, config.windowMs()));
        log.debug("Rate limiter purged {} ended windows out of {}", before - windows.size(), before);
    }

    private record Window(long start, int count) {

        boolean hasEnded(long now, long windowMs) {
            return now - start >= windowMs;
        }
    }
}
