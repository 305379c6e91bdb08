package com.ryuqq.governor.adapter.inmemory.cache;

import java.time.Duration;
import java.time.Instant;

/**
 * Scores an entry by access frequency over idle time.
 *
 * <p>{@code score = accessCount / max(1, now - lastAccessAt)} with the idle time in
 * milliseconds. Frequently and recently read entries survive longest.</p>
 *
 * @author Governor Team
 * @since 1.0.0
 */
public final class FrequencyRecencyEvictionPolicy implements EvictionPolicy {

    @Override
    public double score(CacheEntry entry, Instant now) {
        long idleMillis = Math.max(1L, Duration.between(entry.lastAccessAt(), now).toMillis());
        return (double) entry.accessCount() / idleMillis;
    }
}
