package com.ryuqq.governor.adapter.inmemory.cache;

import java.time.Instant;

/**
 * Scores entries for eviction. Lower scores are evicted first.
 *
 * <p>Ties are broken by the store: oldest {@code createdAt}, then insertion order.</p>
 *
 * @author Governor Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface EvictionPolicy {

    /**
     * Usage score of an entry.
     *
     * @param entry live entry
     * @param now current time
     * @return score (higher is more valuable)
     */
    double score(CacheEntry entry, Instant now);
}
