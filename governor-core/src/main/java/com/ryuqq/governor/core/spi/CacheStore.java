package com.ryuqq.governor.core.spi;

import com.ryuqq.governor.core.cache.CacheStats;
import com.ryuqq.governor.core.cache.SweepReport;
import com.ryuqq.governor.core.error.CapacityUnavailableException;
import com.ryuqq.governor.core.error.EncodingFailedException;

import java.time.Duration;
import java.util.Optional;

/**
 * Cache Store SPI.
 *
 * <p>Capacity- and TTL-bounded key/value store with usage-weighted eviction.</p>
 *
 * <p><strong>Invariants:</strong></p>
 * <ul>
 *   <li>The sum of live payload sizes never exceeds the current capacity</li>
 *   <li>Eviction happens before admission; no over-capacity state is observable</li>
 *   <li>An expired entry is never returned; reading it removes it</li>
 *   <li>Capacity only grows back through {@link #restoreCapacity()}</li>
 * </ul>
 *
 * <p><strong>Concurrency:</strong> implementations must be thread-safe. Every operation is
 * short and in-memory; mirroring to durable storage, if any, happens off the caller's
 * thread.</p>
 *
 * @author Governor Team
 * @since 1.0.0
 */
public interface CacheStore {

    /**
     * Stores a value with a TTL.
     *
     * <p>If the store lacks room, expired entries and then the lowest-scoring entries are
     * evicted until the value fits. Replacing an existing key counts the old entry's bytes
     * as free.</p>
     *
     * @param key cache key (not blank)
     * @param value value to store (must be encodable)
     * @param ttl time-to-live, {@link Duration#ZERO} for no expiry
     * @throws EncodingFailedException if the value cannot be encoded
     * @throws CapacityUnavailableException if the value cannot fit even after eviction
     * @throws IllegalArgumentException if key is blank or ttl is null or negative
     */
    void put(String key, Object value, Duration ttl);

    /**
     * Stores a value without expiry.
     *
     * @param key cache key
     * @param value value to store
     * @throws EncodingFailedException if the value cannot be encoded
     * @throws CapacityUnavailableException if the value cannot fit even after eviction
     */
    default void put(String key, Object value) {
        put(key, value, Duration.ZERO);
    }

    /**
     * Looks up a value.
     *
     * <p>A hit updates the entry's last access time and access count. An expired entry is
     * removed and reported as a miss. The returned value is a copy decoded from the stored
     * payload; changing it does not change the cached entry.</p>
     *
     * @param key cache key
     * @return value, or empty on miss
     */
    Optional<Object> get(String key);

    /**
     * Looks up a value of an expected type.
     *
     * <p>A value of another type is reported as a miss but still counts as an access.</p>
     *
     * @param key cache key
     * @param type expected type
     * @param <T> value type
     * @return value, or empty on miss or type mismatch
     */
    default <T> Optional<T> get(String key, Class<T> type) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        return get(key).filter(type::isInstance).map(type::cast);
    }

    /**
     * Checks whether a live entry exists without touching its access metadata.
     *
     * <p>An expired entry is removed as a side effect.</p>
     *
     * @param key cache key
     * @return true if a live entry exists
     */
    boolean contains(String key);

    /**
     * Removes an entry. Idempotent.
     *
     * @param key cache key
     */
    void remove(String key);

    /**
     * Removes every expired entry.
     *
     * @return reclaimed bytes and removed entry count
     */
    SweepReport runJanitorPass();

    /**
     * Removes entries idle for longer than {@code maxIdle} or accessed fewer than
     * {@code minAccessCount} times.
     *
     * @param maxIdle maximum idle time
     * @param minAccessCount minimum number of reads to survive
     * @return reclaimed bytes and removed entry count
     */
    SweepReport purgeLowValue(Duration maxIdle, long minAccessCount);

    /**
     * Lowers the capacity and evicts down to it immediately.
     *
     * @param targetCapacityBytes new capacity (positive, at most the current capacity)
     * @return reclaimed bytes and removed entry count
     * @throws IllegalArgumentException if the target is not positive or exceeds the current
     *     capacity
     */
    SweepReport shrinkTo(long targetCapacityBytes);

    /**
     * Returns the capacity to its configured value.
     */
    void restoreCapacity();

    /**
     * Drops every entry.
     */
    void clear();

    /**
     * Current statistics.
     *
     * @return statistics snapshot
     */
    CacheStats stats();
}
