package com.ryuqq.governor.core.spi;

/**
 * Durable mirror of the cache.
 *
 * <p>Best-effort: the cache calls it off the hot path and only logs failures. Entries may be
 * lost on eviction or process death.</p>
 *
 * @author Governor Team
 * @since 1.0.0
 */
public interface PersistenceBackend {

    /**
     * Writes or replaces an entry.
     *
     * @param key cache key
     * @param payload encoded value
     * @throws Exception on storage failure
     */
    void write(String key, byte[] payload) throws Exception;

    /**
     * Deletes an entry. Must tolerate absent keys.
     *
     * @param key cache key
     * @throws Exception on storage failure
     */
    void delete(String key) throws Exception;

    /**
     * Deletes every entry.
     *
     * @throws Exception on storage failure
     */
    void clear() throws Exception;
}
