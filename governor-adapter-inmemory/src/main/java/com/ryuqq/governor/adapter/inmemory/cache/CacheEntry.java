package com.ryuqq.governor.adapter.inmemory.cache;

import java.time.Duration;
import java.time.Instant;

/**
 * One cache entry with its usage metadata.
 *
 * <p>The value is held in encoded form together with the type it decodes into.
 * Access metadata is mutable and only changed under the owning store's lock.</p>
 *
 * @author Governor Team
 * @since 1.0.0
 */
public final class CacheEntry {

    private final String key;
    private final byte[] payload;
    private final Class<?> valueType;
    private final Instant createdAt;
    private final Duration ttl;
    private final long sequence;
    private Instant lastAccessAt;
    private long accessCount;

    CacheEntry(String key, byte[] payload, Class<?> valueType, Instant createdAt, Duration ttl, long sequence) {
        this.key = key;
        this.payload = payload;
        this.valueType = valueType;
        this.createdAt = createdAt;
        this.ttl = ttl;
        this.sequence = sequence;
        this.lastAccessAt = createdAt;
        this.accessCount = 1;
    }

    /**
     * Whether the entry is past its TTL. An entry is still live at exactly
     * {@code createdAt + ttl}.
     *
     * @param now current time
     * @return true if expired
     */
    public boolean isExpired(Instant now) {
        return !ttl.isZero() && now.isAfter(createdAt.plus(ttl));
    }

    void touch(Instant now) {
        lastAccessAt = now;
        accessCount++;
    }

    public String key() {
        return key;
    }

    byte[] payload() {
        return payload;
    }

    public Class<?> valueType() {
        return valueType;
    }

    /**
     * Encoded payload length charged against the store capacity.
     *
     * @return size in bytes
     */
    public long sizeBytes() {
        return payload.length;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Duration ttl() {
        return ttl;
    }

    /**
     * Insertion order, unique per store.
     *
     * @return sequence number
     */
    public long sequence() {
        return sequence;
    }

    public Instant lastAccessAt() {
        return lastAccessAt;
    }

    public long accessCount() {
        return accessCount;
    }

    @Override
    public String toString() {
        return "CacheEntry{key=" + key + ", sizeBytes=" + payload.length + ", accessCount=" + accessCount + '}';
    }
}
