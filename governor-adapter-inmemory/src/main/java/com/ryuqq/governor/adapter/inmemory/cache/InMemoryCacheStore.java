package com.ryuqq.governor.adapter.inmemory.cache;

import com.ryuqq.governor.core.cache.CacheStats;
import com.ryuqq.governor.core.cache.EntrySummary;
import com.ryuqq.governor.core.cache.SweepReport;
import com.ryuqq.governor.core.error.CapacityUnavailableException;
import com.ryuqq.governor.core.error.EncodingFailedException;
import com.ryuqq.governor.core.spi.CacheStore;
import com.ryuqq.governor.core.spi.ValueCodec;
import com.ryuqq.governor.core.spi.noop.NoOpPersistenceBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link CacheStore}.
 *
 * <p>Entries live in a {@link HashMap} guarded by a single {@link ReentrantLock}. Every
 * operation, reads included, takes the lock because a hit updates access metadata. Values
 * are encoded outside the lock and only the encoded form is kept; the encoded length is the
 * entry's size. Every hit decodes a new copy, so neither the caller's original object nor a
 * returned value shares state with the cache. An entry whose payload no longer decodes is
 * dropped and reported as a miss.</p>
 *
 * <p><strong>Eviction order:</strong></p>
 * <ol>
 *   <li>Expired entries</li>
 *   <li>Lowest {@link EvictionPolicy} score</li>
 *   <li>Ties: oldest {@code createdAt}, then insertion order</li>
 * </ol>
 *
 * <p><strong>Persistence:</strong> writes, removals and clears are handed to an
 * {@link AsyncPersistenceMirror} while the lock is held, so the mirror receives them in the
 * order they were applied. Entries are never restored from the mirror.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * CacheStore store = new InMemoryCacheStore(CacheStoreConfig.ofCapacity(10 * 1024 * 1024));
 * store.put("profile:42", profile, Duration.ofMinutes(5));
 * Optional&lt;Profile&gt; cached = store.get("profile:42", Profile.class);
 * </pre>
 *
 * @author Governor Team
 * @since 1.0.0
 */
public class InMemoryCacheStore implements CacheStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCacheStore.class);

    private final CacheStoreConfig config;
    private final ValueCodec codec;
    private final EvictionPolicy evictionPolicy;
    private final AsyncPersistenceMirror mirror;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, CacheEntry> entries = new HashMap<>();
    private long sizeBytes;
    private long capacityBytes;
    private long sequence;

    /**
     * Store with a JSON codec, the default eviction policy, no persistence and the system clock.
     *
     * @param config store configuration
     */
    public InMemoryCacheStore(CacheStoreConfig config) {
        this(config, Clock.systemUTC());
    }

    /**
     * Store with a JSON codec, the default eviction policy and no persistence.
     *
     * @param config store configuration
     * @param clock time source
     */
    public InMemoryCacheStore(CacheStoreConfig config, Clock clock) {
        this(
            config,
            new JacksonValueCodec(),
            new FrequencyRecencyEvictionPolicy(),
            new AsyncPersistenceMirror(new NoOpPersistenceBackend(), Runnable::run),
            clock
        );
    }

    /**
     * Fully configured store.
     *
     * @param config store configuration
     * @param codec value codec used for sizing and persistence
     * @param evictionPolicy eviction score
     * @param mirror persistence mirror
     * @param clock time source
     */
    public InMemoryCacheStore(
            CacheStoreConfig config,
            ValueCodec codec,
            EvictionPolicy evictionPolicy,
            AsyncPersistenceMirror mirror,
            Clock clock) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        if (evictionPolicy == null) {
            throw new IllegalArgumentException("evictionPolicy cannot be null");
        }
        if (mirror == null) {
            throw new IllegalArgumentException("mirror cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.config = config;
        this.codec = codec;
        this.evictionPolicy = evictionPolicy;
        this.mirror = mirror;
        this.clock = clock;
        this.capacityBytes = config.capacityBytes();
    }

    @Override
    public void put(String key, Object value, Duration ttl) {
        validateKey(key);
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        if (ttl == null || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must not be null or negative (current: " + ttl + ")");
        }

        byte[] payload = encode(key, value);
        long size = payload.length;

        List<CacheEntry> evicted;
        lock.lock();
        try {
            if (size > capacityBytes) {
                throw new CapacityUnavailableException(key, size, capacityBytes);
            }
            Instant now = clock.instant();
            CacheEntry previous = entries.remove(key);
            if (previous != null) {
                sizeBytes -= previous.sizeBytes();
            }
            evicted = evictUntil(capacityBytes - size, now);
            entries.put(key, new CacheEntry(key, payload, decodeTypeOf(value), now, ttl, ++sequence));
            sizeBytes += size;
            evicted.forEach(entry -> mirror.delete(entry.key()));
            mirror.write(key, payload);
        } finally {
            lock.unlock();
        }

        if (!evicted.isEmpty()) {
            log.debug("Evicted {} entries to admit key {} ({} bytes)", evicted.size(), key, size);
        }
    }

    @Override
    public Optional<Object> get(String key) {
        validateKey(key);
        CacheEntry entry;
        lock.lock();
        try {
            entry = entries.get(key);
            if (entry == null) {
                return Optional.empty();
            }
            Instant now = clock.instant();
            if (entry.isExpired(now)) {
                removeEntry(entry);
                mirror.delete(key);
                return Optional.empty();
            }
            entry.touch(now);
        } finally {
            lock.unlock();
        }
        return decode(entry);
    }

    @Override
    public boolean contains(String key) {
        validateKey(key);
        lock.lock();
        try {
            CacheEntry entry = entries.get(key);
            if (entry == null) {
                return false;
            }
            if (!entry.isExpired(clock.instant())) {
                return true;
            }
            removeEntry(entry);
            mirror.delete(key);
            return false;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void remove(String key) {
        validateKey(key);
        lock.lock();
        try {
            CacheEntry entry = entries.get(key);
            if (entry != null) {
                removeEntry(entry);
                mirror.delete(key);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public SweepReport runJanitorPass() {
        Instant now = clock.instant();
        return sweep(entry -> entry.isExpired(now));
    }

    @Override
    public SweepReport purgeLowValue(Duration maxIdle, long minAccessCount) {
        if (maxIdle == null || maxIdle.isNegative()) {
            throw new IllegalArgumentException("maxIdle must not be null or negative (current: " + maxIdle + ")");
        }
        if (minAccessCount < 0) {
            throw new IllegalArgumentException("minAccessCount must not be negative (current: " + minAccessCount + ")");
        }
        Instant now = clock.instant();
        Instant idleCutoff = now.minus(maxIdle);
        return sweep(entry -> entry.isExpired(now)
            || entry.lastAccessAt().isBefore(idleCutoff)
            || entry.accessCount() < minAccessCount);
    }

    @Override
    public SweepReport shrinkTo(long targetCapacityBytes) {
        if (targetCapacityBytes <= 0 || targetCapacityBytes > config.capacityBytes()) {
            throw new IllegalArgumentException(
                "targetCapacityBytes must be between 1 and " + config.capacityBytes()
                    + " (current: " + targetCapacityBytes + ")"
            );
        }
        List<CacheEntry> evicted;
        long previousCapacity;
        lock.lock();
        try {
            previousCapacity = capacityBytes;
            if (targetCapacityBytes > previousCapacity) {
                throw new IllegalArgumentException(
                    "targetCapacityBytes must not exceed the current capacity of " + previousCapacity
                        + " (current: " + targetCapacityBytes + ")"
                );
            }
            capacityBytes = targetCapacityBytes;
            evicted = evictUntil(targetCapacityBytes, clock.instant());
            evicted.forEach(entry -> mirror.delete(entry.key()));
        } finally {
            lock.unlock();
        }
        SweepReport report = toReport(evicted);
        log.info("Cache capacity shrunk from {} to {} bytes: {} entries evicted ({} bytes)",
            previousCapacity, targetCapacityBytes, report.removedEntries(), report.reclaimedBytes());
        return report;
    }

    @Override
    public void restoreCapacity() {
        lock.lock();
        try {
            if (capacityBytes == config.capacityBytes()) {
                return;
            }
            capacityBytes = config.capacityBytes();
        } finally {
            lock.unlock();
        }
        log.info("Cache capacity restored to {} bytes", config.capacityBytes());
    }

    @Override
    public void clear() {
        int removed;
        lock.lock();
        try {
            removed = entries.size();
            entries.clear();
            sizeBytes = 0;
            mirror.clear();
        } finally {
            lock.unlock();
        }
        log.info("Cache cleared: {} entries dropped", removed);
    }

    @Override
    public CacheStats stats() {
        lock.lock();
        try {
            List<EntrySummary> largest = entries.values().stream()
                .sorted(Comparator.comparingLong(CacheEntry::sizeBytes).reversed()
                    .thenComparing(CacheEntry::key))
                .limit(config.largestEntriesReported())
                .map(entry -> new EntrySummary(entry.key(), entry.sizeBytes(), entry.accessCount()))
                .collect(Collectors.toList());
            return new CacheStats(sizeBytes, entries.size(), capacityBytes, largest);
        } finally {
            lock.unlock();
        }
    }

    private byte[] encode(String key, Object value) {
        try {
            return codec.encode(value);
        } catch (Exception e) {
            throw new EncodingFailedException(key, e);
        }
    }

    private Optional<Object> decode(CacheEntry entry) {
        try {
            return Optional.ofNullable(codec.decode(entry.payload(), entry.valueType()));
        } catch (Exception e) {
            log.warn("Dropping cache entry {}: payload cannot be decoded as {}: {}",
                entry.key(), entry.valueType().getName(), e.getMessage());
            lock.lock();
            try {
                if (entries.get(entry.key()) == entry) {
                    removeEntry(entry);
                    mirror.delete(entry.key());
                }
            } finally {
                lock.unlock();
            }
            return Optional.empty();
        }
    }

    /**
     * Type a stored value decodes into. Lists, sets and maps decode into their interface type.
     */
    private static Class<?> decodeTypeOf(Object value) {
        if (value instanceof List) {
            return List.class;
        }
        if (value instanceof Set) {
            return Set.class;
        }
        if (value instanceof Map) {
            return Map.class;
        }
        return value.getClass();
    }

    private SweepReport sweep(Predicate<CacheEntry> condition) {
        List<CacheEntry> removed = new ArrayList<>();
        lock.lock();
        try {
            Iterator<CacheEntry> iterator = entries.values().iterator();
            while (iterator.hasNext()) {
                CacheEntry entry = iterator.next();
                if (condition.test(entry)) {
                    iterator.remove();
                    sizeBytes -= entry.sizeBytes();
                    removed.add(entry);
                    mirror.delete(entry.key());
                }
            }
        } finally {
            lock.unlock();
        }
        return toReport(removed);
    }

    /**
     * Evicts until the live size is at most {@code limitBytes}. Caller holds the lock.
     */
    private List<CacheEntry> evictUntil(long limitBytes, Instant now) {
        if (sizeBytes <= limitBytes) {
            return List.of();
        }
        List<CacheEntry> evicted = new ArrayList<>();

        Iterator<CacheEntry> iterator = entries.values().iterator();
        while (iterator.hasNext()) {
            CacheEntry entry = iterator.next();
            if (entry.isExpired(now)) {
                iterator.remove();
                sizeBytes -= entry.sizeBytes();
                evicted.add(entry);
            }
        }

        if (sizeBytes > limitBytes) {
            List<CacheEntry> candidates = new ArrayList<>(entries.values());
            candidates.sort(victimOrder(now));
            for (CacheEntry candidate : candidates) {
                if (sizeBytes <= limitBytes) {
                    break;
                }
                removeEntry(candidate);
                evicted.add(candidate);
            }
        }
        return evicted;
    }

    private Comparator<CacheEntry> victimOrder(Instant now) {
        return Comparator.<CacheEntry>comparingDouble(entry -> evictionPolicy.score(entry, now))
            .thenComparing(CacheEntry::createdAt)
            .thenComparingLong(CacheEntry::sequence);
    }

    private void removeEntry(CacheEntry entry) {
        entries.remove(entry.key());
        sizeBytes -= entry.sizeBytes();
    }

    private static SweepReport toReport(List<CacheEntry> removed) {
        long bytes = 0;
        for (CacheEntry entry : removed) {
            bytes += entry.sizeBytes();
        }
        return new SweepReport(bytes, removed.size());
    }

    private static void validateKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key cannot be null or blank");
        }
    }
}
