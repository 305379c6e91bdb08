package com.ryuqq.governor.adapter.inmemory.cache;

/**
 * In-memory cache store configuration.
 *
 * <p><strong>Defaults:</strong></p>
 * <ul>
 *   <li>capacityBytes: 50 MB</li>
 *   <li>largestEntriesReported: 10</li>
 * </ul>
 *
 * @param capacityBytes configured capacity in bytes
 * @param largestEntriesReported number of entries listed in {@code stats().largestEntries()}
 * @author Governor Team
 * @since 1.0.0
 */
public record CacheStoreConfig(long capacityBytes, int largestEntriesReported) {

    private static final long DEFAULT_CAPACITY_BYTES = 50L * 1024 * 1024;
    private static final int DEFAULT_LARGEST_ENTRIES_REPORTED = 10;

    /**
     * Default configuration.
     */
    public CacheStoreConfig() {
        this(DEFAULT_CAPACITY_BYTES, DEFAULT_LARGEST_ENTRIES_REPORTED);
    }

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException if a value is out of range
     */
    public CacheStoreConfig {
        if (capacityBytes <= 0) {
            throw new IllegalArgumentException("capacityBytes must be positive (current: " + capacityBytes + ")");
        }
        if (largestEntriesReported < 0) {
            throw new IllegalArgumentException(
                "largestEntriesReported must not be negative (current: " + largestEntriesReported + ")"
            );
        }
    }

    public static CacheStoreConfig ofCapacity(long capacityBytes) {
        return new CacheStoreConfig().withCapacityBytes(capacityBytes);
    }

    public CacheStoreConfig withCapacityBytes(long capacityBytes) {
        return new CacheStoreConfig(capacityBytes, largestEntriesReported);
    }

    public CacheStoreConfig withLargestEntriesReported(int largestEntriesReported) {
        return new CacheStoreConfig(capacityBytes, largestEntriesReported);
    }
}
