package com.ryuqq.governor.core.cache;

import java.util.List;

/**
 * Cache statistics snapshot.
 *
 * @param sizeBytes sum of live payload sizes
 * @param entryCount number of live entries
 * @param capacityBytes current capacity (may be below the configured one after a shrink)
 * @param largestEntries largest entries, biggest first (at most 10)
 * @author Governor Team
 * @since 1.0.0
 */
public record CacheStats(
    long sizeBytes,
    int entryCount,
    long capacityBytes,
    List<EntrySummary> largestEntries
) {

    public CacheStats {
        if (capacityBytes <= 0) {
            throw new IllegalArgumentException("capacityBytes must be positive (current: " + capacityBytes + ")");
        }
        largestEntries = largestEntries == null ? List.of() : List.copyOf(largestEntries);
    }

    /**
     * Used fraction of the current capacity.
     *
     * @return sizeBytes / capacityBytes
     */
    public double utilizationRatio() {
        return (double) sizeBytes / capacityBytes;
    }
}
