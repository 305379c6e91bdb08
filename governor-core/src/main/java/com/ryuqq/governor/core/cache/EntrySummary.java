package com.ryuqq.governor.core.cache;

/**
 * Size and usage of a single cache entry, as reported in {@link CacheStats}.
 *
 * @param key cache key
 * @param sizeBytes payload size
 * @param accessCount number of hits
 * @author Governor Team
 * @since 1.0.0
 */
public record EntrySummary(String key, long sizeBytes, long accessCount) {
}
