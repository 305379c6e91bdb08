/**
 * In-memory cache store.
 *
 * <p>{@link com.ryuqq.governor.adapter.inmemory.cache.InMemoryCacheStore} bounds the cache by
 * encoded size and TTL and evicts by
 * {@link com.ryuqq.governor.adapter.inmemory.cache.EvictionPolicy} score. Values are sized and
 * mirrored through {@link com.ryuqq.governor.adapter.inmemory.cache.JacksonValueCodec}.</p>
 *
 * @author Governor Team
 * @since 1.0.0
 */
package com.ryuqq.governor.adapter.inmemory.cache;
