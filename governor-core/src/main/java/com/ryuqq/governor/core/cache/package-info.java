/**
 * Value types reported by a {@link com.ryuqq.governor.core.spi.CacheStore}.
 */
package com.ryuqq.governor.core.cache;
