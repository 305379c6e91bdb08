package com.ryuqq.governor.core.error;

/**
 * Wraps a failure to write a result back to the cache. Logged by the coordinator, never surfaced to callers.
 *
 * @author Governor Team
 * @since 1.0.0
 */
public class CacheWriteFailedException extends GovernorException {

    public CacheWriteFailedException(String key, Throwable cause) {
        super(GovernorError.CACHE_WRITE_FAILED, "Cannot cache result for key: " + key, cause);
    }
}
