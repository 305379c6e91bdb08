package com.ryuqq.governor.core.error;

/**
 * Raised when a value cannot be serialized to size it for the cache.
 *
 * @author Governor Team
 * @since 1.0.0
 */
public class EncodingFailedException extends GovernorException {

    public EncodingFailedException(String key, Throwable cause) {
        super(GovernorError.ENCODING_FAILED, "Cannot encode value for key: " + key, cause);
    }
}
