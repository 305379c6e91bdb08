package com.ryuqq.governor.core.error;

/**
 * Raised when the final attempt of a unit of work exceeded its per-attempt timeout.
 *
 * @author Governor Team
 * @since 1.0.0
 */
public class OperationTimeoutException extends GovernorException {

    private final long timeoutMs;

    public OperationTimeoutException(String key, long timeoutMs, Throwable cause) {
        super(GovernorError.TIMEOUT, "Work for key " + key + " timed out after " + timeoutMs + "ms", cause);
        this.timeoutMs = timeoutMs;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
