package com.ryuqq.governor.core.error;

/**
 * Raised when the underlying work failed and no attempts remain.
 *
 * <p>{@link #getCause()} is the failure of the last attempt.</p>
 *
 * @author Governor Team
 * @since 1.0.0
 */
public class WorkFailedException extends GovernorException {

    private final int attempts;

    public WorkFailedException(String key, int attempts, Throwable cause) {
        super(GovernorError.WORK_FAILED, "Work for key " + key + " failed after " + attempts + " attempt(s)", cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
