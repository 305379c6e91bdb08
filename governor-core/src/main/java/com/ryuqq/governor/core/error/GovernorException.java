package com.ryuqq.governor.core.error;

/**
 * Base class of every failure raised by the governor.
 *
 * <p>Unchecked: callers of asynchronous APIs receive it as the cause of a
 * {@link java.util.concurrent.CompletionException}.</p>
 *
 * @author Governor Team
 * @since 1.0.0
 */
public class GovernorException extends RuntimeException {

    private final GovernorError error;

    public GovernorException(GovernorError error, String message) {
        this(error, message, null);
    }

    public GovernorException(GovernorError error, String message, Throwable cause) {
        super("[" + requireError(error).getCode() + "] " + message, cause);
        this.error = error;
    }

    private static GovernorError requireError(GovernorError error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        return error;
    }

    public GovernorError getError() {
        return error;
    }
}
