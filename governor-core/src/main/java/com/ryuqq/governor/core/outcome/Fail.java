package com.ryuqq.governor.core.outcome;

import com.ryuqq.governor.core.error.GovernorError;
import com.ryuqq.governor.core.error.GovernorException;

/**
 * Failed outcome.
 *
 * <p>Carries the governor exception that ended the work, so that
 * {@link #getOrThrow()} rethrows exactly what a direct caller would have seen.</p>
 *
 * @param exception failure (not null)
 * @param <T> value type of the failed work
 * @author Governor Team
 * @since 1.0.0
 */
public record Fail<T>(GovernorException exception) implements Outcome<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException if exception is null
     */
    public Fail {
        if (exception == null) {
            throw new IllegalArgumentException("exception cannot be null");
        }
    }

    /**
     * Creates a Fail.
     *
     * @param exception failure
     * @param <T> value type
     * @return Fail instance
     */
    public static <T> Fail<T> of(GovernorException exception) {
        return new Fail<>(exception);
    }

    /**
     * Error code of the failure.
     *
     * @return governor error
     */
    public GovernorError error() {
        return exception.getError();
    }

    /**
     * Failure message.
     *
     * @return message
     */
    public String message() {
        return exception.getMessage();
    }

    @Override
    public T getOrThrow() {
        throw exception;
    }
}
