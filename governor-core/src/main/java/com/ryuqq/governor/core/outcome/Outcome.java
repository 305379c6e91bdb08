package com.ryuqq.governor.core.outcome;

import com.ryuqq.governor.core.error.GovernorException;

/**
 * Settled result of a unit of work.
 *
 * <p>An Outcome is one of two cases:</p>
 * <ul>
 *   <li>{@link Ok}: the work produced a value</li>
 *   <li>{@link Fail}: the work failed with a governor error</li>
 * </ul>
 *
 * <p>Defined as a sealed interface so that every case is known at compile time.
 * Batch execution reports one Outcome per submitted work, in submission order.</p>
 *
 * @param <T> value type
 * @author Governor Team
 * @since 1.0.0
 */
public sealed interface Outcome<T> permits Ok, Fail {

    /**
     * Whether the outcome is a success.
     *
     * @return true for {@link Ok}
     */
    default boolean isOk() {
        return this instanceof Ok;
    }

    /**
     * Whether the outcome is a failure.
     *
     * @return true for {@link Fail}
     */
    default boolean isFail() {
        return this instanceof Fail;
    }

    /**
     * Returns the value or throws the failure.
     *
     * @return the value of an {@link Ok}
     * @throws GovernorException for a {@link Fail}
     */
    T getOrThrow();
}
