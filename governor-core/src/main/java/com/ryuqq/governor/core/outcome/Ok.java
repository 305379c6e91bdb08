package com.ryuqq.governor.core.outcome;

/**
 * Successful outcome.
 *
 * @param value produced value (null allowed)
 * @param <T> value type
 * @author Governor Team
 * @since 1.0.0
 */
public record Ok<T>(T value) implements Outcome<T> {

    /**
     * Creates an Ok.
     *
     * @param value produced value
     * @param <T> value type
     * @return Ok instance
     */
    public static <T> Ok<T> of(T value) {
        return new Ok<>(value);
    }

    @Override
    public T getOrThrow() {
        return value;
    }
}
