package com.ryuqq.governor.core.model;

/**
 * Rate-limit action class.
 *
 * <p>ActionKey groups cache keys that share a rate-limit window. It is coarser-grained
 * than a cache key: {@code "video:42"} and {@code "video:43"} usually map to the same
 * ActionKey {@code "video"}.</p>
 *
 * <p><strong>Immutability:</strong> value cannot change after creation</p>
 * <p><strong>Validation:</strong></p>
 * <ul>
 *   <li>not null or blank</li>
 *   <li>length: 1~255 characters</li>
 * </ul>
 *
 * @author Governor Team
 * @since 1.0.0
 */
public final class ActionKey {

    private static final int MAX_LENGTH = 255;

    private final String value;

    private ActionKey(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("ActionKey cannot be null or blank");
        }
        if (value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException(
                "ActionKey length cannot exceed " + MAX_LENGTH + " characters (current: " + value.length() + ")"
            );
        }
        this.value = value;
    }

    /**
     * Creates an ActionKey.
     *
     * @param value action class name
     * @return ActionKey instance
     * @throws IllegalArgumentException if the value is invalid
     */
    public static ActionKey of(String value) {
        return new ActionKey(value);
    }

    /**
     * Returns the action class name.
     *
     * @return action class name
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ActionKey actionKey = (ActionKey) o;
        return value.equals(actionKey.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "ActionKey{" + value + '}';
    }
}
