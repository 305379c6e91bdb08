package com.ryuqq.governor.adapter.inmemory.ratelimit;

import com.ryuqq.governor.core.model.ActionKey;
import com.ryuqq.governor.core.protection.ActionKeyResolver;

/**
 * Derives the action class from the part of the key before the first {@code ':'}.
 *
 * <p>{@code "video:42"} maps to {@code video}. A key without a separator, or one that starts
 * with it, maps to itself. Action classes are cut to 255 characters.</p>
 *
 * @author Governor Team
 * @since 1.0.0
 */
public final class PrefixActionKeyResolver implements ActionKeyResolver {

    private static final char SEPARATOR = ':';

    @Override
    public ActionKey resolve(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key cannot be null or blank");
        }
        int index = key.indexOf(SEPARATOR);
        String actionClass = index > 0 ? key.substring(0, index) : key;
        if (actionClass.isBlank()) {
            actionClass = key;
        }
        if (actionClass.length() > 255) {
            actionClass = actionClass.substring(0, 255);
        }
        return ActionKey.of(actionClass);
    }
}
