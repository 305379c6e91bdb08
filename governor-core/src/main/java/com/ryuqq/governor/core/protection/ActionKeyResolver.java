package com.ryuqq.governor.core.protection;

import com.ryuqq.governor.core.model.ActionKey;

/**
 * Derives the rate-limit action class from a cache key.
 *
 * @author Governor Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ActionKeyResolver {

    /**
     * Resolves the action class of a key.
     *
     * @param key cache key (not blank)
     * @return action class
     */
    ActionKey resolve(String key);
}
