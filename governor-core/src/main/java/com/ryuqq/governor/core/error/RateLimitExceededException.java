package com.ryuqq.governor.core.error;

import com.ryuqq.governor.core.model.ActionKey;

/**
 * Raised when an action class has used up its budget for the current window.
 *
 * <p>The call is rejected immediately; the caller decides when to try again.</p>
 *
 * @author Governor Team
 * @since 1.0.0
 */
public class RateLimitExceededException extends GovernorException {

    private final ActionKey actionKey;

    public RateLimitExceededException(ActionKey actionKey) {
        super(GovernorError.RATE_LIMIT_EXCEEDED, "Rate limit exceeded for " + actionKey.getValue());
        this.actionKey = actionKey;
    }

    public ActionKey getActionKey() {
        return actionKey;
    }
}
