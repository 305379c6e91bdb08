package com.ryuqq.governor.core.protection.noop;

import com.ryuqq.governor.core.model.ActionKey;
import com.ryuqq.governor.core.protection.RateLimiter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * NoOpRateLimiter unit test.
 *
 * @author Governor Team
 * @since 1.0.0
 */
@DisplayName("NoOpRateLimiter")
class NoOpRateLimiterTest {

    @Test
    @DisplayName("tryAcquire() always returns true")
    void tryAcquire_AlwaysTrue() {
        // given
        RateLimiter limiter = new NoOpRateLimiter();
        ActionKey actionKey = ActionKey.of("video");

        // when & then
        for (int i = 0; i < 1000; i++) {
            assertTrue(limiter.tryAcquire(actionKey));
        }
    }

    @Test
    @DisplayName("getConfig() returns an unlimited config")
    void getConfig_Unlimited() {
        // given
        RateLimiter limiter = new NoOpRateLimiter();

        // when
        var config = limiter.getConfig();

        // then
        assertEquals(Integer.MAX_VALUE, config.maxRequests());
        assertEquals(Long.MAX_VALUE, config.windowMs());
    }
}
