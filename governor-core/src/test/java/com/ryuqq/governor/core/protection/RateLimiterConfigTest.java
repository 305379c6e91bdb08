package com.ryuqq.governor.core.protection;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RateLimiterConfigTest {

    @Test
    void defaultConstructor_UsesDefaults() {
        RateLimiterConfig config = new RateLimiterConfig();

        assertEquals(10, config.maxRequests());
        assertEquals(1000, config.windowMs());
        assertEquals(100, config.purgeThreshold());
    }

    @Test
    void constructor_ZeroMaxRequests_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new RateLimiterConfig(0, 1000, 100)
        );
        assertTrue(exception.getMessage().contains("maxRequests must be positive (current: 0)"));
    }

    @Test
    void constructor_NegativeWindow_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new RateLimiterConfig(10, -1, 100));
    }

    @Test
    void withMethods_ReturnModifiedCopies() {
        RateLimiterConfig config = new RateLimiterConfig()
            .withMaxRequests(3)
            .withWindowMs(500)
            .withPurgeThreshold(5);

        assertEquals(new RateLimiterConfig(3, 500, 5), config);
    }
}
