/**
 * In-memory rate limiting.
 *
 * @author Governor Team
 * @since 1.0.0
 */
package com.ryuqq.governor.adapter.inmemory.ratelimit;
