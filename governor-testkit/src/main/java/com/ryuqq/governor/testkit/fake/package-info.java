/**
 * Deterministic fakes for time, lifecycle events and pressure readings.
 *
 * @author Governor Team
 * @since 1.0.0
 */
package com.ryuqq.governor.testkit.fake;
