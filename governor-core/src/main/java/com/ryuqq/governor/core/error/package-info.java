/**
 * Failure taxonomy.
 *
 * <p>Every failure is a {@link com.ryuqq.governor.core.error.GovernorException} carrying a
 * {@link com.ryuqq.governor.core.error.GovernorError} code, with one subclass per case so
 * callers can catch the ones they handle.</p>
 *
 * @author Governor Team
 * @since 1.0.0
 */
package com.ryuqq.governor.core.error;
