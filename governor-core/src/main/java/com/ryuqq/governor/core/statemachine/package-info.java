/**
 * Lifecycle state model.
 *
 * <pre>
 *                 lifecycle event
 *   FOREGROUND  ◄──────────────►  BACKGROUND
 *        ×                             ×
 *   NORMAL ◄──► ELEVATED ◄──► CRITICAL   (pressure sampling)
 * </pre>
 *
 * <p>{@link com.ryuqq.governor.core.statemachine.LifecycleState} combines both axes into one
 * immutable snapshot.</p>
 *
 * @author Governor Team
 * @since 1.0.0
 */
package com.ryuqq.governor.core.statemachine;
