/**
 * Value types shared by every governor component.
 *
 * <ul>
 *   <li>{@link com.ryuqq.governor.core.model.ActionKey} - rate-limit action class</li>
 *   <li>{@link com.ryuqq.governor.core.model.Priority} - request and task importance</li>
 * </ul>
 *
 * <p>Cache keys themselves are plain opaque strings; the governor never interprets them
 * beyond deriving an {@code ActionKey}.</p>
 *
 * @author Governor Team
 * @since 1.0.0
 */
package com.ryuqq.governor.core.model;
