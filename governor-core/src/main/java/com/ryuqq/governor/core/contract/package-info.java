/**
 * Caller-facing contract of the request coordinator.
 *
 * <ul>
 *   <li>{@link com.ryuqq.governor.core.contract.Work} - asynchronous unit of work</li>
 *   <li>{@link com.ryuqq.governor.core.contract.RequestOptions} - caching, priority and retry options</li>
 * </ul>
 *
 * @author Governor Team
 * @since 1.0.0
 */
package com.ryuqq.governor.core.contract;
