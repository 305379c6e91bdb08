/**
 * SPI (Service Provider Interface) package.
 *
 * <p>Seams between the governor and its environment:</p>
 * <ul>
 *   <li>{@link com.ryuqq.governor.core.spi.CacheStore} - bounded key/value store</li>
 *   <li>{@link com.ryuqq.governor.core.spi.ValueCodec} - value encoding used for sizing</li>
 *   <li>{@link com.ryuqq.governor.core.spi.PersistenceBackend} - best-effort durable mirror</li>
 *   <li>{@link com.ryuqq.governor.core.spi.LifecycleEventSource} - foreground/background events</li>
 *   <li>{@link com.ryuqq.governor.core.spi.PressureSampler} - resource-pressure readings</li>
 *   <li>{@link com.ryuqq.governor.core.spi.LifecycleListener} - state transition callbacks</li>
 * </ul>
 *
 * <p>None of these depend on a specific OS API; hosts inject their own implementations.</p>
 *
 * @author Governor Team
 * @since 1.0.0
 */
package com.ryuqq.governor.core.spi;
