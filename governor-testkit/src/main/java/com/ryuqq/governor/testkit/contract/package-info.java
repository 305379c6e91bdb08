/**
 * Reusable contract tests.
 *
 * <p>Extend {@link com.ryuqq.governor.testkit.contract.AbstractCacheStoreContractTest} in an
 * implementation module's test sources to check a {@link com.ryuqq.governor.core.spi.CacheStore}
 * against the shared behavior.</p>
 *
 * @author Governor Team
 * @since 1.0.0
 */
package com.ryuqq.governor.testkit.contract;
