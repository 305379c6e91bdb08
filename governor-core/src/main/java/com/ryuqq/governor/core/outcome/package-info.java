/**
 * Settled results of asynchronous work.
 *
 * <pre>
 * Outcome&lt;T&gt; (sealed)
 *   ├── Ok&lt;T&gt;    value produced
 *   └── Fail&lt;T&gt;  GovernorException with its GovernorError code
 * </pre>
 *
 * @author Governor Team
 * @since 1.0.0
 */
package com.ryuqq.governor.core.outcome;
