/**
 * In-memory persistence backend used as a reference mirror.
 *
 * @author Governor Team
 * @since 1.0.0
 */
package com.ryuqq.governor.adapter.inmemory.persistence;
