package com.ryuqq.governor.core.spi.noop;

import com.ryuqq.governor.core.spi.PersistenceBackend;

/**
 * PersistenceBackend NoOp implementation.
 *
 * <p>Discards every write. Default when the host does not mirror the cache.</p>
 *
 * @author Governor Team
 * @since 1.0.0
 */
public final class NoOpPersistenceBackend implements PersistenceBackend {

    @Override
    public void write(String key, byte[] payload) {
    }

    @Override
    public void delete(String key) {
    }

    @Override
    public void clear() {
    }
}
