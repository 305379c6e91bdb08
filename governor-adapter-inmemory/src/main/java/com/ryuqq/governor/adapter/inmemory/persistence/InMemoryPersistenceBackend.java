package com.ryuqq.governor.adapter.inmemory.persistence;

import com.ryuqq.governor.core.spi.PersistenceBackend;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link PersistenceBackend} for testing and reference purposes.
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * @author Governor Team
 * @since 1.0.0
 */
public class InMemoryPersistenceBackend implements PersistenceBackend {

    private final ConcurrentHashMap<String, byte[]> payloads = new ConcurrentHashMap<>();

    @Override
    public void write(String key, byte[] payload) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        payloads.put(key, payload.clone());
    }

    @Override
    public void delete(String key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        payloads.remove(key);
    }

    @Override
    public void clear() {
        payloads.clear();
    }

    /**
     * Reads a stored payload.
     *
     * @param key cache key
     * @return copy of the payload, or empty
     */
    public Optional<byte[]> read(String key) {
        byte[] payload = payloads.get(key);
        return payload == null ? Optional.empty() : Optional.of(payload.clone());
    }

    public Set<String> keys() {
        return Set.copyOf(payloads.keySet());
    }

    public int size() {
        return payloads.size();
    }
}
