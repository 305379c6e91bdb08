package com.ryuqq.governor.adapter.inmemory.cache;

import com.ryuqq.governor.core.spi.PersistenceBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Hands cache mutations to a {@link PersistenceBackend} off the caller's thread.
 *
 * <p>Best-effort: backend failures and executor rejections are logged and dropped. Use a
 * single-threaded executor to keep mutations of one key in order.</p>
 *
 * @author Governor Team
 * @since 1.0.0
 */
public final class AsyncPersistenceMirror {

    private static final Logger log = LoggerFactory.getLogger(AsyncPersistenceMirror.class);

    private final PersistenceBackend backend;
    private final Executor executor;

    public AsyncPersistenceMirror(PersistenceBackend backend, Executor executor) {
        if (backend == null) {
            throw new IllegalArgumentException("backend cannot be null");
        }
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        this.backend = backend;
        this.executor = executor;
    }

    public void write(String key, byte[] payload) {
        submit("write " + key, () -> backend.write(key, payload));
    }

    public void delete(String key) {
        submit("delete " + key, () -> backend.delete(key));
    }

    public void clear() {
        submit("clear", backend::clear);
    }

    private void submit(String description, BackendCall call) {
        try {
            executor.execute(() -> {
                try {
                    call.run();
                } catch (Exception e) {
                    log.warn("Persistence mirror failed to {}: {}", description, e.getMessage());
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Persistence mirror rejected {}: executor unavailable", description);
        }
    }

    @FunctionalInterface
    private interface BackendCall {
        void run() throws Exception;
    }
}
