package com.ryuqq.governor.adapter.runner;

import com.ryuqq.governor.application.scheduler.LifecycleScheduler;
import com.ryuqq.governor.core.cache.CacheStats;
import com.ryuqq.governor.core.cache.SweepReport;
import com.ryuqq.governor.core.model.Priority;
import com.ryuqq.governor.core.spi.CacheStore;
import com.ryuqq.governor.core.statemachine.LifecycleState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Periodic cache maintenance driven by the lifecycle scheduler.
 *
 * <p><strong>Duties:</strong></p>
 * <ul>
 *   <li>Every {@code intervalMs} (scaled by the scheduler multiplier): remove expired entries.</li>
 *   <li>On entering CRITICAL pressure: shrink capacity by {@code shrinkFactor}, never below
 *       {@code minCapacityBytes}.</li>
 *   <li>On leaving CRITICAL pressure: restore the configured capacity.</li>
 *   <li>On entering BACKGROUND: purge low-value entries.</li>
 * </ul>
 *
 * <p>Failures are logged and never reach the scheduler.</p>
 *
 * @author Governor Team
 * @since 1.0.0
 */
public final class CacheJanitor {

    private static final Logger log = LoggerFactory.getLogger(CacheJanitor.class);

    static final String TASK_ID = "cache-janitor";

    private final CacheStore cacheStore;
    private final LifecycleScheduler scheduler;
    private final JanitorConfig config;

    private volatile boolean started;

    public CacheJanitor(CacheStore cacheStore, LifecycleScheduler scheduler, JanitorConfig config) {
        if (cacheStore == null) {
            throw new IllegalArgumentException("cacheStore cannot be null");
        }
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.cacheStore = cacheStore;
        this.scheduler = scheduler;
        this.config = config;
    }

    /**
     * Registers the periodic pass and the state listener. Idempotent.
     */
    public synchronized void start() {
        if (started) {
            return;
        }
        scheduler.registerTask(TASK_ID, Duration.ofMillis(config.intervalMs()), this::runPass, Priority.HIGH);
        scheduler.addListener(this::onStateChanged);
        started = true;
        log.info("Cache janitor started (interval {}ms)", config.intervalMs());
    }

    /**
     * Cancels the periodic pass. State reactions stop as well.
     */
    public synchronized void stop() {
        if (!started) {
            return;
        }
        started = false;
        scheduler.cancelTask(TASK_ID);
        log.info("Cache janitor stopped");
    }

    /**
     * Runs one expiry pass.
     *
     * @return what the pass removed, or an empty report if it failed
     */
    public SweepReport runPass() {
        log.debug("Cache janitor pass started");
        try {
            SweepReport report = cacheStore.runJanitorPass();
            log.debug("Cache janitor pass completed: {} entries removed, {} bytes reclaimed",
                report.removedEntries(), report.reclaimedBytes());
            return report;
        } catch (RuntimeException e) {
            log.warn("Cache janitor pass failed: {}", e.getMessage(), e);
            return SweepReport.empty();
        }
    }

    void onStateChanged(LifecycleState previous, LifecycleState current) {
        if (!started) {
            return;
        }
        if (!previous.isCritical() && current.isCritical()) {
            shrink();
        } else if (previous.isCritical() && !current.isCritical()) {
            restore();
        }
        if (!previous.isBackground() && current.isBackground()) {
            purge();
        }
    }

    long shrinkTarget(long currentCapacityBytes) {
        long scaled = Math.round(currentCapacityBytes * config.shrinkFactor());
        return Math.min(currentCapacityBytes, Math.max(config.minCapacityBytes(), scaled));
    }

    private void shrink() {
        try {
            CacheStats stats = cacheStore.stats();
            long target = shrinkTarget(stats.capacityBytes());
            SweepReport report = cacheStore.shrinkTo(target);
            log.info("Cache shrunk under critical pressure: {} -> {} bytes ({} entries evicted)",
                stats.capacityBytes(), target, report.removedEntries());
        } catch (RuntimeException e) {
            log.warn("Cache shrink failed: {}", e.getMessage(), e);
        }
    }

    private void restore() {
        try {
            cacheStore.restoreCapacity();
            log.info("Cache capacity restored after critical pressure");
        } catch (RuntimeException e) {
            log.warn("Cache capacity restore failed: {}", e.getMessage(), e);
        }
    }

    private void purge() {
        try {
            SweepReport report = cacheStore.purgeLowValue(
                Duration.ofMillis(config.purgeMaxIdleMs()), config.purgeMinAccessCount());
            log.info("Cache purged on entering background: {} entries removed, {} bytes reclaimed",
                report.removedEntries(), report.reclaimedBytes());
        } catch (RuntimeException e) {
            log.warn("Cache purge failed: {}", e.getMessage(), e);
        }
    }
}
