package com.ryuqq.governor.core.cache;

/**
 * Result of a bulk removal (janitor pass, purge, shrink).
 *
 * @param reclaimedBytes bytes freed
 * @param removedEntries entries removed
 * @author Governor Team
 * @since 1.0.0
 */
public record SweepReport(long reclaimedBytes, int removedEntries) {

    private static final SweepReport EMPTY = new SweepReport(0, 0);

    public SweepReport {
        if (reclaimedBytes < 0) {
            throw new IllegalArgumentException("reclaimedBytes must be non-negative (current: " + reclaimedBytes + ")");
        }
        if (removedEntries < 0) {
            throw new IllegalArgumentException("removedEntries must be non-negative (current: " + removedEntries + ")");
        }
    }

    public static SweepReport empty() {
        return EMPTY;
    }

    public SweepReport plus(SweepReport other) {
        return new SweepReport(reclaimedBytes + other.reclaimedBytes, removedEntries + other.removedEntries);
    }
}
