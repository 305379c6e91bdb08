package com.ryuqq.governor.core.error;

/**
 * Raised when the cache cannot admit an entry even after evicting everything evictable,
 * typically because the entry alone is larger than the capacity.
 *
 * @author Governor Team
 * @since 1.0.0
 */
public class CapacityUnavailableException extends GovernorException {

    private final long requiredBytes;
    private final long capacityBytes;

    public CapacityUnavailableException(String key, long requiredBytes, long capacityBytes) {
        super(GovernorError.CAPACITY_UNAVAILABLE,
            "Cannot admit key " + key + ": " + requiredBytes + " bytes required, capacity " + capacityBytes + " bytes");
        this.requiredBytes = requiredBytes;
        this.capacityBytes = capacityBytes;
    }

    public long getRequiredBytes() {
        return requiredBytes;
    }

    public long getCapacityBytes() {
        return capacityBytes;
    }
}
