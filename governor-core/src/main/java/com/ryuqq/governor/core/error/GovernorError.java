package com.ryuqq.governor.core.error;

/**
 * Failure taxonomy of the governor.
 *
 * <p><strong>Propagation:</strong></p>
 * <ul>
 *   <li>CAPACITY_UNAVAILABLE, ENCODING_FAILED: returned by cache writes; absorbed by the coordinator</li>
 *   <li>RATE_LIMIT_EXCEEDED, TIMEOUT, WORK_FAILED: surfaced to the caller</li>
 *   <li>CACHE_WRITE_FAILED: logged only, never fails a call</li>
 * </ul>
 *
 * @author Governor Team
 * @since 1.0.0
 */
public enum GovernorError {

    /**
     * Cache cannot admit an entry even after eviction.
     */
    CAPACITY_UNAVAILABLE("GOV-001"),

    /**
     * Value could not be sized or serialized for storage.
     */
    ENCODING_FAILED("GOV-002"),

    /**
     * Action class exceeded its request budget for the current window.
     */
    RATE_LIMIT_EXCEEDED("GOV-003"),

    /**
     * An attempt exceeded its allotted time.
     */
    TIMEOUT("GOV-004"),

    /**
     * The underlying work failed after retries were exhausted.
     */
    WORK_FAILED("GOV-005"),

    /**
     * Writing a result back to the cache failed.
     */
    CACHE_WRITE_FAILED("GOV-006");

    private final String code;

    GovernorError(String code) {
        this.code = code;
    }

    /**
     * Stable error code.
     *
     * @return error code (e.g. GOV-003)
     */
    public String getCode() {
        return code;
    }
}
