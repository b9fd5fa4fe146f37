package com.catalog.resolution.core.model;

/**
 * How a resolution call ended. Used to tag metrics.
 */
public enum ResolutionOutcome {
    /**
     * At least one candidate survived.
     */
    MATCHED,

    /**
     * The call succeeded with an empty result.
     */
    NO_MATCH,

    /**
     * Rejected caller input (empty query or bad arguments).
     */
    INVALID_INPUT,

    /**
     * The candidate store could not be reached.
     */
    STORE_UNAVAILABLE
}
