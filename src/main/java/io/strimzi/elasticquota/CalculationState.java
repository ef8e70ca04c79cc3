/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.strimzi.elasticquota;

/**
 * Progress of a quota group through a recalculation pass. A group only reaches {@link #COMMITTED} after its parent
 * has been {@link #DISTRIBUTED}.
 */
public enum CalculationState {
    /**
     * transient figures discarded, waiting for the next aggregation
     */
    RESET,
    /**
     * request and used aggregated from the subtree
     */
    AGGREGATED,
    /**
     * auto-scaled minimum computed against the parent's capacity
     */
    MIN_SCALED,
    /**
     * share of the parent's capacity computed, not yet masked to the group's declared resources
     */
    DISTRIBUTED,
    /**
     * runtime masked and written
     */
    COMMITTED
}
