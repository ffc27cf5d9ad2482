package com.entity.network.cache;

import java.util.EnumSet;
import java.util.Set;

/**
 * Independently expiring layers of the analytics cache. Layouts and clusters
 * are computed from a snapshot, so they are dependents of {@link #SNAPSHOT}.
 */
public enum CacheTier {
    SNAPSHOT,
    LAYOUT,
    CLUSTER;

    /**
     * This tier plus every tier derived from it.
     */
    public Set<CacheTier> withDependents() {
        return this == SNAPSHOT ? EnumSet.allOf(CacheTier.class) : EnumSet.of(this);
    }
}
