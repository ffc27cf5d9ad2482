package com.entity.network.snapshot;

/**
 * Ranking of entities in a {@link GraphSubset}.
 */
public enum SubsetOrder {
    /** Degree centrality, highest first. */
    CENTRALITY,
    /** Number of distinct neighbors, highest first. */
    MENTIONS,
    /** Most recently first seen first. */
    RECENT
}
