package com.entity.network.cache;

/**
 * Outcome of the last lookup against a tier of a scope.
 */
public enum AccessOutcome {
    HIT,
    MISS,
    NONE
}
