package com.entity.network.cache;

import com.entity.network.core.model.Scope;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-tier cache state of a scope.
 */
public record CacheStatus(Scope scope, Map<CacheTier, TierStatus> tiers) {

    public CacheStatus {
        tiers = Collections.unmodifiableMap(new EnumMap<>(tiers));
    }

    public TierStatus tier(CacheTier tier) {
        return tiers.get(tier);
    }
}
