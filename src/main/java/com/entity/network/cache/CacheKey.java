package com.entity.network.cache;

import com.entity.network.core.model.Scope;

import java.util.Objects;

/**
 * Identifies one cached value. {@code variant} separates results of the same
 * tier computed with different parameters, such as layout algorithm and seed.
 */
public record CacheKey(Scope scope, CacheTier tier, String variant) {

    public CacheKey {
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(tier, "tier");
        variant = variant != null ? variant : "";
    }

    public static CacheKey of(Scope scope, CacheTier tier) {
        return new CacheKey(scope, tier, "");
    }

    public static CacheKey of(Scope scope, CacheTier tier, String variant) {
        return new CacheKey(scope, tier, variant);
    }
}
