package com.entity.network.cache;

import java.time.Instant;

/**
 * A cached value and the invalidation generation it was computed under.
 *
 * @param loadedAtNanos ticker reading at load, used for age
 */
public record CacheEntry(Object value, CacheKey key, Instant loadedAt, long loadedAtNanos, long generation) {
}
