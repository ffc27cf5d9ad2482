package com.entity.network.cache;

/**
 * Cache-wide counters.
 *
 * @param hitCount      lookups answered from a valid entry
 * @param missCount     lookups that recomputed or waited on a recomputation
 * @param loadCount     recomputations run
 * @param coalescedCount lookups that waited on another caller's recomputation
 * @param evictionCount entries removed by size or expiry
 * @param size          current number of entries
 */
public record CacheStats(long hitCount, long missCount, long loadCount, long coalescedCount,
                         long evictionCount, long size) {

    /**
     * Returns the hit rate (0.0 to 1.0).
     */
    public double hitRate() {
        long total = hitCount + missCount;
        return total == 0 ? 0.0 : (double) hitCount / total;
    }

    public static CacheStats empty() {
        return new CacheStats(0, 0, 0, 0, 0, 0);
    }
}
