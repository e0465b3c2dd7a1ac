package com.bulletin.lifecycle.cache;

/**
 * Counters of the status tip cache, as reported by {@link StatusCache#getStats()}.
 *
 * @param hitCount      latest-status reads answered without resolving the chain
 * @param missCount     reads that resolved the chain tip from the store
 * @param evictionCount tips dropped for size or age; invalidations on append are not counted
 * @param size          status chains whose tip is currently cached
 */
public record CacheStats(long hitCount, long missCount, long evictionCount, long size) {

    public double hitRate() {
        long total = hitCount + missCount;
        return total == 0 ? 0.0 : (double) hitCount / total;
    }

    public static CacheStats empty() {
        return new CacheStats(0, 0, 0, 0);
    }
}
