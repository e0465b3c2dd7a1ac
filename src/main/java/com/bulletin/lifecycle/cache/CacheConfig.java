package com.bulletin.lifecycle.cache;

/**
 * Sizing of the cache that maps a status chain's original hash to its resolved tip.
 *
 * <p>Appends evict the affected chain immediately, so {@code ttlSeconds} only bounds
 * how long a tip can lag behind records that reach the store without a listener
 * notification.</p>
 *
 * @param maxSize    maximum number of status chains whose tip is kept
 * @param ttlSeconds seconds a resolved tip is served before it is resolved again
 * @param enabled    false selects {@link NoOpStatusCache}, so every read resolves the chain
 */
public record CacheConfig(int maxSize, int ttlSeconds, boolean enabled) {

    public CacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be > 0");
        }
    }

    /**
     * Tips of up to 10,000 status chains, each served for at most a minute.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(10_000, 60, true);
    }

    public static CacheConfig disabled() {
        return new CacheConfig(1, 1, false);
    }
}
