package com.bulletin.lifecycle.cache;

import com.bulletin.lifecycle.chain.ChainRecord;
import com.bulletin.lifecycle.status.Status;

import java.util.Optional;
import java.util.function.Function;

/**
 * Cache that never holds anything. Used when caching is disabled.
 */
public class NoOpStatusCache implements StatusCache {

    @Override
    public Optional<ChainRecord<Status>> get(String originalHash) {
        return Optional.empty();
    }

    @Override
    public ChainRecord<Status> getOrLoad(String originalHash, Function<String, ChainRecord<Status>> loader) {
        return loader.apply(originalHash);
    }

    @Override
    public void invalidate(String originalHash) {
        // no-op
    }

    @Override
    public void invalidateAll() {
        // no-op
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
