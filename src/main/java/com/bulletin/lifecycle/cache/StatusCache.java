package com.bulletin.lifecycle.cache;

import com.bulletin.lifecycle.chain.ChainRecord;
import com.bulletin.lifecycle.status.Status;

import java.util.Optional;
import java.util.function.Function;

/**
 * Cache of resolved status chain tips, keyed by the chain's original hash.
 * Entries must be invalidated whenever a record is stored in the chain.
 */
public interface StatusCache {

    Optional<ChainRecord<Status>> get(String originalHash);

    /**
     * Returns the cached tip, loading it when absent. Loading and invalidation of
     * the same chain are mutually exclusive, so an invalidation issued while a load
     * is running removes the loaded value instead of being overwritten by it.
     *
     * @param loader resolves the current tip from the chain store
     */
    ChainRecord<Status> getOrLoad(String originalHash, Function<String, ChainRecord<Status>> loader);

    void invalidate(String originalHash);

    void invalidateAll();

    CacheStats getStats();
}
