package com.bulletin.lifecycle.cache;

import com.bulletin.lifecycle.chain.ChainListener;
import com.bulletin.lifecycle.chain.ChainRecord;
import com.bulletin.lifecycle.status.Status;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Function;

/**
 * Caffeine-backed cache of status chain tips.
 * Registered as a {@link ChainListener} so every stored record evicts its chain's entry.
 */
public class CaffeineStatusCache implements StatusCache, ChainListener<Status> {
    private static final Logger log = LoggerFactory.getLogger(CaffeineStatusCache.class);

    private final Cache<String, ChainRecord<Status>> cache;

    public CaffeineStatusCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .build();
        log.info("CaffeineStatusCache initialized: maxSize={}, ttl={}s", config.maxSize(), config.ttlSeconds());
    }

    @Override
    public Optional<ChainRecord<Status>> get(String originalHash) {
        return Optional.ofNullable(cache.getIfPresent(originalHash));
    }

    @Override
    public ChainRecord<Status> getOrLoad(String originalHash, Function<String, ChainRecord<Status>> loader) {
        return cache.get(originalHash, loader);
    }

    @Override
    public void invalidate(String originalHash) {
        cache.invalidate(originalHash);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("Invalidated all cached status tips");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.evictionCount(),
                cache.estimatedSize()
        );
    }

    @Override
    public void onRecordStored(ChainRecord<Status> record) {
        invalidate(record.originalHash());
    }
}
