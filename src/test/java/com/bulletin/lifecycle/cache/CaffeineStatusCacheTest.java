package com.bulletin.lifecycle.cache;

import com.bulletin.lifecycle.chain.ChainRecord;
import com.bulletin.lifecycle.chain.ChainRecordCodec;
import com.bulletin.lifecycle.chain.InMemoryRevisionChainStore;
import com.bulletin.lifecycle.status.Status;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("StatusCache Tests")
class CaffeineStatusCacheTest {

    private InMemoryRevisionChainStore<Status> store;
    private CaffeineStatusCache cache;

    @BeforeEach
    void setUp() {
        store = new InMemoryRevisionChainStore<>(new ChainRecordCodec<>(Status.class));
        cache = new CaffeineStatusCache(CacheConfig.defaults());
        store.addListener(cache);
    }

    @Test
    @DisplayName("Should load a tip once and count hits and misses")
    void loadAndGet() {
        ChainRecord<Status> root = store.create("agent", Status.pending());

        assertTrue(cache.get(root.originalHash()).isEmpty());
        assertEquals(root, cache.getOrLoad(root.originalHash(), store::resolveLatest));
        assertEquals(root, cache.get(root.originalHash()).orElseThrow());
        assertEquals(root, cache.getOrLoad(root.originalHash(), key -> {
            throw new AssertionError("cached tip must not be reloaded");
        }));

        CacheStats stats = cache.getStats();
        assertEquals(2, stats.hitCount());
        assertEquals(2, stats.missCount());
        assertEquals(0.5, stats.hitRate(), 0.001);
    }

    @Test
    @DisplayName("Should drop a tip that was superseded while it was loading")
    void appendDuringLoad() throws Exception {
        ChainRecord<Status> root = store.create("agent", Status.pending());
        CountDownLatch tipRead = new CountDownLatch(1);
        CountDownLatch appended = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<ChainRecord<Status>> append = executor.submit(() -> {
                tipRead.await();
                ChainRecord<Status> next = store.append(root.originalHash(), root.hash(), "admin", Status.accepted());
                appended.countDown();
                return next;
            });

            ChainRecord<Status> loaded = cache.getOrLoad(root.originalHash(), key -> {
                ChainRecord<Status> tip = store.resolveLatest(key);
                tipRead.countDown();
                // The append blocks on the load, so this wait times out
                awaitQuietly(appended);
                return tip;
            });
            ChainRecord<Status> accepted = append.get(5, TimeUnit.SECONDS);

            assertEquals(root, loaded);
            assertEquals(accepted, store.resolveLatest(root.originalHash()));
            assertEquals(accepted, cache.getOrLoad(root.originalHash(), store::resolveLatest));
        } finally {
            executor.shutdownNow();
        }
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(200, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Test
    @DisplayName("Should evict a chain's tip when a record is stored on it")
    void evictedOnAppend() {
        ChainRecord<Status> root = store.create("agent", Status.pending());
        ChainRecord<Status> other = store.create("agent-2", Status.pending());
        cache.getOrLoad(root.originalHash(), store::resolveLatest);
        cache.getOrLoad(other.originalHash(), store::resolveLatest);

        store.append(root.originalHash(), root.hash(), "admin", Status.accepted());

        assertTrue(cache.get(root.originalHash()).isEmpty());
        assertTrue(cache.get(other.originalHash()).isPresent());
    }

    @Test
    @DisplayName("Should drop everything on invalidateAll")
    void invalidateAll() {
        ChainRecord<Status> root = store.create("agent", Status.pending());
        cache.getOrLoad(root.originalHash(), store::resolveLatest);

        cache.invalidateAll();

        assertTrue(cache.get(root.originalHash()).isEmpty());
    }

    @Test
    @DisplayName("NoOp cache should never hold anything")
    void noOpCache() {
        NoOpStatusCache noOp = new NoOpStatusCache();
        ChainRecord<Status> root = store.create("agent", Status.pending());

        assertEquals(root, noOp.getOrLoad(root.originalHash(), store::resolveLatest));

        assertTrue(noOp.get(root.originalHash()).isEmpty());
        assertEquals(CacheStats.empty(), noOp.getStats());
    }

    @Test
    @DisplayName("Should reject invalid configuration")
    void invalidConfig() {
        assertThrows(IllegalArgumentException.class, () -> new CacheConfig(0, 60, true));
        assertThrows(IllegalArgumentException.class, () -> new CacheConfig(10, 0, true));
        assertFalse(CacheConfig.disabled().enabled());
    }
}
