package com.bulletin.lifecycle.metrics;

import com.bulletin.lifecycle.core.model.EntityType;
import com.bulletin.lifecycle.status.StatusType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code lifecycle.status.transition} - Counter (tags: entityType, from, to)</li>
 *   <li>{@code lifecycle.stale.reference} - Counter</li>
 *   <li>{@code lifecycle.unauthorized} - Counter</li>
 *   <li>{@code lifecycle.administrator.change} - Counter (tag: action)</li>
 *   <li>{@code lifecycle.index.rebuild.duration} - Timer</li>
 *   <li>{@code lifecycle.cache.hit} / {@code lifecycle.cache.miss} - Counters</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Counter staleReferenceCounter;
    private final Counter unauthorizedCounter;
    private final Timer indexRebuildTimer;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.staleReferenceCounter = Counter.builder("lifecycle.stale.reference")
                .description("Number of updates rejected because of a stale previous hash")
                .register(registry);
        this.unauthorizedCounter = Counter.builder("lifecycle.unauthorized")
                .description("Number of mutations rejected by the authorization guard")
                .register(registry);
        this.indexRebuildTimer = Timer.builder("lifecycle.index.rebuild.duration")
                .description("Duration of full status index rebuilds")
                .register(registry);
        this.cacheHitCounter = Counter.builder("lifecycle.cache.hit")
                .description("Number of latest-status cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("lifecycle.cache.miss")
                .description("Number of latest-status cache misses")
                .register(registry);
    }

    @Override
    public void recordStatusTransition(EntityType type, StatusType from, StatusType to) {
        String fromTag = from != null ? from.name() : "NONE";
        String key = "transition:" + type.name() + ":" + fromTag + ":" + to.name();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("lifecycle.status.transition")
                        .description("Number of status transitions")
                        .tag("entityType", type.name())
                        .tag("from", fromTag)
                        .tag("to", to.name())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void incrementStaleReference() {
        staleReferenceCounter.increment();
    }

    @Override
    public void incrementUnauthorized() {
        unauthorizedCounter.increment();
    }

    @Override
    public void incrementAdministratorChange(String action) {
        Counter counter = counterCache.computeIfAbsent("admin:" + action, k ->
                Counter.builder("lifecycle.administrator.change")
                        .description("Number of administrator registrations and removals")
                        .tag("action", action)
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordIndexRebuildDuration(Duration duration) {
        indexRebuildTimer.record(duration);
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }
}
