package com.bulletin.lifecycle.api;

import com.bulletin.lifecycle.cache.CacheConfig;

import java.util.Objects;

/**
 * Settings of an {@link EntityLifecycle} instance.
 *
 * @param progenitorAgentKey agent allowed to register the first administrator, or null to disable bootstrap
 * @param maxSuspensionDays  upper bound for {@code suspendTemporarily} durations
 * @param cacheConfig        latest-status cache settings
 */
public record LifecycleConfig(String progenitorAgentKey, int maxSuspensionDays, CacheConfig cacheConfig) {

    public static final int DEFAULT_MAX_SUSPENSION_DAYS = 365;

    public LifecycleConfig {
        if (maxSuspensionDays <= 0) {
            throw new IllegalArgumentException("maxSuspensionDays must be > 0");
        }
        Objects.requireNonNull(cacheConfig, "cacheConfig is required");
    }

    /**
     * No progenitor, 365 day suspension cap, caching disabled.
     */
    public static LifecycleConfig defaults() {
        return new LifecycleConfig(null, DEFAULT_MAX_SUSPENSION_DAYS, CacheConfig.disabled());
    }

    public LifecycleConfig withProgenitor(String agentKey) {
        return new LifecycleConfig(agentKey, maxSuspensionDays, cacheConfig);
    }

    public LifecycleConfig withCache(CacheConfig cache) {
        return new LifecycleConfig(progenitorAgentKey, maxSuspensionDays, cache);
    }
}
