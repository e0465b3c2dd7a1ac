package com.bulletin.lifecycle.metrics;

import com.bulletin.lifecycle.core.model.EntityType;
import com.bulletin.lifecycle.status.StatusType;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordStatusTransition(EntityType type, StatusType from, StatusType to) {
    }

    @Override
    public void incrementStaleReference() {
    }

    @Override
    public void incrementUnauthorized() {
    }

    @Override
    public void incrementAdministratorChange(String action) {
    }

    @Override
    public void recordIndexRebuildDuration(Duration duration) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}
