package com.bulletin.lifecycle.metrics;

import com.bulletin.lifecycle.core.model.EntityType;
import com.bulletin.lifecycle.status.StatusType;

import java.time.Duration;

/**
 * Interface for recording lifecycle metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without a metrics backend.
 */
public interface MetricsService {

    /**
     * @param from the previous status type, or null for a first status
     */
    void recordStatusTransition(EntityType type, StatusType from, StatusType to);

    void incrementStaleReference();

    void incrementUnauthorized();

    void incrementAdministratorChange(String action);

    void recordIndexRebuildDuration(Duration duration);

    void recordCacheHit();

    void recordCacheMiss();
}
