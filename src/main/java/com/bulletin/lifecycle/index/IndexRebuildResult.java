package com.bulletin.lifecycle.index;

import com.bulletin.lifecycle.status.StatusCategory;

import java.time.Duration;
import java.util.Map;

/**
 * Outcome of a full index rebuild.
 *
 * @param entitiesScanned number of status chains resolved
 * @param categoryCounts  resulting size of every category set, across namespaces
 * @param duration        wall time of the rebuild
 */
public record IndexRebuildResult(int entitiesScanned, Map<StatusCategory, Integer> categoryCounts, Duration duration) {

    public IndexRebuildResult {
        categoryCounts = Map.copyOf(categoryCounts);
    }
}
