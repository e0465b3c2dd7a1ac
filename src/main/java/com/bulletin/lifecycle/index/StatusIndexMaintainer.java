package com.bulletin.lifecycle.index;

import com.bulletin.lifecycle.chain.ChainRecord;
import com.bulletin.lifecycle.chain.RevisionChainStore;
import com.bulletin.lifecycle.core.model.EntityType;
import com.bulletin.lifecycle.metrics.MetricsService;
import com.bulletin.lifecycle.status.Status;
import com.bulletin.lifecycle.status.StatusCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Keeps the category sets of a {@link StatusIndex} in step with the status chains.
 *
 * <p>Index updates happen after the chain append has already succeeded, with no
 * transaction around the two. A failed update leaves the index stale until
 * {@link #rebuildIndexFromChains()} re-derives it from the chains.</p>
 */
public class StatusIndexMaintainer {
    private static final Logger log = LoggerFactory.getLogger(StatusIndexMaintainer.class);

    private final StatusIndex index;
    private final StatusLinkRepository links;
    private final RevisionChainStore<Status> store;
    private final MetricsService metricsService;

    public StatusIndexMaintainer(StatusIndex index, StatusLinkRepository links,
                                 RevisionChainStore<Status> store, MetricsService metricsService) {
        this.index = index;
        this.links = links;
        this.store = store;
        this.metricsService = metricsService;
    }

    /**
     * Moves an entity into {@code newCategory}. Idempotent: the entity is removed
     * from every other category, not only from {@code oldCategory}, so a repeated or
     * out-of-order call still leaves it in exactly one set.
     *
     * @param oldCategory the category before the transition, or null for a first status
     */
    public void onTransition(EntityType type, String entityHash, StatusCategory oldCategory, StatusCategory newCategory) {
        index.addToAll(type, entityHash);
        index.add(type, newCategory, entityHash);
        for (StatusCategory category : StatusCategory.values()) {
            if (category != newCategory) {
                index.remove(type, category, entityHash);
            }
        }
        log.debug("index.moved type={} entity={} from={} to={}", type, entityHash, oldCategory, newCategory);
    }

    /**
     * Same as {@link #onTransition} but reports failure instead of throwing.
     * Used after a chain append, where the authoritative write has already happened.
     *
     * @return true if the index was updated
     */
    public boolean tryOnTransition(EntityType type, String entityHash,
                                   StatusCategory oldCategory, StatusCategory newCategory) {
        try {
            onTransition(type, entityHash, oldCategory, newCategory);
            return true;
        } catch (RuntimeException e) {
            log.warn("index.update.failed type={} entity={} to={}: {}; index stays stale until rebuilt",
                    type, entityHash, newCategory, e.getMessage(), e);
            return false;
        }
    }

    /**
     * Re-derives every namespace of the index from the latest record of each status chain.
     * Always correct, and linear in the number of entities.
     */
    public IndexRebuildResult rebuildIndexFromChains() {
        long start = System.nanoTime();
        int scanned = 0;
        Map<StatusCategory, Integer> counts = new EnumMap<>(StatusCategory.class);
        for (StatusCategory category : StatusCategory.values()) {
            counts.put(category, 0);
        }

        for (EntityType type : EntityType.values()) {
            Map<StatusCategory, Set<String>> categories = new EnumMap<>(StatusCategory.class);
            for (StatusCategory category : StatusCategory.values()) {
                categories.put(category, new HashSet<>());
            }
            Set<String> all = new HashSet<>();

            for (Map.Entry<String, String> link : links.findAll(type).entrySet()) {
                ChainRecord<Status> latest = store.resolveLatest(link.getValue());
                StatusCategory category = latest.payload().category();
                categories.get(category).add(link.getKey());
                all.add(link.getKey());
                counts.merge(category, 1, Integer::sum);
                scanned++;
            }
            index.replace(type, categories, all);
        }

        Duration duration = Duration.ofNanos(System.nanoTime() - start);
        metricsService.recordIndexRebuildDuration(duration);
        log.info("index.rebuilt entities={} counts={} durationMs={}", scanned, counts, duration.toMillis());
        return new IndexRebuildResult(scanned, counts, duration);
    }
}
