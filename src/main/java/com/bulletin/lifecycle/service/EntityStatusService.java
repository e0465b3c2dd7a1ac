package com.bulletin.lifecycle.service;

import com.bulletin.lifecycle.audit.AuditAction;
import com.bulletin.lifecycle.audit.AuditService;
import com.bulletin.lifecycle.auth.AuthorizationGuard;
import com.bulletin.lifecycle.cache.StatusCache;
import com.bulletin.lifecycle.chain.ChainFork;
import com.bulletin.lifecycle.chain.ChainRecord;
import com.bulletin.lifecycle.chain.RevisionChainStore;
import com.bulletin.lifecycle.chain.StaleReferenceException;
import com.bulletin.lifecycle.core.NotFoundException;
import com.bulletin.lifecycle.core.model.EntityType;
import com.bulletin.lifecycle.index.IndexRebuildResult;
import com.bulletin.lifecycle.index.StatusIndex;
import com.bulletin.lifecycle.index.StatusIndexMaintainer;
import com.bulletin.lifecycle.index.StatusLinkRepository;
import com.bulletin.lifecycle.logging.LogContext;
import com.bulletin.lifecycle.metrics.MetricsService;
import com.bulletin.lifecycle.status.Status;
import com.bulletin.lifecycle.status.StatusCategory;
import com.bulletin.lifecycle.status.StatusStateMachine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Coordinates entity status chains with authorization, the derived index,
 * caching and the audit trail.
 *
 * <p>Mutation flow: guard, state machine, optimistic append, index update.
 * A stale {@code previousHash} surfaces as {@link StaleReferenceException}; the
 * caller re-reads the latest record and decides whether to retry. Reads are not
 * guarded and may be stale, in particular a temporary suspension stays in place
 * until {@link #unsuspendIfExpired} is called.</p>
 */
public class EntityStatusService {
    private static final Logger log = LoggerFactory.getLogger(EntityStatusService.class);

    private final RevisionChainStore<Status> store;
    private final StatusLinkRepository links;
    private final StatusIndex index;
    private final StatusIndexMaintainer indexMaintainer;
    private final StatusStateMachine stateMachine;
    private final AuthorizationGuard guard;
    private final StatusCache cache;
    private final AuditService auditService;
    private final MetricsService metricsService;
    private final int maxSuspensionDays;

    public EntityStatusService(RevisionChainStore<Status> store, StatusLinkRepository links, StatusIndex index,
                               StatusIndexMaintainer indexMaintainer, StatusStateMachine stateMachine,
                               AuthorizationGuard guard, StatusCache cache, AuditService auditService,
                               MetricsService metricsService, int maxSuspensionDays) {
        this.store = store;
        this.links = links;
        this.index = index;
        this.indexMaintainer = indexMaintainer;
        this.stateMachine = stateMachine;
        this.guard = guard;
        this.cache = cache;
        this.auditService = auditService;
        this.metricsService = metricsService;
        this.maxSuspensionDays = maxSuspensionDays;
    }

    // ========== Creation ==========

    /**
     * Creates the first, {@code pending}, status of a newly created entity.
     * Called by the profile and organization creation flows, so it is not guarded.
     *
     * @param authorAgentKey agent that created the entity
     * @throws StatusAlreadyExistsException if the entity already has a status chain
     */
    public synchronized ChainRecord<Status> createStatus(EntityType type, String entityHash, String authorAgentKey) {
        try (LogContext ctx = LogContext.forStatusUpdate(LogContext.generateCorrelationId(), type.name(), entityHash)) {
            if (links.find(type, entityHash).isPresent()) {
                throw new StatusAlreadyExistsException(type, entityHash);
            }
            Status initial = stateMachine.transition(null, Status.pendingFor(type.pathName() + "/" + entityHash));
            ChainRecord<Status> root = store.create(authorAgentKey, initial);
            links.link(type, entityHash, root.originalHash());
            indexMaintainer.tryOnTransition(type, entityHash, null, initial.category());

            auditService.record(AuditAction.STATUS_CREATED, entityHash, authorAgentKey, Map.of(
                    "entityType", type.name(),
                    "statusOriginalHash", root.originalHash()
            ));
            metricsService.recordStatusTransition(type, null, initial.statusType());
            log.info("status.created type={} entity={} chain={}", type, entityHash, root.originalHash());
            return root;
        }
    }

    // ========== Queries ==========

    /**
     * Original hash of the entity's status chain.
     *
     * @throws NotFoundException if the entity has no status chain
     */
    public String getStatusOriginalHash(EntityType type, String entityHash) {
        return links.find(type, entityHash)
                .orElseThrow(() -> new NotFoundException("No status for " + type.pathName() + "/" + entityHash));
    }

    public ChainRecord<Status> getLatestStatusRecord(EntityType type, String entityHash) {
        return latestRecord(getStatusOriginalHash(type, entityHash));
    }

    /**
     * Latest recorded status. An expired temporary suspension is reported as is.
     */
    public Status getLatestStatus(EntityType type, String entityHash) {
        return getLatestStatusRecord(type, entityHash).payload();
    }

    public List<ChainRecord<Status>> getStatusHistory(EntityType type, String entityHash) {
        return store.resolveHistory(getStatusOriginalHash(type, entityHash));
    }

    public List<ChainFork> findForks(EntityType type, String entityHash) {
        return store.findForks(getStatusOriginalHash(type, entityHash));
    }

    public List<String> listEntitiesByCategory(EntityType type, StatusCategory category) {
        return index.members(type, category);
    }

    public List<String> listAllEntities(EntityType type) {
        return index.all(type);
    }

    public boolean isEntityAccepted(EntityType type, String entityHash) {
        return index.members(type, StatusCategory.ACCEPTED).contains(entityHash);
    }

    // ========== Mutations ==========

    /**
     * Appends a new status to the entity's chain.
     *
     * @param callerAgentKey agent performing the update
     * @param originalHash   original hash of the entity's status chain
     * @param previousHash   the tip the caller read before deciding on the update
     * @param newStatus      the requested status
     * @return the appended record
     * @throws com.bulletin.lifecycle.auth.UnauthorizedException if the caller fails the guard
     * @throws NotFoundException if the entity has no status chain or {@code originalHash} is not its chain
     * @throws com.bulletin.lifecycle.status.InvalidTransitionException if the status is malformed
     * @throws StaleReferenceException if {@code previousHash} is no longer the tip
     */
    public ChainRecord<Status> updateStatus(String callerAgentKey, EntityType type, String entityHash,
                                            String originalHash, String previousHash, Status newStatus) {
        try (LogContext ctx = LogContext.forStatusUpdate(LogContext.generateCorrelationId(), type.name(), entityHash)) {
            guard.requireCanMutate(callerAgentKey, entityHash);
            return applyUpdate(callerAgentKey, type, entityHash, originalHash, previousHash, newStatus);
        }
    }

    public ChainRecord<Status> accept(String callerAgentKey, EntityType type, String entityHash,
                                      String originalHash, String previousHash) {
        return updateStatus(callerAgentKey, type, entityHash, originalHash, previousHash, Status.accepted());
    }

    public ChainRecord<Status> reject(String callerAgentKey, EntityType type, String entityHash,
                                      String originalHash, String previousHash, String reason) {
        return updateStatus(callerAgentKey, type, entityHash, originalHash, previousHash, Status.rejected(reason));
    }

    /**
     * Suspends an entity for a number of days starting now.
     *
     * @throws com.bulletin.lifecycle.status.InvalidTransitionException if {@code durationInDays}
     *         is missing, not positive or above the configured maximum
     */
    public ChainRecord<Status> suspendTemporarily(String callerAgentKey, EntityType type, String entityHash,
                                                  String originalHash, String previousHash,
                                                  String reason, Integer durationInDays) {
        Status suspension = stateMachine.suspensionForDays(reason, durationInDays, maxSuspensionDays);
        return updateStatus(callerAgentKey, type, entityHash, originalHash, previousHash, suspension);
    }

    public ChainRecord<Status> suspendIndefinitely(String callerAgentKey, EntityType type, String entityHash,
                                                   String originalHash, String previousHash, String reason) {
        return updateStatus(callerAgentKey, type, entityHash, originalHash, previousHash,
                Status.suspendedIndefinitely(reason));
    }

    /**
     * Lifts a suspension immediately, whatever its kind.
     */
    public ChainRecord<Status> unsuspend(String callerAgentKey, EntityType type, String entityHash,
                                         String originalHash, String previousHash) {
        return accept(callerAgentKey, type, entityHash, originalHash, previousHash);
    }

    /**
     * Lifts a temporary suspension whose end has passed.
     *
     * @return true if the entity was moved to {@code accepted}; false, with nothing
     *         written, if the latest status is not an expired temporary suspension
     * @throws StaleReferenceException if the suspension expired but {@code previousHash} is stale
     */
    public boolean unsuspendIfExpired(String callerAgentKey, EntityType type, String entityHash,
                                      String originalHash, String previousHash) {
        try (LogContext ctx = LogContext.forStatusUpdate(LogContext.generateCorrelationId(), type.name(), entityHash)) {
            guard.requireCanMutate(callerAgentKey, entityHash);
            ChainRecord<Status> latest = store.resolveLatest(getStatusOriginalHash(type, entityHash));
            if (!stateMachine.isExpired(latest.payload())) {
                log.debug("status.unsuspend.skipped type={} entity={} status={}",
                        type, entityHash, latest.payload().statusType().wireName());
                return false;
            }

            ChainRecord<Status> record = applyUpdate(callerAgentKey, type, entityHash, originalHash, previousHash,
                    Status.accepted());
            auditService.record(AuditAction.STATUS_UNSUSPENDED, entityHash, callerAgentKey, Map.of(
                    "suspendedUntil", latest.payload().suspendedUntil().toString(),
                    "recordHash", record.hash()
            ));
            return true;
        }
    }

    // ========== Replication and repair ==========

    /**
     * Stores a status record authored on another replica and re-derives the
     * entity's category from the resulting tip. Such a record may fork the chain.
     *
     * @throws NotFoundException if the entity has no chain or the record belongs to another chain
     */
    public ChainRecord<Status> integrate(EntityType type, String entityHash, ChainRecord<Status> remote) {
        try (LogContext ctx = LogContext.forStatusUpdate(LogContext.generateCorrelationId(), type.name(), entityHash)) {
            String linked = getStatusOriginalHash(type, entityHash);
            if (!linked.equals(remote.originalHash())) {
                throw new NotFoundException("Record " + remote.hash() + " does not belong to the status chain of "
                        + type.pathName() + "/" + entityHash);
            }
            ChainRecord<Status> stored = store.integrate(remote);
            StatusCategory category = store.resolveLatest(linked).payload().category();
            Optional<StatusCategory> indexed = index.categoryOf(type, entityHash);
            indexMaintainer.tryOnTransition(type, entityHash, indexed.orElse(null), category);

            auditService.record(AuditAction.RECORD_INTEGRATED, entityHash, remote.author(), Map.of(
                    "recordHash", stored.hash(),
                    "forks", store.findForks(linked).size()
            ));
            return stored;
        }
    }

    /**
     * Re-derives the whole status index from the chains.
     */
    public IndexRebuildResult rebuildIndexFromChains() {
        try (LogContext ctx = LogContext.forIndexRebuild(LogContext.generateCorrelationId())) {
            IndexRebuildResult result = indexMaintainer.rebuildIndexFromChains();
            auditService.record(AuditAction.INDEX_REBUILT, null, null, Map.of(
                    "entitiesScanned", result.entitiesScanned()
            ));
            return result;
        }
    }

    private ChainRecord<Status> applyUpdate(String callerAgentKey, EntityType type, String entityHash,
                                            String originalHash, String previousHash, Status newStatus) {
        String linked = getStatusOriginalHash(type, entityHash);
        if (!linked.equals(originalHash)) {
            throw new NotFoundException("Status chain " + originalHash + " does not belong to "
                    + type.pathName() + "/" + entityHash);
        }

        ChainRecord<Status> current = store.resolveLatest(originalHash);
        Status validated = stateMachine.transition(current.payload().statusType(), newStatus);

        ChainRecord<Status> record;
        try {
            record = store.append(originalHash, previousHash, callerAgentKey, validated);
        } catch (StaleReferenceException e) {
            metricsService.incrementStaleReference();
            log.info("status.stale type={} entity={} supplied={} tip={}",
                    type, entityHash, previousHash, e.getCurrentTipHash());
            throw e;
        }

        // The append succeeded against previousHash, so that record is the exact predecessor
        Status previous = store.get(previousHash).map(ChainRecord::payload).orElse(current.payload());
        indexMaintainer.tryOnTransition(type, entityHash, previous.category(), validated.category());

        Map<String, Object> details = new HashMap<>();
        details.put("entityType", type.name());
        details.put("from", previous.statusType().wireName());
        details.put("to", validated.statusType().wireName());
        details.put("recordHash", record.hash());
        if (validated.reason() != null) {
            details.put("reason", validated.reason());
        }
        if (validated.suspendedUntil() != null) {
            details.put("suspendedUntil", validated.suspendedUntil().toString());
        }
        auditService.record(AuditAction.STATUS_UPDATED, entityHash, callerAgentKey, details);
        metricsService.recordStatusTransition(type, previous.statusType(), validated.statusType());
        log.info("status.updated type={} entity={} from={} to={} by={}", type, entityHash,
                previous.statusType().wireName(), validated.statusType().wireName(), callerAgentKey);
        return record;
    }

    private ChainRecord<Status> latestRecord(String originalHash) {
        AtomicBoolean loaded = new AtomicBoolean();
        ChainRecord<Status> latest = cache.getOrLoad(originalHash, key -> {
            loaded.set(true);
            return store.resolveLatest(key);
        });
        if (loaded.get()) {
            metricsService.recordCacheMiss();
        } else {
            metricsService.recordCacheHit();
        }
        return latest;
    }
}
