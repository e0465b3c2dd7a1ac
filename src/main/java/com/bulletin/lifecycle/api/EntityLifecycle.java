package com.bulletin.lifecycle.api;

import com.bulletin.lifecycle.admin.AdministratorRecord;
import com.bulletin.lifecycle.admin.AdministratorRegistry;
import com.bulletin.lifecycle.admin.AdministratorService;
import com.bulletin.lifecycle.audit.AuditService;
import com.bulletin.lifecycle.auth.AgentDirectory;
import com.bulletin.lifecycle.auth.AuthorizationGuard;
import com.bulletin.lifecycle.auth.InMemoryAgentDirectory;
import com.bulletin.lifecycle.cache.CaffeineStatusCache;
import com.bulletin.lifecycle.cache.NoOpStatusCache;
import com.bulletin.lifecycle.cache.StatusCache;
import com.bulletin.lifecycle.chain.ChainFork;
import com.bulletin.lifecycle.chain.ChainListener;
import com.bulletin.lifecycle.chain.ChainRecord;
import com.bulletin.lifecycle.chain.ChainRecordCodec;
import com.bulletin.lifecycle.chain.InMemoryRevisionChainStore;
import com.bulletin.lifecycle.chain.RevisionChainStore;
import com.bulletin.lifecycle.core.model.EntityType;
import com.bulletin.lifecycle.index.InMemoryStatusIndex;
import com.bulletin.lifecycle.index.InMemoryStatusLinkRepository;
import com.bulletin.lifecycle.index.IndexRebuildResult;
import com.bulletin.lifecycle.index.StatusIndex;
import com.bulletin.lifecycle.index.StatusIndexMaintainer;
import com.bulletin.lifecycle.index.StatusLinkRepository;
import com.bulletin.lifecycle.metrics.MetricsService;
import com.bulletin.lifecycle.metrics.NoOpMetricsService;
import com.bulletin.lifecycle.service.EntityStatusService;
import com.bulletin.lifecycle.status.Status;
import com.bulletin.lifecycle.status.StatusCategory;
import com.bulletin.lifecycle.status.StatusStateMachine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;

/**
 * Main entry point of the entity lifecycle library.
 *
 * <p>Tracks the moderation status of users and organizations as hash-linked
 * revision chains, derives category sets for bulk queries, and manages the
 * administrators allowed to change statuses.</p>
 *
 * <h2>Key Design Principles</h2>
 * <ul>
 *   <li>Status history is append-only; every change references the tip it supersedes</li>
 *   <li>Concurrent changes are detected, not prevented: a stale tip fails, replicated forks stay visible</li>
 *   <li>The caller's agent key is an explicit argument on every mutation</li>
 * </ul>
 *
 * <h2>Example usage:</h2>
 * <pre>
 * EntityLifecycle lifecycle = EntityLifecycle.builder()
 *     .config(LifecycleConfig.defaults().withProgenitor(progenitorKey))
 *     .build();
 *
 * lifecycle.registerAdministrator(progenitorKey, adminEntity, List.of(adminKey));
 * ChainRecord&lt;Status&gt; root = lifecycle.createStatus(EntityType.USERS, user, userKey);
 *
 * ChainRecord&lt;Status&gt; tip = lifecycle.getLatestStatusRecord(EntityType.USERS, user);
 * lifecycle.suspendTemporarily(adminKey, EntityType.USERS, user,
 *     tip.originalHash(), tip.hash(), "violation", 7);
 * </pre>
 */
public class EntityLifecycle {
    private static final Logger log = LoggerFactory.getLogger(EntityLifecycle.class);

    private final EntityStatusService statusService;
    private final AdministratorService administratorService;
    private final AuditService auditService;
    private final StatusCache cache;
    private final LifecycleConfig config;

    private EntityLifecycle(Builder builder) {
        this.config = builder.config;
        Clock clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        MetricsService metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        this.auditService = builder.auditService != null ? builder.auditService : new AuditService(clock);
        AgentDirectory agentDirectory = builder.agentDirectory != null
                ? builder.agentDirectory : new InMemoryAgentDirectory();
        StatusStateMachine stateMachine = new StatusStateMachine(clock);

        RevisionChainStore<Status> statusStore = builder.statusStore != null
                ? builder.statusStore : new InMemoryRevisionChainStore<>(new ChainRecordCodec<>(Status.class), clock);
        RevisionChainStore<AdministratorRecord> administratorStore = builder.administratorStore != null
                ? builder.administratorStore
                : new InMemoryRevisionChainStore<>(new ChainRecordCodec<>(AdministratorRecord.class), clock);
        StatusLinkRepository links = builder.linkRepository != null
                ? builder.linkRepository : new InMemoryStatusLinkRepository();
        StatusIndex index = builder.statusIndex != null ? builder.statusIndex : new InMemoryStatusIndex();

        if (builder.statusCache != null) {
            this.cache = builder.statusCache;
        } else if (config.cacheConfig().enabled()) {
            this.cache = new CaffeineStatusCache(config.cacheConfig());
        } else {
            this.cache = new NoOpStatusCache();
        }
        // Register cache as chain listener if it implements ChainListener
        if (cache instanceof ChainListener<?>) {
            @SuppressWarnings("unchecked")
            ChainListener<Status> listener = (ChainListener<Status>) cache;
            statusStore.addListener(listener);
        }

        AdministratorRegistry registry = new AdministratorRegistry(administratorStore, stateMachine);
        AuthorizationGuard guard = new AuthorizationGuard(registry, agentDirectory, metricsService,
                config.progenitorAgentKey());
        StatusIndexMaintainer maintainer = new StatusIndexMaintainer(index, links, statusStore, metricsService);

        this.statusService = new EntityStatusService(statusStore, links, index, maintainer, stateMachine,
                guard, cache, auditService, metricsService, config.maxSuspensionDays());
        this.administratorService = new AdministratorService(registry, guard, auditService, metricsService);

        log.info("EntityLifecycle initialized: cache={} maxSuspensionDays={} progenitor={}",
                cache.getClass().getSimpleName(), config.maxSuspensionDays(), config.progenitorAgentKey() != null);
    }

    // ========== Status creation and queries ==========

    public ChainRecord<Status> createStatus(EntityType type, String entityHash, String authorAgentKey) {
        return statusService.createStatus(type, entityHash, authorAgentKey);
    }

    public Status getLatestStatus(EntityType type, String entityHash) {
        return statusService.getLatestStatus(type, entityHash);
    }

    /**
     * Tip of the entity's status chain. Its {@code originalHash} and {@code hash}
     * are the references a subsequent update must supply.
     */
    public ChainRecord<Status> getLatestStatusRecord(EntityType type, String entityHash) {
        return statusService.getLatestStatusRecord(type, entityHash);
    }

    public String getStatusOriginalHash(EntityType type, String entityHash) {
        return statusService.getStatusOriginalHash(type, entityHash);
    }

    /**
     * Full status history, oldest first. Forked branches are all included.
     */
    public List<ChainRecord<Status>> getStatusHistory(EntityType type, String entityHash) {
        return statusService.getStatusHistory(type, entityHash);
    }

    public List<ChainFork> findForks(EntityType type, String entityHash) {
        return statusService.findForks(type, entityHash);
    }

    public List<String> listEntitiesByCategory(EntityType type, StatusCategory category) {
        return statusService.listEntitiesByCategory(type, category);
    }

    public List<String> listAllEntities(EntityType type) {
        return statusService.listAllEntities(type);
    }

    public boolean isEntityAccepted(EntityType type, String entityHash) {
        return statusService.isEntityAccepted(type, entityHash);
    }

    // ========== Status mutations ==========

    public ChainRecord<Status> updateStatus(String callerAgentKey, EntityType type, String entityHash,
                                            String originalHash, String previousHash, Status newStatus) {
        return statusService.updateStatus(callerAgentKey, type, entityHash, originalHash, previousHash, newStatus);
    }

    public ChainRecord<Status> accept(String callerAgentKey, EntityType type, String entityHash,
                                      String originalHash, String previousHash) {
        return statusService.accept(callerAgentKey, type, entityHash, originalHash, previousHash);
    }

    public ChainRecord<Status> reject(String callerAgentKey, EntityType type, String entityHash,
                                      String originalHash, String previousHash, String reason) {
        return statusService.reject(callerAgentKey, type, entityHash, originalHash, previousHash, reason);
    }

    public ChainRecord<Status> suspendTemporarily(String callerAgentKey, EntityType type, String entityHash,
                                                  String originalHash, String previousHash,
                                                  String reason, Integer durationInDays) {
        return statusService.suspendTemporarily(callerAgentKey, type, entityHash, originalHash, previousHash,
                reason, durationInDays);
    }

    public ChainRecord<Status> suspendIndefinitely(String callerAgentKey, EntityType type, String entityHash,
                                                   String originalHash, String previousHash, String reason) {
        return statusService.suspendIndefinitely(callerAgentKey, type, entityHash, originalHash, previousHash, reason);
    }

    public ChainRecord<Status> unsuspend(String callerAgentKey, EntityType type, String entityHash,
                                         String originalHash, String previousHash) {
        return statusService.unsuspend(callerAgentKey, type, entityHash, originalHash, previousHash);
    }

    public boolean unsuspendIfExpired(String callerAgentKey, EntityType type, String entityHash,
                                      String originalHash, String previousHash) {
        return statusService.unsuspendIfExpired(callerAgentKey, type, entityHash, originalHash, previousHash);
    }

    /**
     * Accepts a status record authored on another replica.
     */
    public ChainRecord<Status> integrate(EntityType type, String entityHash, ChainRecord<Status> record) {
        return statusService.integrate(type, entityHash, record);
    }

    public IndexRebuildResult rebuildIndexFromChains() {
        return statusService.rebuildIndexFromChains();
    }

    // ========== Administration ==========

    public ChainRecord<AdministratorRecord> registerAdministrator(String callerAgentKey, String entityHash,
                                                                  List<String> agentKeys) {
        return administratorService.registerAdministrator(callerAgentKey, entityHash, agentKeys);
    }

    public ChainRecord<AdministratorRecord> removeAdministrator(String callerAgentKey, String entityHash,
                                                                List<String> agentKeys) {
        return administratorService.removeAdministrator(callerAgentKey, entityHash, agentKeys);
    }

    public boolean isAgentAdministrator(String agentKey) {
        return administratorService.isAgentAdministrator(agentKey);
    }

    public boolean isEntityAdministrator(String entityHash) {
        return administratorService.isEntityAdministrator(entityHash);
    }

    public List<String> getAllAdministrators() {
        return administratorService.getAllAdministrators();
    }

    public List<ChainRecord<AdministratorRecord>> getAdministratorHistory(String entityHash) {
        return administratorService.getAdministratorHistory(entityHash);
    }

    // ========== Accessors ==========

    public AuditService getAuditService() {
        return auditService;
    }

    public StatusCache getCache() {
        return cache;
    }

    public LifecycleConfig getConfig() {
        return config;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private LifecycleConfig config = LifecycleConfig.defaults();
        private Clock clock;
        private MetricsService metricsService;
        private AuditService auditService;
        private AgentDirectory agentDirectory;
        private StatusCache statusCache;
        private RevisionChainStore<Status> statusStore;
        private RevisionChainStore<AdministratorRecord> administratorStore;
        private StatusLinkRepository linkRepository;
        private StatusIndex statusIndex;

        public Builder config(LifecycleConfig config) {
            this.config = config;
            return this;
        }

        /**
         * Clock used for record timestamps and suspension expiry.
         * Defaults to the UTC system clock.
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Sets a custom metrics service for recording operational metrics.
         * Defaults to {@link NoOpMetricsService} if not set.
         */
        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder auditService(AuditService auditService) {
            this.auditService = auditService;
            return this;
        }

        /**
         * Sets the lookup from agent keys to user entities.
         * Defaults to an empty {@link InMemoryAgentDirectory}.
         */
        public Builder agentDirectory(AgentDirectory agentDirectory) {
            this.agentDirectory = agentDirectory;
            return this;
        }

        /**
         * Sets a custom latest-status cache. When not set, a {@link CaffeineStatusCache}
         * is created if the configured cache is enabled, else {@link NoOpStatusCache}.
         */
        public Builder cache(StatusCache cache) {
            this.statusCache = cache;
            return this;
        }

        public Builder statusStore(RevisionChainStore<Status> store) {
            this.statusStore = store;
            return this;
        }

        public Builder administratorStore(RevisionChainStore<AdministratorRecord> store) {
            this.administratorStore = store;
            return this;
        }

        public Builder linkRepository(StatusLinkRepository linkRepository) {
            this.linkRepository = linkRepository;
            return this;
        }

        public Builder statusIndex(StatusIndex statusIndex) {
            this.statusIndex = statusIndex;
            return this;
        }

        public EntityLifecycle build() {
            if (config == null) {
                throw new IllegalStateException("LifecycleConfig is required");
            }
            return new EntityLifecycle(this);
        }
    }
}
