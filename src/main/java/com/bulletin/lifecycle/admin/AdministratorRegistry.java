package com.bulletin.lifecycle.admin;

import com.bulletin.lifecycle.chain.ChainRecord;
import com.bulletin.lifecycle.chain.RevisionChainStore;
import com.bulletin.lifecycle.core.NotFoundException;
import com.bulletin.lifecycle.status.Status;
import com.bulletin.lifecycle.status.StatusStateMachine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * The network's set of administrators, kept as one revision chain per
 * administrator entity plus an agent-key lookup index.
 *
 * <p>Registration starts a chain, or extends it when the entity was removed
 * before. Removal appends a {@code rejected} record and drops the agent keys from
 * the index; history is never deleted. Agent lookups go through the index only.</p>
 *
 * <p>This class performs no authorization; see
 * {@link AdministratorService} for the guarded operations.</p>
 */
public class AdministratorRegistry {
    private static final Logger log = LoggerFactory.getLogger(AdministratorRegistry.class);

    static final String REMOVAL_REASON = "administrator removed";

    private final RevisionChainStore<AdministratorRecord> store;
    private final StatusStateMachine stateMachine;
    // Administrator entity -> original hash of its administrator chain
    private final ConcurrentMap<String, String> chainByEntity = new ConcurrentHashMap<>();
    // Agent key -> administrator entity, active administrators only
    private final ConcurrentMap<String, String> entityByAgent = new ConcurrentHashMap<>();
    private final Set<String> activeEntities = ConcurrentHashMap.newKeySet();

    public AdministratorRegistry(RevisionChainStore<AdministratorRecord> store, StatusStateMachine stateMachine) {
        this.store = store;
        this.stateMachine = stateMachine;
    }

    /**
     * Makes an entity an administrator and grants all of its agent keys.
     *
     * @param author     agent key recorded as the author
     * @param entityHash the administrator's user entity
     * @param agentKeys  agent keys of the entity
     * @return the new tip of the administrator chain
     * @throws AlreadyAdministratorException if the entity is already active
     */
    public synchronized ChainRecord<AdministratorRecord> register(String author, String entityHash, List<String> agentKeys) {
        if (agentKeys == null || agentKeys.isEmpty()) {
            throw new IllegalArgumentException("At least one agent key is required");
        }
        if (isEntityAdministrator(entityHash)) {
            throw new AlreadyAdministratorException(entityHash);
        }

        String original = chainByEntity.get(entityHash);
        ChainRecord<AdministratorRecord> tip = original != null ? store.resolveLatest(original) : null;
        Status standing = stateMachine.transition(
                tip != null ? tip.payload().standing().statusType() : null, Status.accepted());
        AdministratorRecord payload = new AdministratorRecord(entityHash, agentKeys, standing);
        ChainRecord<AdministratorRecord> record;
        if (tip == null) {
            record = store.create(author, payload);
            chainByEntity.put(entityHash, record.originalHash());
        } else {
            record = store.append(original, tip.hash(), author, payload);
        }

        for (String agentKey : agentKeys) {
            entityByAgent.put(agentKey, entityHash);
        }
        activeEntities.add(entityHash);
        log.info("administrator.registered entity={} agents={} chain={}",
                entityHash, agentKeys.size(), record.originalHash());
        return record;
    }

    /**
     * Revokes an administrator. The keys recorded at registration are revoked
     * together with any keys passed here.
     *
     * @return the new tip of the administrator chain
     * @throws NotFoundException          if the entity is not an active administrator
     * @throws LastAdministratorException if it is the only active administrator
     */
    public synchronized ChainRecord<AdministratorRecord> remove(String author, String entityHash, List<String> agentKeys) {
        if (!isEntityAdministrator(entityHash)) {
            throw new NotFoundException("Administrator not found: " + entityHash);
        }
        if (activeEntities.size() == 1) {
            throw new LastAdministratorException(entityHash);
        }

        String original = chainByEntity.get(entityHash);
        ChainRecord<AdministratorRecord> tip = store.resolveLatest(original);
        Set<String> revoked = new LinkedHashSet<>(tip.payload().agentKeys());
        if (agentKeys != null) {
            revoked.addAll(agentKeys);
        }
        Status standing = stateMachine.transition(tip.payload().standing().statusType(),
                Status.rejected(REMOVAL_REASON));
        ChainRecord<AdministratorRecord> record = store.append(original, tip.hash(), author,
                new AdministratorRecord(entityHash, List.copyOf(revoked), standing));

        for (String agentKey : revoked) {
            entityByAgent.remove(agentKey, entityHash);
        }
        activeEntities.remove(entityHash);
        log.info("administrator.removed entity={} agents={}", entityHash, revoked.size());
        return record;
    }

    public boolean isAgentAdministrator(String agentKey) {
        return entityByAgent.containsKey(agentKey);
    }

    /**
     * Resolves the entity's administrator chain and checks its standing.
     */
    public boolean isEntityAdministrator(String entityHash) {
        String original = chainByEntity.get(entityHash);
        if (original == null) {
            return false;
        }
        return store.resolveLatest(original).payload().active();
    }

    public Optional<String> findAdministratorEntity(String agentKey) {
        return Optional.ofNullable(entityByAgent.get(agentKey));
    }

    /**
     * Active administrator entities, sorted.
     */
    public List<String> getAllAdministrators() {
        return activeEntities.stream().sorted().toList();
    }

    public boolean hasAdministrators() {
        return !activeEntities.isEmpty();
    }

    /**
     * Full administrator chain of an entity, oldest first.
     *
     * @throws NotFoundException if the entity was never an administrator
     */
    public List<ChainRecord<AdministratorRecord>> getHistory(String entityHash) {
        String original = chainByEntity.get(entityHash);
        if (original == null) {
            throw new NotFoundException("No administrator chain for entity: " + entityHash);
        }
        return store.resolveHistory(original);
    }

    /**
     * Agent index snapshot, agent key to administrator entity.
     */
    Map<String, String> agentIndex() {
        return Map.copyOf(entityByAgent);
    }
}
