package com.bulletin.lifecycle.index;

import com.bulletin.lifecycle.core.model.EntityType;
import com.bulletin.lifecycle.status.StatusCategory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Derived sets of entity identities per status category, plus an "all" set per namespace.
 * Not authoritative: the status chains are. Implementations must make
 * {@link #add} and {@link #remove} idempotent.
 */
public interface StatusIndex {

    void add(EntityType type, StatusCategory category, String entityHash);

    void remove(EntityType type, StatusCategory category, String entityHash);

    void addToAll(EntityType type, String entityHash);

    /**
     * Members of a category set, sorted by identity.
     */
    List<String> members(EntityType type, StatusCategory category);

    /**
     * Every entity of the namespace that has a status chain, sorted by identity.
     */
    List<String> all(EntityType type);

    /**
     * Categories an entity currently appears in. A consistent index reports at most one.
     */
    Set<StatusCategory> categoriesOf(EntityType type, String entityHash);

    /**
     * Atomically replaces the whole namespace with a freshly derived state.
     */
    void replace(EntityType type, Map<StatusCategory, Set<String>> categories, Set<String> all);

    /**
     * Convenience accessor for the single category of an entity.
     */
    default Optional<StatusCategory> categoryOf(EntityType type, String entityHash) {
        return categoriesOf(type, entityHash).stream().findFirst();
    }
}
