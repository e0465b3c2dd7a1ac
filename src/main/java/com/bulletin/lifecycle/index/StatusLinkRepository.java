package com.bulletin.lifecycle.index;

import com.bulletin.lifecycle.core.model.EntityType;

import java.util.Map;
import java.util.Optional;

/**
 * Links each entity to the original hash of its status chain.
 */
public interface StatusLinkRepository {

    /**
     * Links an entity to its status chain.
     *
     * @return false if the entity was already linked; the existing link is kept
     */
    boolean link(EntityType type, String entityHash, String statusOriginalHash);

    Optional<String> find(EntityType type, String entityHash);

    /**
     * All links of a namespace, entity hash to status original hash.
     */
    Map<String, String> findAll(EntityType type);
}
