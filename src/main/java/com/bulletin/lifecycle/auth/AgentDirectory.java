package com.bulletin.lifecycle.auth;

import java.util.List;
import java.util.Optional;

/**
 * Maps agent keys to the user entity they act as.
 * Populated by the profile creation flow; an entity may have several agent keys.
 */
public interface AgentDirectory {

    Optional<String> findEntity(String agentKey);

    List<String> findAgents(String entityHash);
}
