package com.bulletin.lifecycle.auth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory implementation of {@link AgentDirectory}.
 */
public class InMemoryAgentDirectory implements AgentDirectory {
    private static final Logger log = LoggerFactory.getLogger(InMemoryAgentDirectory.class);

    private final ConcurrentMap<String, String> entityByAgent = new ConcurrentHashMap<>();

    /**
     * Associates an agent key with an entity.
     *
     * @throws IllegalStateException if the key already belongs to another entity
     */
    public void link(String agentKey, String entityHash) {
        String existing = entityByAgent.putIfAbsent(agentKey, entityHash);
        if (existing != null && !existing.equals(entityHash)) {
            throw new IllegalStateException("Agent " + agentKey + " already belongs to entity " + existing);
        }
        log.debug("agent.linked agent={} entity={}", agentKey, entityHash);
    }

    @Override
    public Optional<String> findEntity(String agentKey) {
        return Optional.ofNullable(entityByAgent.get(agentKey));
    }

    @Override
    public List<String> findAgents(String entityHash) {
        return entityByAgent.entrySet().stream()
                .filter(e -> e.getValue().equals(entityHash))
                .map(Map.Entry::getKey)
                .sorted()
                .toList();
    }
}
