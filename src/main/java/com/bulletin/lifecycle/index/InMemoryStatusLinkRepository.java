package com.bulletin.lifecycle.index;

import com.bulletin.lifecycle.core.model.EntityType;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory implementation of {@link StatusLinkRepository}.
 */
public class InMemoryStatusLinkRepository implements StatusLinkRepository {

    private final ConcurrentMap<EntityType, ConcurrentMap<String, String>> links = new ConcurrentHashMap<>();

    @Override
    public boolean link(EntityType type, String entityHash, String statusOriginalHash) {
        return namespace(type).putIfAbsent(entityHash, statusOriginalHash) == null;
    }

    @Override
    public Optional<String> find(EntityType type, String entityHash) {
        return Optional.ofNullable(namespace(type).get(entityHash));
    }

    @Override
    public Map<String, String> findAll(EntityType type) {
        return Map.copyOf(namespace(type));
    }

    private ConcurrentMap<String, String> namespace(EntityType type) {
        return links.computeIfAbsent(type, t -> new ConcurrentHashMap<>());
    }
}
