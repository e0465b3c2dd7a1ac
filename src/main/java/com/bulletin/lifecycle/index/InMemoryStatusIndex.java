package com.bulletin.lifecycle.index;

import com.bulletin.lifecycle.core.model.EntityType;
import com.bulletin.lifecycle.status.StatusCategory;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link StatusIndex}.
 * A rebuild swaps out the sets of a namespace as a whole.
 */
public class InMemoryStatusIndex implements StatusIndex {

    private final Map<EntityType, Namespace> namespaces = new ConcurrentHashMap<>();

    @Override
    public void add(EntityType type, StatusCategory category, String entityHash) {
        namespace(type).categories.get(category).add(entityHash);
    }

    @Override
    public void remove(EntityType type, StatusCategory category, String entityHash) {
        namespace(type).categories.get(category).remove(entityHash);
    }

    @Override
    public void addToAll(EntityType type, String entityHash) {
        namespace(type).all.add(entityHash);
    }

    @Override
    public List<String> members(EntityType type, StatusCategory category) {
        return namespace(type).categories.get(category).stream().sorted().toList();
    }

    @Override
    public List<String> all(EntityType type) {
        return namespace(type).all.stream().sorted().toList();
    }

    @Override
    public Set<StatusCategory> categoriesOf(EntityType type, String entityHash) {
        Set<StatusCategory> result = EnumSet.noneOf(StatusCategory.class);
        namespace(type).categories.forEach((category, members) -> {
            if (members.contains(entityHash)) {
                result.add(category);
            }
        });
        return result;
    }

    @Override
    public void replace(EntityType type, Map<StatusCategory, Set<String>> categories, Set<String> all) {
        Namespace fresh = new Namespace();
        categories.forEach((category, members) -> fresh.categories.get(category).addAll(members));
        fresh.all.addAll(all);
        namespaces.put(type, fresh);
    }

    private Namespace namespace(EntityType type) {
        return namespaces.computeIfAbsent(type, t -> new Namespace());
    }

    private static final class Namespace {
        private final Map<StatusCategory, Set<String>> categories = new EnumMap<>(StatusCategory.class);
        private final Set<String> all = ConcurrentHashMap.newKeySet();

        private Namespace() {
            for (StatusCategory category : StatusCategory.values()) {
                categories.put(category, ConcurrentHashMap.newKeySet());
            }
        }
    }
}
