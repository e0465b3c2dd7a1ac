package com.bulletin.lifecycle.index;

import com.bulletin.lifecycle.core.model.EntityType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryStatusLinkRepositoryTest {

    private final InMemoryStatusLinkRepository links = new InMemoryStatusLinkRepository();

    @Test
    @DisplayName("Should link an entity to one status chain only")
    void linkOnce() {
        assertTrue(links.link(EntityType.USERS, "alice", "chain-1"));
        assertFalse(links.link(EntityType.USERS, "alice", "chain-2"));

        assertEquals(Optional.of("chain-1"), links.find(EntityType.USERS, "alice"));
    }

    @Test
    @DisplayName("Should scope links by entity type")
    void scopedByType() {
        links.link(EntityType.USERS, "same", "chain-u");
        links.link(EntityType.ORGANIZATIONS, "same", "chain-o");

        assertEquals(Map.of("same", "chain-u"), links.findAll(EntityType.USERS));
        assertEquals(Map.of("same", "chain-o"), links.findAll(EntityType.ORGANIZATIONS));
        assertTrue(links.find(EntityType.USERS, "other").isEmpty());
    }
}
