package com.bulletin.lifecycle.core.model;

/**
 * Namespaces that carry a status chain.
 * Each namespace keeps its own category sets.
 */
public enum EntityType {
    USERS("users"),
    ORGANIZATIONS("organizations");

    private final String pathName;

    EntityType(String pathName) {
        this.pathName = pathName;
    }

    /**
     * Name used for index paths, e.g. {@code users.status.accepted}.
     */
    public String pathName() {
        return pathName;
    }
}
