package com.bulletin.lifecycle.admin;

import com.bulletin.lifecycle.status.Status;
import com.bulletin.lifecycle.status.StatusType;

import java.util.List;
import java.util.Objects;

/**
 * Payload of one record in an administrator chain.
 *
 * <p>Standing uses the entity status values: {@code accepted} means the
 * administrator is active, {@code rejected} marks a removal.</p>
 *
 * @param entityHash the administrator's user entity
 * @param agentKeys  agent keys granted or revoked together with this record
 * @param standing   administrator standing
 */
public record AdministratorRecord(String entityHash, List<String> agentKeys, Status standing) {

    public AdministratorRecord {
        Objects.requireNonNull(entityHash, "entityHash is required");
        Objects.requireNonNull(standing, "standing is required");
        agentKeys = agentKeys != null ? List.copyOf(agentKeys) : List.of();
    }

    public boolean active() {
        return standing.statusType() == StatusType.ACCEPTED;
    }
}
