package com.bulletin.lifecycle.service;

import com.bulletin.lifecycle.core.LifecycleException;
import com.bulletin.lifecycle.core.model.EntityType;

/**
 * Thrown when creating a status chain for an entity that already has one.
 */
public class StatusAlreadyExistsException extends LifecycleException {

    public StatusAlreadyExistsException(EntityType type, String entityHash) {
        super("Entity already has a status: " + type.pathName() + "/" + entityHash);
    }
}
