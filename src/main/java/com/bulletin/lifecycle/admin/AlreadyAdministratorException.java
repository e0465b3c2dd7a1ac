package com.bulletin.lifecycle.admin;

import com.bulletin.lifecycle.core.LifecycleException;

/**
 * Thrown when registering an entity that is already an active administrator.
 */
public class AlreadyAdministratorException extends LifecycleException {

    public AlreadyAdministratorException(String entityHash) {
        super("Entity is already an administrator: " + entityHash);
    }
}
