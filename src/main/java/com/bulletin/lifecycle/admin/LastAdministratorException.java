package com.bulletin.lifecycle.admin;

import com.bulletin.lifecycle.core.LifecycleException;

/**
 * Thrown when a removal would leave the network without an active administrator.
 */
public class LastAdministratorException extends LifecycleException {

    public LastAdministratorException(String entityHash) {
        super("Cannot remove the last administrator: " + entityHash);
    }
}
