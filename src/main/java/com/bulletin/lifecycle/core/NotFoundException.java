package com.bulletin.lifecycle.core;

/**
 * Thrown when an entity, a chain root or a record does not exist.
 */
public class NotFoundException extends LifecycleException {

    public NotFoundException(String message) {
        super(message);
    }
}
