package com.bulletin.lifecycle.core;

/**
 * Base class for all errors raised by the lifecycle subsystem.
 * Errors are always propagated to the caller; nothing is retried internally.
 */
public abstract class LifecycleException extends RuntimeException {

    protected LifecycleException(String message) {
        super(message);
    }

    protected LifecycleException(String message, Throwable cause) {
        super(message, cause);
    }
}
