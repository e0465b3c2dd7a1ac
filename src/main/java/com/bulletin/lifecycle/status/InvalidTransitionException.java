package com.bulletin.lifecycle.status;

import com.bulletin.lifecycle.core.LifecycleException;

/**
 * Thrown when a requested status is missing a required reason or suspension end,
 * or carries a suspension end that is not in the future.
 */
public class InvalidTransitionException extends LifecycleException {

    public InvalidTransitionException(String message) {
        super(message);
    }
}
