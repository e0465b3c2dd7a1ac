package com.bulletin.lifecycle.auth;

import com.bulletin.lifecycle.core.LifecycleException;

/**
 * Thrown when a caller fails the authorization guard.
 */
public class UnauthorizedException extends LifecycleException {

    private final String agentKey;

    public UnauthorizedException(String agentKey, String message) {
        super(message);
        this.agentKey = agentKey;
    }

    public String getAgentKey() {
        return agentKey;
    }
}
