package com.bulletin.lifecycle.chain;

import com.bulletin.lifecycle.core.LifecycleException;

/**
 * Thrown when a new chain would have the same root hash as an existing one.
 * Roots must carry enough content to tell their chains apart.
 */
public class ChainAlreadyExistsException extends LifecycleException {

    private final String originalHash;

    public ChainAlreadyExistsException(String originalHash) {
        super("Chain already exists: " + originalHash);
        this.originalHash = originalHash;
    }

    public String getOriginalHash() {
        return originalHash;
    }
}
