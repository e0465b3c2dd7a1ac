package com.bulletin.lifecycle.chain;

import com.bulletin.lifecycle.core.LifecycleException;

/**
 * Thrown when an append names a previous hash that is no longer the chain tip.
 * The caller is expected to re-fetch the latest record and retry; the store never
 * retries on its own.
 */
public class StaleReferenceException extends LifecycleException {

    private final String originalHash;
    private final String suppliedPreviousHash;
    private final String currentTipHash;

    public StaleReferenceException(String originalHash, String suppliedPreviousHash, String currentTipHash) {
        super("Stale reference for chain " + originalHash + ": supplied " + suppliedPreviousHash
                + " but the current tip is " + currentTipHash);
        this.originalHash = originalHash;
        this.suppliedPreviousHash = suppliedPreviousHash;
        this.currentTipHash = currentTipHash;
    }

    public String getOriginalHash() {
        return originalHash;
    }

    public String getSuppliedPreviousHash() {
        return suppliedPreviousHash;
    }

    public String getCurrentTipHash() {
        return currentTipHash;
    }
}
