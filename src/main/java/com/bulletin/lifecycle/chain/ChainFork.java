package com.bulletin.lifecycle.chain;

import java.util.List;
import java.util.Objects;

/**
 * A point in a chain where two or more records claim the same predecessor.
 * Forks are a data condition, not an error: they are reconciled by a later update.
 *
 * @param previousHash    the contested predecessor
 * @param successorHashes the competing successors, oldest first
 */
public record ChainFork(String previousHash, List<String> successorHashes) {

    public ChainFork {
        Objects.requireNonNull(previousHash, "previousHash is required");
        successorHashes = List.copyOf(successorHashes);
        if (successorHashes.size() < 2) {
            throw new IllegalArgumentException("a fork needs at least two successors");
        }
    }
}
