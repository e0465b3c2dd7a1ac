package com.bulletin.lifecycle.chain;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable node of a revision chain.
 *
 * <p>The root record of a chain references itself: its {@code previousHash} and
 * {@code originalHash} both equal its own {@code hash}. Every other record points
 * at the record it supersedes and at the root of its chain.</p>
 *
 * @param hash         content hash of this record
 * @param originalHash hash of the chain root
 * @param previousHash hash of the superseded record
 * @param author       agent key that authored the record
 * @param createdAt    authoring timestamp
 * @param payload      record content
 * @param <T>          payload type
 */
public record ChainRecord<T>(
        String hash,
        String originalHash,
        String previousHash,
        String author,
        Instant createdAt,
        T payload
) {
    public ChainRecord {
        Objects.requireNonNull(hash, "hash is required");
        Objects.requireNonNull(originalHash, "originalHash is required");
        Objects.requireNonNull(previousHash, "previousHash is required");
        Objects.requireNonNull(author, "author is required");
        Objects.requireNonNull(createdAt, "createdAt is required");
        Objects.requireNonNull(payload, "payload is required");
    }

    @JsonIgnore
    public boolean isRoot() {
        return hash.equals(originalHash) && hash.equals(previousHash);
    }
}
