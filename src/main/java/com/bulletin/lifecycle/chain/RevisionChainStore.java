package com.bulletin.lifecycle.chain;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Append-only store of hash-linked revision chains.
 *
 * <p>Each chain is identified by the hash of its root record. Updates are
 * optimistic: an append names the tip it believes is current and fails with
 * {@link StaleReferenceException} otherwise. Records authored on other replicas
 * are accepted through {@link #integrate(ChainRecord)} without that check, which
 * is how forks enter a chain.</p>
 *
 * @param <T> payload type
 */
public interface RevisionChainStore<T> {

    /**
     * Starts a new chain whose root carries the given payload.
     *
     * @param author  agent key of the author
     * @param payload root payload
     * @return the stored root record
     * @throws ChainAlreadyExistsException if an identical root is already stored
     */
    ChainRecord<T> create(String author, T payload);

    /**
     * Appends a record that supersedes {@code previousHash}.
     *
     * @param originalHash root of the chain
     * @param previousHash the tip the caller believes is current
     * @param author       agent key of the author
     * @param payload      new payload
     * @return the stored record
     * @throws StaleReferenceException if {@code previousHash} is not the current tip
     * @throws com.bulletin.lifecycle.core.NotFoundException if the chain does not exist
     */
    ChainRecord<T> append(String originalHash, String previousHash, String author, T payload);

    /**
     * Stores a record authored elsewhere. The record hash is verified and its
     * predecessor must already be known, but it need not be the current tip.
     * Integrating an already-known record is a no-op.
     *
     * @return the stored record
     * @throws IllegalArgumentException if the hash does not match the content
     * @throws com.bulletin.lifecycle.core.NotFoundException if the predecessor is unknown
     */
    ChainRecord<T> integrate(ChainRecord<T> record);

    /**
     * Gets a record by hash.
     */
    Optional<ChainRecord<T>> get(String hash);

    /**
     * Resolves the tip of a chain. When the chain is forked, the tip with the
     * latest timestamp wins, ties broken by the greater hash.
     *
     * @throws com.bulletin.lifecycle.core.NotFoundException if the chain does not exist
     */
    ChainRecord<T> resolveLatest(String originalHash);

    /**
     * Returns every record of a chain, oldest first, every record after its predecessor.
     * Forked branches are all included. The list is computed fresh on each call.
     *
     * @throws com.bulletin.lifecycle.core.NotFoundException if the chain does not exist
     */
    List<ChainRecord<T>> resolveHistory(String originalHash);

    /**
     * Lists the fork points of a chain; empty for a linear chain.
     */
    List<ChainFork> findForks(String originalHash);

    /**
     * Returns the root hashes of all known chains.
     */
    Set<String> originals();

    void addListener(ChainListener<T> listener);
}
