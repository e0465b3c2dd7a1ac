package com.bulletin.lifecycle.chain;

import com.bulletin.lifecycle.core.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of {@link RevisionChainStore}.
 *
 * <p>Keeps a forward index from each record to its successors so the tip of a
 * chain is found without reverse traversal. Writes are serialized so the tip
 * comparison in {@link #append} and the store are one atomic step; reads go
 * straight to the concurrent maps.</p>
 *
 * @param <T> payload type
 */
public class InMemoryRevisionChainStore<T> implements RevisionChainStore<T> {
    private static final Logger log = LoggerFactory.getLogger(InMemoryRevisionChainStore.class);

    private static final Comparator<ChainRecord<?>> OLDEST_FIRST = Comparator
            .comparing((ChainRecord<?> r) -> r.createdAt())
            .thenComparing(r -> r.hash());

    private final ChainRecordCodec<T> codec;
    private final Clock clock;
    private final ConcurrentMap<String, ChainRecord<T>> records = new ConcurrentHashMap<>();
    // Forward update links: previous hash -> successor hashes
    private final ConcurrentMap<String, Set<String>> successors = new ConcurrentHashMap<>();
    // Chain membership: original hash -> record hashes
    private final ConcurrentMap<String, Set<String>> chains = new ConcurrentHashMap<>();
    private final List<ChainListener<T>> listeners = new CopyOnWriteArrayList<>();

    public InMemoryRevisionChainStore(ChainRecordCodec<T> codec) {
        this(codec, Clock.systemUTC());
    }

    public InMemoryRevisionChainStore(ChainRecordCodec<T> codec, Clock clock) {
        this.codec = codec;
        this.clock = clock;
    }

    @Override
    public synchronized ChainRecord<T> create(String author, T payload) {
        Instant createdAt = clock.instant();
        String hash = codec.computeHash(null, author, createdAt, payload);
        if (records.containsKey(hash)) {
            throw new ChainAlreadyExistsException(hash);
        }
        ChainRecord<T> root = new ChainRecord<>(hash, hash, hash, author, createdAt, payload);
        store(root);
        log.debug("chain.created original={} author={}", hash, author);
        return root;
    }

    @Override
    public synchronized ChainRecord<T> append(String originalHash, String previousHash, String author, T payload) {
        ChainRecord<T> tip = resolveLatest(originalHash);
        if (!tip.hash().equals(previousHash)) {
            log.debug("chain.stale original={} supplied={} tip={}", originalHash, previousHash, tip.hash());
            throw new StaleReferenceException(originalHash, previousHash, tip.hash());
        }

        // Keep authoring time strictly after the superseded record so the new record becomes the tip
        Instant now = clock.instant();
        Instant createdAt = now.isAfter(tip.createdAt()) ? now : tip.createdAt().plusNanos(1);

        String hash = codec.computeHash(previousHash, author, createdAt, payload);
        ChainRecord<T> record = new ChainRecord<>(hash, originalHash, previousHash, author, createdAt, payload);
        store(record);
        log.debug("chain.appended original={} previous={} hash={} author={}",
                originalHash, previousHash, hash, author);
        return record;
    }

    @Override
    public synchronized ChainRecord<T> integrate(ChainRecord<T> record) {
        ChainRecord<T> known = records.get(record.hash());
        if (known != null) {
            return known;
        }
        if (!codec.verify(record)) {
            throw new IllegalArgumentException("Record hash does not match its content: " + record.hash());
        }
        if (!record.isRoot()) {
            Set<String> members = chains.get(record.originalHash());
            if (members == null) {
                throw new NotFoundException("Chain not found: " + record.originalHash());
            }
            if (!members.contains(record.previousHash())) {
                throw new NotFoundException("Predecessor " + record.previousHash()
                        + " is not part of chain " + record.originalHash());
            }
        }
        store(record);
        if (successors.getOrDefault(record.previousHash(), Set.of()).size() > 1) {
            log.warn("chain.fork original={} previous={} hash={}",
                    record.originalHash(), record.previousHash(), record.hash());
        }
        return record;
    }

    @Override
    public Optional<ChainRecord<T>> get(String hash) {
        return Optional.ofNullable(records.get(hash));
    }

    @Override
    public ChainRecord<T> resolveLatest(String originalHash) {
        Set<String> members = requireChain(originalHash);
        ChainRecord<T> latest = null;
        for (String hash : members) {
            if (!successors.getOrDefault(hash, Set.of()).isEmpty()) {
                continue;
            }
            ChainRecord<T> candidate = records.get(hash);
            if (latest == null || OLDEST_FIRST.compare(candidate, latest) > 0) {
                latest = candidate;
            }
        }
        if (latest == null) {
            // Cannot happen for a well-formed chain: a finite chain always has a record without successors
            throw new IllegalStateException("Chain has no tip: " + originalHash);
        }
        return latest;
    }

    @Override
    public List<ChainRecord<T>> resolveHistory(String originalHash) {
        requireChain(originalHash);
        List<ChainRecord<T>> history = new ArrayList<>();
        PriorityQueue<ChainRecord<T>> ready = new PriorityQueue<>(OLDEST_FIRST);
        ready.add(records.get(originalHash));
        while (!ready.isEmpty()) {
            ChainRecord<T> next = ready.poll();
            history.add(next);
            for (String successor : successors.getOrDefault(next.hash(), Set.of())) {
                ready.add(records.get(successor));
            }
        }
        return history;
    }

    @Override
    public List<ChainFork> findForks(String originalHash) {
        List<ChainFork> forks = new ArrayList<>();
        Map<String, List<ChainRecord<T>>> byPrevious = new HashMap<>();
        for (ChainRecord<T> record : resolveHistory(originalHash)) {
            if (!record.isRoot()) {
                byPrevious.computeIfAbsent(record.previousHash(), k -> new ArrayList<>()).add(record);
            }
        }
        byPrevious.forEach((previous, children) -> {
            if (children.size() > 1) {
                forks.add(new ChainFork(previous, children.stream().map(ChainRecord::hash).toList()));
            }
        });
        forks.sort(Comparator.comparing(ChainFork::previousHash));
        return forks;
    }

    @Override
    public Set<String> originals() {
        return Set.copyOf(chains.keySet());
    }

    @Override
    public void addListener(ChainListener<T> listener) {
        listeners.add(listener);
    }

    private Set<String> requireChain(String originalHash) {
        Set<String> members = chains.get(originalHash);
        if (members == null) {
            throw new NotFoundException("Chain not found: " + originalHash);
        }
        return members;
    }

    private void store(ChainRecord<T> record) {
        records.put(record.hash(), record);
        chains.computeIfAbsent(record.originalHash(), k -> ConcurrentHashMap.newKeySet()).add(record.hash());
        if (!record.isRoot()) {
            successors.computeIfAbsent(record.previousHash(), k -> ConcurrentHashMap.newKeySet()).add(record.hash());
        }
        for (ChainListener<T> listener : listeners) {
            listener.onRecordStored(record);
        }
    }
}
