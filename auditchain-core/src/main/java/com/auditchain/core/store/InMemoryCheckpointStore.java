package com.auditchain.core.store;

import com.auditchain.core.domain.Checkpoint;
import com.auditchain.core.exception.CheckpointNotFoundException;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Checkpoint store held in process memory.
 */
public class InMemoryCheckpointStore implements CheckpointStore {

    private final Map<String, NavigableMap<Long, Checkpoint>> checkpoints = new ConcurrentHashMap<>();

    @Override
    public Checkpoint save(Checkpoint checkpoint) {
        NavigableMap<Long, Checkpoint> chain =
                checkpoints.computeIfAbsent(checkpoint.chainId(), id -> new ConcurrentSkipListMap<>());
        synchronized (chain) {
            if (!chain.isEmpty() && chain.lastKey() >= checkpoint.sequence()) {
                throw new IllegalStateException("Checkpoint sequence " + checkpoint.sequence()
                        + " does not advance past " + chain.lastKey() + " for chain " + checkpoint.chainId());
            }
            chain.put(checkpoint.sequence(), checkpoint);
        }
        return checkpoint;
    }

    @Override
    public Optional<Checkpoint> latest(String chainId) {
        NavigableMap<Long, Checkpoint> chain = checkpoints.get(chainId);
        if (chain == null || chain.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(chain.lastEntry().getValue());
    }

    @Override
    public Optional<Checkpoint> find(String chainId, long sequence) {
        NavigableMap<Long, Checkpoint> chain = checkpoints.get(chainId);
        return chain == null ? Optional.empty() : Optional.ofNullable(chain.get(sequence));
    }

    @Override
    public List<Checkpoint> list(String chainId) {
        NavigableMap<Long, Checkpoint> chain = checkpoints.get(chainId);
        return chain == null ? List.of() : List.copyOf(chain.values());
    }

    @Override
    public List<Checkpoint> unexported() {
        return checkpoints.values().stream()
                .flatMap(chain -> chain.values().stream())
                .filter(cp -> !cp.isExported())
                .sorted(Comparator.comparing(Checkpoint::createdAt))
                .toList();
    }

    @Override
    public Checkpoint markExported(Checkpoint checkpoint, Instant exportedAt, String destination) {
        return replace(stored(checkpoint).exported(exportedAt, destination));
    }

    @Override
    public Checkpoint recordExportFailure(Checkpoint checkpoint, String error) {
        return replace(stored(checkpoint).exportFailed(error));
    }

    private Checkpoint stored(Checkpoint checkpoint) {
        return find(checkpoint.chainId(), checkpoint.sequence())
                .orElseThrow(() -> new CheckpointNotFoundException(checkpoint.chainId(), checkpoint.sequence()));
    }

    private Checkpoint replace(Checkpoint updated) {
        checkpoints.get(updated.chainId()).put(updated.sequence(), updated);
        return updated;
    }
}
