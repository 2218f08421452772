package com.auditchain.core.store;

import com.auditchain.core.domain.Checkpoint;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Local record of checkpoints and their export state.
 */
public interface CheckpointStore {

    /**
     * Stores a new checkpoint. Sequences per chain must strictly increase.
     */
    Checkpoint save(Checkpoint checkpoint);

    Optional<Checkpoint> latest(String chainId);

    Optional<Checkpoint> find(String chainId, long sequence);

    /**
     * All checkpoints of a chain, ascending by sequence.
     */
    List<Checkpoint> list(String chainId);

    /**
     * Checkpoints of every chain not yet exported, oldest first.
     */
    List<Checkpoint> unexported();

    Checkpoint markExported(Checkpoint checkpoint, Instant exportedAt, String destination);

    Checkpoint recordExportFailure(Checkpoint checkpoint, String error);
}
