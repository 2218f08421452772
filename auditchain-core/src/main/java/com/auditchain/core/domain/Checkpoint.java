package com.auditchain.core.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.util.Objects;

/**
 * Periodic witness of a chain tip. The export bookkeeping fields are the only
 * part of a checkpoint that changes after it is created.
 *
 * @param merkleRoot root of the Merkle tree over the entry hashes since the previous
 *                   checkpoint, up to and including this one; null on checkpoints taken
 *                   before segment trees were recorded
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Checkpoint(
        String chainId,
        long sequence,
        String rootHash,
        String merkleRoot,
        Instant createdAt,
        Instant exportedAt,
        String exportDestination,
        int exportAttempts,
        String lastExportError
) {

    public Checkpoint {
        Objects.requireNonNull(chainId, "Chain ID cannot be null");
        Objects.requireNonNull(rootHash, "Root hash cannot be null");
        Objects.requireNonNull(createdAt, "Creation time cannot be null");
    }

    public static Checkpoint create(String chainId, long sequence, String rootHash, Instant createdAt) {
        return create(chainId, sequence, rootHash, null, createdAt);
    }

    public static Checkpoint create(String chainId, long sequence, String rootHash, String merkleRoot,
                                    Instant createdAt) {
        return new Checkpoint(chainId, sequence, rootHash, merkleRoot, createdAt, null, null, 0, null);
    }

    /**
     * A checkpoint supplied back by an auditor; only the trust anchor fields matter.
     */
    public static Checkpoint trusted(String chainId, long sequence, String rootHash) {
        return trusted(chainId, sequence, rootHash, null);
    }

    public static Checkpoint trusted(String chainId, long sequence, String rootHash, String merkleRoot) {
        return new Checkpoint(chainId, sequence, rootHash, merkleRoot, Instant.EPOCH, null, null, 0, null);
    }

    public boolean isExported() {
        return exportedAt != null;
    }

    public Checkpoint exported(Instant when, String destination) {
        return new Checkpoint(chainId, sequence, rootHash, merkleRoot, createdAt, when, destination,
                exportAttempts + 1, null);
    }

    public Checkpoint exportFailed(String error) {
        return new Checkpoint(chainId, sequence, rootHash, merkleRoot, createdAt, null, null,
                exportAttempts + 1, error);
    }
}
