package com.auditchain.core.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Objects;

/**
 * What leaves the system when a checkpoint is exported, and what an auditor hands back
 * to verify against it. The JSON form is stable; {@code merkleRoot} is left out when the
 * checkpoint has none.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CheckpointArtifact(
        String format,
        String chainId,
        long sequence,
        String rootHash,
        Instant timestamp,
        String merkleRoot
) {

    public static final String FORMAT = "auditchain-checkpoint/v1";

    public CheckpointArtifact {
        Objects.requireNonNull(chainId, "Chain ID cannot be null");
        Objects.requireNonNull(rootHash, "Root hash cannot be null");
        if (format == null) {
            format = FORMAT;
        }
    }

    public CheckpointArtifact(String format, String chainId, long sequence, String rootHash, Instant timestamp) {
        this(format, chainId, sequence, rootHash, timestamp, null);
    }

    public static CheckpointArtifact of(Checkpoint checkpoint) {
        return new CheckpointArtifact(FORMAT, checkpoint.chainId(), checkpoint.sequence(),
                checkpoint.rootHash(), checkpoint.createdAt(), checkpoint.merkleRoot());
    }

    public Checkpoint toTrustedCheckpoint() {
        if (!FORMAT.equals(format)) {
            throw new IllegalArgumentException("Unsupported checkpoint format: " + format);
        }
        return Checkpoint.trusted(chainId, sequence, rootHash, merkleRoot);
    }
}
