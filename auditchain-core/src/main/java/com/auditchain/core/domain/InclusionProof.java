package com.auditchain.core.domain;

import com.auditchain.core.canonical.MerkleTree;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Proof that one entry belongs to the segment sealed by a checkpoint.
 *
 * @param segmentFrom first sequence of the segment; the proven leaf sits at {@code sequence - segmentFrom}
 * @param path        sibling hashes from the entry hash up to {@code merkleRoot}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record InclusionProof(
        String chainId,
        long sequence,
        String entryHash,
        long checkpointSequence,
        String checkpointRoot,
        String merkleRoot,
        long segmentFrom,
        List<MerkleTree.ProofStep> path
) {

    public InclusionProof {
        path = path == null ? List.of() : List.copyOf(path);
    }
}
