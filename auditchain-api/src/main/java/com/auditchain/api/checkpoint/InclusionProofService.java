package com.auditchain.api.checkpoint;

import com.auditchain.core.canonical.MerkleTree;
import com.auditchain.core.domain.AuditEntry;
import com.auditchain.core.domain.Checkpoint;
import com.auditchain.core.domain.InclusionProof;
import com.auditchain.core.exception.ChainIntegrityException;
import com.auditchain.core.exception.CheckpointNotFoundException;
import com.auditchain.core.exception.EntryNotFoundException;
import com.auditchain.core.store.ChainStore;
import com.auditchain.core.store.CheckpointStore;
import com.auditchain.core.verify.BreakReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Merkle inclusion proofs for single entries against the checkpoint that covers them.
 */
@Service
public class InclusionProofService {

    private static final Logger log = LoggerFactory.getLogger(InclusionProofService.class);

    private final ChainStore chainStore;
    private final CheckpointStore checkpointStore;

    public InclusionProofService(ChainStore chainStore, CheckpointStore checkpointStore) {
        this.chainStore = chainStore;
        this.checkpointStore = checkpointStore;
    }

    /**
     * Proves that the entry at {@code sequence} is a leaf of the segment tree sealed by the
     * first checkpoint at or after it. The tree is rebuilt from storage and must still have
     * the recorded root.
     *
     * @throws EntryNotFoundException      if the entry does not exist
     * @throws CheckpointNotFoundException if no checkpoint with a Merkle root covers the entry yet
     * @throws ChainIntegrityException     if the stored segment no longer matches its checkpoint
     */
    public InclusionProof prove(String chainId, long sequence) {
        AuditEntry entry = chainStore.getEntry(chainId, sequence)
                .orElseThrow(() -> new EntryNotFoundException(chainId, sequence));

        Checkpoint covering = null;
        long segmentFrom = 0;
        for (Checkpoint checkpoint : checkpointStore.list(chainId)) {
            if (checkpoint.sequence() >= sequence) {
                covering = checkpoint;
                break;
            }
            segmentFrom = checkpoint.sequence() + 1;
        }
        if (covering == null || covering.merkleRoot() == null) {
            throw CheckpointNotFoundException.covering(chainId, sequence);
        }

        MerkleTree tree = CheckpointManager.segmentTree(chainStore, chainId, segmentFrom, covering.sequence());
        if (!tree.root().equals(covering.merkleRoot())) {
            log.error("Segment {}..{} of chain {} no longer matches its checkpoint Merkle root",
                    segmentFrom, covering.sequence(), chainId);
            throw new ChainIntegrityException(chainId, covering.sequence(), BreakReason.CHECKPOINT_MISMATCH,
                    "segment " + segmentFrom + ".." + covering.sequence() + " differs from the checkpoint Merkle root");
        }
        return new InclusionProof(chainId, sequence, entry.entryHash(), covering.sequence(), covering.rootHash(),
                covering.merkleRoot(), segmentFrom, tree.proof((int) (sequence - segmentFrom)));
    }
}
