package com.auditchain.core.verify;

import com.auditchain.core.canonical.EntryHasher;
import com.auditchain.core.domain.Checkpoint;

/**
 * Where a verification walk starts.
 * <ul>
 *   <li>genesis: the chain must start at sequence 0 with the genesis sentinel;</li>
 *   <li>checkpoint: the entry at {@code sequence} must hash to the trusted {@code hash};</li>
 *   <li>boundary: a segment start inside a larger walk. The entry at {@code sequence}
 *       is re-hashed but its link to the previous segment is checked by the caller.</li>
 * </ul>
 */
public record VerificationAnchor(long sequence, String hash, Kind kind) {

    public enum Kind { GENESIS, CHECKPOINT, BOUNDARY }

    public static VerificationAnchor fromGenesis() {
        return new VerificationAnchor(0, EntryHasher.GENESIS_SENTINEL, Kind.GENESIS);
    }

    public static VerificationAnchor fromCheckpoint(Checkpoint checkpoint) {
        return new VerificationAnchor(checkpoint.sequence(), checkpoint.rootHash(), Kind.CHECKPOINT);
    }

    public static VerificationAnchor boundary(long sequence) {
        return new VerificationAnchor(sequence, null, Kind.BOUNDARY);
    }

    public boolean genesis() {
        return kind == Kind.GENESIS;
    }
}
