package com.auditchain.core.verify;

/**
 * Why verification stopped at an entry.
 */
public enum BreakReason {
    /** Stored hash differs from the recomputed one: content altered without rehashing. */
    HASH_MISMATCH,
    /** Predecessor hash or ordering does not match the prior entry: reordered, duplicated or forked. */
    LINKAGE_MISMATCH,
    /** No sequence-0 entry carrying the genesis sentinel. */
    GENESIS_MISSING,
    /** Sequence gap: the referenced predecessor is not in the chain. */
    UNKNOWN_PREDECESSOR,
    /** The entry a trusted checkpoint refers to is missing or differs from the checkpoint. */
    CHECKPOINT_MISMATCH
}
