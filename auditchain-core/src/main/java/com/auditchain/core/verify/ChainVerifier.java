package com.auditchain.core.verify;

import com.auditchain.core.canonical.EntryHasher;
import com.auditchain.core.domain.AuditEntry;
import com.auditchain.core.domain.SequenceRange;
import com.auditchain.core.exception.SerializationException;

import java.util.Iterator;
import java.util.Objects;

/**
 * Walks entries in ascending sequence order, recomputing each hash and checking
 * each link. Pure: reads nothing but the supplied entries, so the same walk serves
 * the service and auditors verifying an exported copy.
 * <p>
 * Checks per entry, in order: position (genesis, gap, reordering), recomputed hash,
 * then linkage to the prior entry. With a checkpoint anchor the first entry must be
 * the checkpoint's entry; its own predecessor hash is trusted. A boundary anchor trusts
 * the predecessor hash of its first entry the same way but has no root to compare.
 */
public final class ChainVerifier {

    private ChainVerifier() {}

    public static VerificationResult verify(Iterator<AuditEntry> entries, VerificationAnchor anchor,
                                            CancellationToken cancellation) {
        Objects.requireNonNull(anchor, "Anchor cannot be null");
        CancellationToken token = cancellation == null ? CancellationToken.none() : cancellation;

        long start = anchor.sequence();
        long expected = start;
        long last = start - 1;
        String lastHash = null;
        boolean first = true;

        while (entries.hasNext()) {
            if (token.isCancelled()) {
                return new VerificationResult.Partial(SequenceRange.of(start, last), lastHash);
            }
            AuditEntry entry = entries.next();
            long seq = entry.sequence();
            SequenceRange verified = SequenceRange.of(start, last);

            if (first) {
                if (anchor.genesis()) {
                    if (seq != 0) {
                        return new VerificationResult.Broken(0, BreakReason.GENESIS_MISSING, verified,
                                "first stored entry has sequence " + seq);
                    }
                    if (!EntryHasher.GENESIS_SENTINEL.equals(entry.previousHash())) {
                        return new VerificationResult.Broken(0, BreakReason.GENESIS_MISSING, verified,
                                "entry 0 does not carry the genesis sentinel");
                    }
                } else if (seq != anchor.sequence() && anchor.kind() == VerificationAnchor.Kind.BOUNDARY) {
                    return new VerificationResult.Broken(seq, BreakReason.UNKNOWN_PREDECESSOR, verified,
                            "entries " + anchor.sequence() + ".." + (seq - 1) + " are missing");
                } else if (seq != anchor.sequence()) {
                    return new VerificationResult.Broken(anchor.sequence(), BreakReason.CHECKPOINT_MISMATCH,
                            verified, "checkpoint entry is missing");
                }
            } else if (seq > expected) {
                return new VerificationResult.Broken(seq, BreakReason.UNKNOWN_PREDECESSOR, verified,
                        "entries " + expected + ".." + (seq - 1) + " are missing");
            } else if (seq < expected) {
                return new VerificationResult.Broken(seq, BreakReason.LINKAGE_MISMATCH, verified,
                        "sequence " + seq + " appears out of order after " + last);
            }

            if (entry.previousHash() == null || entry.entryHash() == null) {
                return new VerificationResult.Broken(seq, BreakReason.HASH_MISMATCH, verified,
                        "stored entry has no " + (entry.previousHash() == null ? "previous hash" : "entry hash"));
            }
            String recomputed;
            try {
                recomputed = EntryHasher.hash(entry);
            } catch (SerializationException e) {
                return new VerificationResult.Broken(seq, BreakReason.HASH_MISMATCH, verified,
                        "stored content cannot be encoded: " + e.getMessage());
            }
            if (!recomputed.equals(entry.entryHash())) {
                return new VerificationResult.Broken(seq, BreakReason.HASH_MISMATCH, verified,
                        "stored hash does not match content");
            }

            if (first && anchor.kind() == VerificationAnchor.Kind.CHECKPOINT && !anchor.hash().equals(entry.entryHash())) {
                return new VerificationResult.Broken(seq, BreakReason.CHECKPOINT_MISMATCH, verified,
                        "entry hash differs from checkpoint root");
            }
            if (!first && !lastHash.equals(entry.previousHash())) {
                return new VerificationResult.Broken(seq, BreakReason.LINKAGE_MISMATCH, verified,
                        "previous hash does not match entry " + last);
            }

            last = seq;
            lastHash = entry.entryHash();
            expected = seq + 1;
            first = false;
        }

        if (first && anchor.kind() == VerificationAnchor.Kind.CHECKPOINT) {
            return new VerificationResult.Broken(anchor.sequence(), BreakReason.CHECKPOINT_MISMATCH,
                    SequenceRange.empty(), "checkpoint entry is missing");
        }
        return new VerificationResult.Valid(first ? SequenceRange.empty() : SequenceRange.of(start, last), lastHash);
    }
}
