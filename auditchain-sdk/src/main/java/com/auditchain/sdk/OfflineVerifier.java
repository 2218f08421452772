package com.auditchain.sdk;

import com.auditchain.core.canonical.EntryHasher;
import com.auditchain.core.canonical.MerkleTree;
import com.auditchain.core.canonical.PackageHasher;
import com.auditchain.core.domain.AuditEntry;
import com.auditchain.core.domain.AuditPackage;
import com.auditchain.core.domain.Checkpoint;
import com.auditchain.core.domain.CheckpointArtifact;
import com.auditchain.core.domain.InclusionProof;
import com.auditchain.core.verify.CancellationToken;
import com.auditchain.core.verify.ChainVerifier;
import com.auditchain.core.verify.VerificationAnchor;
import com.auditchain.core.verify.VerificationResult;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Checks chains and evidence packages without trusting the service that produced them.
 * Uses the same canonical encoding and hashing as the service.
 */
public final class OfflineVerifier {

    private OfflineVerifier() {}

    /**
     * Verifies a complete chain from genesis. Entries may be given in any order.
     */
    public static VerificationResult verifyChain(List<AuditEntry> entries) {
        return ChainVerifier.verify(sorted(entries).iterator(), VerificationAnchor.fromGenesis(),
                CancellationToken.none());
    }

    /**
     * Verifies a chain from a checkpoint artifact held by the auditor. Entries before the
     * checkpoint sequence are ignored; the entry at that sequence must still hash to the
     * artifact's root.
     */
    public static VerificationResult verifyChain(List<AuditEntry> entries, CheckpointArtifact trusted) {
        Checkpoint checkpoint = trusted.toTrustedCheckpoint();
        List<AuditEntry> tail = sorted(entries).stream()
                .filter(e -> e.sequence() >= checkpoint.sequence())
                .toList();
        return ChainVerifier.verify(tail.iterator(), VerificationAnchor.fromCheckpoint(checkpoint),
                CancellationToken.none());
    }

    /**
     * Checks an evidence package: the seal, the entries it carries and the checkpoints
     * that fall inside them. A package that starts mid-chain has its first entry's link
     * taken on trust; pass a checkpoint artifact to pin it.
     */
    public static PackageReport verifyPackage(AuditPackage auditPackage, Optional<CheckpointArtifact> trusted) {
        Objects.requireNonNull(auditPackage, "Audit package cannot be null");
        boolean intact = PackageHasher.isIntact(auditPackage);
        List<AuditEntry> entries = sorted(auditPackage.entries());

        VerificationResult recomputed;
        if (entries.isEmpty() || entries.get(0).sequence() == 0) {
            recomputed = verifyChain(entries);
        } else {
            recomputed = ChainVerifier.verify(entries.iterator(),
                    VerificationAnchor.boundary(entries.get(0).sequence()), CancellationToken.none());
        }

        Map<Long, String> hashes = new HashMap<>();
        for (AuditEntry entry : entries) {
            hashes.put(entry.sequence(), entry.entryHash());
        }
        List<Long> mismatched = new ArrayList<>();
        for (Checkpoint checkpoint : auditPackage.checkpoints()) {
            String hash = hashes.get(checkpoint.sequence());
            if (hash != null && !hash.equals(checkpoint.rootHash())) {
                mismatched.add(checkpoint.sequence());
            }
        }

        Boolean trustedMatch = null;
        if (trusted.isPresent()) {
            Checkpoint anchor = trusted.get().toTrustedCheckpoint();
            if (!anchor.chainId().equals(auditPackage.chainId())) {
                throw new IllegalArgumentException("Checkpoint artifact belongs to chain " + anchor.chainId());
            }
            String hash = hashes.get(anchor.sequence());
            trustedMatch = hash == null ? null : hash.equals(anchor.rootHash());
        }
        return new PackageReport(intact, recomputed, List.copyOf(mismatched), trustedMatch);
    }

    /**
     * Checks that {@code entry} is covered by a checkpoint artifact the auditor holds,
     * without fetching the rest of the chain. The entry must hash to its stored hash, the
     * proof must belong to the artifact, and the path must lead from the entry's position
     * in the segment to the artifact's Merkle root.
     *
     * @throws IllegalArgumentException if the artifact carries no Merkle root
     */
    public static boolean verifyInclusion(AuditEntry entry, InclusionProof proof, CheckpointArtifact trusted) {
        Objects.requireNonNull(entry, "Entry cannot be null");
        Objects.requireNonNull(proof, "Inclusion proof cannot be null");
        Checkpoint anchor = trusted.toTrustedCheckpoint();
        if (anchor.merkleRoot() == null) {
            throw new IllegalArgumentException("Checkpoint artifact " + anchor.chainId() + "@" + anchor.sequence()
                    + " carries no Merkle root");
        }
        if (entry.entryHash() == null || !entry.entryHash().equals(EntryHasher.hash(entry))) {
            return false;
        }
        boolean sameEntry = entry.chainId().equals(proof.chainId())
                && entry.sequence() == proof.sequence()
                && entry.entryHash().equals(proof.entryHash());
        boolean sameCheckpoint = anchor.chainId().equals(proof.chainId())
                && anchor.sequence() == proof.checkpointSequence()
                && anchor.rootHash().equals(proof.checkpointRoot())
                && anchor.merkleRoot().equals(proof.merkleRoot());
        boolean inSegment = proof.segmentFrom() <= proof.sequence() && proof.sequence() <= proof.checkpointSequence();
        return sameEntry
                && sameCheckpoint
                && inSegment
                && MerkleTree.indexOf(proof.path()) == proof.sequence() - proof.segmentFrom()
                && MerkleTree.rootOf(entry.entryHash(), proof.path()).equals(anchor.merkleRoot());
    }

    private static List<AuditEntry> sorted(List<AuditEntry> entries) {
        List<AuditEntry> copy = new ArrayList<>(entries);
        copy.sort(Comparator.comparingLong(AuditEntry::sequence));
        return copy;
    }

    /**
     * Outcome of {@link #verifyPackage}.
     *
     * @param intact                 the package hash matches its contents
     * @param recomputed             verification of the carried entries, done locally
     * @param mismatchedCheckpoints  checkpoint sequences whose root differs from the carried entry
     * @param trustedCheckpointMatch null when no artifact was given or its entry is not in the package
     */
    public record PackageReport(
            boolean intact,
            VerificationResult recomputed,
            List<Long> mismatchedCheckpoints,
            Boolean trustedCheckpointMatch
    ) {
        public boolean isTrustworthy() {
            return intact
                    && recomputed.isValid()
                    && mismatchedCheckpoints.isEmpty()
                    && !Boolean.FALSE.equals(trustedCheckpointMatch);
        }
    }
}
