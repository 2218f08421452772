package com.auditchain.api.checkpoint;

import com.auditchain.api.append.ChainLockRegistry;
import com.auditchain.api.verify.VerificationEngine;
import com.auditchain.core.canonical.MerkleTree;
import com.auditchain.core.domain.AuditEntry;
import com.auditchain.core.domain.Checkpoint;
import com.auditchain.core.domain.CheckpointArtifact;
import com.auditchain.core.exception.ChainIntegrityException;
import com.auditchain.core.exception.ChainNotFoundException;
import com.auditchain.core.exception.CheckpointExportFailureException;
import com.auditchain.core.export.CheckpointExporter;
import com.auditchain.core.store.ChainStore;
import com.auditchain.core.store.CheckpointStore;
import com.auditchain.core.verify.BreakReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;

/**
 * Takes checkpoints of chain tips and exports them outside the primary store.
 * <p>
 * A checkpoint is stored before it is exported. A failed export leaves it unexported
 * with the failure recorded; appends carry on and the export is retried later.
 */
@Service
public class CheckpointManager {

    private static final Logger log = LoggerFactory.getLogger(CheckpointManager.class);

    private final ChainStore chainStore;
    private final CheckpointStore checkpointStore;
    private final CheckpointExporter exporter;
    private final VerificationEngine verificationEngine;
    private final ChainLockRegistry locks;
    private final Clock clock;

    public CheckpointManager(ChainStore chainStore, CheckpointStore checkpointStore, CheckpointExporter exporter,
                             VerificationEngine verificationEngine, ChainLockRegistry locks, Clock clock) {
        this.chainStore = chainStore;
        this.checkpointStore = checkpointStore;
        this.exporter = exporter;
        this.verificationEngine = verificationEngine;
        this.locks = locks;
        this.clock = clock;
    }

    /**
     * Checkpoints the current head of a chain. Returns the latest checkpoint unchanged
     * when it already covers the head. The entries since the previous checkpoint are
     * verified first; a broken chain is never checkpointed. The new checkpoint carries the
     * Merkle root of the entry hashes after the previous checkpoint, up to the head.
     *
     * @throws ChainNotFoundException if the chain has no entries
     * @throws com.auditchain.core.exception.ChainIntegrityException if the chain fails verification
     */
    public Checkpoint checkpoint(String chainId) {
        ReentrantLock lock = locks.checkpointLock(chainId);
        lock.lock();
        try {
            AuditEntry head = chainStore.getHead(chainId)
                    .orElseThrow(() -> new ChainNotFoundException(chainId));
            Optional<Checkpoint> latest = checkpointStore.latest(chainId);
            if (latest.isPresent() && latest.get().sequence() >= head.sequence()) {
                return latest.get();
            }
            verificationEngine.verify(chainId, latest).requireValid(chainId);

            long segmentFrom = latest.map(cp -> cp.sequence() + 1).orElse(0L);
            String merkleRoot = segmentTree(chainStore, chainId, segmentFrom, head.sequence()).root();
            Checkpoint created = checkpointStore.save(Checkpoint.create(
                    chainId, head.sequence(), head.entryHash(), merkleRoot, clock.instant()));
            log.info("Checkpoint created chain={} sequence={}", chainId, created.sequence());
            return export(created);
        } finally {
            lock.unlock();
        }
    }

    public List<Checkpoint> list(String chainId) {
        return checkpointStore.list(chainId);
    }

    public Optional<Checkpoint> find(String chainId, long sequence) {
        return checkpointStore.find(chainId, sequence);
    }

    public Optional<Checkpoint> latest(String chainId) {
        return checkpointStore.latest(chainId);
    }

    // ==================== Export ====================

    /**
     * Re-exports every unexported checkpoint whose root still matches the stored entry.
     * A mismatch is an integrity problem: it is logged and the checkpoint stays unexported.
     */
    public ExportRetryReport retryPendingExports() {
        int exported = 0;
        int failed = 0;
        List<String> mismatched = new ArrayList<>();
        for (Checkpoint pending : checkpointStore.unexported()) {
            Optional<AuditEntry> entry = chainStore.getEntry(pending.chainId(), pending.sequence());
            if (entry.isEmpty() || !pending.rootHash().equals(entry.get().entryHash())) {
                log.error("Checkpoint {}@{} no longer matches the stored entry; not exporting",
                        pending.chainId(), pending.sequence());
                mismatched.add(key(pending));
                continue;
            }
            if (export(pending).isExported()) {
                exported++;
            } else {
                failed++;
            }
        }
        if (exported + failed + mismatched.size() > 0) {
            log.info("Checkpoint export retry: {} exported, {} failed, {} mismatched",
                    exported, failed, mismatched.size());
        }
        return new ExportRetryReport(exported, failed, mismatched);
    }

    /**
     * Unexported checkpoints created more than {@code threshold} ago.
     */
    public List<CheckpointExportFailure> staleExports(Duration threshold) {
        Instant cutoff = clock.instant().minus(threshold);
        return checkpointStore.unexported().stream()
                .filter(cp -> cp.createdAt().isBefore(cutoff))
                .map(cp -> new CheckpointExportFailure(cp.chainId(), cp.sequence(), cp.createdAt(),
                        cp.exportAttempts(), cp.lastExportError()))
                .toList();
    }

    /**
     * @throws CheckpointExportFailureException if any checkpoint stayed unexported past {@code threshold}
     */
    public void requireNoStaleExports(Duration threshold) {
        List<CheckpointExportFailure> stale = staleExports(threshold);
        if (!stale.isEmpty()) {
            throw new CheckpointExportFailureException(stale.stream().map(CheckpointExportFailure::key).toList());
        }
    }

    private Checkpoint export(Checkpoint checkpoint) {
        try {
            String destination = exporter.export(CheckpointArtifact.of(checkpoint));
            Checkpoint exported = checkpointStore.markExported(checkpoint, clock.instant(), destination);
            log.info("Checkpoint exported chain={} sequence={} exporter={}",
                    checkpoint.chainId(), checkpoint.sequence(), exporter.name());
            return exported;
        } catch (RuntimeException e) {
            log.warn("Checkpoint export failed chain={} sequence={} exporter={}: {}",
                    checkpoint.chainId(), checkpoint.sequence(), exporter.name(), e.getMessage());
            return checkpointStore.recordExportFailure(checkpoint, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    /**
     * Merkle tree over the entry hashes of {@code [from, to]}.
     */
    static MerkleTree segmentTree(ChainStore chainStore, String chainId, long from, long to) {
        List<String> leaves;
        try (Stream<AuditEntry> entries = chainStore.getRange(chainId, from, to)) {
            leaves = entries.map(AuditEntry::entryHash).toList();
        }
        if (leaves.size() != to - from + 1) {
            throw new ChainIntegrityException(chainId, from + leaves.size(), BreakReason.UNKNOWN_PREDECESSOR,
                    "segment " + from + ".." + to + " has " + leaves.size() + " stored entries");
        }
        return MerkleTree.build(leaves);
    }

    private static String key(Checkpoint checkpoint) {
        return checkpoint.chainId() + "@" + checkpoint.sequence();
    }

    // Result records
    public record ExportRetryReport(int exported, int failed, List<String> rootMismatches) {}

    public record CheckpointExportFailure(
            String chainId,
            long sequence,
            Instant createdAt,
            int attempts,
            String lastError
    ) {
        public String key() {
            return chainId + "@" + sequence;
        }
    }
}
