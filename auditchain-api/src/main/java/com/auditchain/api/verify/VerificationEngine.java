package com.auditchain.api.verify;

import com.auditchain.core.domain.AuditEntry;
import com.auditchain.core.domain.Checkpoint;
import com.auditchain.core.domain.SequenceRange;
import com.auditchain.core.store.ChainStore;
import com.auditchain.core.store.CheckpointStore;
import com.auditchain.core.verify.BreakReason;
import com.auditchain.core.verify.CancellationToken;
import com.auditchain.core.verify.ChainVerifier;
import com.auditchain.core.verify.VerificationAnchor;
import com.auditchain.core.verify.VerificationResult;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

/**
 * Verifies stored chains.
 * <p>
 * A run covers the entries up to the head observed when it starts; later appends are
 * left for the next run. Runs only read, never block appends, and are idempotent.
 */
@Service
public class VerificationEngine {

    private static final Logger log = LoggerFactory.getLogger(VerificationEngine.class);

    private final ChainStore chainStore;
    private final CheckpointStore checkpointStore;
    private final ExecutorService segmentPool;

    public VerificationEngine(ChainStore chainStore, CheckpointStore checkpointStore,
                              @Value("${auditchain.verify.parallelism:4}") int parallelism) {
        this.chainStore = chainStore;
        this.checkpointStore = checkpointStore;
        AtomicInteger threads = new AtomicInteger();
        this.segmentPool = Executors.newFixedThreadPool(Math.max(1, parallelism), runnable -> {
            Thread thread = new Thread(runnable, "chain-verify-" + threads.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @PreDestroy
    public void shutdown() {
        segmentPool.shutdownNow();
    }

    public VerificationResult verify(String chainId, Optional<Checkpoint> checkpoint) {
        return verify(chainId, checkpoint, CancellationToken.none());
    }

    /**
     * Walks a chain from genesis, or from a trusted checkpoint whose entry must still
     * hash to the checkpoint's root.
     */
    public VerificationResult verify(String chainId, Optional<Checkpoint> checkpoint, CancellationToken token) {
        checkpoint.ifPresent(cp -> requireSameChain(chainId, cp));
        long head = chainStore.getHead(chainId).map(AuditEntry::sequence).orElse(-1L);
        VerificationAnchor anchor = checkpoint.map(VerificationAnchor::fromCheckpoint)
                .orElseGet(VerificationAnchor::fromGenesis);

        VerificationResult result = walk(chainId, anchor, head, token);
        report(chainId, result);
        return result;
    }

    /**
     * Verifies a chain in parallel segments split at its stored checkpoints. Each segment
     * ends on the entry the next one starts with; the two reads of that entry must agree.
     * Stored checkpoint roots only choose the split points and are not trusted here, so
     * the verdict matches {@link #verify(String, Optional)} from genesis.
     */
    public VerificationResult verifySegmented(String chainId, CancellationToken token) {
        long head = chainStore.getHead(chainId).map(AuditEntry::sequence).orElse(-1L);
        List<Long> boundaries = new ArrayList<>();
        for (Checkpoint cp : checkpointStore.list(chainId)) {
            if (cp.sequence() > 0 && cp.sequence() < head) {
                boundaries.add(cp.sequence());
            }
        }
        if (boundaries.isEmpty()) {
            VerificationResult result = walk(chainId, VerificationAnchor.fromGenesis(), head, token);
            report(chainId, result);
            return result;
        }

        List<CompletableFuture<Segment>> futures = new ArrayList<>();
        long from = 0;
        for (int i = 0; i <= boundaries.size(); i++) {
            long to = i < boundaries.size() ? boundaries.get(i) : head;
            VerificationAnchor anchor = i == 0 ? VerificationAnchor.fromGenesis() : VerificationAnchor.boundary(from);
            long segmentFrom = from;
            futures.add(CompletableFuture.supplyAsync(
                    () -> runSegment(chainId, segmentFrom, anchor, to, token), segmentPool));
            from = to;
        }
        log.debug("Verifying chain {} in {} segments up to {}", chainId, futures.size(), head);

        VerificationResult result = combine(joinAll(futures));
        report(chainId, result);
        return result;
    }

    // ==================== Segments ====================

    private record Segment(long from, String firstHash, VerificationResult result) {}

    private Segment runSegment(String chainId, long from, VerificationAnchor anchor, long to, CancellationToken token) {
        try (Stream<AuditEntry> entries = chainStore.getRange(chainId, from, to)) {
            FirstHashIterator iterator = new FirstHashIterator(entries.iterator());
            VerificationResult result = ChainVerifier.verify(iterator, anchor, token);
            return new Segment(from, iterator.firstHash, result);
        }
    }

    /**
     * Waits for every segment. A segment that failed rethrows its own exception, so a store
     * outage surfaces the same way as in a sequential run.
     */
    private List<Segment> joinAll(List<CompletableFuture<Segment>> futures) {
        try {
            return futures.stream().map(CompletableFuture::join).toList();
        } catch (CompletionException e) {
            futures.forEach(future -> future.cancel(true));
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    private VerificationResult combine(List<Segment> segments) {
        long coveredTo = -1;
        String tip = null;
        for (Segment segment : segments) {
            VerificationResult result = segment.result();
            if (result instanceof VerificationResult.Broken broken) {
                long verifiedTo = broken.verified().isEmpty() ? coveredTo : broken.verified().to();
                return new VerificationResult.Broken(broken.sequence(), broken.reason(),
                        SequenceRange.of(0, verifiedTo), broken.detail());
            }
            if (tip != null && segment.firstHash() != null && !tip.equals(segment.firstHash())) {
                return new VerificationResult.Broken(segment.from(), BreakReason.LINKAGE_MISMATCH,
                        SequenceRange.of(0, segment.from() - 1), "segments disagree on boundary entry hash");
            }
            if (result instanceof VerificationResult.Partial partial) {
                long verifiedTo = partial.verified().isEmpty() ? coveredTo : partial.verified().to();
                String partialTip = partial.verified().isEmpty() ? tip : partial.tipHash();
                return new VerificationResult.Partial(SequenceRange.of(0, verifiedTo), partialTip);
            }
            VerificationResult.Valid valid = (VerificationResult.Valid) result;
            if (!valid.covered().isEmpty()) {
                coveredTo = valid.covered().to();
                tip = valid.tipHash();
            }
        }
        return new VerificationResult.Valid(coveredTo < 0 ? SequenceRange.empty() : SequenceRange.of(0, coveredTo), tip);
    }

    /**
     * Remembers the entry hash of the first entry handed out.
     */
    private static final class FirstHashIterator implements Iterator<AuditEntry> {

        private final Iterator<AuditEntry> delegate;
        private String firstHash;
        private boolean seen;

        FirstHashIterator(Iterator<AuditEntry> delegate) {
            this.delegate = delegate;
        }

        @Override
        public boolean hasNext() {
            return delegate.hasNext();
        }

        @Override
        public AuditEntry next() {
            AuditEntry entry = delegate.next();
            if (!seen) {
                seen = true;
                firstHash = entry.entryHash();
            }
            return entry;
        }
    }

    // ==================== Helpers ====================

    private VerificationResult walk(String chainId, VerificationAnchor anchor, long head, CancellationToken token) {
        try (Stream<AuditEntry> entries = chainStore.getRange(chainId, anchor.sequence(), head)) {
            return ChainVerifier.verify(entries.iterator(), anchor, token);
        }
    }

    private void requireSameChain(String chainId, Checkpoint checkpoint) {
        if (!chainId.equals(checkpoint.chainId())) {
            throw new IllegalArgumentException("Checkpoint belongs to chain " + checkpoint.chainId()
                    + ", not " + chainId);
        }
    }

    private void report(String chainId, VerificationResult result) {
        if (result instanceof VerificationResult.Broken broken) {
            log.error("Chain {} failed verification at sequence {}: {} ({})",
                    chainId, broken.sequence(), broken.reason(), broken.detail());
        } else if (result instanceof VerificationResult.Partial partial) {
            log.info("Verification of chain {} cancelled after {}", chainId, partial.verified());
        } else {
            log.info("Chain {} verified: {}", chainId, ((VerificationResult.Valid) result).covered());
        }
    }
}
