package com.auditchain.api.evidence;

import com.auditchain.api.verify.VerificationEngine;
import com.auditchain.core.canonical.PackageHasher;
import com.auditchain.core.domain.AuditEntry;
import com.auditchain.core.domain.AuditPackage;
import com.auditchain.core.domain.AuditQuery;
import com.auditchain.core.exception.ChainNotFoundException;
import com.auditchain.core.store.ChainStore;
import com.auditchain.core.store.CheckpointStore;
import com.auditchain.core.verify.VerificationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Builds sealed evidence packages for auditors.
 */
@Service
public class AuditPackageService {

    private static final Logger log = LoggerFactory.getLogger(AuditPackageService.class);
    private final ChainStore chainStore;
    private final CheckpointStore checkpointStore;
    private final VerificationEngine verificationEngine;
    private final Clock clock;
    private final int maxEntries;

    public AuditPackageService(ChainStore chainStore, CheckpointStore checkpointStore,
                               VerificationEngine verificationEngine, Clock clock,
                               @Value("${auditchain.export.max-entries:100000}") int maxEntries) {
        this.chainStore = chainStore;
        this.checkpointStore = checkpointStore;
        this.verificationEngine = verificationEngine;
        this.clock = clock;
        this.maxEntries = maxEntries;
    }

    /**
     * Entries stamped in {@code [from, to)} (either bound may be null), every checkpoint of
     * the chain and a full verification, sealed with the package hash.
     * <p>
     * Entries are exported as the contiguous sequence span from the first to the last entry
     * stamped in the window. Caller-supplied timestamps need not follow sequence order, so
     * the span can include entries stamped outside the window; it never has gaps, which
     * keeps the package verifiable on its own.
     */
    public AuditPackage exportPackage(String chainId, Instant from, Instant to) {
        if (chainStore.getHead(chainId).isEmpty()) {
            throw new ChainNotFoundException(chainId);
        }
        if (from != null && to != null && !from.isBefore(to)) {
            throw new IllegalArgumentException("Time window start must be before its end");
        }
        List<AuditEntry> entries = spanOf(chainId, AuditQuery.forChain(chainId).between(from, to));

        VerificationResult verification = verificationEngine.verify(chainId, Optional.empty());
        AuditPackage sealed = PackageHasher.seal(new AuditPackage(
                chainId, from, to, clock.instant(), entries, checkpointStore.list(chainId), verification, null));
        log.info("Audit package exported chain={} entries={} verification={}",
                chainId, entries.size(), verification.getClass().getSimpleName());
        return sealed;
    }

    private List<AuditEntry> spanOf(String chainId, AuditQuery window) {
        Page<AuditEntry> first = chainStore.query(window, PageRequest.of(0, 1));
        if (!first.hasContent()) {
            return List.of();
        }
        long low = first.getContent().get(0).sequence();
        long high = low;
        if (first.getTotalElements() > 1) {
            int lastPage = (int) Math.min(first.getTotalElements() - 1, Integer.MAX_VALUE);
            Page<AuditEntry> last = chainStore.query(window, PageRequest.of(lastPage, 1));
            if (last.hasContent()) {
                high = Math.max(low, last.getContent().get(0).sequence());
            }
        }
        long span = high - low + 1;
        if (span > maxEntries) {
            throw new IllegalArgumentException("Time window spans " + span
                    + " entries, more than " + maxEntries + "; narrow it");
        }
        try (Stream<AuditEntry> range = chainStore.getRange(chainId, low, high)) {
            return range.toList();
        }
    }
}
