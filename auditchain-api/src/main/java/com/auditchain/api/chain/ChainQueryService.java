package com.auditchain.api.chain;

import com.auditchain.core.domain.AuditEntry;
import com.auditchain.core.domain.AuditQuery;
import com.auditchain.core.domain.ChainStatus;
import com.auditchain.core.exception.ChainNotFoundException;
import com.auditchain.core.exception.EntryNotFoundException;
import com.auditchain.core.store.ChainStore;
import com.auditchain.core.store.CheckpointStore;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Read access to committed entries and per-chain status.
 */
@Service
public class ChainQueryService {

    private final ChainStore chainStore;
    private final CheckpointStore checkpointStore;

    public ChainQueryService(ChainStore chainStore, CheckpointStore checkpointStore) {
        this.chainStore = chainStore;
        this.checkpointStore = checkpointStore;
    }

    /**
     * Entries matching every set filter field, ascending by chain then sequence.
     */
    public Page<AuditEntry> query(AuditQuery filter, Pageable pageable) {
        if (filter.from() != null && filter.to() != null && !filter.from().isBefore(filter.to())) {
            throw new IllegalArgumentException("Time window start must be before its end");
        }
        return chainStore.query(filter, pageable);
    }

    public AuditEntry getEntry(String chainId, long sequence) {
        return chainStore.getEntry(chainId, sequence)
                .orElseThrow(() -> new EntryNotFoundException(chainId, sequence));
    }

    /**
     * Entry count, head and latest checkpoint of a chain.
     */
    public ChainStatus status(String chainId) {
        Optional<AuditEntry> head = chainStore.getHead(chainId);
        if (head.isEmpty()) {
            throw new ChainNotFoundException(chainId);
        }
        return new ChainStatus(
                chainId,
                chainStore.count(chainId),
                head.get().sequence(),
                head.get().entryHash(),
                checkpointStore.latest(chainId).orElse(null)
        );
    }
}
