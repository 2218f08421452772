package com.auditchain.core.store;

import com.auditchain.core.domain.AuditEntry;
import com.auditchain.core.domain.AuditQuery;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Durable, append-only storage of chain entries.
 * <p>
 * Implementations enforce uniqueness of {@code (chainId, sequence)} and nothing else:
 * linkage is the append engine's job. Storage failures surface as
 * {@link com.auditchain.core.exception.StoreUnavailableException}.
 */
public interface ChainStore {

    /**
     * Persists a sealed entry; durable when this returns.
     *
     * @throws com.auditchain.core.exception.DuplicateSequenceException if the position is taken
     */
    AuditEntry append(AuditEntry entry);

    /**
     * Latest committed entry of a chain, empty if the chain has no entries.
     */
    Optional<AuditEntry> getHead(String chainId);

    /**
     * Entries with {@code from <= sequence <= to} in ascending order, fetched lazily.
     * Callers close the stream.
     */
    Stream<AuditEntry> getRange(String chainId, long from, long to);

    /**
     * Matching entries ordered by chain id then sequence, ascending.
     */
    Page<AuditEntry> query(AuditQuery filter, Pageable page);

    Optional<AuditEntry> getEntry(String chainId, long sequence);

    long count(String chainId);

    List<String> chainIds();
}
