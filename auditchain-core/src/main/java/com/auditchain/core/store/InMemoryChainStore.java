package com.auditchain.core.store;

import com.auditchain.core.domain.AuditEntry;
import com.auditchain.core.domain.AuditQuery;
import com.auditchain.core.exception.DuplicateSequenceException;
import com.auditchain.core.exception.StoreUnavailableException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.stream.Stream;

/**
 * Chain store held in process memory, for tests and local runs.
 * <p>
 * Also exposes {@link #overwrite} and {@link #delete}, which stand in for a party with
 * direct write access to the underlying storage.
 */
public class InMemoryChainStore implements ChainStore {

    private static final Comparator<AuditEntry> CHAIN_ORDER =
            Comparator.comparing(AuditEntry::chainId).thenComparingLong(AuditEntry::sequence);

    private final Map<String, NavigableMap<Long, AuditEntry>> chains = new ConcurrentHashMap<>();
    private volatile boolean unavailable;

    @Override
    public AuditEntry append(AuditEntry entry) {
        checkAvailable();
        Objects.requireNonNull(entry.entryHash(), "Entry must be sealed before it is stored");
        NavigableMap<Long, AuditEntry> chain =
                chains.computeIfAbsent(entry.chainId(), id -> new ConcurrentSkipListMap<>());
        if (chain.putIfAbsent(entry.sequence(), entry) != null) {
            throw new DuplicateSequenceException(entry.chainId(), entry.sequence());
        }
        return entry;
    }

    @Override
    public Optional<AuditEntry> getHead(String chainId) {
        checkAvailable();
        NavigableMap<Long, AuditEntry> chain = chains.get(chainId);
        if (chain == null || chain.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(chain.lastEntry().getValue());
    }

    @Override
    public Stream<AuditEntry> getRange(String chainId, long from, long to) {
        checkAvailable();
        NavigableMap<Long, AuditEntry> chain = chains.get(chainId);
        if (chain == null || to < from) {
            return Stream.empty();
        }
        return new ArrayList<>(chain.subMap(from, true, to, true).values()).stream();
    }

    @Override
    public Page<AuditEntry> query(AuditQuery filter, Pageable page) {
        checkAvailable();
        List<AuditEntry> matches = chains.values().stream()
                .flatMap(chain -> chain.values().stream())
                .filter(filter::matches)
                .sorted(CHAIN_ORDER)
                .toList();
        if (page.isUnpaged()) {
            return new PageImpl<>(matches, page, matches.size());
        }
        int start = (int) Math.min(page.getOffset(), matches.size());
        int end = Math.min(start + page.getPageSize(), matches.size());
        return new PageImpl<>(matches.subList(start, end), page, matches.size());
    }

    @Override
    public Optional<AuditEntry> getEntry(String chainId, long sequence) {
        checkAvailable();
        NavigableMap<Long, AuditEntry> chain = chains.get(chainId);
        return chain == null ? Optional.empty() : Optional.ofNullable(chain.get(sequence));
    }

    @Override
    public long count(String chainId) {
        checkAvailable();
        NavigableMap<Long, AuditEntry> chain = chains.get(chainId);
        return chain == null ? 0 : chain.size();
    }

    @Override
    public List<String> chainIds() {
        checkAvailable();
        return chains.entrySet().stream()
                .filter(e -> !e.getValue().isEmpty())
                .map(Map.Entry::getKey)
                .sorted()
                .toList();
    }

    // ==================== Direct storage access ====================

    /**
     * Replaces the stored row at the entry's position, bypassing every check.
     */
    public void overwrite(AuditEntry entry) {
        chains.computeIfAbsent(entry.chainId(), id -> new ConcurrentSkipListMap<>())
                .put(entry.sequence(), entry);
    }

    /**
     * Removes a stored row, bypassing every check.
     */
    public void delete(String chainId, long sequence) {
        NavigableMap<Long, AuditEntry> chain = chains.get(chainId);
        if (chain != null) {
            chain.remove(sequence);
        }
    }

    /**
     * Makes every operation fail as if the backing storage stopped responding.
     */
    public void setUnavailable(boolean unavailable) {
        this.unavailable = unavailable;
    }

    private void checkAvailable() {
        if (unavailable) {
            throw new StoreUnavailableException("In-memory store marked unavailable", null);
        }
    }
}
