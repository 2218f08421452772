package com.auditchain.core.store;

import com.auditchain.core.canonical.CanonicalEncoder;
import com.auditchain.core.domain.AuditEntry;
import com.auditchain.core.domain.AuditQuery;
import com.auditchain.core.domain.StoredEntry;
import com.auditchain.core.exception.DuplicateSequenceException;
import com.auditchain.core.repository.AuditEntryRepository;
import jakarta.persistence.criteria.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Chain store on Spring Data JPA.
 * <p>
 * Each append commits in its own transaction before returning. Range reads page through
 * the chain in short read-only transactions keyed on sequence, so a long verification
 * never holds a transaction open against concurrent appends.
 */
public class JpaChainStore implements ChainStore {

    private static final Logger log = LoggerFactory.getLogger(JpaChainStore.class);
    private static final Sort CHAIN_ORDER = Sort.by(Sort.Order.asc("chainId"), Sort.Order.asc("sequence"));

    private final AuditEntryRepository repository;
    private final TransactionTemplate writeTx;
    private final TransactionTemplate readTx;
    private final int batchSize;

    public JpaChainStore(AuditEntryRepository repository, PlatformTransactionManager transactionManager, int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("Batch size must be positive: " + batchSize);
        }
        this.repository = repository;
        this.writeTx = new TransactionTemplate(transactionManager);
        this.readTx = new TransactionTemplate(transactionManager);
        this.readTx.setReadOnly(true);
        this.batchSize = batchSize;
    }

    @Override
    public AuditEntry append(AuditEntry entry) {
        Objects.requireNonNull(entry.entryHash(), "Entry must be sealed before it is stored");
        try {
            return StoreFailures.translate("append", () -> writeTx.execute(status -> {
                repository.saveAndFlush(StoredEntry.from(entry));
                return entry;
            }));
        } catch (DataIntegrityViolationException e) {
            if (positionTaken(entry)) {
                throw new DuplicateSequenceException(entry.chainId(), entry.sequence(), e);
            }
            throw e;
        }
    }

    private boolean positionTaken(AuditEntry entry) {
        Boolean exists = StoreFailures.translate("append", () -> readTx.execute(status ->
                repository.existsByChainIdAndSequence(entry.chainId(), entry.sequence())));
        return Boolean.TRUE.equals(exists);
    }

    @Override
    public Optional<AuditEntry> getHead(String chainId) {
        return StoreFailures.translate("getHead", () -> readTx.execute(status ->
                repository.findFirstByChainIdOrderBySequenceDesc(chainId).map(StoredEntry::toEntry)));
    }

    @Override
    public Stream<AuditEntry> getRange(String chainId, long from, long to) {
        Iterator<AuditEntry> batches = new BatchIterator(chainId, from, to);
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(batches, Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    @Override
    public Page<AuditEntry> query(AuditQuery filter, Pageable page) {
        Pageable ordered = page.isUnpaged()
                ? Pageable.unpaged(CHAIN_ORDER)
                : PageRequest.of(page.getPageNumber(), page.getPageSize(), CHAIN_ORDER);
        return StoreFailures.translate("query", () -> readTx.execute(status ->
                repository.findAll(specification(filter), ordered).map(StoredEntry::toEntry)));
    }

    @Override
    public Optional<AuditEntry> getEntry(String chainId, long sequence) {
        return StoreFailures.translate("getEntry", () -> readTx.execute(status ->
                repository.findByChainIdAndSequence(chainId, sequence).map(StoredEntry::toEntry)));
    }

    @Override
    public long count(String chainId) {
        Long count = StoreFailures.translate("count", () -> readTx.execute(status ->
                repository.countByChainId(chainId)));
        return count == null ? 0 : count;
    }

    @Override
    public List<String> chainIds() {
        return StoreFailures.translate("chainIds", () -> readTx.execute(status -> repository.findChainIds()));
    }

    static Specification<StoredEntry> specification(AuditQuery filter) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            if (filter.chainId() != null) {
                predicates.add(cb.equal(root.get("chainId"), filter.chainId()));
            }
            if (filter.actorId() != null) {
                predicates.add(cb.equal(root.get("actorId"), filter.actorId()));
            }
            if (filter.resourceType() != null) {
                predicates.add(cb.equal(root.get("resourceType"), filter.resourceType()));
            }
            if (filter.resourceId() != null) {
                predicates.add(cb.equal(root.get("resourceId"), filter.resourceId()));
            }
            if (filter.from() != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.get("timestampMicros"),
                        CanonicalEncoder.toEpochMicros(filter.from())));
            }
            if (filter.to() != null) {
                predicates.add(cb.lessThan(root.get("timestampMicros"),
                        CanonicalEncoder.toEpochMicros(filter.to())));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }

    /**
     * Walks a sequence range one batch at a time, each batch starting after the last
     * sequence seen. Gaps in the chain are passed through, not filled.
     */
    private final class BatchIterator implements Iterator<AuditEntry> {

        private final String chainId;
        private final long to;
        private long nextFrom;
        private Iterator<AuditEntry> current = Collections.emptyIterator();
        private boolean exhausted;

        BatchIterator(String chainId, long from, long to) {
            this.chainId = chainId;
            this.nextFrom = from;
            this.to = to;
            this.exhausted = to < from;
        }

        @Override
        public boolean hasNext() {
            if (current.hasNext()) {
                return true;
            }
            if (exhausted) {
                return false;
            }
            List<AuditEntry> batch = fetch();
            if (batch.isEmpty()) {
                exhausted = true;
                return false;
            }
            long last = batch.get(batch.size() - 1).sequence();
            if (batch.size() < batchSize || last >= to) {
                exhausted = true;
            } else {
                nextFrom = last + 1;
            }
            current = batch.iterator();
            return true;
        }

        @Override
        public AuditEntry next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return current.next();
        }

        private List<AuditEntry> fetch() {
            List<AuditEntry> batch = StoreFailures.translate("getRange", () -> readTx.execute(status ->
                    repository.findBatch(chainId, nextFrom, to, PageRequest.of(0, batchSize)).stream()
                            .map(StoredEntry::toEntry)
                            .toList()));
            log.debug("Fetched {} entries of chain {} from sequence {}", batch.size(), chainId, nextFrom);
            return batch;
        }
    }
}
