package com.auditchain.core.repository;

import com.auditchain.core.domain.StoredEntry;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for audit entries.
 * Append-only: callers use {@code save} for new rows and never update or delete.
 */
@Repository
public interface AuditEntryRepository extends JpaRepository<StoredEntry, UUID>, JpaSpecificationExecutor<StoredEntry> {

    /**
     * Chain head: the entry with the highest sequence.
     */
    Optional<StoredEntry> findFirstByChainIdOrderBySequenceDesc(String chainId);

    Optional<StoredEntry> findByChainIdAndSequence(String chainId, long sequence);

    /**
     * One batch of a range scan, keyset-paged on sequence.
     */
    @Query("SELECT e FROM StoredEntry e WHERE e.chainId = :chainId AND e.sequence >= :from AND e.sequence <= :to ORDER BY e.sequence ASC")
    List<StoredEntry> findBatch(
            @Param("chainId") String chainId,
            @Param("from") long from,
            @Param("to") long to,
            Pageable pageable);

    long countByChainId(String chainId);

    boolean existsByChainIdAndSequence(String chainId, long sequence);

    @Query("SELECT DISTINCT e.chainId FROM StoredEntry e ORDER BY e.chainId")
    List<String> findChainIds();
}
