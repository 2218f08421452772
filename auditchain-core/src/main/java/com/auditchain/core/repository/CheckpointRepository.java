package com.auditchain.core.repository;

import com.auditchain.core.domain.StoredCheckpoint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface CheckpointRepository extends JpaRepository<StoredCheckpoint, UUID> {

    Optional<StoredCheckpoint> findFirstByChainIdOrderBySequenceDesc(String chainId);

    Optional<StoredCheckpoint> findByChainIdAndSequence(String chainId, long sequence);

    List<StoredCheckpoint> findByChainIdOrderBySequenceAsc(String chainId);

    /**
     * Checkpoints still waiting for an external copy, oldest first.
     */
    List<StoredCheckpoint> findByExportedAtIsNullOrderByCreatedAtAsc();
}
