package com.auditchain.core.store;

import com.auditchain.core.domain.Checkpoint;
import com.auditchain.core.domain.StoredCheckpoint;
import com.auditchain.core.exception.CheckpointNotFoundException;
import com.auditchain.core.repository.CheckpointRepository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Checkpoint store on Spring Data JPA.
 */
public class JpaCheckpointStore implements CheckpointStore {

    private final CheckpointRepository repository;
    private final TransactionTemplate tx;

    public JpaCheckpointStore(CheckpointRepository repository, PlatformTransactionManager transactionManager) {
        this.repository = repository;
        this.tx = new TransactionTemplate(transactionManager);
    }

    @Override
    public Checkpoint save(Checkpoint checkpoint) {
        return StoreFailures.translate("saveCheckpoint", () -> tx.execute(status -> {
            repository.findFirstByChainIdOrderBySequenceDesc(checkpoint.chainId())
                    .filter(latest -> latest.getSequence() >= checkpoint.sequence())
                    .ifPresent(latest -> {
                        throw new IllegalStateException("Checkpoint sequence " + checkpoint.sequence()
                                + " does not advance past " + latest.getSequence()
                                + " for chain " + checkpoint.chainId());
                    });
            return repository.saveAndFlush(StoredCheckpoint.from(checkpoint)).toCheckpoint();
        }));
    }

    @Override
    public Optional<Checkpoint> latest(String chainId) {
        return StoreFailures.translate("latestCheckpoint", () -> tx.execute(status ->
                repository.findFirstByChainIdOrderBySequenceDesc(chainId).map(StoredCheckpoint::toCheckpoint)));
    }

    @Override
    public Optional<Checkpoint> find(String chainId, long sequence) {
        return StoreFailures.translate("findCheckpoint", () -> tx.execute(status ->
                repository.findByChainIdAndSequence(chainId, sequence).map(StoredCheckpoint::toCheckpoint)));
    }

    @Override
    public List<Checkpoint> list(String chainId) {
        return StoreFailures.translate("listCheckpoints", () -> tx.execute(status ->
                repository.findByChainIdOrderBySequenceAsc(chainId).stream()
                        .map(StoredCheckpoint::toCheckpoint)
                        .toList()));
    }

    @Override
    public List<Checkpoint> unexported() {
        return StoreFailures.translate("unexportedCheckpoints", () -> tx.execute(status ->
                repository.findByExportedAtIsNullOrderByCreatedAtAsc().stream()
                        .map(StoredCheckpoint::toCheckpoint)
                        .toList()));
    }

    @Override
    public Checkpoint markExported(Checkpoint checkpoint, Instant exportedAt, String destination) {
        return update(checkpoint, stored -> stored.exported(exportedAt, destination));
    }

    @Override
    public Checkpoint recordExportFailure(Checkpoint checkpoint, String error) {
        return update(checkpoint, stored -> stored.exportFailed(error));
    }

    private Checkpoint update(Checkpoint checkpoint, UnaryOperator<Checkpoint> change) {
        return StoreFailures.translate("updateCheckpoint", () -> tx.execute(status -> {
            StoredCheckpoint row = repository.findByChainIdAndSequence(checkpoint.chainId(), checkpoint.sequence())
                    .orElseThrow(() -> new CheckpointNotFoundException(checkpoint.chainId(), checkpoint.sequence()));
            Checkpoint updated = change.apply(row.toCheckpoint());
            row.applyExportState(updated);
            return repository.saveAndFlush(row).toCheckpoint();
        }));
    }
}
