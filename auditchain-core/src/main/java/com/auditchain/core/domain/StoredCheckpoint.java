package com.auditchain.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.util.UUID;

/**
 * Persistent checkpoint. Only the export bookkeeping columns change after insert.
 */
@Entity
@Table(name = "audit_checkpoints",
    uniqueConstraints = @UniqueConstraint(name = "uk_audit_checkpoints_chain_seq", columnNames = {"chain_id", "sequence"}),
    indexes = @Index(name = "idx_audit_checkpoints_unexported", columnList = "exported_at"))
public class StoredCheckpoint {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @Column(name = "chain_id", nullable = false, length = 128)
    private String chainId;

    @Column(nullable = false)
    private long sequence;

    @NotNull
    @Column(name = "root_hash", nullable = false, length = 64)
    private String rootHash;

    @Column(name = "merkle_root", length = 64)
    private String merkleRoot;

    @NotNull
    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "exported_at")
    private Instant exportedAt;

    @Column(name = "export_destination", length = 512)
    private String exportDestination;

    @Column(name = "export_attempts", nullable = false)
    private int exportAttempts;

    @Column(name = "last_export_error", length = 1024)
    private String lastExportError;

    protected StoredCheckpoint() {}

    public static StoredCheckpoint from(Checkpoint checkpoint) {
        var row = new StoredCheckpoint();
        row.chainId = checkpoint.chainId();
        row.sequence = checkpoint.sequence();
        row.rootHash = checkpoint.rootHash();
        row.merkleRoot = checkpoint.merkleRoot();
        row.createdAt = checkpoint.createdAt();
        row.applyExportState(checkpoint);
        return row;
    }

    /**
     * Copies the export bookkeeping of {@code checkpoint}; anchor fields stay untouched.
     */
    public void applyExportState(Checkpoint checkpoint) {
        this.exportedAt = checkpoint.exportedAt();
        this.exportDestination = checkpoint.exportDestination();
        this.exportAttempts = checkpoint.exportAttempts();
        this.lastExportError = truncate(checkpoint.lastExportError(), 1024);
    }

    public Checkpoint toCheckpoint() {
        return new Checkpoint(chainId, sequence, rootHash, merkleRoot, createdAt, exportedAt,
                exportDestination, exportAttempts, lastExportError);
    }

    private static String truncate(String s, int max) {
        return s == null || s.length() <= max ? s : s.substring(0, max);
    }

    // Getters
    public UUID getId() { return id; }
    public String getChainId() { return chainId; }
    public long getSequence() { return sequence; }
    public String getRootHash() { return rootHash; }
    public String getMerkleRoot() { return merkleRoot; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getExportedAt() { return exportedAt; }
    public String getExportDestination() { return exportDestination; }
    public int getExportAttempts() { return exportAttempts; }
    public String getLastExportError() { return lastExportError; }
}
