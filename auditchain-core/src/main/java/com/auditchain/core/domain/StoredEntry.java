package com.auditchain.core.domain;

import com.auditchain.core.canonical.CanonicalEncoder;
import com.auditchain.core.canonical.PayloadCodec;
import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;

import java.util.UUID;

/**
 * Persistent row of an audit entry. Written once, never updated.
 */
@Entity
@Table(name = "audit_entries",
    uniqueConstraints = @UniqueConstraint(name = "uk_audit_entries_chain_seq", columnNames = {"chain_id", "sequence"}),
    indexes = {
        @Index(name = "idx_audit_entries_actor", columnList = "actor_id"),
        @Index(name = "idx_audit_entries_resource", columnList = "resource_type, resource_id"),
        @Index(name = "idx_audit_entries_timestamp", columnList = "timestamp_micros")
    })
public class StoredEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @Column(name = "chain_id", nullable = false, length = 128)
    private String chainId;

    @Column(nullable = false)
    private long sequence;

    @Column(name = "timestamp_micros", nullable = false)
    private long timestampMicros;

    @NotNull
    @Column(name = "actor_id", nullable = false, length = 256)
    private String actorId;

    @NotNull
    @Column(nullable = false, length = 256)
    private String action;

    @NotNull
    @Column(name = "resource_type", nullable = false, length = 256)
    private String resourceType;

    @Column(name = "resource_id", length = 256)
    private String resourceId;

    @NotNull
    @Column(name = "payload_json", nullable = false, length = 1_048_576)
    private String payloadJson;

    @NotNull
    @Column(name = "previous_hash", nullable = false, length = 64)
    private String previousHash;

    @NotNull
    @Column(name = "entry_hash", nullable = false, length = 64)
    private String entryHash;

    protected StoredEntry() {}

    public static StoredEntry from(AuditEntry entry) {
        var row = new StoredEntry();
        row.chainId = entry.chainId();
        row.sequence = entry.sequence();
        row.timestampMicros = CanonicalEncoder.toEpochMicros(entry.timestamp());
        row.actorId = entry.actorId();
        row.action = entry.action();
        row.resourceType = entry.resourceType();
        row.resourceId = entry.resourceId();
        row.payloadJson = PayloadCodec.write(entry.payload());
        row.previousHash = entry.previousHash();
        row.entryHash = entry.entryHash();
        return row;
    }

    public AuditEntry toEntry() {
        return new AuditEntry(
                chainId,
                sequence,
                CanonicalEncoder.fromEpochMicros(timestampMicros),
                actorId,
                action,
                resourceType,
                resourceId,
                PayloadCodec.read(payloadJson),
                previousHash,
                entryHash
        );
    }

    // Getters
    public UUID getId() { return id; }
    public String getChainId() { return chainId; }
    public long getSequence() { return sequence; }
    public long getTimestampMicros() { return timestampMicros; }
    public String getActorId() { return actorId; }
    public String getAction() { return action; }
    public String getResourceType() { return resourceType; }
    public String getResourceId() { return resourceId; }
    public String getPayloadJson() { return payloadJson; }
    public String getPreviousHash() { return previousHash; }
    public String getEntryHash() { return entryHash; }
}
