package com.auditchain.core.domain;

import com.auditchain.core.canonical.EntryHasher;
import com.auditchain.core.canonical.PayloadCodec;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import java.util.Objects;

/**
 * One committed position in a tenant's audit chain.
 * <p>
 * {@code entryHash = SHA-256(previousHash || canonical(entry))}. Timestamps carry
 * microsecond precision so that they survive storage unchanged.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AuditEntry(
        String chainId,
        long sequence,
        Instant timestamp,
        String actorId,
        String action,
        String resourceType,
        String resourceId,
        Map<String, Object> payload,
        String previousHash,
        String entryHash
) {

    public AuditEntry {
        Objects.requireNonNull(chainId, "Chain ID cannot be null");
        Objects.requireNonNull(timestamp, "Timestamp cannot be null");
        if (sequence < 0) {
            throw new IllegalArgumentException("Sequence cannot be negative: " + sequence);
        }
        timestamp = timestamp.truncatedTo(ChronoUnit.MICROS);
        payload = PayloadCodec.immutableCopy(payload);
    }

    /**
     * Builds the unhashed entry that follows a chain position.
     */
    public static AuditEntry next(String chainId, long sequence, String previousHash,
                                  AuditEvent event, Instant timestamp) {
        return new AuditEntry(
                chainId,
                sequence,
                timestamp,
                event.actorId(),
                event.action(),
                event.resourceType(),
                event.resourceId(),
                event.payload(),
                previousHash,
                null
        );
    }

    public AuditEntry withEntryHash(String hash) {
        return new AuditEntry(chainId, sequence, timestamp, actorId, action, resourceType,
                resourceId, payload, previousHash, hash);
    }

    public AuditEntry withPayload(Map<String, Object> newPayload) {
        return new AuditEntry(chainId, sequence, timestamp, actorId, action, resourceType,
                resourceId, newPayload, previousHash, entryHash);
    }

    public AuditEntry withPreviousHash(String hash) {
        return new AuditEntry(chainId, sequence, timestamp, actorId, action, resourceType,
                resourceId, payload, hash, entryHash);
    }

    @JsonIgnore
    public boolean isGenesis() {
        return sequence == 0 && EntryHasher.GENESIS_SENTINEL.equals(previousHash);
    }
}
