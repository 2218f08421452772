package com.auditchain.core.domain;

import java.time.Instant;

/**
 * Filter for entry queries. Null fields match everything; set fields are AND-combined.
 * The time window is {@code [from, to)}.
 */
public record AuditQuery(
        String chainId,
        String actorId,
        String resourceType,
        String resourceId,
        Instant from,
        Instant to
) {

    public static AuditQuery all() {
        return new AuditQuery(null, null, null, null, null, null);
    }

    public static AuditQuery forChain(String chainId) {
        return new AuditQuery(chainId, null, null, null, null, null);
    }

    public AuditQuery withChainId(String id) {
        return new AuditQuery(id, actorId, resourceType, resourceId, from, to);
    }

    public AuditQuery between(Instant start, Instant end) {
        return new AuditQuery(chainId, actorId, resourceType, resourceId, start, end);
    }

    public boolean matches(AuditEntry entry) {
        return (chainId == null || chainId.equals(entry.chainId()))
                && (actorId == null || actorId.equals(entry.actorId()))
                && (resourceType == null || resourceType.equals(entry.resourceType()))
                && (resourceId == null || resourceId.equals(entry.resourceId()))
                && (from == null || !entry.timestamp().isBefore(from))
                && (to == null || entry.timestamp().isBefore(to));
    }
}
