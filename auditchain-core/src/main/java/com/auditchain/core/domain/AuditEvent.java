package com.auditchain.core.domain;

import com.auditchain.core.canonical.PayloadCodec;

import java.time.Instant;
import java.util.Map;

/**
 * Logical content of an auditable action as submitted by a calling service.
 * Sequencing, linkage and hashing are added by the append engine.
 *
 * @param actorId      who performed the action
 * @param action       what was done, in the caller's vocabulary
 * @param resourceType kind of resource acted upon
 * @param resourceId   resource identifier, may be null
 * @param payload      JSON-shaped details of the event
 * @param timestamp    when it happened; null lets the engine stamp it
 */
public record AuditEvent(
        String actorId,
        String action,
        String resourceType,
        String resourceId,
        Map<String, Object> payload,
        Instant timestamp
) {

    public AuditEvent {
        payload = PayloadCodec.immutableCopy(payload);
    }

    public static AuditEvent of(String actorId, String action, String resourceType,
                                String resourceId, Map<String, Object> payload) {
        return new AuditEvent(actorId, action, resourceType, resourceId, payload, null);
    }

    public AuditEvent at(Instant when) {
        return new AuditEvent(actorId, action, resourceType, resourceId, payload, when);
    }
}
