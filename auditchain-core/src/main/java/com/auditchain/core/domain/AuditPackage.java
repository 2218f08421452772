package com.auditchain.core.domain;

import com.auditchain.core.verify.VerificationResult;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.util.List;

/**
 * Evidence handed to an auditor: the entries of a time window, the chain's checkpoints
 * and a verification of the chain, sealed with {@code packageHash}.
 *
 * @param packageHash SHA-256 of the package without this field, serialized with sorted keys
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AuditPackage(
        String chainId,
        Instant from,
        Instant to,
        Instant generatedAt,
        List<AuditEntry> entries,
        List<Checkpoint> checkpoints,
        VerificationResult verification,
        String packageHash
) {

    public AuditPackage {
        entries = entries == null ? List.of() : List.copyOf(entries);
        checkpoints = checkpoints == null ? List.of() : List.copyOf(checkpoints);
    }

    public AuditPackage withPackageHash(String hash) {
        return new AuditPackage(chainId, from, to, generatedAt, entries, checkpoints, verification, hash);
    }
}
