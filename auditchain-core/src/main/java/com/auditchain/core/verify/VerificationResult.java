package com.auditchain.core.verify;

import com.auditchain.core.domain.SequenceRange;
import com.auditchain.core.exception.ChainIntegrityException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Outcome of walking a chain.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "status")
@JsonSubTypes({
        @JsonSubTypes.Type(value = VerificationResult.Valid.class, name = "VALID"),
        @JsonSubTypes.Type(value = VerificationResult.Broken.class, name = "BROKEN"),
        @JsonSubTypes.Type(value = VerificationResult.Partial.class, name = "PARTIAL")
})
@JsonIgnoreProperties(ignoreUnknown = true)
public sealed interface VerificationResult
        permits VerificationResult.Valid, VerificationResult.Broken, VerificationResult.Partial {

    /**
     * Every entry in {@code covered} recomputed and linked correctly.
     * {@code tipHash} is the entry hash of the last covered entry, null for an empty chain.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record Valid(SequenceRange covered, String tipHash) implements VerificationResult {}

    /**
     * The first failing entry. {@code verified} holds the entries checked before it.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record Broken(long sequence, BreakReason reason, SequenceRange verified, String detail)
            implements VerificationResult {}

    /**
     * Verification was cancelled; {@code verified} can be resumed from.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record Partial(SequenceRange verified, String tipHash) implements VerificationResult {}

    default boolean isValid() {
        return this instanceof Valid;
    }

    /**
     * Returns this result unless it reports a break, which is raised instead.
     */
    default VerificationResult requireValid(String chainId) {
        if (this instanceof Broken broken) {
            throw new ChainIntegrityException(chainId, broken.sequence(), broken.reason(), broken.detail());
        }
        return this;
    }
}
