package com.auditchain.core.exception;

import com.auditchain.core.verify.BreakReason;

/**
 * A chain failed verification. Never repaired automatically.
 */
public class ChainIntegrityException extends AuditChainException {

    public static final String CODE = "AUDIT_422";

    private final String chainId;
    private final long sequence;
    private final BreakReason reason;

    public ChainIntegrityException(String chainId, long sequence, BreakReason reason, String detail) {
        super(CODE, "Chain " + chainId + " broken at sequence " + sequence + " (" + reason + "): " + detail);
        this.chainId = chainId;
        this.sequence = sequence;
        this.reason = reason;
    }

    public String getChainId() { return chainId; }
    public long getSequence() { return sequence; }
    public BreakReason getReason() { return reason; }
}
