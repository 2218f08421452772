package com.auditchain.core.exception;

/**
 * Raised by a chain store when a write would reuse an existing (chain, sequence) position.
 */
public class DuplicateSequenceException extends AuditChainException {

    public static final String CODE = "AUDIT_410";

    private final String chainId;
    private final long sequence;

    public DuplicateSequenceException(String chainId, long sequence) {
        this(chainId, sequence, null);
    }

    public DuplicateSequenceException(String chainId, long sequence, Throwable cause) {
        super(CODE, "Chain " + chainId + " already holds sequence " + sequence, cause);
        this.chainId = chainId;
        this.sequence = sequence;
    }

    public String getChainId() { return chainId; }
    public long getSequence() { return sequence; }
}
