package com.auditchain.core.exception;

/**
 * Another writer kept winning the race for the next sequence of a chain and the
 * bounded retry budget ran out.
 */
public class ConcurrentAppendConflictException extends AuditChainException {

    public static final String CODE = "AUDIT_409";

    private final String chainId;
    private final int attempts;

    public ConcurrentAppendConflictException(String chainId, int attempts, Throwable cause) {
        super(CODE, "Append to chain " + chainId + " lost the sequencing race after "
                + attempts + " attempts", cause);
        this.chainId = chainId;
        this.attempts = attempts;
    }

    public String getChainId() { return chainId; }
    public int getAttempts() { return attempts; }
}
