package com.auditchain.core.exception;

public class CheckpointNotFoundException extends AuditChainException {

    public static final String CODE = "AUDIT_404";

    public CheckpointNotFoundException(String chainId, long sequence) {
        this("Checkpoint not found: " + chainId + "@" + sequence);
    }

    private CheckpointNotFoundException(String message) {
        super(CODE, message);
    }

    /**
     * No checkpoint with a segment Merkle root is at or after the entry yet.
     */
    public static CheckpointNotFoundException covering(String chainId, long sequence) {
        return new CheckpointNotFoundException("No checkpoint with a Merkle root covers " + chainId + "@" + sequence);
    }
}
