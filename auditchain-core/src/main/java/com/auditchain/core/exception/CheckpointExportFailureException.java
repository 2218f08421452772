package com.auditchain.core.exception;

import java.util.List;

/**
 * One or more checkpoints stayed unexported past the configured threshold.
 * Appends are not affected; the local checkpoints are kept and retried.
 */
public class CheckpointExportFailureException extends AuditChainException {

    public static final String CODE = "AUDIT_502";

    private final List<String> checkpoints;

    public CheckpointExportFailureException(List<String> checkpoints) {
        super(CODE, "Checkpoints not exported past threshold: " + checkpoints);
        this.checkpoints = List.copyOf(checkpoints);
    }

    public List<String> getCheckpoints() {
        return checkpoints;
    }
}
