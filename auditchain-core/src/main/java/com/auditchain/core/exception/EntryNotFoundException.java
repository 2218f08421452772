package com.auditchain.core.exception;

public class EntryNotFoundException extends AuditChainException {

    public static final String CODE = "AUDIT_404";

    public EntryNotFoundException(String chainId, long sequence) {
        super(CODE, "Entry not found: " + chainId + "#" + sequence);
    }
}
