package com.auditchain.core.exception;

public class ChainNotFoundException extends AuditChainException {

    public static final String CODE = "AUDIT_404";

    public ChainNotFoundException(String chainId) {
        super(CODE, "Chain not found or empty: " + chainId);
    }
}
