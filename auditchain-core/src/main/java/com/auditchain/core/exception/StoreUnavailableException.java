package com.auditchain.core.exception;

/**
 * The underlying storage did not respond. Propagated immediately; retry policy
 * belongs to the caller.
 */
public class StoreUnavailableException extends AuditChainException {

    public static final String CODE = "AUDIT_503";

    public StoreUnavailableException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}
