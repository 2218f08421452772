package com.auditchain.core.exception;

/**
 * Logical fields could not be canonically encoded. The caller's input is invalid
 * and the operation is not retried.
 */
public class SerializationException extends AuditChainException {

    public static final String CODE = "AUDIT_400";

    public SerializationException(String message) {
        super(CODE, message);
    }

    public SerializationException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}
