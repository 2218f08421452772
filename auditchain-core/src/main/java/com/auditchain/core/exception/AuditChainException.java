package com.auditchain.core.exception;

/**
 * Base type of every error raised by the audit chain core. Each subtype carries a
 * stable error code that the API reports alongside the message.
 */
public abstract class AuditChainException extends RuntimeException {

    private final String code;

    protected AuditChainException(String code, String message) {
        super(message);
        this.code = code;
    }

    protected AuditChainException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
