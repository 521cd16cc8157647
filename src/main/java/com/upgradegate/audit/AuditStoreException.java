package com.upgradegate.audit;

/**
 * The audit store could not persist or read. State transitions that cannot
 * be persisted are aborted.
 */
public class AuditStoreException extends RuntimeException {

    public AuditStoreException(String message) {
        super(message);
    }

    public AuditStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
