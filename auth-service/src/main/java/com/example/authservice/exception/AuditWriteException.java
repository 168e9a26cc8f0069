package com.example.authservice.exception;

import org.springframework.http.HttpStatus;

/**
 * Audit entry could not be persisted while audit is mandatory.
 */
public class AuditWriteException extends BaseException {

    public AuditWriteException(String action, Throwable cause) {
        super("AUDIT_WRITE_FAILED", "Failed to write audit entry for " + action,
                HttpStatus.INTERNAL_SERVER_ERROR, cause);
    }
}
