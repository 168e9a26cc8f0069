package com.example.authservice.exception;

import com.example.authservice.security.TokenFailure;
import org.springframework.http.HttpStatus;

/**
 * Token failed signature, kind or expiry checks (HTTP 401).
 * The caller never learns which check failed.
 */
public class InvalidTokenException extends BaseException {

    public static final String MESSAGE = "Invalid or expired token";

    private final TokenFailure failure;

    public InvalidTokenException() {
        this(null);
    }

    public InvalidTokenException(TokenFailure failure) {
        super("INVALID_OR_EXPIRED_TOKEN", MESSAGE, HttpStatus.UNAUTHORIZED);
        this.failure = failure;
    }

    /**
     * Internal reason, for logs only. Null when the token itself was fine
     * but the state behind it was not.
     */
    public TokenFailure getFailure() {
        return failure;
    }
}
