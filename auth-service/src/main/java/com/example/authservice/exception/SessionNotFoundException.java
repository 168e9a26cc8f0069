package com.example.authservice.exception;

/**
 * Refresh token verified, but no active unexpired session holds it (revoked, swept, expired).
 * Same code and message as {@link InvalidTokenException}.
 */
public class SessionNotFoundException extends InvalidTokenException {

    public SessionNotFoundException() {
        super();
    }
}
