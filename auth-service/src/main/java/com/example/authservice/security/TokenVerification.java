package com.example.authservice.security;

import io.jsonwebtoken.Claims;

/**
 * Result of verifying a token: either its claims or the reason it was rejected.
 */
public final class TokenVerification {

    private final Claims claims;
    private final TokenFailure failure;

    private TokenVerification(Claims claims, TokenFailure failure) {
        this.claims = claims;
        this.failure = failure;
    }

    public static TokenVerification valid(Claims claims) {
        return new TokenVerification(claims, null);
    }

    public static TokenVerification rejected(TokenFailure failure) {
        return new TokenVerification(null, failure);
    }

    public boolean isValid() {
        return claims != null;
    }

    public Claims getClaims() {
        if (claims == null) {
            throw new IllegalStateException("Token was rejected: " + failure);
        }
        return claims;
    }

    public TokenFailure getFailure() {
        return failure;
    }

    public String getSubject() {
        return getClaims().getSubject();
    }

    @Override
    public String toString() {
        return isValid() ? "TokenVerification[valid]" : "TokenVerification[" + failure + "]";
    }
}
