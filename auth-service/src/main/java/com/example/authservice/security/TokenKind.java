package com.example.authservice.security;

/**
 * Purpose of a signed token. Carried in the {@code type} claim so a token minted for one
 * purpose is rejected everywhere else.
 */
public enum TokenKind {
    ACCESS("access"),
    REFRESH("refresh"),
    PASSWORD_RESET("password_reset"),
    EMAIL_VERIFICATION("email_verification");

    private final String claimValue;

    TokenKind(String claimValue) {
        this.claimValue = claimValue;
    }

    public String getClaimValue() {
        return claimValue;
    }
}
