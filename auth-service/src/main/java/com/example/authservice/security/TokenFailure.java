package com.example.authservice.security;

/**
 * Why a token was rejected.
 */
public enum TokenFailure {
    INVALID_SIGNATURE,
    EXPIRED,
    KIND_MISMATCH,
    MALFORMED    // not a JWT at all: null, blank, garbage
}
