package com.example.authservice.dto;

import java.util.UUID;

/**
 * Token pair minted for a new session.
 *
 * @param expiresInSeconds access token lifetime
 */
public record IssuedTokens(
    String accessToken,
    String refreshToken,
    UUID sessionId,
    long expiresInSeconds
) {
}
