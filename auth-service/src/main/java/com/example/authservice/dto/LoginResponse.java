package com.example.authservice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Login response DTO.
 */
public record LoginResponse(
    @JsonProperty("accessToken")
    String accessToken,

    @JsonProperty("refreshToken")
    String refreshToken,

    @JsonProperty("tokenType")
    String tokenType,

    @JsonProperty("expiresIn")
    long expiresIn
) {
    /**
     * Factory method with default tokenType = "Bearer"
     */
    public static LoginResponse of(IssuedTokens tokens) {
        return new LoginResponse(tokens.accessToken(), tokens.refreshToken(), "Bearer", tokens.expiresInSeconds());
    }
}
