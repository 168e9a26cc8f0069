package com.example.authservice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Refresh response: a new access token only, the refresh token stays the same.
 */
public record RefreshTokenResponse(
    @JsonProperty("accessToken")
    String accessToken,

    @JsonProperty("tokenType")
    String tokenType,

    @JsonProperty("expiresIn")
    long expiresIn
) {
    public static RefreshTokenResponse of(String accessToken, long expiresIn) {
        return new RefreshTokenResponse(accessToken, "Bearer", expiresIn);
    }
}
