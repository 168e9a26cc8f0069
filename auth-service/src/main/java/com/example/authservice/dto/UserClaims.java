package com.example.authservice.dto;

import com.example.authservice.entity.Role;

import java.util.UUID;

/**
 * Identity extracted from a verified access token.
 */
public record UserClaims(
    UUID userId,
    String email,
    Role role,
    UUID sessionId
) {
}
