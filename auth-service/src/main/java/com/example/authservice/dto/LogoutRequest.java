package com.example.authservice.dto;

/**
 * Logout request DTO.
 * Without a refresh token (or with allDevices) every session of the caller is revoked.
 */
public record LogoutRequest(
    String refreshToken,
    boolean allDevices
) {
}
