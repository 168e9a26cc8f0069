package com.example.authservice.dto;

import com.example.authservice.entity.UserSession;
import com.fasterxml.jackson.annotation.JsonFormat;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Session listing entry. The refresh token itself is never exposed.
 */
public record SessionDto(
    UUID id,
    String deviceInfo,
    String ipAddress,
    String userAgent,
    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    LocalDateTime createdAt,
    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    LocalDateTime lastUsedAt,
    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    LocalDateTime expiresAt,
    boolean current
) {
    public static SessionDto fromEntity(UserSession session, UUID currentSessionId) {
        return new SessionDto(
            session.getId(),
            session.getDeviceInfo(),
            session.getIpAddress(),
            session.getUserAgent(),
            session.getCreatedAt(),
            session.getLastUsedAt(),
            session.getExpiresAt(),
            session.getId().equals(currentSessionId)
        );
    }
}
