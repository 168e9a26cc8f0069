package com.example.authservice.dto;

import com.example.authservice.entity.AuditAction;
import com.example.authservice.entity.AuditLog;
import com.fasterxml.jackson.annotation.JsonFormat;

import java.time.LocalDateTime;
import java.util.UUID;

public record AuditLogDto(
    Long id,
    UUID actorId,
    String actorEmail,
    AuditAction action,
    String resource,
    String resourceId,
    String oldValues,
    String newValues,
    AuditLog.AuditOutcome outcome,
    String ipAddress,
    String userAgent,
    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    LocalDateTime createdAt
) {
    public static AuditLogDto fromEntity(AuditLog log) {
        return new AuditLogDto(
            log.getId(),
            log.getActorId(),
            log.getActorEmail(),
            log.getAction(),
            log.getResource(),
            log.getResourceId(),
            log.getOldValues(),
            log.getNewValues(),
            log.getOutcome(),
            log.getIpAddress(),
            log.getUserAgent(),
            log.getCreatedAt()
        );
    }
}
