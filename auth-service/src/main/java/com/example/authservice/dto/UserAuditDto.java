package com.example.authservice.dto;

import com.example.authservice.entity.User;

import java.util.UUID;

/**
 * DTO for audit logging - excludes sensitive fields like passwordHash.
 * Never serialize the User entity directly into audit values.
 */
public record UserAuditDto(
        UUID id,
        String email,
        String firstName,
        String lastName,
        String avatarUrl,
        String role,
        boolean active,
        boolean verified,
        boolean locked
) {
    public static UserAuditDto from(User user) {
        return new UserAuditDto(
                user.getId(),
                user.getEmail(),
                user.getFirstName(),
                user.getLastName(),
                user.getAvatarUrl(),
                user.getRole() != null ? user.getRole().getValue() : null,
                user.isActive(),
                user.isVerified(),
                user.isLocked()
        );
    }
}
