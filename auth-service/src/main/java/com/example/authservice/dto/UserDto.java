package com.example.authservice.dto;

import com.example.authservice.entity.AccountState;
import com.example.authservice.entity.Role;
import com.example.authservice.entity.User;
import com.fasterxml.jackson.annotation.JsonFormat;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * User DTO for API responses.
 */
public record UserDto(
    UUID id,
    String email,
    String firstName,
    String lastName,
    String fullName,
    String avatarUrl,
    Role role,
    boolean active,
    boolean verified,
    boolean locked,
    AccountState accountState,
    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    LocalDateTime lockedUntil,
    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    LocalDateTime lastLogin,
    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    LocalDateTime createdAt
) {
    public static UserDto fromEntity(User user) {
        return new UserDto(
            user.getId(),
            user.getEmail(),
            user.getFirstName(),
            user.getLastName(),
            user.getFullName(),
            user.getAvatarUrl(),
            user.getRole(),
            user.isActive(),
            user.isVerified(),
            user.isLocked(),
            AccountState.of(user),
            user.getLockedUntil(),
            user.getLastLogin(),
            user.getCreatedAt()
        );
    }
}
