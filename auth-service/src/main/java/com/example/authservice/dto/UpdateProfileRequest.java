package com.example.authservice.dto;

import jakarta.validation.constraints.Size;

/**
 * Self-service profile update. Null fields are left unchanged.
 */
public record UpdateProfileRequest(
    @Size(min = 1, max = 100, message = "First name must be 1-100 characters")
    String firstName,

    @Size(min = 1, max = 100, message = "Last name must be 1-100 characters")
    String lastName,

    @Size(max = 500, message = "Avatar URL must not exceed 500 characters")
    String avatarUrl
) {
}
