package com.example.authservice.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

/**
 * Request a password reset link.
 */
public record PasswordResetRequestDto(
    @NotBlank(message = "Email is required")
    @Email(message = "Invalid email format")
    String email
) {
}
