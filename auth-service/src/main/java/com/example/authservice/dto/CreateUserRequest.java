package com.example.authservice.dto;

import com.example.authservice.entity.Role;
import jakarta.validation.constraints.*;

/**
 * Admin request DTO for creating user accounts.
 * Which roles the caller may assign is decided by the authorization engine.
 */
public record CreateUserRequest(
    @NotBlank(message = "Email is required")
    @Email(message = "Invalid email format")
    @Size(max = 255, message = "Email must not exceed 255 characters")
    String email,

    @NotBlank(message = "Password is required")
    @Size(max = 128, message = "Password must not exceed 128 characters")
    String password,

    @NotBlank(message = "First name is required")
    @Size(max = 100, message = "First name must not exceed 100 characters")
    String firstName,

    @NotBlank(message = "Last name is required")
    @Size(max = 100, message = "Last name must not exceed 100 characters")
    String lastName,

    @NotNull(message = "Role is required")
    Role role,

    Boolean active
) {
    public boolean activeOrDefault() {
        return active == null || active;
    }
}
