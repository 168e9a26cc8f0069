package com.example.authservice.dto;

import com.example.authservice.entity.Role;
import jakarta.validation.constraints.Size;

/**
 * Admin update. Null fields are left unchanged.
 */
public record UpdateUserRequest(
    @Size(min = 1, max = 100, message = "First name must be 1-100 characters")
    String firstName,

    @Size(min = 1, max = 100, message = "Last name must be 1-100 characters")
    String lastName,

    Role role,

    Boolean active
) {
}
