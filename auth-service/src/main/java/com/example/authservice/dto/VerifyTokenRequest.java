package com.example.authservice.dto;

import jakarta.validation.constraints.NotBlank;

public record VerifyTokenRequest(
    @NotBlank(message = "Token is required")
    String token
) {
}
