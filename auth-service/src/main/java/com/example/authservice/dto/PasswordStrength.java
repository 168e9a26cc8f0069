package com.example.authservice.dto;

import java.util.List;

/**
 * Outcome of a password strength check.
 *
 * @param score 0..100, minus 20 per violation
 */
public record PasswordStrength(
    boolean valid,
    List<String> violations,
    int score
) {
}
