package com.example.authservice.service;

import com.example.authservice.dto.PasswordStrength;
import com.example.authservice.exception.WeakPasswordException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Password strength policy.
 * Applied to admin-created accounts, password change and password reset.
 */
@Service
public class PasswordPolicyService {

    static final String SPECIAL_CHARACTERS = "!@#$%^&*()_+-=[]{}|;:,.<>?";

    private final int minLength;
    private final boolean requireUppercase;
    private final boolean requireLowercase;
    private final boolean requireDigit;
    private final boolean requireSpecial;

    public PasswordPolicyService(
            @Value("${app.security.password.min-length:8}") int minLength,
            @Value("${app.security.password.require-uppercase:true}") boolean requireUppercase,
            @Value("${app.security.password.require-lowercase:true}") boolean requireLowercase,
            @Value("${app.security.password.require-digit:true}") boolean requireDigit,
            @Value("${app.security.password.require-special:true}") boolean requireSpecial) {
        this.minLength = minLength;
        this.requireUppercase = requireUppercase;
        this.requireLowercase = requireLowercase;
        this.requireDigit = requireDigit;
        this.requireSpecial = requireSpecial;
    }

    public PasswordStrength validatePasswordStrength(String password) {
        String candidate = password == null ? "" : password;
        List<String> violations = new ArrayList<>();

        if (candidate.length() < minLength) {
            violations.add(String.format("Password must be at least %d characters long", minLength));
        }
        if (requireUppercase && candidate.chars().noneMatch(Character::isUpperCase)) {
            violations.add("Password must contain at least one uppercase letter");
        }
        if (requireLowercase && candidate.chars().noneMatch(Character::isLowerCase)) {
            violations.add("Password must contain at least one lowercase letter");
        }
        if (requireDigit && candidate.chars().noneMatch(Character::isDigit)) {
            violations.add("Password must contain at least one number");
        }
        if (requireSpecial && candidate.chars().noneMatch(c -> SPECIAL_CHARACTERS.indexOf(c) >= 0)) {
            violations.add("Password must contain at least one special character");
        }

        int score = Math.max(0, 100 - violations.size() * 20);
        return new PasswordStrength(violations.isEmpty(), List.copyOf(violations), score);
    }

    /**
     * @throws WeakPasswordException listing every violated rule
     */
    public void requireStrongPassword(String password) {
        PasswordStrength strength = validatePasswordStrength(password);
        if (!strength.valid()) {
            throw new WeakPasswordException(strength.violations());
        }
    }
}
