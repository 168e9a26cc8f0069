package com.example.authservice.exception;

import org.springframework.http.HttpStatus;

import java.util.List;
import java.util.Map;

public class WeakPasswordException extends BaseException {

    private final List<String> violations;

    public WeakPasswordException(List<String> violations) {
        super("WEAK_PASSWORD", "Password validation failed: " + String.join(", ", violations),
                HttpStatus.BAD_REQUEST);
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }

    @Override
    public Map<String, Object> getDetails() {
        return Map.of("violations", violations);
    }
}
