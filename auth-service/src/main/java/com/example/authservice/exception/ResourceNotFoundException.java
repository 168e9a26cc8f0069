package com.example.authservice.exception;

import org.springframework.http.HttpStatus;

import java.util.UUID;

/**
 * Exception for resource not found errors (HTTP 404).
 */
public class ResourceNotFoundException extends BaseException {

    public ResourceNotFoundException(String code, String message) {
        super(code, message, HttpStatus.NOT_FOUND);
    }

    public static ResourceNotFoundException userNotFound(UUID userId) {
        return new ResourceNotFoundException(
            "USER_NOT_FOUND",
            String.format("User with ID %s not found", userId)
        );
    }

    public static ResourceNotFoundException sessionNotFound(UUID sessionId) {
        return new ResourceNotFoundException(
            "SESSION_NOT_FOUND",
            String.format("Session with ID %s not found", sessionId)
        );
    }
}
